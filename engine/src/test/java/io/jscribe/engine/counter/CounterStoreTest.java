package io.jscribe.engine.counter;

import static org.junit.jupiter.api.Assertions.*;

import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.RedefinitionException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

class CounterStoreTest {

  @Test
  void incrementTwiceReadsTwo() throws Exception {
    CounterStore counters = new CounterStore();
    counters.create("c");
    counters.increment("c");
    counters.increment("c");

    assertEquals(2, counters.read("c"));
  }

  @Test
  void newCounterIsZeroAndNotPositive() throws Exception {
    CounterStore counters = new CounterStore();
    counters.create("c");

    assertEquals(0, counters.read("c"));
    assertFalse(counters.positive("c"));
    counters.set("c", -3);
    assertFalse(counters.positive("c"));
    counters.set("c", 1);
    assertTrue(counters.positive("c"));
  }

  @Test
  void incrementPastMaximumFails() throws Exception {
    CounterStore counters = new CounterStore();
    counters.create("c");
    counters.set("c", Integer.MAX_VALUE);

    EvaluationException e = assertThrows(EvaluationException.class, () -> counters.increment("c"));
    assertEquals("counter overflow: c", e.getDetail());
    assertInstanceOf(ArithmeticException.class, e.getCause());
    assertEquals(Integer.MAX_VALUE, counters.read("c"));
  }

  @Test
  void createTwiceFails() throws Exception {
    CounterStore counters = new CounterStore();
    counters.create("c");

    assertThrows(RedefinitionException.class, () -> counters.create("c"));
  }

  @Test
  void unknownCounterFails() {
    CounterStore counters = new CounterStore();

    EvaluationException e = assertThrows(EvaluationException.class, () -> counters.read("x"));
    assertEquals("counter not found: x", e.getDetail());
    assertThrows(EvaluationException.class, () -> counters.increment("x"));
    assertFalse(counters.contains("x"));
  }

  @Property(tries = 200)
  void incrementAddsExactlyOne(@ForAll @IntRange(min = -1000, max = 1000) int start)
      throws Exception {
    CounterStore counters = new CounterStore();
    counters.create("c");
    counters.set("c", start);

    int next = counters.increment("c");

    assertEquals(start + 1, next);
    assertEquals(start + 1, counters.read("c"));
  }

  @Property(tries = 200)
  void setThenReadReturnsValue(@ForAll int value) throws Exception {
    CounterStore counters = new CounterStore();
    counters.create("c");
    counters.increment("c");

    counters.set("c", value);

    assertEquals(value, counters.read("c"));
    assertEquals(value > 0, counters.positive("c"));
  }
}
