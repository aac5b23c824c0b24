package io.jscribe.engine.counter;

import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.RedefinitionException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Named integer counters of a compilation unit. Every counter starts at 0. */
public final class CounterStore {
  private static final Logger log = LoggerFactory.getLogger(CounterStore.class);

  private final Map<String, Integer> values = new HashMap<>();

  /**
   * Creates a counter with value 0.
   *
   * @throws RedefinitionException if the counter already exists
   */
  public void create(String name) throws RedefinitionException {
    if (values.putIfAbsent(name, 0) != null) {
      throw new RedefinitionException("counter already exists: " + name);
    }
    log.debug("Created counter {}", name);
  }

  public void set(String name, int value) throws EvaluationException {
    require(name);
    values.put(name, value);
  }

  /**
   * Adds one to a counter.
   *
   * @return the new value
   * @throws EvaluationException if the counter does not exist or would overflow
   */
  public int increment(String name) throws EvaluationException {
    int next;
    try {
      next = Math.addExact(require(name), 1);
    } catch (ArithmeticException e) {
      throw new EvaluationException("counter overflow: " + name, e);
    }
    values.put(name, next);
    return next;
  }

  public int read(String name) throws EvaluationException {
    return require(name);
  }

  /** Returns true if the counter is greater than zero. */
  public boolean positive(String name) throws EvaluationException {
    return require(name) > 0;
  }

  public boolean contains(String name) {
    return values.containsKey(name);
  }

  private int require(String name) throws EvaluationException {
    Integer value = values.get(name);
    if (value == null) {
      throw new EvaluationException("counter not found: " + name);
    }
    return value;
  }
}
