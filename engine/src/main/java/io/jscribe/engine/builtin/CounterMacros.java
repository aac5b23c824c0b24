package io.jscribe.engine.builtin;

import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.RedefinitionException;
import io.jscribe.engine.counter.CounterStore;
import io.jscribe.engine.expand.Invocation;
import io.jscribe.engine.macro.BuiltinMacro;
import io.jscribe.engine.macro.MacroTable;
import io.jscribe.parser.ScribeException;
import io.jscribe.parser.Tokenizer;

/**
 * Counter primitives. Creating counter {@code c} also defines the shorthand macros {@code $c},
 * {@code $c.incr}, {@code $c.set[value]} and {@code $c.if.positive[body]}.
 */
public final class CounterMacros implements MacroLibrary {

  @Override
  public void install(MacroTable table) throws RedefinitionException {
    table.register(BuiltinMacro.of("counter.create", 1, CounterMacros::create));
    table.register(
        BuiltinMacro.of("counter.incr", 1, inv -> counters(inv).increment(inv.rawText(0))));
    table.register(
        BuiltinMacro.of(
            "counter.set", 2, inv -> counters(inv).set(inv.rawText(0), inv.integer(1))));
    table.register(
        BuiltinMacro.of(
            "counter.value",
            1,
            inv -> inv.emit(Integer.toString(counters(inv).read(inv.rawText(0))))));
    table.register(
        BuiltinMacro.of(
            "counter.if.positive",
            2,
            inv -> {
              if (counters(inv).positive(inv.rawText(0))) {
                inv.expand(1);
              }
            }));
  }

  private static void create(Invocation inv) throws ScribeException {
    String name = inv.rawText(0);
    if (!Tokenizer.isValidName(name)) {
      throw new EvaluationException("invalid counter name: '" + name + "'");
    }
    counters(inv).create(name);
    MacroTable table = inv.context().macros();
    table.register(
        BuiltinMacro.of(
            name, 0, call -> call.emit(Integer.toString(counters(call).read(name)))));
    table.register(BuiltinMacro.of(name + ".incr", 0, call -> counters(call).increment(name)));
    table.register(
        BuiltinMacro.of(name + ".set", 1, call -> counters(call).set(name, call.integer(0))));
    table.register(
        BuiltinMacro.of(
            name + ".if.positive",
            1,
            call -> {
              if (counters(call).positive(name)) {
                call.expand(0);
              }
            }));
  }

  private static CounterStore counters(Invocation inv) {
    return inv.context().counters();
  }
}
