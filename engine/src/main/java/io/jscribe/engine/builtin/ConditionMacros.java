package io.jscribe.engine.builtin;

import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.RedefinitionException;
import io.jscribe.engine.expand.Invocation;
import io.jscribe.engine.macro.BuiltinMacro;
import io.jscribe.engine.macro.MacroTable;
import io.jscribe.parser.ScribeException;

/**
 * Conditionals and loops. Only the selected block of a conditional is expanded; the other one is
 * never looked at, so it may refer to macros that do not exist.
 */
public final class ConditionMacros implements MacroLibrary {

  @Override
  public void install(MacroTable table) throws RedefinitionException {
    table.register(new BuiltinMacro("if.eq", 3, 4, ConditionMacros::ifEq));
    table.register(new BuiltinMacro("if.def", 2, 3, ConditionMacros::ifDef));
    table.register(BuiltinMacro.of("repeat", 2, ConditionMacros::repeat));
  }

  // $if.eq[a][b][then][else]
  private static void ifEq(Invocation inv) throws ScribeException {
    boolean equal = inv.rawText(0).equals(inv.rawText(1));
    choose(inv, equal, 2);
  }

  // $if.def[name][then][else]
  private static void ifDef(Invocation inv) throws ScribeException {
    String name = inv.rawText(0);
    boolean defined = inv.frame().isBound(name) || inv.context().macros().contains(name);
    choose(inv, defined, 1);
  }

  private static void choose(Invocation inv, boolean condition, int thenIndex)
      throws ScribeException {
    if (condition) {
      inv.expand(thenIndex);
    } else if (inv.hasArg(thenIndex + 1)) {
      inv.expand(thenIndex + 1);
    }
  }

  // $repeat[count][body]
  private static void repeat(Invocation inv) throws ScribeException {
    int count = inv.integer(0);
    if (count < 0) {
      throw new EvaluationException("$repeat: count must not be negative: " + count);
    }
    for (int i = 0; i < count; i++) {
      inv.expand(1);
    }
  }
}
