package io.jscribe.engine.builtin;

import io.jscribe.engine.RedefinitionException;
import io.jscribe.engine.macro.MacroTable;
import java.util.List;

/**
 * A set of built-in macros. Hosts can add their own libraries through {@link
 * io.jscribe.engine.Compiler.Builder#library(MacroLibrary)} or register them for discovery via
 * {@link java.util.ServiceLoader}.
 */
public interface MacroLibrary {

  /**
   * Registers this library's macros.
   *
   * @param table the unit's macro table
   * @throws RedefinitionException if a macro name is already taken
   */
  void install(MacroTable table) throws RedefinitionException;

  /** Returns the libraries every compilation unit starts with. */
  static List<MacroLibrary> standard() {
    return List.of(
        new CoreMacros(),
        new ConditionMacros(),
        new CounterMacros(),
        new TextMacros(),
        new BranchMacros());
  }
}
