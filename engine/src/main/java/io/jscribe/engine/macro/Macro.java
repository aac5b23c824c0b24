package io.jscribe.engine.macro;

/** A named entry of the {@link MacroTable}. */
public sealed interface Macro permits UserMacro, BuiltinMacro {

  /** Returns the name the macro is invoked by, without sigil. */
  String name();
}
