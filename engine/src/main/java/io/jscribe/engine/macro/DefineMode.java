package io.jscribe.engine.macro;

/** How {@link MacroTable#define} treats an existing binding of the same name. */
public enum DefineMode {
  /** The name must be free. */
  NEW,
  /** The name must be bound; the old binding stays reachable from the new body. */
  WRAP
}
