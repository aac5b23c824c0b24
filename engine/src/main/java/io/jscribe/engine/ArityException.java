package io.jscribe.engine;

import io.jscribe.parser.ScribeException;

/** Thrown when a macro is invoked with a number of argument groups it does not accept. */
public final class ArityException extends ScribeException {
  private final String macroName;
  private final int actual;

  /**
   * Creates an arity error.
   *
   * @param macroName name of the invoked macro
   * @param expected human-readable expected count, e.g. "2" or "at least 1"
   * @param actual number of argument groups given
   */
  public ArityException(String macroName, String expected, int actual) {
    super(
        String.format(
            "$%s: arguments count mismatch: expected %s, got %d", macroName, expected, actual),
        null);
    this.macroName = macroName;
    this.actual = actual;
  }

  public String getMacroName() {
    return macroName;
  }

  public int getActual() {
    return actual;
  }
}
