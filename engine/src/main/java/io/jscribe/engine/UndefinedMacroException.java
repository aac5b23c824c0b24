package io.jscribe.engine;

import io.jscribe.parser.ScribeException;
import io.jscribe.parser.SourceLocation;

/** Thrown when an invocation names a macro that is neither bound nor defined. */
public final class UndefinedMacroException extends ScribeException {
  private final String macroName;

  public UndefinedMacroException(String macroName, SourceLocation location) {
    super("macro not found: $" + macroName, location);
    this.macroName = macroName;
  }

  public String getMacroName() {
    return macroName;
  }
}
