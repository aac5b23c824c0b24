package io.jscribe.parser;

/**
 * Thrown when source text cannot be tokenized: unbalanced brackets, a dangling escape marker, an
 * invalid macro name or a malformed directive.
 */
public final class ScribeSyntaxException extends ScribeException {

  public ScribeSyntaxException(String message, SourceLocation location) {
    super(message, location);
  }
}
