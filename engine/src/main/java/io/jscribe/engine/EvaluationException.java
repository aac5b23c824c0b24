package io.jscribe.engine;

import io.jscribe.parser.ScribeException;

/**
 * Thrown by a primitive whose arguments expand to unusable values, such as a non-numeric count or
 * the name of a branch that does not exist.
 */
public final class EvaluationException extends ScribeException {

  public EvaluationException(String message) {
    super(message, null);
  }

  public EvaluationException(String message, Throwable cause) {
    super(message, null, cause);
  }
}
