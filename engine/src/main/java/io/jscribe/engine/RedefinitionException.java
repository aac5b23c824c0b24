package io.jscribe.engine;

import io.jscribe.parser.ScribeException;

/**
 * Thrown when a definition conflicts with the current state: defining an existing macro, wrapping
 * a missing one, or creating a counter or branch whose name is taken.
 */
public final class RedefinitionException extends ScribeException {

  public RedefinitionException(String message) {
    super(message, null);
  }
}
