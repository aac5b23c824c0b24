package io.jscribe.engine.macro;

import io.jscribe.engine.expand.Invocation;
import io.jscribe.parser.ScribeException;

/** Implementation of a built-in macro. */
@FunctionalInterface
public interface Primitive {

  /**
   * Runs the primitive. Output goes through {@link Invocation#emit(String)} or by expanding
   * arguments in place.
   *
   * @param invocation the call being evaluated
   * @throws ScribeException if evaluation fails
   */
  void invoke(Invocation invocation) throws ScribeException;
}
