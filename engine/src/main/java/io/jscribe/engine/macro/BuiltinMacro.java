package io.jscribe.engine.macro;

import io.jscribe.engine.ArityException;

/**
 * A macro implemented in Java.
 *
 * @param name macro name
 * @param minArgs minimum number of argument groups
 * @param maxArgs maximum number of argument groups, or {@link #UNBOUNDED}
 * @param primitive implementation
 */
public record BuiltinMacro(String name, int minArgs, int maxArgs, Primitive primitive)
    implements Macro {
  public static final int UNBOUNDED = -1;

  /** Creates a primitive taking exactly {@code args} argument groups. */
  public static BuiltinMacro of(String name, int args, Primitive primitive) {
    return new BuiltinMacro(name, args, args, primitive);
  }

  /**
   * Verifies an argument count against the accepted range.
   *
   * @param actual number of argument groups given
   * @throws ArityException if the count is outside the range
   */
  public void checkArity(int actual) throws ArityException {
    if (actual >= minArgs && (maxArgs == UNBOUNDED || actual <= maxArgs)) {
      return;
    }
    String expected;
    if (maxArgs == UNBOUNDED) {
      expected = "at least " + minArgs;
    } else if (minArgs == maxArgs) {
      expected = Integer.toString(minArgs);
    } else {
      expected = minArgs + " to " + maxArgs;
    }
    throw new ArityException(name, expected, actual);
  }
}
