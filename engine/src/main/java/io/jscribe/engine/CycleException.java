package io.jscribe.engine;

import io.jscribe.parser.ScribeException;
import io.jscribe.parser.SourceLocation;
import java.util.List;

/**
 * Thrown when a structure refers back to itself: a branch reference cycle found at flatten time,
 * a file including itself, or macro recursion deeper than the configured limit.
 */
public final class CycleException extends ScribeException {
  private final List<String> chain;

  /**
   * Creates a cycle error.
   *
   * @param what short description of the cycle kind
   * @param chain offending chain, outermost first
   * @param location location of the construct that closes the cycle, may be null
   */
  public CycleException(String what, List<String> chain, SourceLocation location) {
    super(what + ": " + String.join(" -> ", chain), location);
    this.chain = List.copyOf(chain);
  }

  /** Returns the offending chain, outermost first. */
  public List<String> getChain() {
    return chain;
  }
}
