package io.jscribe.parser;

import java.util.List;

/**
 * Base exception for all errors raised while compiling a source tree. Every error is fatal to the
 * compilation unit it occurs in.
 *
 * <p>Errors raised deep inside a primitive usually do not know where they happened. The expander
 * attaches the location of the surfacing macro call and the active call chain the first time the
 * exception crosses an invocation boundary; later attempts keep the innermost values.
 */
public abstract class ScribeException extends Exception {
  private final String detail;
  private SourceLocation location;
  private List<String> callChain = List.of();

  protected ScribeException(String detail, SourceLocation location) {
    super(detail);
    this.detail = detail;
    this.location = location;
  }

  protected ScribeException(String detail, SourceLocation location, Throwable cause) {
    super(detail, cause);
    this.detail = detail;
    this.location = location;
  }

  /**
   * Sets the location of this error unless one is already known.
   *
   * @param where location of the construct that surfaced the error
   * @return this exception, for rethrowing
   */
  public ScribeException at(SourceLocation where) {
    if (location == null) {
      location = where;
    }
    return this;
  }

  /**
   * Sets the macro call chain of this error unless one is already known.
   *
   * @param chain active invocations, innermost first
   * @return this exception, for rethrowing
   */
  public ScribeException within(List<String> chain) {
    if (callChain.isEmpty() && chain != null) {
      callChain = List.copyOf(chain);
    }
    return this;
  }

  /** Returns the error description without location or call chain. */
  public String getDetail() {
    return detail;
  }

  /** Returns the location of the error, or null if it was never located. */
  public SourceLocation getLocation() {
    return location;
  }

  /** Returns the active invocations when the error was raised, innermost first. */
  public List<String> getCallChain() {
    return callChain;
  }

  @Override
  public String getMessage() {
    StringBuilder sb = new StringBuilder();
    if (location != null) {
      sb.append(location).append(": ");
    }
    sb.append(detail);
    for (String frame : callChain) {
      sb.append(System.lineSeparator()).append("  at ").append(frame);
    }
    return sb.toString();
  }
}
