package io.jscribe.engine;

import io.jscribe.parser.ScribeException;
import io.jscribe.parser.SourceLocation;

/** Thrown when the host cannot supply the source text of an included path. */
public final class IncludeResolutionException extends ScribeException {
  private final String path;

  public IncludeResolutionException(String path, String reason, SourceLocation location) {
    super("unable to include \"" + path + "\": " + reason, location);
    this.path = path;
  }

  public IncludeResolutionException(
      String path, String reason, SourceLocation location, Throwable cause) {
    super("unable to include \"" + path + "\": " + reason, location, cause);
    this.path = path;
  }

  public String getPath() {
    return path;
  }
}
