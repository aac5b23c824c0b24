package io.jscribe.engine.host;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Supplies source text for logical include paths. Path variables and file-system layout are the
 * host's concern; the engine passes paths through as written.
 */
@FunctionalInterface
public interface SourceResolver {

  /**
   * Looks up the source text of a path.
   *
   * @param path logical path as written in {@code $include}
   * @return the text, or empty if the path does not exist
   * @throws IOException if the path exists but cannot be read
   */
  Optional<String> resolve(String path) throws IOException;

  /** Returns a resolver serving a fixed set of in-memory sources. */
  static SourceResolver of(Map<String, String> sources) {
    Map<String, String> copy = Map.copyOf(sources);
    return path -> Optional.ofNullable(copy.get(path));
  }

  /** Returns a resolver that knows no paths. */
  static SourceResolver none() {
    return path -> Optional.empty();
  }
}
