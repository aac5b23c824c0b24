package io.jscribe.engine.host;

import io.jscribe.engine.CompilationContext;
import io.jscribe.engine.CycleException;
import io.jscribe.engine.IncludeResolutionException;
import io.jscribe.engine.expand.Frame;
import io.jscribe.parser.ScribeException;
import io.jscribe.parser.SourceLocation;
import io.jscribe.parser.Tokenizer;
import io.jscribe.parser.ast.Node;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands included files at the point of inclusion. Included files share the unit's macro table,
 * counters, branches and mode flags, so their definitions and directives stay in effect after the
 * include returns.
 */
public final class IncludeResolver {
  private static final Logger log = LoggerFactory.getLogger(IncludeResolver.class);

  private final CompilationContext context;
  private final SourceResolver sources;
  // innermost first
  private final Deque<String> stack = new ArrayDeque<>();

  public IncludeResolver(CompilationContext context, SourceResolver sources) {
    this.context = context;
    this.sources = sources;
  }

  /**
   * Resolves, tokenizes and expands a file into the current output.
   *
   * @param path logical path
   * @param location location of the include request, or null for the entry file
   * @throws CycleException if the path is already being expanded
   * @throws IncludeResolutionException if the path cannot be read or nesting is too deep
   * @throws ScribeException if the included source fails to tokenize or expand
   */
  public void include(String path, SourceLocation location) throws ScribeException {
    if (stack.contains(path)) {
      List<String> chain = new ArrayList<>();
      for (Iterator<String> it = stack.descendingIterator(); it.hasNext(); ) {
        chain.add(it.next());
      }
      chain.add(path);
      throw new CycleException("include cycle", chain, location);
    }
    int limit = context.config().maxIncludeDepth();
    if (stack.size() >= limit) {
      throw new IncludeResolutionException(
          path, "too many nested includes (limit " + limit + ")", location);
    }
    expandSource(path, readText(path, location));
  }

  /**
   * Tokenizes and expands source text as if it had been included from {@code path}.
   *
   * @param path logical path used in locations and cycle detection
   * @param text source text
   * @throws ScribeException if the source fails to tokenize or expand
   */
  public void expandSource(String path, String text) throws ScribeException {
    log.debug("Including {} at depth {}", path, stack.size());
    List<Node> nodes = Tokenizer.tokenize(path, text, context.modes());
    stack.push(path);
    try {
      context.expander().expand(nodes, Frame.root());
    } finally {
      stack.pop();
    }
  }

  /**
   * Reads a file without tokenizing it.
   *
   * @param path logical path
   * @param location location of the request, or null
   * @return the source text
   * @throws IncludeResolutionException if the path does not exist or cannot be read
   */
  public String readText(String path, SourceLocation location)
      throws IncludeResolutionException {
    Optional<String> text;
    try {
      text = sources.resolve(path);
    } catch (IOException e) {
      throw new IncludeResolutionException(path, e.getMessage(), location, e);
    }
    if (text.isEmpty()) {
      throw new IncludeResolutionException(path, "not found", location);
    }
    return text.get();
  }

  /** Returns the number of files currently being expanded. */
  public int depth() {
    return stack.size();
  }
}
