package io.jscribe.parser.ast;

import io.jscribe.parser.SourceLocation;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A macro invocation {@code $name[arg]...}. Arguments are kept unexpanded.
 *
 * @param location position of the sigil
 * @param name macro name without sigil
 * @param args one node list per bracket group
 */
public record CallNode(SourceLocation location, String name, List<List<Node>> args)
    implements Node {

  public CallNode {
    args = args.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
  }

  /** Returns the call in source form, e.g. {@code $greet[World]}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("$").append(name);
    for (List<Node> arg : args) {
      sb.append('[');
      arg.forEach(sb::append);
      sb.append(']');
    }
    return sb.toString();
  }
}
