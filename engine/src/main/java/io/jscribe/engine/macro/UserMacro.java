package io.jscribe.engine.macro;

import io.jscribe.engine.expand.Frame;
import io.jscribe.parser.EscapeMode;
import io.jscribe.parser.SourceLocation;
import io.jscribe.parser.ast.Node;
import io.jscribe.parser.ast.TextNode;
import java.util.List;

/**
 * A macro defined in source or by the host.
 *
 * @param name macro name
 * @param params formal parameter names, in order
 * @param body unexpanded body
 * @param previous binding this macro wraps, or null
 * @param previousAlias name under which the body reaches {@code previous}, or null
 * @param definitionFrame parameter bindings visible where the macro was defined, or null
 */
public record UserMacro(
    String name,
    List<String> params,
    List<Node> body,
    Macro previous,
    String previousAlias,
    Frame definitionFrame)
    implements Macro {

  public UserMacro {
    params = List.copyOf(params);
    body = List.copyOf(body);
  }

  /**
   * Creates a parameterless macro that expands to fixed text.
   *
   * @param name macro name
   * @param value text produced by the macro
   * @param location location reported for the text
   * @return the macro
   */
  public static UserMacro constant(String name, String value, SourceLocation location) {
    List<Node> body =
        value.isEmpty() ? List.of() : List.of(new TextNode(location, value, EscapeMode.NONE));
    return new UserMacro(name, List.of(), body, null, null, null);
  }

  /** Returns a copy of this macro that reaches {@code previous} as {@code $alias}. */
  UserMacro wrapping(Macro previous, String alias) {
    return new UserMacro(name, params, body, previous, alias, definitionFrame);
  }
}
