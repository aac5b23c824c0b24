package io.jscribe.engine.expand;

import io.jscribe.engine.macro.Macro;
import io.jscribe.parser.ast.Node;
import java.util.List;

/** What a name resolves to inside a macro body before the macro table is consulted. */
public sealed interface Binding permits Binding.Argument, Binding.Alias {

  /**
   * An actual argument, kept unexpanded together with the frame of the call site.
   *
   * <p>Under by-need evaluation the first expansion is remembered in {@link #memo}.
   */
  final class Argument implements Binding {
    private final List<Node> nodes;
    private final Frame callerFrame;
    private Rendered memo;

    Argument(List<Node> nodes, Frame callerFrame) {
      this.nodes = nodes;
      this.callerFrame = callerFrame;
    }

    public List<Node> nodes() {
      return nodes;
    }

    public Frame callerFrame() {
      return callerFrame;
    }

    Rendered memo() {
      return memo;
    }

    void memoize(Rendered rendered) {
      this.memo = rendered;
    }
  }

  /** Another macro reachable under a local name, such as the binding a wrapper replaced. */
  record Alias(Macro target) implements Binding {}
}
