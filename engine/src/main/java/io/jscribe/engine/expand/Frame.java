package io.jscribe.engine.expand;

import java.util.Map;
import java.util.Optional;

/**
 * Local bindings of one macro body expansion. Frames chain to the frame the macro was defined in,
 * not to the caller, so a nested definition sees the parameters of the body that defined it.
 */
public final class Frame {
  private static final Frame ROOT = new Frame(null, Map.of());

  private final Frame parent;
  private final Map<String, Binding> bindings;

  private Frame(Frame parent, Map<String, Binding> bindings) {
    this.parent = parent;
    this.bindings = bindings;
  }

  /** Returns the frame without bindings used for top-level source. */
  public static Frame root() {
    return ROOT;
  }

  /**
   * Creates a frame with the given bindings on top of {@code parent}.
   *
   * @param parent enclosing frame, or null for the root frame
   * @param bindings local bindings
   * @return the new frame
   */
  static Frame child(Frame parent, Map<String, Binding> bindings) {
    return new Frame(parent == null ? ROOT : parent, Map.copyOf(bindings));
  }

  /**
   * Resolves a name through this frame and its ancestors.
   *
   * @param name parameter or alias name
   * @return the innermost binding, or empty
   */
  public Optional<Binding> lookup(String name) {
    for (Frame f = this; f != null; f = f.parent) {
      Binding b = f.bindings.get(name);
      if (b != null) {
        return Optional.of(b);
      }
    }
    return Optional.empty();
  }

  public boolean isBound(String name) {
    return lookup(name).isPresent();
  }
}
