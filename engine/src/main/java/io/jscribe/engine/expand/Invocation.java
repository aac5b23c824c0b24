package io.jscribe.engine.expand;

import io.jscribe.engine.CompilationContext;
import io.jscribe.engine.EvaluationException;
import io.jscribe.parser.EscapeMode;
import io.jscribe.parser.ScribeException;
import io.jscribe.parser.SourceLocation;
import io.jscribe.parser.ast.CallNode;
import io.jscribe.parser.ast.Node;
import java.util.List;

/**
 * A call to a built-in macro as seen by its {@link io.jscribe.engine.macro.Primitive}. Arguments
 * stay unexpanded until the primitive asks for them, so a primitive decides which arguments are
 * expanded and how often.
 */
public final class Invocation {
  private final Expander expander;
  private final CallNode call;
  private final Frame frame;

  Invocation(Expander expander, CallNode call, Frame frame) {
    this.expander = expander;
    this.call = call;
    this.frame = frame;
  }

  public String name() {
    return call.name();
  }

  public SourceLocation location() {
    return call.location();
  }

  public int argCount() {
    return call.args().size();
  }

  public boolean hasArg(int index) {
    return index < call.args().size();
  }

  /** Returns argument {@code index} unexpanded. */
  public List<Node> nodes(int index) {
    return call.args().get(index);
  }

  /** Returns the unexpanded arguments from {@code from} on. */
  public List<List<Node>> nodesFrom(int from) {
    return call.args().subList(from, call.args().size());
  }

  /** Expands argument {@code index} in the caller's frame into a capture. */
  public Rendered render(int index) throws ScribeException {
    return expander.evaluate(nodes(index), frame);
  }

  /** Expands argument {@code index} and returns it as it would appear in output. */
  public String text(int index) throws ScribeException {
    return render(index).escaped();
  }

  /** Expands argument {@code index} without escaping, for names, numbers and paths. */
  public String rawText(int index) throws ScribeException {
    return render(index).raw().strip();
  }

  /**
   * Expands argument {@code index} and parses it as a decimal integer.
   *
   * @throws EvaluationException if the expanded text is not an integer
   */
  public int integer(int index) throws ScribeException {
    String value = rawText(index);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new EvaluationException(
          "$" + name() + ": expected an integer, got '" + value + "'", e);
    }
  }

  /** Expands argument {@code index} in place, into the current output. */
  public void expand(int index) throws ScribeException {
    expander.expand(nodes(index), frame);
  }

  /** Writes computed text to the current output. Computed text is never escaped. */
  public void emit(String text) {
    expander.emit(text, EscapeMode.NONE);
  }

  /** Writes previously rendered text to the current output, each piece in its own mode. */
  public void emit(Rendered rendered) throws EvaluationException {
    expander.emit(rendered);
  }

  /** Returns the frame of the call site. */
  public Frame frame() {
    return frame;
  }

  public Expander expander() {
    return expander;
  }

  public CompilationContext context() {
    return expander.context();
  }
}
