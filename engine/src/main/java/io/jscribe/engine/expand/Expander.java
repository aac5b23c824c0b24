package io.jscribe.engine.expand;

import io.jscribe.engine.ArityException;
import io.jscribe.engine.CompilationContext;
import io.jscribe.engine.CycleException;
import io.jscribe.engine.EngineConfig.ArgumentEvaluation;
import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.UndefinedMacroException;
import io.jscribe.engine.branch.Branch;
import io.jscribe.engine.branch.BranchManager;
import io.jscribe.engine.macro.BuiltinMacro;
import io.jscribe.engine.macro.Macro;
import io.jscribe.engine.macro.UserMacro;
import io.jscribe.parser.EscapeMode;
import io.jscribe.parser.ScribeException;
import io.jscribe.parser.SourceLocation;
import io.jscribe.parser.ast.CallNode;
import io.jscribe.parser.ast.Node;
import io.jscribe.parser.ast.TextNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands node sequences left to right, depth first, writing literal text into the active branch
 * or into the innermost capture.
 *
 * <p>Arguments are passed by name: a parameter is bound to the unexpanded argument and the frame
 * of the call site, and each reference expands it again. With {@link ArgumentEvaluation#BY_NEED}
 * the first expansion of an argument is reused by later references within the same invocation.
 */
public final class Expander {
  private static final Logger log = LoggerFactory.getLogger(Expander.class);

  private final CompilationContext context;
  // innermost first
  private final Deque<CallNode> active = new ArrayDeque<>();
  private Deque<List<Rendered.Piece>> captures = new ArrayDeque<>();

  public Expander(CompilationContext context) {
    this.context = context;
  }

  public CompilationContext context() {
    return context;
  }

  /**
   * Expands nodes into the current output.
   *
   * @param nodes nodes to expand
   * @param frame local bindings for parameter references
   * @throws ScribeException if any invocation fails
   */
  public void expand(List<Node> nodes, Frame frame) throws ScribeException {
    for (Node node : nodes) {
      if (node instanceof TextNode text) {
        emit(text.text(), text.escape());
      } else if (node instanceof CallNode call) {
        invoke(call, frame);
      }
    }
  }

  /**
   * Expands nodes into a fresh capture instead of the current output.
   *
   * @param nodes nodes to expand
   * @param frame local bindings for parameter references
   * @return the captured text
   * @throws ScribeException if any invocation fails
   */
  public Rendered evaluate(List<Node> nodes, Frame frame) throws ScribeException {
    List<Rendered.Piece> capture = new ArrayList<>();
    captures.push(capture);
    try {
      expand(nodes, frame);
    } finally {
      captures.pop();
    }
    return new Rendered(capture);
  }

  /**
   * Expands nodes with another branch active. Captures in progress do not receive the output.
   *
   * @param branchId identifier of the branch to write to
   * @param nodes nodes to expand
   * @param frame local bindings for parameter references
   * @throws ScribeException if the branch does not exist or expansion fails
   */
  public void expandInto(String branchId, List<Node> nodes, Frame frame) throws ScribeException {
    BranchManager branches = context.branches();
    Branch target = branches.get(branchId);
    Branch previous = branches.active();
    Deque<List<Rendered.Piece>> saved = captures;
    captures = new ArrayDeque<>();
    branches.activate(target);
    try {
      expand(nodes, frame);
    } finally {
      branches.activate(previous);
      captures = saved;
    }
  }

  /**
   * Writes text to the current output. Escaping is applied when the text reaches a branch;
   * captures keep it unescaped together with its mode.
   *
   * @param text unescaped text
   * @param escape escape mode of the text
   */
  public void emit(String text, EscapeMode escape) {
    if (text.isEmpty()) {
      return;
    }
    List<Rendered.Piece> top = captures.peek();
    if (top != null) {
      top.add(new Rendered.Text(text, escape));
    } else {
      context.branches().appendText(escape.apply(text));
    }
  }

  /**
   * Writes captured output to the current output, text and branch references in their original
   * order.
   *
   * @throws EvaluationException if a referenced branch no longer resolves
   */
  public void emit(Rendered rendered) throws EvaluationException {
    for (Rendered.Piece piece : rendered.pieces()) {
      if (piece instanceof Rendered.Text text) {
        emit(text.text(), text.escape());
      } else if (piece instanceof Rendered.Reference ref) {
        emitReference(ref.branchId(), ref.location());
      }
    }
  }

  /**
   * Places a branch at the current write position. Inside a capture the reference is kept with
   * the captured text and reaches the branch together with it.
   *
   * @param branchId identifier of the branch to place
   * @param location location of the request
   * @throws EvaluationException if no branch has this identifier
   */
  public void emitReference(String branchId, SourceLocation location)
      throws EvaluationException {
    BranchManager branches = context.branches();
    Branch target = branches.get(branchId);
    List<Rendered.Piece> top = captures.peek();
    if (top != null) {
      top.add(new Rendered.Reference(target.id(), location));
    } else {
      branches.append(target.id(), location);
    }
  }

  /**
   * Evaluates one invocation. Parameters and aliases of {@code frame} shadow the macro table.
   *
   * @param call the invocation
   * @param frame frame of the call site
   * @throws ScribeException if the macro is unknown or its evaluation fails
   */
  public void invoke(CallNode call, Frame frame) throws ScribeException {
    Optional<Binding> local = frame.lookup(call.name());
    if (local.isPresent()) {
      Binding binding = local.get();
      if (binding instanceof Binding.Argument argument) {
        if (!call.args().isEmpty()) {
          throw new ArityException(call.name(), "0", call.args().size())
              .at(call.location())
              .within(chain());
        }
        expandArgument(argument);
      } else if (binding instanceof Binding.Alias alias) {
        call(alias.target(), call, frame);
      }
      return;
    }
    Optional<Macro> macro = context.macros().lookup(call.name());
    if (macro.isEmpty()) {
      throw new UndefinedMacroException(call.name(), call.location()).within(chain());
    }
    call(macro.get(), call, frame);
  }

  private void call(Macro macro, CallNode call, Frame frame) throws ScribeException {
    int limit = context.config().maxCallDepth();
    if (active.size() >= limit) {
      List<String> names = new ArrayList<>();
      for (Iterator<CallNode> it = active.descendingIterator(); it.hasNext(); ) {
        names.add("$" + it.next().name());
      }
      names.add("$" + call.name());
      throw new CycleException(
          "macro recursion deeper than " + limit + " calls", names, call.location());
    }
    active.push(call);
    try {
      if (macro instanceof BuiltinMacro builtin) {
        builtin.checkArity(call.args().size());
        builtin.primitive().invoke(new Invocation(this, call, frame));
      } else if (macro instanceof UserMacro user) {
        expandBody(user, call, frame);
      }
    } catch (ScribeException e) {
      throw e.at(call.location()).within(chain());
    } finally {
      active.pop();
    }
  }

  private void expandBody(UserMacro macro, CallNode call, Frame callerFrame)
      throws ScribeException {
    List<String> params = macro.params();
    if (call.args().size() != params.size()) {
      throw new ArityException(
          macro.name(), Integer.toString(params.size()), call.args().size());
    }
    Map<String, Binding> bindings = new HashMap<>();
    for (int i = 0; i < params.size(); i++) {
      bindings.put(params.get(i), new Binding.Argument(call.args().get(i), callerFrame));
    }
    if (macro.previous() != null) {
      bindings.put(macro.previousAlias(), new Binding.Alias(macro.previous()));
    }
    expand(macro.body(), Frame.child(macro.definitionFrame(), bindings));
  }

  private void expandArgument(Binding.Argument argument) throws ScribeException {
    if (context.config().argumentEvaluation() == ArgumentEvaluation.BY_NEED) {
      Rendered memo = argument.memo();
      if (memo == null) {
        memo = evaluate(argument.nodes(), argument.callerFrame());
        argument.memoize(memo);
      } else {
        log.trace("Reusing memoized argument of {} piece(s)", memo.pieces().size());
      }
      emit(memo);
    } else {
      expand(argument.nodes(), argument.callerFrame());
    }
  }

  /** Returns the active invocations, innermost first, with their locations. */
  public List<String> chain() {
    List<String> frames = new ArrayList<>(active.size());
    for (CallNode call : active) {
      frames.add("$" + call.name() + " (" + call.location() + ")");
    }
    return frames;
  }

  /** Returns the number of macro invocations currently being evaluated. */
  public int depth() {
    return active.size();
  }
}
