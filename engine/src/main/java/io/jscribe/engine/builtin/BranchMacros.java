package io.jscribe.engine.builtin;

import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.RedefinitionException;
import io.jscribe.engine.branch.Branch;
import io.jscribe.engine.branch.BranchManager;
import io.jscribe.engine.expand.Invocation;
import io.jscribe.engine.macro.BuiltinMacro;
import io.jscribe.engine.macro.MacroTable;
import io.jscribe.engine.macro.UserMacro;
import io.jscribe.parser.ScribeException;
import io.jscribe.parser.Tokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Branch primitives.
 *
 * <p>A branch identifier written as {@code !name} asks for a generated identifier ({@code
 * name#1}, {@code name#2}, ...) which is then bound to macro {@code $name}, so that repeated
 * structures such as one footnote list per section do not collide.
 */
public final class BranchMacros implements MacroLibrary {
  private static final Logger log = LoggerFactory.getLogger(BranchMacros.class);

  @Override
  public void install(MacroTable table) throws RedefinitionException {
    table.register(BuiltinMacro.of("branch.create.root", 3, BranchMacros::createRoot));
    table.register(BuiltinMacro.of("branch.create.sub", 1, BranchMacros::createSub));
    table.register(
        BuiltinMacro.of(
            "branch.write",
            2,
            inv -> inv.expander().expandInto(inv.rawText(0), inv.nodes(1), inv.frame())));
    table.register(
        BuiltinMacro.of(
            "branch.append",
            1,
            inv -> inv.expander().emitReference(inv.rawText(0), inv.location())));
    table.register(
        BuiltinMacro.of("branch.kind", 0, inv -> inv.emit(branches(inv).active().kind())));
    table.register(
        BuiltinMacro.of("branch.current", 0, inv -> inv.emit(branches(inv).active().id())));
  }

  // $branch.create.root[kind][name_or_ref][destination]
  private static void createRoot(Invocation inv) throws ScribeException {
    String kind = inv.rawText(0);
    if (kind.isEmpty()) {
      throw new EvaluationException("$" + inv.name() + ": branch kind must not be empty");
    }
    String requested = checkId(inv.rawText(1));
    Branch branch = branches(inv).createRoot(kind, requested, inv.rawText(2));
    bindReference(inv, requested, branch);
    log.debug("Root branch {} of kind {} -> {}", branch.id(), kind, branch.destination());
  }

  // $branch.create.sub[name_or_ref]
  private static void createSub(Invocation inv) throws ScribeException {
    String requested = checkId(inv.rawText(0));
    bindReference(inv, requested, branches(inv).createSub(requested));
  }

  private static String checkId(String requested) throws EvaluationException {
    if (requested.isEmpty() || requested.equals(String.valueOf(BranchManager.AUTO_MARKER))) {
      throw new EvaluationException("invalid branch name: '" + requested + "'");
    }
    if (BranchManager.isAutoNamed(requested) && !Tokenizer.isValidName(requested.substring(1))) {
      throw new EvaluationException(
          "invalid branch reference macro name: '" + requested.substring(1) + "'");
    }
    return requested;
  }

  private static void bindReference(Invocation inv, String requested, Branch branch) {
    if (BranchManager.isAutoNamed(requested)) {
      inv.context()
          .macros()
          .rebind(UserMacro.constant(requested.substring(1), branch.id(), inv.location()));
    }
  }

  private static BranchManager branches(Invocation inv) {
    return inv.context().branches();
  }
}
