package io.jscribe.engine.builtin;

import static io.jscribe.engine.macro.BuiltinMacro.UNBOUNDED;

import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.RedefinitionException;
import io.jscribe.engine.expand.Invocation;
import io.jscribe.engine.macro.BuiltinMacro;
import io.jscribe.engine.macro.DefineMode;
import io.jscribe.engine.macro.MacroSignature;
import io.jscribe.engine.macro.MacroTable;
import io.jscribe.parser.ScribeException;
import io.jscribe.parser.Tokenizer;
import io.jscribe.parser.ast.CallNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Definition, dynamic dispatch, inclusion and small text helpers.
 *
 * <pre>
 * $macro.new[name(a, b)][body]        define
 * $macro.wrap[name(a)][body]          redefine, old binding reachable as $previous
 * $macro.override[name][orig][body]   redefine, old binding reachable as $orig
 * $macro.call[name-expr][arg]...      invoke a computed name
 * $include[path]  $include.text[path]
 * $empty  $newline  $eval.text[text]  $log[message]
 * </pre>
 */
public final class CoreMacros implements MacroLibrary {
  private static final Logger log = LoggerFactory.getLogger(CoreMacros.class);

  @Override
  public void install(MacroTable table) throws RedefinitionException {
    table.register(BuiltinMacro.of("empty", 0, inv -> {}));
    table.register(BuiltinMacro.of("newline", 0, inv -> inv.emit("\n")));
    table.register(BuiltinMacro.of("eval.text", 1, inv -> inv.emit(inv.render(0))));
    table.register(
        BuiltinMacro.of("log", 1, inv -> log.info("{}: {}", inv.location(), inv.rawText(0))));
    table.register(BuiltinMacro.of("macro.new", 2, inv -> define(inv, DefineMode.NEW)));
    table.register(BuiltinMacro.of("macro.wrap", 2, inv -> define(inv, DefineMode.WRAP)));
    table.register(BuiltinMacro.of("macro.override", 3, CoreMacros::override));
    table.register(new BuiltinMacro("macro.call", 1, UNBOUNDED, CoreMacros::call));
    table.register(
        BuiltinMacro.of(
            "include", 1, inv -> inv.context().includes().include(inv.rawText(0), inv.location())));
    table.register(
        BuiltinMacro.of(
            "include.text",
            1,
            inv -> inv.emit(inv.context().includes().readText(inv.rawText(0), inv.location()))));
  }

  private static void define(Invocation inv, DefineMode mode) throws ScribeException {
    MacroSignature signature = MacroSignature.parse(inv.rawText(0));
    inv.context()
        .macros()
        .define(signature.name(), signature.params(), inv.nodes(1), inv.frame(), mode);
  }

  private static void override(Invocation inv) throws ScribeException {
    MacroSignature signature = MacroSignature.parse(inv.rawText(0));
    String alias = inv.rawText(1);
    if (!Tokenizer.isValidName(alias)) {
      throw new EvaluationException("invalid original macro name: '" + alias + "'");
    }
    inv.context()
        .macros()
        .override(signature.name(), signature.params(), inv.nodes(2), inv.frame(), alias);
  }

  private static void call(Invocation inv) throws ScribeException {
    String name = inv.rawText(0);
    if (name.isEmpty()) {
      throw new EvaluationException("$" + inv.name() + ": expected non-empty macro name");
    }
    CallNode target = new CallNode(inv.location(), name, inv.nodesFrom(1));
    inv.expander().invoke(target, inv.frame());
  }
}
