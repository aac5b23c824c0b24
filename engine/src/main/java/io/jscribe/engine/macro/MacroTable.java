package io.jscribe.engine.macro;

import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.RedefinitionException;
import io.jscribe.engine.expand.Frame;
import io.jscribe.parser.ast.Node;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The flat, dynamically scoped macro namespace of a compilation unit. A definition is visible to
 * every invocation that is expanded after it, wherever it happens.
 */
public final class MacroTable {
  private static final Logger log = LoggerFactory.getLogger(MacroTable.class);

  /** Name under which a wrapping body reaches the binding it replaced. */
  public static final String PREVIOUS = "previous";

  private final Map<String, Macro> macros = new HashMap<>();

  /**
   * Defines a macro. A wrapping definition reaches the binding it replaces as {@code $previous}.
   *
   * @param name macro name
   * @param params formal parameter names
   * @param body unexpanded body
   * @param definitionFrame bindings visible at the definition site, or null
   * @param mode whether the name must be free or already bound
   * @return the installed macro
   * @throws RedefinitionException if {@code mode} does not match the current state of the name
   * @throws EvaluationException if a wrapping macro declares a parameter named {@value #PREVIOUS}
   */
  public UserMacro define(
      String name, List<String> params, List<Node> body, Frame definitionFrame, DefineMode mode)
      throws RedefinitionException, EvaluationException {
    if (mode == DefineMode.WRAP) {
      return override(name, params, body, definitionFrame, PREVIOUS);
    }
    if (macros.containsKey(name)) {
      throw new RedefinitionException("macro already defined: $" + name);
    }
    UserMacro macro = new UserMacro(name, params, body, null, null, definitionFrame);
    macros.put(name, macro);
    log.debug("Defined ${} with {} parameter(s)", name, params.size());
    return macro;
  }

  /**
   * Replaces an existing macro, keeping the old binding reachable from the new body under a
   * chosen name.
   *
   * @param name macro name, must be bound
   * @param params formal parameter names of the new definition
   * @param body unexpanded body
   * @param definitionFrame bindings visible at the definition site, or null
   * @param alias name of the old binding inside the new body
   * @return the installed macro
   * @throws RedefinitionException if the name is not bound
   * @throws EvaluationException if {@code alias} is also a parameter name
   */
  public UserMacro override(
      String name, List<String> params, List<Node> body, Frame definitionFrame, String alias)
      throws RedefinitionException, EvaluationException {
    Macro existing = macros.get(name);
    if (existing == null) {
      throw new RedefinitionException("cannot wrap undefined macro: $" + name);
    }
    if (params.contains(alias)) {
      throw new EvaluationException(
          "$" + name + ": parameter name conflicts with the wrapped macro alias: " + alias);
    }
    UserMacro macro =
        new UserMacro(name, params, body, null, null, definitionFrame).wrapping(existing, alias);
    macros.put(name, macro);
    log.debug("Wrapped ${} with {} parameter(s), previous as ${}", name, params.size(), alias);
    return macro;
  }

  /**
   * Adds a macro under a free name.
   *
   * @param macro built-in or constant macro
   * @throws RedefinitionException if the name is already bound
   */
  public void register(Macro macro) throws RedefinitionException {
    if (macros.putIfAbsent(macro.name(), macro) != null) {
      throw new RedefinitionException("macro already defined: $" + macro.name());
    }
  }

  /**
   * Binds a name unconditionally, replacing any previous binding.
   *
   * @param macro new binding
   */
  public void rebind(Macro macro) {
    macros.put(macro.name(), macro);
  }

  public Optional<Macro> lookup(String name) {
    return Optional.ofNullable(macros.get(name));
  }

  public boolean contains(String name) {
    return macros.containsKey(name);
  }

  public int size() {
    return macros.size();
  }
}
