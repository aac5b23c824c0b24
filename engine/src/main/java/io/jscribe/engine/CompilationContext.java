package io.jscribe.engine;

import io.jscribe.engine.branch.BranchManager;
import io.jscribe.engine.counter.CounterStore;
import io.jscribe.engine.expand.Expander;
import io.jscribe.engine.host.IncludeResolver;
import io.jscribe.engine.host.SourceResolver;
import io.jscribe.engine.macro.MacroTable;
import io.jscribe.parser.ModeState;

/**
 * All mutable state of one compilation unit. Created by {@link Compiler} at the start of a run and
 * dropped when the run ends; nothing in it is shared between runs.
 */
public final class CompilationContext {
  private final EngineConfig config;
  private final MacroTable macros = new MacroTable();
  private final CounterStore counters = new CounterStore();
  private final BranchManager branches = new BranchManager();
  private final ModeState modes;
  private final Expander expander;
  private final IncludeResolver includes;

  public CompilationContext(EngineConfig config, SourceResolver sources) {
    this.config = config;
    this.modes = new ModeState(config.whitespace(), config.escape());
    this.expander = new Expander(this);
    this.includes = new IncludeResolver(this, sources);
  }

  public EngineConfig config() {
    return config;
  }

  public MacroTable macros() {
    return macros;
  }

  public CounterStore counters() {
    return counters;
  }

  public BranchManager branches() {
    return branches;
  }

  public ModeState modes() {
    return modes;
  }

  public Expander expander() {
    return expander;
  }

  public IncludeResolver includes() {
    return includes;
  }
}
