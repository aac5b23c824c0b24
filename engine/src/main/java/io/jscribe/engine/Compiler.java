package io.jscribe.engine;

import io.jscribe.engine.CompilationResult.RenderedBranch;
import io.jscribe.engine.branch.Branch;
import io.jscribe.engine.builtin.MacroLibrary;
import io.jscribe.engine.host.DestinationWriter;
import io.jscribe.engine.host.SourceResolver;
import io.jscribe.engine.macro.MacroTable;
import io.jscribe.engine.macro.UserMacro;
import io.jscribe.parser.ScribeException;
import io.jscribe.parser.SourceLocation;
import io.jscribe.parser.Tokenizer;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs compilation units. Each run gets a fresh {@link CompilationContext}: the standard and
 * configured macro libraries, the host bindings as parameterless macros, and a root branch {@value
 * #MAIN_BRANCH} of kind {@value #MAIN_KIND} that receives the top-level output.
 *
 * <p>Once expansion is complete the reference graph of all branches is checked for cycles, attached
 * or not, and every root branch is flattened. Outputs are handed to the {@link DestinationWriter}
 * only after all roots flattened successfully, so a failing unit writes nothing. A writer failure
 * stops the remaining writes; roots written before it stay written.
 *
 * <pre>{@code
 * Compiler compiler = Compiler.builder()
 *     .sources(path -> Optional.of(Files.readString(root.resolve(path))))
 *     .writer((destination, kind, text) -> Files.writeString(out.resolve(destination), text))
 *     .bind("format", "html")
 *     .build();
 * CompilationResult result = compiler.compile("book.psc");
 * }</pre>
 */
public final class Compiler {
  private static final Logger log = LoggerFactory.getLogger(Compiler.class);

  public static final String MAIN_BRANCH = "main";
  public static final String MAIN_KIND = "text";

  private final EngineConfig config;
  private final SourceResolver sources;
  private final DestinationWriter writer;
  private final Map<String, String> bindings;
  private final List<MacroLibrary> libraries;

  private Compiler(Builder builder) {
    this.config = builder.config;
    this.sources = builder.sources;
    this.writer = builder.writer;
    this.bindings = Map.copyOf(builder.bindings);
    this.libraries = List.copyOf(builder.libraries);
  }

  public static Builder builder() {
    return new Builder();
  }

  public EngineConfig config() {
    return config;
  }

  /**
   * Compiles a source tree starting at an entry file obtained from the source resolver.
   *
   * @param entryPath logical path of the entry file
   * @return the flattened root branches
   * @throws ScribeException if the unit fails; nothing has been written in that case
   * @throws IOException if the destination writer fails
   */
  public CompilationResult compile(String entryPath) throws ScribeException, IOException {
    log.info("Compiling {}", entryPath);
    CompilationContext context = prepare();
    context.includes().include(entryPath, null);
    return finish(context, entryPath);
  }

  /**
   * Compiles source text given directly. Includes are still served by the source resolver.
   *
   * @param name logical file name used in locations
   * @param text source text
   * @return the flattened root branches
   * @throws ScribeException if the unit fails; nothing has been written in that case
   * @throws IOException if the destination writer fails
   */
  public CompilationResult compileSource(String name, String text)
      throws ScribeException, IOException {
    log.info("Compiling {}", name);
    CompilationContext context = prepare();
    context.includes().expandSource(name, text);
    return finish(context, name);
  }

  private CompilationContext prepare() throws ScribeException {
    CompilationContext context = new CompilationContext(config, sources);
    MacroTable table = context.macros();
    for (MacroLibrary library : libraries) {
      library.install(table);
    }
    SourceLocation origin = SourceLocation.start("<bindings>");
    for (Map.Entry<String, String> binding : bindings.entrySet()) {
      table.register(UserMacro.constant(binding.getKey(), binding.getValue(), origin));
    }
    context.branches().createRoot(MAIN_KIND, MAIN_BRANCH, config.mainDestination());
    log.debug("Prepared unit with {} macros", table.size());
    return context;
  }

  private CompilationResult finish(CompilationContext context, String unit)
      throws ScribeException, IOException {
    context.branches().checkAcyclic();
    List<RenderedBranch> rendered = new ArrayList<>();
    for (Branch root : context.branches().roots()) {
      String text = context.branches().flatten(root.id());
      rendered.add(new RenderedBranch(root.id(), root.kind(), root.destination(), text));
    }
    if (writer != null) {
      for (RenderedBranch branch : rendered) {
        if (branch.destination() != null) {
          log.debug("Writing branch {} to {}", branch.id(), branch.destination());
          writer.write(branch.destination(), branch.kind(), branch.text());
        }
      }
    }
    log.info("Compiled {}: {} root branch(es)", unit, rendered.size());
    return new CompilationResult(rendered);
  }

  /** Builder for {@link Compiler}. */
  public static final class Builder {
    private EngineConfig config = EngineConfig.defaults();
    private SourceResolver sources = SourceResolver.none();
    private DestinationWriter writer;
    private final Map<String, String> bindings = new LinkedHashMap<>();
    private final List<MacroLibrary> libraries = new ArrayList<>(MacroLibrary.standard());

    private Builder() {}

    public Builder config(EngineConfig config) {
      this.config = config;
      return this;
    }

    public Builder sources(SourceResolver sources) {
      this.sources = sources;
      return this;
    }

    /** Sets the writer for root branches with a destination. Without one nothing is written. */
    public Builder writer(DestinationWriter writer) {
      this.writer = writer;
      return this;
    }

    /**
     * Seeds the macro table with a parameterless macro expanding to {@code value}.
     *
     * @throws IllegalArgumentException if {@code name} is not a valid macro name
     */
    public Builder bind(String name, String value) {
      if (!Tokenizer.isValidName(name)) {
        throw new IllegalArgumentException("Invalid macro name: " + name);
      }
      bindings.put(name, value);
      return this;
    }

    public Builder bindings(Map<String, String> values) {
      values.forEach(this::bind);
      return this;
    }

    /** Adds a library installed after the standard ones. */
    public Builder library(MacroLibrary library) {
      libraries.add(library);
      return this;
    }

    /** Adds every {@link MacroLibrary} registered through {@link ServiceLoader}. */
    public Builder discoverLibraries() {
      ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
      if (classLoader == null) {
        classLoader = Compiler.class.getClassLoader();
      }
      for (MacroLibrary library : ServiceLoader.load(MacroLibrary.class, classLoader)) {
        log.debug("Discovered macro library {}", library.getClass().getName());
        libraries.add(library);
      }
      return this;
    }

    public Compiler build() {
      return new Compiler(this);
    }
  }
}
