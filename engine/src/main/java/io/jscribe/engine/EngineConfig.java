package io.jscribe.engine;

import io.jscribe.parser.EscapeMode;
import io.jscribe.parser.WhitespaceMode;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Settings of a compilation run. Loads from {@code jscribe.properties}; every key is optional.
 *
 * @param maxCallDepth maximum number of simultaneously active macro invocations
 * @param maxIncludeDepth maximum nesting of included files
 * @param argumentEvaluation how often a parameter reference expands its argument
 * @param whitespace initial whitespace mode of each unit
 * @param escape initial escape mode of each unit
 * @param mainDestination destination tag of the {@code main} root branch, or null to keep the main
 *     output in memory only
 */
public record EngineConfig(
    int maxCallDepth,
    int maxIncludeDepth,
    ArgumentEvaluation argumentEvaluation,
    WhitespaceMode whitespace,
    EscapeMode escape,
    String mainDestination) {

  public static final String RESOURCE = "/jscribe.properties";

  static final String KEY_MAX_CALL_DEPTH = "jscribe.maxCallDepth";
  static final String KEY_MAX_INCLUDE_DEPTH = "jscribe.maxIncludeDepth";
  static final String KEY_ARGUMENT_EVALUATION = "jscribe.argumentEvaluation";
  static final String KEY_WHITESPACE = "jscribe.whitespace";
  static final String KEY_ESCAPE = "jscribe.escape";
  static final String KEY_MAIN_DESTINATION = "jscribe.mainDestination";

  /** Strategy for expanding macro arguments. */
  public enum ArgumentEvaluation {
    /** Every reference to a parameter re-expands the argument in the caller's context. */
    BY_NAME,
    /** The first reference expands the argument; later ones reuse its text. */
    BY_NEED;

    static ArgumentEvaluation fromName(String name) {
      return switch (name.trim().toLowerCase(Locale.ROOT)) {
        case "by-name" -> BY_NAME;
        case "by-need" -> BY_NEED;
        default -> throw new IllegalArgumentException("Unknown argument evaluation: " + name);
      };
    }
  }

  public EngineConfig {
    if (maxCallDepth < 1) {
      throw new IllegalArgumentException("maxCallDepth must be positive: " + maxCallDepth);
    }
    if (maxIncludeDepth < 1) {
      throw new IllegalArgumentException("maxIncludeDepth must be positive: " + maxIncludeDepth);
    }
  }

  /**
   * Creates the default configuration.
   *
   * @return default configuration
   */
  public static EngineConfig defaults() {
    return new EngineConfig(
        100, 25, ArgumentEvaluation.BY_NAME, WhitespaceMode.PRESERVE, EscapeMode.NONE, null);
  }

  /**
   * Loads configuration from {@code jscribe.properties} at the classpath root.
   *
   * @return loaded configuration, or defaults if the resource doesn't exist
   * @throws IOException if the resource exists but cannot be read
   */
  public static EngineConfig fromClasspath() throws IOException {
    try (InputStream in = EngineConfig.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        return defaults();
      }
      Properties props = new Properties();
      props.load(in);
      return fromProperties(props);
    }
  }

  /**
   * Loads configuration from a properties file.
   *
   * @param path properties file
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static EngineConfig load(Path path) throws IOException {
    if (!Files.exists(path)) {
      return defaults();
    }
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  /**
   * Converts properties to a configuration object. Missing keys take their default values.
   *
   * @param props properties to convert
   * @return configuration object
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static EngineConfig fromProperties(Properties props) {
    int maxCallDepth = Integer.parseInt(props.getProperty(KEY_MAX_CALL_DEPTH, "100").trim());
    int maxIncludeDepth = Integer.parseInt(props.getProperty(KEY_MAX_INCLUDE_DEPTH, "25").trim());
    ArgumentEvaluation evaluation =
        ArgumentEvaluation.fromName(props.getProperty(KEY_ARGUMENT_EVALUATION, "by-name"));
    WhitespaceMode whitespace =
        WhitespaceMode.fromName(props.getProperty(KEY_WHITESPACE, "preserve"));
    EscapeMode escape = EscapeMode.fromName(props.getProperty(KEY_ESCAPE, "none"));
    String mainDestination = props.getProperty(KEY_MAIN_DESTINATION);
    if (mainDestination != null && mainDestination.isBlank()) {
      mainDestination = null;
    }
    return new EngineConfig(
        maxCallDepth, maxIncludeDepth, evaluation, whitespace, escape, mainDestination);
  }

  /** Returns a copy of this configuration with a different main destination. */
  public EngineConfig withMainDestination(String destination) {
    return new EngineConfig(
        maxCallDepth, maxIncludeDepth, argumentEvaluation, whitespace, escape, destination);
  }

  /** Returns a copy of this configuration with a different argument evaluation strategy. */
  public EngineConfig withArgumentEvaluation(ArgumentEvaluation evaluation) {
    return new EngineConfig(
        maxCallDepth, maxIncludeDepth, evaluation, whitespace, escape, mainDestination);
  }
}
