package io.jscribe.parser;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Controls how line breaks in literal source text are captured. */
public enum WhitespaceMode {
  /** Line breaks are kept; blanks around them are dropped. */
  PRESERVE,
  /** Line breaks and the blanks around them are dropped. */
  SKIP;

  // A run of line breaks together with the spaces and tabs on either side of each break.
  private static final Pattern LINE_BREAKS = Pattern.compile("[ \\t]*(?:\\n[ \\t]*)+");

  /**
   * Applies this mode to a run of unescaped source text.
   *
   * @param raw source text, with line breaks normalized to {@code \n}
   * @return the captured text
   */
  public String apply(String raw) {
    if (raw.indexOf('\n') < 0) {
      return raw;
    }
    StringBuilder sb = new StringBuilder(raw.length());
    Matcher m = LINE_BREAKS.matcher(raw);
    int last = 0;
    while (m.find()) {
      sb.append(raw, last, m.start());
      if (this == PRESERVE) {
        for (int i = m.start(); i < m.end(); i++) {
          if (raw.charAt(i) == '\n') {
            sb.append('\n');
          }
        }
      }
      last = m.end();
    }
    sb.append(raw, last, raw.length());
    return sb.toString();
  }

  /**
   * Parses a mode name as used in configuration files.
   *
   * @param name "preserve" or "skip", case-insensitive
   * @return the mode
   * @throws IllegalArgumentException if the name is unknown
   */
  public static WhitespaceMode fromName(String name) {
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "preserve" -> PRESERVE;
      case "skip" -> SKIP;
      default -> throw new IllegalArgumentException("Unknown whitespace mode: " + name);
    };
  }
}
