package io.jscribe.parser;

import java.util.Locale;

/**
 * Controls how characters that are special in a target document are rewritten when literal text is
 * emitted. The mode in effect when a text run is tokenized is stored with the run.
 */
public enum EscapeMode {
  /** Text is emitted verbatim. */
  NONE,
  /** Markup-significant characters ({@code & < > "}) are replaced by entities. */
  ALL,
  /** Characters with a meaning in typesetting source are replaced by their literal forms. */
  LATEX;

  /**
   * Escapes a run of literal text.
   *
   * @param text literal text
   * @return the escaped text
   */
  public String apply(String text) {
    if (this == NONE || text.isEmpty()) {
      return text;
    }
    StringBuilder sb = new StringBuilder(text.length() + 16);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      String replacement = this == ALL ? markup(c) : latex(c);
      if (replacement == null) {
        sb.append(c);
      } else {
        sb.append(replacement);
      }
    }
    return sb.toString();
  }

  private static String markup(char c) {
    return switch (c) {
      case '&' -> "&amp;";
      case '<' -> "&lt;";
      case '>' -> "&gt;";
      case '"' -> "&quot;";
      default -> null;
    };
  }

  private static String latex(char c) {
    return switch (c) {
      case '\\' -> "\\textbackslash{}";
      case '{' -> "\\{";
      case '}' -> "\\}";
      case '#' -> "\\#";
      case '$' -> "\\$";
      case '%' -> "\\%";
      case '&' -> "\\&";
      case '_' -> "\\_";
      case '~' -> "\\textasciitilde{}";
      case '^' -> "\\textasciicircum{}";
      default -> null;
    };
  }

  /**
   * Parses a mode name as used in configuration files.
   *
   * @param name "none", "all" or "latex", case-insensitive
   * @return the mode
   * @throws IllegalArgumentException if the name is unknown
   */
  public static EscapeMode fromName(String name) {
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "none" -> NONE;
      case "all" -> ALL;
      case "latex" -> LATEX;
      default -> throw new IllegalArgumentException("Unknown escape mode: " + name);
    };
  }
}
