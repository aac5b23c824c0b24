package io.jscribe.parser;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/** Argument-less instructions written {@code $$name} that switch a mode flag immediately. */
public enum Directive {
  WHITESPACE_PRESERVE("whitespace.preserve") {
    @Override
    void apply(ModeState modes) {
      modes.setWhitespace(WhitespaceMode.PRESERVE);
    }
  },
  WHITESPACE_SKIP("whitespace.skip") {
    @Override
    void apply(ModeState modes) {
      modes.setWhitespace(WhitespaceMode.SKIP);
    }
  },
  ESCAPE_NONE("escape.none") {
    @Override
    void apply(ModeState modes) {
      modes.setEscape(EscapeMode.NONE);
    }
  },
  ESCAPE_ALL("escape.all") {
    @Override
    void apply(ModeState modes) {
      modes.setEscape(EscapeMode.ALL);
    }
  },
  ESCAPE_LATEX("escape.latex") {
    @Override
    void apply(ModeState modes) {
      modes.setEscape(EscapeMode.LATEX);
    }
  };

  private final String keyword;

  Directive(String keyword) {
    this.keyword = keyword;
  }

  /** Returns the name written after the doubled sigil. */
  public String keyword() {
    return keyword;
  }

  abstract void apply(ModeState modes);

  /**
   * Looks up a directive by the name written after the doubled sigil.
   *
   * @param keyword directive name, e.g. "whitespace.skip"
   * @return the directive, or empty if unknown
   */
  public static Optional<Directive> fromKeyword(String keyword) {
    return Arrays.stream(values()).filter(d -> d.keyword.equals(keyword)).findFirst();
  }

  /** Returns the known directives as they are written in source, sorted, comma separated. */
  public static String describeAll() {
    return Arrays.stream(values())
        .map(d -> "$$" + d.keyword)
        .sorted()
        .collect(Collectors.joining(", "));
  }
}
