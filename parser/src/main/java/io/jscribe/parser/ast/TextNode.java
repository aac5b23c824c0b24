package io.jscribe.parser.ast;

import io.jscribe.parser.EscapeMode;
import io.jscribe.parser.SourceLocation;

/**
 * A run of literal text. Whitespace handling has already been applied; the escape mode is recorded
 * so that it can be applied when the text is emitted.
 *
 * @param location start of the run
 * @param text captured text, may contain line breaks
 * @param escape escape mode in effect when the run was tokenized
 */
public record TextNode(SourceLocation location, String text, EscapeMode escape) implements Node {

  /** Returns the text as it must appear in output. */
  public String escaped() {
    return escape.apply(text);
  }

  @Override
  public String toString() {
    return text;
  }
}
