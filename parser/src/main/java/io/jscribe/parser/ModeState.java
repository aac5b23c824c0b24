package io.jscribe.parser;

/**
 * The mode flags of one compilation unit. Directives switch them for every token that follows,
 * across included files, until the next directive or the end of the unit. They are not block
 * scoped and do not nest.
 */
public final class ModeState {
  private WhitespaceMode whitespace;
  private EscapeMode escape;

  public ModeState() {
    this(WhitespaceMode.PRESERVE, EscapeMode.NONE);
  }

  public ModeState(WhitespaceMode whitespace, EscapeMode escape) {
    this.whitespace = whitespace;
    this.escape = escape;
  }

  public WhitespaceMode whitespace() {
    return whitespace;
  }

  public EscapeMode escape() {
    return escape;
  }

  public void setWhitespace(WhitespaceMode whitespace) {
    this.whitespace = whitespace;
  }

  public void setEscape(EscapeMode escape) {
    this.escape = escape;
  }
}
