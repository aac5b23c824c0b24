package io.jscribe.parser;

import io.jscribe.parser.ast.CallNode;
import io.jscribe.parser.ast.Node;
import io.jscribe.parser.ast.TextNode;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns source text into a tree of literal text runs and macro invocations.
 *
 * <p>Syntax:
 *
 * <pre>
 * $name[arg1][arg2]   invocation; groups nest without limit and hold text and invocations
 * $$whitespace.skip   directive; applied as soon as it is read, no arguments
 * # text              comment up to the end of the line, outside argument groups only
 * ^c                  the character c taken literally
 * </pre>
 *
 * <p>Whitespace just inside the brackets of an argument group is dropped, as is whitespace at the
 * start and end of the input. In {@link WhitespaceMode#SKIP} blanks following an invocation are
 * dropped too. Brackets that do not open an argument group are literal text but must balance.
 */
public final class Tokenizer {
  public static final char SIGIL = '$';
  public static final char ESCAPE = '^';
  public static final char COMMENT = '#';
  public static final char OPEN = '[';
  public static final char CLOSE = ']';

  private final String file;
  private final String input;
  private final ModeState modes;
  private int pos = 0;
  private int line = 1;
  private int column = 1;
  private int groupDepth = 0;

  private Tokenizer(String file, String input, ModeState modes) {
    this.file = file;
    this.input = input;
    this.modes = modes;
  }

  /**
   * Tokenizes a source file. Directives update {@code modes} as they are encountered, so the
   * caller observes the modes in effect at the end of the file.
   *
   * @param file logical file name used in locations
   * @param source source text
   * @param modes mode flags of the compilation unit
   * @return top-level nodes
   * @throws ScribeSyntaxException if the source is malformed
   */
  public static List<Node> tokenize(String file, String source, ModeState modes)
      throws ScribeSyntaxException {
    String normalized = source.replace("\r\n", "\n").replace('\r', '\n');
    Tokenizer tokenizer = new Tokenizer(file, normalized, modes);
    tokenizer.skipWhitespace();
    return tokenizer.parseSequence(false);
  }

  // sequence := (text | escape | comment | directive | call | '[' sequence ']')*
  private List<Node> parseSequence(boolean inGroup) throws ScribeSyntaxException {
    List<Node> nodes = new ArrayList<>();
    TextRun text = new TextRun(nodes);
    Deque<SourceLocation> bareBrackets = new ArrayDeque<>();
    while (!eof()) {
      char c = peek();
      if (c == CLOSE) {
        if (!bareBrackets.isEmpty()) {
          bareBrackets.pop();
          text.raw(location(), advance());
          continue;
        }
        if (inGroup) {
          break;
        }
        throw new ScribeSyntaxException("unbalanced bracket: unexpected ']'", location());
      }
      if (c == OPEN) {
        bareBrackets.push(location());
        text.raw(location(), advance());
      } else if (c == ESCAPE) {
        SourceLocation at = location();
        advance();
        if (eof()) {
          throw new ScribeSyntaxException("unterminated escape at end of input", at);
        }
        text.literal(at, advance());
      } else if (c == COMMENT && groupDepth == 0) {
        text.dropTrailingBlanks();
        skipComment();
      } else if (c == SIGIL) {
        text.flush();
        if (peek(1) == SIGIL) {
          parseDirective();
        } else {
          nodes.add(parseCall());
          if (modes.whitespace() == WhitespaceMode.SKIP) {
            skipBlanks();
          }
        }
      } else {
        text.raw(location(), advance());
      }
    }
    if (!bareBrackets.isEmpty()) {
      throw new ScribeSyntaxException(
          "unbalanced bracket: '[' is never closed", bareBrackets.getLast());
    }
    text.dropTrailingWhitespace();
    text.flush();
    return nodes;
  }

  private CallNode parseCall() throws ScribeSyntaxException {
    SourceLocation at = location();
    advance(); // sigil
    String name = readName();
    if (name.isEmpty()) {
      throw new ScribeSyntaxException("invalid macro name: '" + SIGIL + excerpt() + "'", at);
    }
    List<List<Node>> args = new ArrayList<>();
    while (!eof() && peek() == OPEN) {
      SourceLocation open = location();
      advance();
      groupDepth++;
      skipWhitespace();
      List<Node> arg = parseSequence(true);
      if (eof()) {
        throw new ScribeSyntaxException(
            "unbalanced bracket: argument of " + SIGIL + name + " is never closed", open);
      }
      advance(); // ]
      groupDepth--;
      args.add(arg);
    }
    return new CallNode(at, name, args);
  }

  private void parseDirective() throws ScribeSyntaxException {
    SourceLocation at = location();
    advance();
    advance();
    int start = pos;
    while (!eof() && (isNamePart(peek()) || peek() == '.')) {
      advance();
    }
    String keyword = input.substring(start, pos);
    Directive directive =
        Directive.fromKeyword(keyword)
            .orElseThrow(
                () ->
                    new ScribeSyntaxException(
                        "unknown directive: '$$"
                            + keyword
                            + "'; known directives: "
                            + Directive.describeAll(),
                        at));
    directive.apply(modes);
    if (!eof() && peek() == '\n') {
      advance();
    }
  }

  private String readName() {
    int start = pos;
    if (eof() || !isNameStart(peek())) {
      return "";
    }
    advance();
    while (!eof()) {
      char c = peek();
      if (isNamePart(c) || (c == '.' && isNamePart(peek(1)))) {
        advance();
      } else {
        break;
      }
    }
    return input.substring(start, pos);
  }

  private void skipComment() {
    while (!eof() && peek() != '\n') {
      advance();
    }
    skipWhitespace();
  }

  private void skipBlanks() {
    while (!eof() && (peek() == ' ' || peek() == '\t')) {
      advance();
    }
  }

  private void skipWhitespace() {
    while (!eof() && Character.isWhitespace(peek())) {
      advance();
    }
  }

  /**
   * Checks whether a string is a macro name that can be written after the sigil.
   *
   * @param name candidate name
   * @return true if {@code $name} would be read as an invocation of exactly this name
   */
  public static boolean isValidName(String name) {
    if (name.isEmpty() || !isNameStart(name.charAt(0))) {
      return false;
    }
    for (int i = 1; i < name.length(); i++) {
      char c = name.charAt(i);
      boolean dotted = c == '.' && i + 1 < name.length() && isNamePart(name.charAt(i + 1));
      if (!isNamePart(c) && !dotted) {
        return false;
      }
    }
    return true;
  }

  private String excerpt() {
    int end = pos;
    while (end < input.length() && end - pos < 10 && !Character.isWhitespace(input.charAt(end))) {
      end++;
    }
    return input.substring(pos, end);
  }

  private static boolean isNameStart(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
  }

  private static boolean isNamePart(char c) {
    return isNameStart(c) || (c >= '0' && c <= '9');
  }

  private SourceLocation location() {
    return new SourceLocation(file, line, column);
  }

  private boolean eof() {
    return pos >= input.length();
  }

  private char peek() {
    return input.charAt(pos);
  }

  private char peek(int offset) {
    int i = pos + offset;
    return i < input.length() ? input.charAt(i) : '\0';
  }

  private char advance() {
    char c = input.charAt(pos++);
    if (c == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    return c;
  }

  /**
   * Accumulates consecutive text into a single node. Unescaped characters go through the current
   * whitespace mode; escaped characters are taken as they are.
   */
  private final class TextRun {
    private final List<Node> out;
    private final StringBuilder raw = new StringBuilder();
    private final StringBuilder captured = new StringBuilder();
    private SourceLocation start;

    TextRun(List<Node> out) {
      this.out = out;
    }

    void raw(SourceLocation at, char c) {
      if (start == null) {
        start = at;
      }
      raw.append(c);
    }

    void literal(SourceLocation at, char c) {
      if (start == null) {
        start = at;
      }
      settle();
      captured.append(c);
    }

    void dropTrailingBlanks() {
      int len = raw.length();
      while (len > 0 && (raw.charAt(len - 1) == ' ' || raw.charAt(len - 1) == '\t')) {
        len--;
      }
      raw.setLength(len);
    }

    void dropTrailingWhitespace() {
      int len = raw.length();
      while (len > 0 && Character.isWhitespace(raw.charAt(len - 1))) {
        len--;
      }
      raw.setLength(len);
    }

    void flush() {
      settle();
      if (captured.length() > 0) {
        out.add(new TextNode(start, captured.toString(), modes.escape()));
        captured.setLength(0);
      }
      start = null;
    }

    private void settle() {
      if (raw.length() > 0) {
        captured.append(modes.whitespace().apply(raw.toString()));
        raw.setLength(0);
      }
    }
  }
}
