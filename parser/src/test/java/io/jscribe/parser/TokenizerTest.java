package io.jscribe.parser;

import static org.junit.jupiter.api.Assertions.*;

import io.jscribe.parser.ast.CallNode;
import io.jscribe.parser.ast.Node;
import io.jscribe.parser.ast.TextNode;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class TokenizerTest {

  private ModeState modes;

  @BeforeEach
  void setUp() {
    modes = new ModeState();
  }

  private List<Node> tokenize(String source) throws ScribeSyntaxException {
    return Tokenizer.tokenize("test.psc", source, modes);
  }

  private static String text(Node node) {
    return assertInstanceOf(TextNode.class, node).text();
  }

  @Test
  void textAndInvocation() throws Exception {
    List<Node> nodes = tokenize("Hello $name[World]!");

    assertEquals(3, nodes.size());
    assertEquals("Hello ", text(nodes.get(0)));
    CallNode call = assertInstanceOf(CallNode.class, nodes.get(1));
    assertEquals("name", call.name());
    assertEquals(1, call.args().size());
    assertEquals("World", text(call.args().get(0).get(0)));
    assertEquals("!", text(nodes.get(2)));
  }

  @Test
  void invocationWithoutArguments() throws Exception {
    List<Node> nodes = tokenize("$newline after");

    CallNode call = assertInstanceOf(CallNode.class, nodes.get(0));
    assertEquals("newline", call.name());
    assertTrue(call.args().isEmpty());
    assertEquals(" after", text(nodes.get(1)));
  }

  @Test
  void dottedNameStopsBeforeTrailingDot() throws Exception {
    List<Node> nodes = tokenize("$counter.value[c]. $x.");

    assertEquals("counter.value", ((CallNode) nodes.get(0)).name());
    assertEquals(". ", text(nodes.get(1)));
    assertEquals("x", ((CallNode) nodes.get(2)).name());
    assertEquals(".", text(nodes.get(3)));
  }

  @Test
  void argumentGroupsNest() throws Exception {
    List<Node> nodes = tokenize("$a[$b[$c[x]]][y]");

    CallNode a = (CallNode) nodes.get(0);
    assertEquals(2, a.args().size());
    CallNode b = (CallNode) a.args().get(0).get(0);
    CallNode c = (CallNode) b.args().get(0).get(0);
    assertEquals("c", c.name());
    assertEquals("x", text(c.args().get(0).get(0)));
    assertEquals("$a[$b[$c[x]]][y]", a.toString());
  }

  @Test
  void deepNestingIsSupported() throws Exception {
    int depth = 500;
    String source = "$f[".repeat(depth) + "x" + "]".repeat(depth);

    Node node = tokenize(source).get(0);
    for (int i = 0; i < depth; i++) {
      node = ((CallNode) node).args().get(0).get(0);
    }
    assertEquals("x", text(node));
  }

  @Test
  void whitespaceInsideGroupIsTrimmed() throws Exception {
    CallNode call = (CallNode) tokenize("$f[  a b \n ]").get(0);

    assertEquals("a b", text(call.args().get(0).get(0)));
  }

  @Test
  void inputIsTrimmed() throws Exception {
    List<Node> nodes = tokenize("  \n hi \n\n");

    assertEquals(1, nodes.size());
    assertEquals("hi", text(nodes.get(0)));
  }

  @Test
  void bareBracketsAreLiteral() throws Exception {
    assertEquals("see [1] and [2]", text(tokenize("see [1] and [2]").get(0)));

    CallNode call = (CallNode) tokenize("$f[[x]]").get(0);
    assertEquals("[x]", text(call.args().get(0).get(0)));
  }

  @Test
  void escapeMakesNextCharacterLiteral() throws Exception {
    assertEquals("$x [ ] # ^", text(tokenize("^$x ^[ ^] ^# ^^").get(0)));
  }

  @Test
  void escapedWhitespaceSurvivesTrimming() throws Exception {
    CallNode call = (CallNode) tokenize("$f[^ a^ ]").get(0);

    assertEquals(" a ", text(call.args().get(0).get(0)));
  }

  @Test
  void commentRunsToEndOfLineAndEatsLineBreak() throws Exception {
    List<Node> nodes = tokenize("a   # note\n  b");

    assertEquals(1, nodes.size());
    assertEquals("ab", text(nodes.get(0)));
  }

  @Test
  void hashInsideArgumentIsText() throws Exception {
    CallNode call = (CallNode) tokenize("$f[#1]").get(0);

    assertEquals("#1", text(call.args().get(0).get(0)));
  }

  @Test
  void preserveModeKeepsLineBreaksOnly() throws Exception {
    assertEquals("a\nb", text(tokenize("a  \n\t b").get(0)));
  }

  @Test
  void skipDirectiveAppliesToFollowingText() throws Exception {
    List<Node> nodes = tokenize("one\ntwo\n$$whitespace.skip\nthree\n four");

    assertEquals("one\ntwo\n", text(nodes.get(0)));
    assertEquals("threefour", text(nodes.get(1)));
    assertEquals(WhitespaceMode.SKIP, modes.whitespace());
  }

  @Test
  void skipModeDropsBlanksAfterInvocation() throws Exception {
    List<Node> nodes = tokenize("$$whitespace.skip\n$deep b$x[1]  c");

    assertEquals("deep", ((CallNode) nodes.get(0)).name());
    assertEquals("b", text(nodes.get(1)));
    assertEquals("x", ((CallNode) nodes.get(2)).name());
    assertEquals("c", text(nodes.get(3)));
  }

  @Test
  void skipModeInsideNestedGroups() throws Exception {
    String source =
        String.join(
            "\n",
            "$$whitespace.skip",
            "$top[",
            "  a",
            "  $inner[arg][",
            "    $deep b",
            "    before close",
            "  ]",
            "c]");

    List<Node> nodes = tokenize(source);

    assertEquals(1, nodes.size());
    CallNode top = (CallNode) nodes.get(0);
    assertEquals(2, top.location().line());
    List<Node> body = top.args().get(0);
    assertEquals(3, body.size());
    assertEquals("a", text(body.get(0)));
    CallNode inner = (CallNode) body.get(1);
    assertEquals("inner", inner.name());
    assertEquals(4, inner.location().line());
    assertEquals("arg", text(inner.args().get(0).get(0)));
    List<Node> second = inner.args().get(1);
    assertEquals("deep", ((CallNode) second.get(0)).name());
    assertEquals(5, second.get(0).location().line());
    assertEquals("bbefore close", text(second.get(1)));
    assertEquals("c", text(body.get(2)));
  }

  @Test
  void escapeModeIsCapturedPerRun() throws Exception {
    List<Node> nodes = tokenize("$$escape.latex\na_b $$escape.none\nc_d");

    TextNode first = (TextNode) nodes.get(0);
    TextNode second = (TextNode) nodes.get(1);
    assertEquals(EscapeMode.LATEX, first.escape());
    assertEquals("a\\_b ", first.escaped());
    assertEquals(EscapeMode.NONE, second.escape());
    assertEquals("c_d", second.escaped());
  }

  @Test
  void crlfIsNormalized() throws Exception {
    assertEquals("a\nb", text(tokenize("a\r\nb").get(0)));
  }

  @Test
  void locationsTrackLinesAndColumns() throws Exception {
    List<Node> nodes = tokenize("first\n  $m[x]");

    assertEquals(new SourceLocation("test.psc", 2, 3), nodes.get(1).location());
  }

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      quoteCharacter = '"',
      value = {
        "a]          | 1 | 2 | unbalanced bracket: unexpected ']'",
        "[abc        | 1 | 1 | unbalanced bracket: '[' is never closed",
        "x $f[abc    | 1 | 5 | unbalanced bracket: argument of $f is never closed",
        "abc^        | 1 | 4 | unterminated escape at end of input",
        "$1          | 1 | 1 | invalid macro name: '$1'"
      })
  void syntaxErrorsCarryLocation(String source, int line, int column, String detail) {
    ScribeSyntaxException e =
        assertThrows(ScribeSyntaxException.class, () -> tokenize(source.strip()));

    assertEquals(new SourceLocation("test.psc", line, column), e.getLocation());
    assertEquals(detail, e.getDetail());
    assertTrue(e.getMessage().startsWith("test.psc:" + line + ":" + column + ": "));
  }

  @Test
  void unclosedArgumentReportsOpeningBracketLine() {
    ScribeSyntaxException e =
        assertThrows(ScribeSyntaxException.class, () -> tokenize("line1\n  $oops[\nmore"));

    assertEquals(new SourceLocation("test.psc", 2, 8), e.getLocation());
  }

  @Test
  void unknownDirectiveListsKnownOnes() {
    ScribeSyntaxException e = assertThrows(ScribeSyntaxException.class, () -> tokenize("$$foo"));

    assertTrue(e.getDetail().startsWith("unknown directive: '$$foo'"));
    assertTrue(e.getDetail().contains("$$whitespace.skip"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"a", "_x", "counter.value", "a1.b2.c3", "x.if.positive"})
  void validNames(String name) {
    assertTrue(Tokenizer.isValidName(name));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "1a", ".a", "a.", "a..b", "a-b", "!a"})
  void invalidNames(String name) {
    assertFalse(Tokenizer.isValidName(name));
  }
}
