package io.jscribe.parser;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class WhitespaceModeTest {

  @Test
  void preserveKeepsEveryLineBreak() {
    assertEquals("a\nb", WhitespaceMode.PRESERVE.apply("a \t\n\t b"));
    assertEquals("a\n\nb", WhitespaceMode.PRESERVE.apply("a\n\n b"));
  }

  @Test
  void skipDropsLineBreaksAndSurroundingBlanks() {
    assertEquals("ab", WhitespaceMode.SKIP.apply("a \t\n\t b"));
    assertEquals("ab", WhitespaceMode.SKIP.apply("a\n\n b"));
  }

  @Test
  void blanksWithoutLineBreakAreKept() {
    assertEquals("a  b", WhitespaceMode.SKIP.apply("a  b"));
    assertEquals("a  b", WhitespaceMode.PRESERVE.apply("a  b"));
  }

  @Test
  void fromNameIgnoresCase() {
    assertEquals(WhitespaceMode.SKIP, WhitespaceMode.fromName(" Skip "));
    assertEquals(WhitespaceMode.PRESERVE, WhitespaceMode.fromName("preserve"));
    assertThrows(IllegalArgumentException.class, () -> WhitespaceMode.fromName("collapse"));
  }
}
