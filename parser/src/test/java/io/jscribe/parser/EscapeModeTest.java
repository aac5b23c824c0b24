package io.jscribe.parser;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class EscapeModeTest {

  @Test
  void noneLeavesTextAlone() {
    assertEquals("<b>50% & $x</b>", EscapeMode.NONE.apply("<b>50% & $x</b>"));
  }

  @Test
  void allEscapesMarkupCharacters() {
    assertEquals(
        "&lt;a href=&quot;x&quot;&gt;&amp;&lt;/a&gt;",
        EscapeMode.ALL.apply("<a href=\"x\">&</a>"));
  }

  @Test
  void latexEscapesSpecialCharacters() {
    assertEquals(
        "50\\% of \\$x\\_1 \\& \\{y\\} \\#2 \\textasciitilde{} \\textasciicircum{}"
            + " \\textbackslash{}",
        EscapeMode.LATEX.apply("50% of $x_1 & {y} #2 ~ ^ \\"));
  }

  @Test
  void fromNameRejectsUnknownModes() {
    assertEquals(EscapeMode.LATEX, EscapeMode.fromName("LaTeX"));
    assertThrows(IllegalArgumentException.class, () -> EscapeMode.fromName("html"));
  }
}
