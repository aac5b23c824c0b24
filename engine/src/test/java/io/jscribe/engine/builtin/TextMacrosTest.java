package io.jscribe.engine.builtin;

import static org.junit.jupiter.api.Assertions.*;

import io.jscribe.engine.Compiler;
import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.builtin.TextMacros.NumberStyle;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class TextMacrosTest {

  private static String expand(String source) throws Exception {
    return Compiler.builder().build().compileSource("text.psc", source).mainText();
  }

  @ParameterizedTest
  @CsvSource({
    "1, I", "4, IV", "9, IX", "14, XIV", "40, XL", "90, XC", "400, CD", "1994, MCMXCIV",
    "3999, MMMCMXCIX"
  })
  void romanNumerals(int number, String expected) throws Exception {
    assertEquals(expected, TextMacros.toRoman(number));
  }

  @Test
  void romanRejectsOutOfRange() {
    assertThrows(EvaluationException.class, () -> TextMacros.toRoman(0));
    assertThrows(EvaluationException.class, () -> TextMacros.toRoman(4000));
  }

  @ParameterizedTest
  @CsvSource({"1, A", "26, Z", "27, AA", "52, AZ", "53, BA", "702, ZZ", "703, AAA"})
  void alphaLatin(int number, String expected) throws Exception {
    assertEquals(expected, TextMacros.toAlphaLatin(number));
  }

  @Test
  void alphaLatinRejectsZero() {
    assertThrows(EvaluationException.class, () -> TextMacros.toAlphaLatin(0));
  }

  @Test
  void numberStyles() throws Exception {
    assertEquals("1234567.50", TextMacros.formatNumber("1234567.50", NumberStyle.NEUTRAL));
    assertEquals("1,234,567.50", TextMacros.formatNumber("1234567.50", NumberStyle.EN));
    assertEquals("1\u00a0234\u00a0567,50", TextMacros.formatNumber("1234567.50", NumberStyle.FR));
    assertEquals("-1,000", TextMacros.formatNumber("-1000", NumberStyle.EN));
    assertEquals("999", TextMacros.formatNumber("999", NumberStyle.FR));
  }

  @Test
  void numberRejectsGarbage() {
    assertThrows(EvaluationException.class, () -> TextMacros.formatNumber("12a", NumberStyle.EN));
  }

  @Test
  void macrosExpandTheirArguments() throws Exception {
    String source =
        "$macro.new[n][1994]"
            + "$roman[$n] $alpha.latin[28] $case.lower[HeLLo] $case.upper[mixed Case]"
            + " $number[12345.6][en] $number[12345.6][FR] $number[12345.6][neutral]";

    assertEquals("MCMXCIV AB hello MIXED CASE 12,345.6 12\u00a0345,6 12345.6", expand(source));
  }

  @Test
  void unknownNumberStyleIsAnError() {
    EvaluationException e =
        assertThrows(EvaluationException.class, () -> expand("$number[1][de]"));
    assertTrue(e.getDetail().startsWith("unknown number format: 'de'"));
    assertEquals(1, e.getLocation().line());
  }

  @Test
  void caseFoldingKeepsEscaping() throws Exception {
    assertEquals("&amp;A&lt;", expand("$$escape.all\n$case.upper[&a<]"));
  }

  @Property(tries = 500)
  void romanUsesOnlyNumeralLetters(@ForAll @IntRange(min = 1, max = 3999) int n)
      throws EvaluationException {
    String roman = TextMacros.toRoman(n);

    assertTrue(roman.matches("M{0,3}(CM|CD|D?C{0,3})(XC|XL|L?X{0,3})(IX|IV|V?I{0,3})"));
  }

  @Property(tries = 500)
  void alphaLatinIsBijective(@ForAll @IntRange(min = 1, max = 100_000) int n)
      throws EvaluationException {
    String letters = TextMacros.toAlphaLatin(n);

    int decoded = 0;
    for (char c : letters.toCharArray()) {
      decoded = decoded * 26 + (c - 'A' + 1);
    }
    assertEquals(n, decoded);
  }
}
