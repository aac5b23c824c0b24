package io.jscribe.engine.builtin;

import io.jscribe.engine.EvaluationException;
import io.jscribe.engine.RedefinitionException;
import io.jscribe.engine.expand.Invocation;
import io.jscribe.engine.expand.Rendered;
import io.jscribe.engine.macro.BuiltinMacro;
import io.jscribe.engine.macro.MacroTable;
import io.jscribe.parser.ScribeException;
import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/** Numeral conversions, case folding and number formatting. */
public final class TextMacros implements MacroLibrary {
  private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
  private static final String[] ROMAN_SYMBOLS = {
    "M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"
  };

  /** Separator conventions accepted by {@code $number}. */
  public enum NumberStyle {
    /** No grouping, {@code .} as decimal separator. */
    NEUTRAL(null, '.'),
    /** {@code ,} grouping, {@code .} as decimal separator. */
    EN(',', '.'),
    /** No-break space grouping, {@code ,} as decimal separator. */
    FR('\u00a0', ',');

    private final Character grouping;
    private final char decimal;

    NumberStyle(Character grouping, char decimal) {
      this.grouping = grouping;
      this.decimal = decimal;
    }

    static NumberStyle fromName(String name) throws EvaluationException {
      for (NumberStyle style : values()) {
        if (style.name().equalsIgnoreCase(name)) {
          return style;
        }
      }
      throw new EvaluationException(
          "unknown number format: '" + name + "'; expected one of: neutral, en, fr");
    }
  }

  @Override
  public void install(MacroTable table) throws RedefinitionException {
    table.register(BuiltinMacro.of("roman", 1, inv -> inv.emit(toRoman(inv.integer(0)))));
    table.register(
        BuiltinMacro.of("alpha.latin", 1, inv -> inv.emit(toAlphaLatin(inv.integer(0)))));
    table.register(BuiltinMacro.of("case.lower", 1, inv -> fold(inv, false)));
    table.register(BuiltinMacro.of("case.upper", 1, inv -> fold(inv, true)));
    table.register(
        BuiltinMacro.of(
            "number",
            2,
            inv ->
                inv.emit(
                    formatNumber(inv.rawText(0), NumberStyle.fromName(inv.rawText(1))))));
  }

  // Folds before escaping so that entities and commands keep their case.
  private static void fold(Invocation inv, boolean upper) throws ScribeException {
    Rendered text = inv.render(0);
    inv.emit(text.map(s -> upper ? s.toUpperCase(Locale.ROOT) : s.toLowerCase(Locale.ROOT)));
  }

  /**
   * Converts a number to uppercase Roman numerals in subtractive notation.
   *
   * @param number value in 1..3999
   * @return numeral, e.g. {@code MCMXCIV} for 1994
   * @throws EvaluationException if the number has no Roman representation
   */
  public static String toRoman(int number) throws EvaluationException {
    if (number < 1 || number > 3999) {
      throw new EvaluationException("unsupported number for conversion to Roman: " + number);
    }
    StringBuilder sb = new StringBuilder();
    int remaining = number;
    for (int i = 0; i < ROMAN_VALUES.length; i++) {
      while (remaining >= ROMAN_VALUES[i]) {
        sb.append(ROMAN_SYMBOLS[i]);
        remaining -= ROMAN_VALUES[i];
      }
    }
    return sb.toString();
  }

  /**
   * Converts a number to bijective base 26 with uppercase Latin letters: 1 is A, 26 is Z, 27 is
   * AA.
   *
   * @param number positive value
   * @return letter sequence
   * @throws EvaluationException if the number is not positive
   */
  public static String toAlphaLatin(int number) throws EvaluationException {
    if (number < 1) {
      throw new EvaluationException(
          "unsupported number for conversion to latin letters: " + number);
    }
    StringBuilder sb = new StringBuilder();
    int remaining = number;
    while (remaining > 0) {
      remaining--;
      sb.append((char) ('A' + remaining % 26));
      remaining /= 26;
    }
    return sb.reverse().toString();
  }

  /**
   * Formats a decimal literal with the separators of a style. Fraction digits are kept as
   * written.
   *
   * @param value decimal literal, e.g. {@code -1234567.50}
   * @param style separator convention
   * @return formatted number
   * @throws EvaluationException if the value is not a decimal literal
   */
  public static String formatNumber(String value, NumberStyle style) throws EvaluationException {
    BigDecimal number;
    try {
      number = new BigDecimal(value.strip());
    } catch (NumberFormatException e) {
      throw new EvaluationException("invalid number: '" + value + "'", e);
    }
    if (style == NumberStyle.NEUTRAL) {
      return number.toPlainString();
    }
    DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
    symbols.setGroupingSeparator(style.grouping);
    symbols.setDecimalSeparator(style.decimal);
    symbols.setMinusSign('-');
    DecimalFormat format = new DecimalFormat("#,##0", symbols);
    int scale = Math.max(0, number.scale());
    format.setMinimumFractionDigits(scale);
    format.setMaximumFractionDigits(scale);
    return format.format(number);
  }
}
