package io.biblcal.report;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Fixed-width rendering of the numeric report columns. */
public final class FieldFormat {
  private FieldFormat() {}

  /**
   * Renders a number in a column of {@code width + 1} characters.
   *
   * <p>The value is rounded half-even to as many decimals as the width leaves after the integer
   * digits. Trailing zeros are dropped, an integer keeps ".0" when it fits, and values below one
   * in magnitude carry a leading zero. The result is padded with spaces and cut to the column.
   *
   * @param value the number
   * @param width the field width, at least 2
   * @return the column text, exactly {@code max(width, 2) + 1} characters
   */
  public static String format(double value, int width) {
    int length = Math.max(width, 2);
    if (!Double.isFinite(value)) {
      return pad(Double.toString(value), length + 1);
    }
    int integerDigits = 0;
    double scaled = value;
    while (Math.abs(scaled) > 1) {
      scaled /= 10;
      integerDigits++;
    }
    int room = integerDigits >= length ? integerDigits + 1 : length;
    int decimals = Math.abs(value) < 1 ? room - integerDigits - 2 : room - integerDigits - 1;

    BigDecimal rounded = BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_EVEN);
    String text;
    boolean integer;
    if (rounded.signum() == 0) {
      text = "0";
      integer = true;
    } else {
      BigDecimal stripped = rounded.stripTrailingZeros();
      text = stripped.toPlainString();
      integer = stripped.scale() <= 0;
    }
    if (integer && text.length() + 2 <= length + 1) {
      text += ".0";
    }
    return pad(text, length + 1);
  }

  static String pad(String text, int columns) {
    if (text.length() >= columns) {
      return text.substring(0, columns);
    }
    return text + " ".repeat(columns - text.length());
  }
}
