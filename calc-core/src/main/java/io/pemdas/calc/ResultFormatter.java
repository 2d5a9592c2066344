package io.pemdas.calc;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Formats evaluation results for display.
 *
 * <p>Output of {@link #format(double)} is itself a valid expression that evaluates to the same
 * value, for every finite input.
 */
public final class ResultFormatter {
  private static final double MAX_PLAIN_INTEGRAL = 1e15;

  private ResultFormatter() {}

  /**
   * Formats a value in its shortest exact form. Integral values print without a fraction.
   *
   * @param value the value
   * @return the text form
   */
  public static String format(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return String.valueOf(value);
    }
    if (value == Math.rint(value) && Math.abs(value) <= MAX_PLAIN_INTEGRAL) {
      return String.valueOf((long) value);
    }
    return String.valueOf(value);
  }

  /**
   * Formats a value rounded to a number of significant digits, dropping trailing zeros. Values
   * whose decimal exponent is below -5 or not less than {@code significantDigits} use scientific
   * notation.
   *
   * @param value the value
   * @param significantDigits digits to keep; zero or less selects {@link #format(double)}
   * @return the text form
   */
  public static String format(double value, int significantDigits) {
    if (significantDigits <= 0 || Double.isNaN(value) || Double.isInfinite(value)) {
      return format(value);
    }
    if (value == 0) {
      return "0";
    }
    BigDecimal rounded =
        new BigDecimal(value)
            .round(new MathContext(significantDigits, RoundingMode.HALF_EVEN))
            .stripTrailingZeros();
    int exponent = rounded.precision() - rounded.scale() - 1;
    if (exponent < -5 || exponent >= significantDigits) {
      return rounded.unscaledValue().signum() < 0
          ? "-" + scientific(rounded.negate(), exponent)
          : scientific(rounded, exponent);
    }
    return rounded.toPlainString();
  }

  private static String scientific(BigDecimal positive, int exponent) {
    String mantissa = positive.movePointLeft(exponent).stripTrailingZeros().toPlainString();
    return mantissa + "e" + (exponent < 0 ? "-" : "+") + Math.abs(exponent);
  }
}
