package io.pemdas.calc;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates single-line arithmetic expressions to a {@code double}.
 *
 * <p>Supported syntax:
 *
 * <ul>
 *   <li>Addition and subtraction: {@code +}, {@code -}
 *   <li>Multiplication, division and integer remainder: {@code *}, {@code /}, {@code %}
 *   <li>Implicit multiplication: {@code 2(3+4)}, {@code (1+2)(3+4)}, {@code 3 4}
 *   <li>Right-associative exponentiation: {@code ^} or {@code **}
 *   <li>Unary signs, which may be chained: {@code +-+5}
 *   <li>Parentheses for grouping
 *   <li>Decimal and scientific literals: {@code 3.5}, {@code .5}, {@code 1e-3}
 * </ul>
 *
 * <p>The remainder operator truncates both operands toward zero before dividing, so {@code 7.9 %
 * 2.5} is {@code 7 % 2 = 1}.
 *
 * <p>The class holds no state. Every call parses its input independently, so it may be used from
 * any number of threads.
 */
public final class ExpressionEvaluator {
  private static final Logger LOG = LoggerFactory.getLogger(ExpressionEvaluator.class);

  private ExpressionEvaluator() {}

  /**
   * Evaluates an expression.
   *
   * @param text the expression text
   * @return the computed value; may be NaN or infinite when floating-point arithmetic produces one
   * @throws ExpressionParseException if the text is malformed or a division or remainder by zero
   *     occurs
   */
  public static double evaluate(String text) {
    Objects.requireNonNull(text, "text");
    try {
      return ExpressionParser.parse(text);
    } catch (ExpressionParseException e) {
      LOG.debug("Failed to evaluate '{}': {}", text, e.getMessage());
      throw e;
    }
  }

  /**
   * Evaluates an expression, reporting failure as a value instead of an exception.
   *
   * @param text the expression text
   * @return {@link Evaluation.Success} with the value, or {@link Evaluation.Failure} with the error
   */
  public static Evaluation tryEvaluate(String text) {
    try {
      return new Evaluation.Success(evaluate(text));
    } catch (ExpressionParseException e) {
      return new Evaluation.Failure(e);
    }
  }
}
