package io.pemdas.calc;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for the error taxonomy and reported positions of ExpressionEvaluator. */
class ExpressionEvaluatorErrorTest {

  private static ExpressionParseException fail(String text) {
    return assertThrows(ExpressionParseException.class, () -> ExpressionEvaluator.evaluate(text));
  }

  // ==================== Division and remainder by zero ====================

  @Test
  void testDivisionByZero() {
    ExpressionParseException e = fail("5/0");
    assertEquals(ErrorKind.DIVISION_BY_ZERO, e.kind());
    assertEquals(1, e.position());
    assertEquals("Division by zero at pos 1", e.getMessage());
  }

  @Test
  void testDivisionByComputedZero() {
    assertEquals(ErrorKind.DIVISION_BY_ZERO, fail("1/(2-2)").kind());
    assertEquals(ErrorKind.DIVISION_BY_ZERO, fail("1/-0").kind());
  }

  @Test
  void testDivisionByTinyValueIsAllowed() {
    assertEquals(1e300, ExpressionEvaluator.evaluate("1/1e-300"), 1e286);
  }

  @Test
  void testModuloByZero() {
    ExpressionParseException e = fail("10 % 0");
    assertEquals(ErrorKind.MODULO_BY_ZERO, e.kind());
    assertEquals(3, e.position());
  }

  @Test
  void testModuloByFractionTruncatedToZero() {
    assertEquals(ErrorKind.MODULO_BY_ZERO, fail("5 % 0.5").kind());
  }

  @Test
  void testErrorAbortsWholeEvaluation() {
    assertEquals(ErrorKind.DIVISION_BY_ZERO, fail("1 + (2/0) + 3").kind());
  }

  // ==================== Parentheses ====================

  @Test
  void testUnclosedParenthesis() {
    ExpressionParseException e = fail("(1+2");
    assertEquals(ErrorKind.UNCLOSED_PARENTHESIS, e.kind());
    assertEquals(4, e.position());
  }

  @Test
  void testUnclosedNestedParenthesis() {
    assertEquals(ErrorKind.UNCLOSED_PARENTHESIS, fail("((1+2)").kind());
  }

  @Test
  void testStrayClosingParenthesisIsTrailingInput() {
    ExpressionParseException e = fail("1+2)");
    assertEquals(ErrorKind.TRAILING_INPUT, e.kind());
    assertEquals(3, e.position());
  }

  // ==================== Missing operands ====================

  @ParameterizedTest
  @ValueSource(strings = {"", "   ", "1+", "*2", "()", "2*", "-", "."})
  void testExpectedNumber(String text) {
    assertEquals(ErrorKind.EXPECTED_NUMBER, fail(text).kind());
  }

  @Test
  void testExpectedNumberReportsPosition() {
    ExpressionParseException e = fail("1 + x");
    assertEquals(ErrorKind.EXPECTED_NUMBER, e.kind());
    assertEquals(4, e.position());
    assertEquals("Expected number at pos 4: found 'x'", e.getMessage());
  }

  @Test
  void testExpectedNumberAtEndOfInput() {
    ExpressionParseException e = fail("2^");
    assertEquals(2, e.position());
    assertTrue(e.getMessage().endsWith("end of input"));
  }

  // ==================== Trailing input ====================

  @Test
  void testTrailingInputAfterNumber() {
    ExpressionParseException e = fail("3 q");
    assertEquals(ErrorKind.TRAILING_INPUT, e.kind());
    assertEquals(2, e.position());
  }

  @Test
  void testDanglingExponentIsLeftAsTrailingInput() {
    ExpressionParseException e = fail("2e");
    assertEquals(ErrorKind.TRAILING_INPUT, e.kind());
    assertEquals(1, e.position());
  }

  @Test
  void testSignedExponentWithoutDigitsIsRolledBack() {
    ExpressionParseException e = fail("2e+");
    assertEquals(ErrorKind.TRAILING_INPUT, e.kind());
    assertEquals(1, e.position());
  }

  @Test
  void testLoneDecimalPointAfterLiteral() {
    ExpressionParseException e = fail("1.2.");
    assertEquals(ErrorKind.EXPECTED_NUMBER, e.kind());
    assertEquals(3, e.position());
  }

  @Test
  void testTrailingWhitespaceIsAccepted() {
    assertEquals(3.0, ExpressionEvaluator.evaluate("1+2   \t"));
  }

  @Test
  void testTrailingInputMessageContainsRemainder() {
    assertEquals("Unexpected trailing input at pos 4: abc", fail("1+2 abc").getMessage());
  }
}
