package io.pemdas.calc;

/** Categories of failure reported by {@link ExpressionEvaluator}. */
public enum ErrorKind {
  /** A number, unary sign or opening parenthesis was required but not found. */
  EXPECTED_NUMBER("Expected number"),
  /** An opening parenthesis has no matching closing parenthesis. */
  UNCLOSED_PARENTHESIS("Missing ')'"),
  /** The right operand of {@code /} is exactly zero. */
  DIVISION_BY_ZERO("Division by zero"),
  /** The right operand of {@code %}, truncated to an integer, is zero. */
  MODULO_BY_ZERO("Modulo by zero"),
  /** Non-whitespace input remains after a complete expression. */
  TRAILING_INPUT("Unexpected trailing input");

  private final String description;

  ErrorKind(String description) {
    this.description = description;
  }

  public String description() {
    return description;
  }
}
