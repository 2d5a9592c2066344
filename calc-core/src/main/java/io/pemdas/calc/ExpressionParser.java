package io.pemdas.calc;

/**
 * Recursive descent parser that evaluates arithmetic expressions while parsing them.
 *
 * <p>Grammar:
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := power (('*' | '/' | '%' | implicit) power)*
 * power      := factor (('**' | '^') power)?
 * factor     := '+' factor | '-' factor | '(' expression ')' | number
 * number     := digits ('.' digits?)? exponent? | '.' digits exponent?
 * exponent   := ('e' | 'E') ('+' | '-')? digits
 * </pre>
 *
 * <p>{@code implicit} is an empty operator inferred when the next character opens a new factor
 * ({@code (}, a digit or {@code .}). Unary signs do not trigger it, so {@code 3 -4} is a
 * subtraction.
 *
 * <p>Instances hold the cursor of a single evaluation and are not reused.
 */
final class ExpressionParser {

  private final String input;
  private int pos;

  private ExpressionParser(String input) {
    this.input = input;
    this.pos = 0;
  }

  /**
   * Parses and evaluates a complete expression.
   *
   * @param input the expression text
   * @return the computed value
   * @throws ExpressionParseException if the text is not a valid expression or evaluation fails
   */
  static double parse(String input) {
    return new ExpressionParser(input).parseInput();
  }

  private double parseInput() {
    double value = parseExpression();
    skipWs();
    if (!isAtEnd()) {
      throw new ExpressionParseException(ErrorKind.TRAILING_INPUT, pos, remaining());
    }
    return value;
  }

  private double parseExpression() {
    double value = parseTerm();
    while (true) {
      if (match('+')) {
        value += parseTerm();
      } else if (match('-')) {
        value -= parseTerm();
      } else {
        return value;
      }
    }
  }

  private double parseTerm() {
    double value = parsePower();
    while (true) {
      skipWs();
      int opPos = pos;
      if (match('*')) {
        value *= parsePower();
      } else if (match('/')) {
        double divisor = parsePower();
        if (divisor == 0) {
          throw new ExpressionParseException(ErrorKind.DIVISION_BY_ZERO, opPos);
        }
        value /= divisor;
      } else if (match('%')) {
        double rhs = parsePower();
        long dividend = (long) value;
        long divisor = (long) rhs;
        if (divisor == 0) {
          throw new ExpressionParseException(ErrorKind.MODULO_BY_ZERO, opPos);
        }
        value = (double) (dividend % divisor);
      } else if (startsFactor()) {
        value *= parsePower();
      } else {
        return value;
      }
    }
  }

  private double parsePower() {
    double base = parseFactor();
    // '**' first, otherwise its leading '*' would be taken as multiplication
    if (match("**") || match('^')) {
      double exponent = parsePower();
      return Math.pow(base, exponent);
    }
    return base;
  }

  private double parseFactor() {
    if (match('+')) {
      return parseFactor();
    }
    if (match('-')) {
      return -parseFactor();
    }
    if (match('(')) {
      double value = parseExpression();
      if (!match(')')) {
        throw new ExpressionParseException(ErrorKind.UNCLOSED_PARENTHESIS, pos);
      }
      return value;
    }
    return parseNumber();
  }

  private double parseNumber() {
    skipWs();
    int start = pos;
    boolean seenDigit = false;
    boolean seenDot = false;

    while (!isAtEnd()) {
      char c = peek();
      if (isDigit(c)) {
        seenDigit = true;
        advance();
      } else if (c == '.' && !seenDot) {
        seenDot = true;
        advance();
      } else {
        break;
      }
    }

    if (!seenDigit) {
      String found =
          start < input.length() ? "found '" + input.charAt(start) + "'" : "end of input";
      throw new ExpressionParseException(ErrorKind.EXPECTED_NUMBER, start, found);
    }

    if (peek() == 'e' || peek() == 'E') {
      int mark = pos;
      advance();
      if (peek() == '+' || peek() == '-') {
        advance();
      }
      boolean exponentDigits = false;
      while (isDigit(peek())) {
        exponentDigits = true;
        advance();
      }
      if (!exponentDigits) {
        pos = mark;
      }
    }

    return Double.parseDouble(input.substring(start, pos));
  }

  private boolean startsFactor() {
    char c = peek();
    return c == '(' || c == '.' || isDigit(c);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private boolean match(char expected) {
    skipWs();
    if (peek() == expected && !isAtEnd()) {
      pos++;
      return true;
    }
    return false;
  }

  private boolean match(String expected) {
    skipWs();
    if (input.startsWith(expected, pos)) {
      pos += expected.length();
      return true;
    }
    return false;
  }

  private void skipWs() {
    while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }

  private char peek() {
    return pos < input.length() ? input.charAt(pos) : '\0';
  }

  private void advance() {
    pos++;
  }

  private boolean isAtEnd() {
    return pos >= input.length();
  }

  private String remaining() {
    return input.substring(pos);
  }
}
