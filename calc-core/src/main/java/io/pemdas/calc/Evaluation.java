package io.pemdas.calc;

import java.util.Objects;

/**
 * Outcome of {@link ExpressionEvaluator#tryEvaluate(String)}: either a numeric value or the error
 * that aborted evaluation.
 */
public sealed interface Evaluation permits Evaluation.Success, Evaluation.Failure {

  boolean isSuccess();

  /**
   * Returns the value of a successful evaluation.
   *
   * @throws ExpressionParseException the recorded error if this evaluation failed
   */
  double orThrow();

  /** Successful evaluation. */
  record Success(double value) implements Evaluation {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public double orThrow() {
      return value;
    }
  }

  /** Failed evaluation. */
  record Failure(ExpressionParseException error) implements Evaluation {
    public Failure {
      Objects.requireNonNull(error, "error");
    }

    public ErrorKind kind() {
      return error.kind();
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public double orThrow() {
      throw error;
    }
  }
}
