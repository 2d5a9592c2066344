package io.pemdas.shell;

import io.pemdas.calc.Evaluation;
import io.pemdas.calc.ExpressionEvaluator;
import io.pemdas.calc.ResultFormatter;

/** Evaluates one input line and prints the result or the error. */
public final class ExpressionRunner {

  /** Output seam, so the runner can print to a terminal, a stream or a test buffer. */
  public interface IO {
    void println(String s);

    void error(String s);
  }

  private final IO io;
  private final int precision;

  /**
   * Creates a runner.
   *
   * @param io output target
   * @param precision significant digits of printed results, {@code 0} for the shortest exact form
   */
  public ExpressionRunner(IO io, int precision) {
    this.io = io;
    this.precision = precision;
  }

  /**
   * Evaluates a line.
   *
   * @param line expression text
   * @return the outcome that was printed
   */
  public Evaluation run(String line) {
    Evaluation evaluation = ExpressionEvaluator.tryEvaluate(line);
    if (evaluation instanceof Evaluation.Success success) {
      io.println("Result: " + ResultFormatter.format(success.value(), precision));
    } else if (evaluation instanceof Evaluation.Failure failure) {
      io.error("Error: " + failure.error().getMessage());
    }
    return evaluation;
  }
}
