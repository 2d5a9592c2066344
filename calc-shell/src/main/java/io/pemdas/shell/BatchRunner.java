package io.pemdas.shell;

import io.pemdas.calc.Evaluation;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a sequence of expressions, one per line.
 *
 * <p>Blank lines and lines starting with '#' are skipped. Example input:
 *
 * <pre>
 * # unit conversions
 * 72 * 2.54
 * (98.6 - 32) * 5 / 9
 * </pre>
 */
public class BatchRunner {
  private static final Logger LOG = LoggerFactory.getLogger(BatchRunner.class);

  private final ExpressionRunner runner;
  private boolean continueOnError;

  public BatchRunner(ExpressionRunner runner) {
    this.runner = runner;
    this.continueOnError = false;
  }

  /**
   * Sets whether to continue after a failing line.
   *
   * @param continueOnError if true, evaluate every line regardless of earlier failures
   */
  public void setContinueOnError(boolean continueOnError) {
    this.continueOnError = continueOnError;
  }

  /**
   * Evaluates every line of a file.
   *
   * @param path input file
   * @return execution result
   * @throws IOException if the file cannot be read
   */
  public ExecutionResult execute(Path path) throws IOException {
    LOG.debug("Running batch file {}", path);
    return execute(Files.readAllLines(path, StandardCharsets.UTF_8));
  }

  /**
   * Evaluates lines in order.
   *
   * @param lines input lines
   * @return execution result
   */
  public ExecutionResult execute(List<String> lines) {
    int successCount = 0;
    List<LineError> errors = new ArrayList<>();

    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i).trim();
      int lineNumber = i + 1;

      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }

      Evaluation evaluation = runner.run(line);
      if (evaluation instanceof Evaluation.Failure failure) {
        errors.add(new LineError(lineNumber, line, failure.error().getMessage()));
        if (!continueOnError) {
          break;
        }
      } else {
        successCount++;
      }
    }

    return new ExecutionResult(successCount, errors);
  }

  /** Result of a batch run. */
  public record ExecutionResult(int successCount, List<LineError> errors) {
    public ExecutionResult {
      errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
      return !errors.isEmpty();
    }
  }

  /** A line that failed to evaluate. */
  public record LineError(int lineNumber, String line, String message) {
    @Override
    public String toString() {
      return "Line " + lineNumber + ": " + message + " (" + line + ")";
    }
  }
}
