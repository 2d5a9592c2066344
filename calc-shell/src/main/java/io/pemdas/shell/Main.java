package io.pemdas.shell;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "pemdas-calc",
    description = "Arithmetic calculator with PEMDAS precedence",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public final class Main implements Callable<Integer> {

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(
      names = {"-e", "--expression"},
      description = "Expression to evaluate and exit (repeatable)")
  private List<String> expressions;

  @CommandLine.Option(
      names = {"-f", "--file"},
      description = "File of expressions to evaluate, one per line")
  private Path file;

  @CommandLine.Option(
      names = "--continue-on-error",
      description = "Keep evaluating the file after a failing line")
  private boolean continueOnError;

  @CommandLine.Option(
      names = {"-p", "--precision"},
      description = "Significant digits of printed results (0 = shortest exact form)")
  private Integer precision;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Suppress banner (interactive mode)")
  private boolean quiet;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    ShellConfig config = ShellConfig.fromSystemProperties();
    if (precision != null) {
      if (precision < 0) {
        throw new CommandLine.ParameterException(
            spec.commandLine(), "Precision must not be negative: " + precision);
      }
      config = config.withPrecision(precision);
    }

    boolean hasExpressions = expressions != null && !expressions.isEmpty();
    if (hasExpressions && file != null) {
      throw new CommandLine.ParameterException(
          spec.commandLine(), "Options --expression and --file cannot be used together");
    }
    if (hasExpressions) {
      return evaluateAll(expressions, config);
    }
    if (file != null) {
      return runFile(file, config);
    }

    try (Shell shell = new Shell(config, quiet)) {
      shell.run();
      return 0;
    }
  }

  private Integer evaluateAll(List<String> lines, ShellConfig config) {
    ExpressionRunner runner = new ExpressionRunner(stdio(), config.getPrecision());
    int exitCode = 0;
    for (String line : lines) {
      if (!runner.run(line).isSuccess()) {
        exitCode = 1;
      }
    }
    return exitCode;
  }

  private Integer runFile(Path path, ShellConfig config) throws IOException {
    if (!Files.exists(path)) {
      System.err.println("Error: File not found: " + path);
      return 1;
    }
    BatchRunner batch = new BatchRunner(new ExpressionRunner(stdio(), config.getPrecision()));
    batch.setContinueOnError(continueOnError);
    BatchRunner.ExecutionResult result = batch.execute(path);
    if (result.hasErrors()) {
      System.err.println(
          "Completed with "
              + result.errors().size()
              + " error(s), "
              + result.successCount()
              + " succeeded");
      for (BatchRunner.LineError error : result.errors()) {
        System.err.println("  " + error);
      }
      return 1;
    }
    return 0;
  }

  private static ExpressionRunner.IO stdio() {
    return new ExpressionRunner.IO() {
      @Override
      public void println(String s) {
        System.out.println(s);
      }

      @Override
      public void error(String s) {
        System.err.println(s);
      }
    };
  }
}
