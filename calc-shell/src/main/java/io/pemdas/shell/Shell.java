package io.pemdas.shell;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.reader.impl.history.DefaultHistory;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Interactive read-evaluate-print loop over a JLine terminal. */
public final class Shell implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(Shell.class);

  private final Terminal terminal;
  private final LineReader lineReader;
  private final DefaultHistory history;
  private final ExpressionRunner runner;
  private final ShellConfig config;
  private final boolean quiet;
  private boolean running = true;

  public Shell(ShellConfig config, boolean quiet) throws IOException {
    this(TerminalBuilder.builder().system(true).build(), config, quiet);
  }

  Shell(Terminal terminal, ShellConfig config, boolean quiet) {
    this.terminal = terminal;
    this.config = config;
    this.quiet = quiet;

    Path histPath = config.getHistoryFile();
    try {
      Files.createDirectories(histPath.toAbsolutePath().getParent());
    } catch (IOException e) {
      LOG.warn("Cannot create history directory for {}: {}", histPath, e.getMessage());
    }
    this.history = new DefaultHistory();
    Map<String, Object> vars = new HashMap<>();
    vars.put(LineReader.HISTORY_FILE, histPath);

    // Expressions never contain quotes or escapes; keep every character literal
    DefaultParser parser = new DefaultParser();
    parser.setEscapeChars(null);
    parser.setQuoteChars(new char[0]);

    this.lineReader =
        LineReaderBuilder.builder()
            .terminal(terminal)
            .variables(vars)
            .history(history)
            .parser(parser)
            .build();

    this.runner =
        new ExpressionRunner(
            new ExpressionRunner.IO() {
              @Override
              public void println(String s) {
                terminal.writer().println(s);
                terminal.flush();
              }

              @Override
              public void error(String s) {
                terminal.writer().println(s);
                terminal.flush();
              }
            },
            config.getPrecision());
  }

  public void run() {
    if (!quiet) {
      printBanner();
    }

    while (running) {
      try {
        String input = lineReader.readLine(config.getPrompt());
        if (input == null || input.isBlank()) continue;
        input = input.trim();

        // Quit check happens before evaluation, so "q" is never parsed as an expression
        if (isQuit(input)) {
          running = false;
          continue;
        }

        if ("help".equalsIgnoreCase(input)) {
          printHelp();
          continue;
        }

        runner.run(input);
      } catch (UserInterruptException e) {
        terminal.writer().println("^C");
        terminal.flush();
      } catch (EndOfFileException e) {
        terminal.writer().println();
        running = false;
      }
    }

    terminal.writer().println("Goodbye!");
    terminal.flush();
  }

  static boolean isQuit(String input) {
    return "q".equalsIgnoreCase(input)
        || "quit".equalsIgnoreCase(input)
        || "exit".equalsIgnoreCase(input);
  }

  private void printBanner() {
    terminal.writer().println("╔═══════════════════════════════════════╗");
    terminal.writer().println("║        PEMDAS Calculator (CLI)        ║");
    terminal.writer().println("╚═══════════════════════════════════════╝");
    terminal.writer().println("Type an expression, 'help' for syntax, 'q' to quit");
    terminal.writer().println();
    terminal.flush();
  }

  private void printHelp() {
    terminal.writer().println("Operators (highest precedence first):");
    terminal.writer().println("  ( )          grouping");
    terminal.writer().println("  + -          unary sign, may be chained: +-+5");
    terminal.writer().println("  ^ **         power, right-associative: 2^3^2 = 512");
    terminal.writer().println("  * / %        multiply, divide, integer remainder");
    terminal.writer().println("  implicit     2(3+4), (1+2)(3+4), 3.5(2)");
    terminal.writer().println("  + -          add, subtract");
    terminal.writer().println("Numbers: 42, 3.14, .5, 1e-3, 2.5E+4");
    terminal.writer().println("Commands: help, q | quit | exit");
    terminal.flush();
  }

  @Override
  public void close() throws IOException {
    try {
      history.save();
    } catch (IOException e) {
      LOG.warn("Failed to save history to {}: {}", config.getHistoryFile(), e.getMessage());
    }
    terminal.close();
  }
}
