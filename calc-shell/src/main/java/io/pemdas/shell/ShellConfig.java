package io.pemdas.shell;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shell settings resolved from system properties.
 *
 * <ul>
 *   <li>{@code pemdas.history}: history file, default {@code ~/.pemdas-calc/history}
 *   <li>{@code pemdas.precision}: significant digits of printed results, {@code 0} for the
 *       shortest exact form
 *   <li>{@code pemdas.prompt}: interactive prompt
 * </ul>
 */
public final class ShellConfig {
  private static final Logger LOG = LoggerFactory.getLogger(ShellConfig.class);

  public static final String HISTORY_PROPERTY = "pemdas.history";
  public static final String PRECISION_PROPERTY = "pemdas.precision";
  public static final String PROMPT_PROPERTY = "pemdas.prompt";

  static final String DEFAULT_PROMPT = "calc> ";
  static final int DEFAULT_PRECISION = 0;

  private final Path historyFile;
  private final int precision;
  private final String prompt;

  public ShellConfig(Path historyFile, int precision, String prompt) {
    this.historyFile = historyFile;
    this.precision = precision;
    this.prompt = prompt;
  }

  public static ShellConfig fromSystemProperties() {
    return from(System.getProperties());
  }

  static ShellConfig from(Properties props) {
    String history = props.getProperty(HISTORY_PROPERTY);
    Path historyFile =
        history != null && !history.isBlank()
            ? Paths.get(history)
            : Paths.get(props.getProperty("user.home", "."), ".pemdas-calc", "history");
    int precision = parsePrecision(props.getProperty(PRECISION_PROPERTY));
    String prompt = props.getProperty(PROMPT_PROPERTY, DEFAULT_PROMPT);
    ShellConfig config = new ShellConfig(historyFile, precision, prompt);
    LOG.debug("Resolved configuration: {}", config);
    return config;
  }

  private static int parsePrecision(String value) {
    if (value == null || value.isBlank()) {
      return DEFAULT_PRECISION;
    }
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed < 0) {
        LOG.warn("Ignoring negative {}={}", PRECISION_PROPERTY, value);
        return DEFAULT_PRECISION;
      }
      return parsed;
    } catch (NumberFormatException e) {
      LOG.warn("Ignoring invalid {}={}", PRECISION_PROPERTY, value);
      return DEFAULT_PRECISION;
    }
  }

  public ShellConfig withPrecision(int precision) {
    return new ShellConfig(historyFile, precision, prompt);
  }

  public Path getHistoryFile() {
    return historyFile;
  }

  public int getPrecision() {
    return precision;
  }

  public String getPrompt() {
    return prompt;
  }

  @Override
  public String toString() {
    return "ShellConfig{historyFile="
        + historyFile
        + ", precision="
        + precision
        + ", prompt='"
        + prompt
        + "'}";
  }
}
