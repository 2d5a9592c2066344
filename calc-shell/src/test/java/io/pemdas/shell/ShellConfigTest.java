package io.pemdas.shell;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Paths;
import java.util.Properties;
import org.junit.jupiter.api.Test;

class ShellConfigTest {

  @Test
  void defaults() {
    Properties props = new Properties();
    props.setProperty("user.home", "/home/test");

    ShellConfig config = ShellConfig.from(props);

    assertEquals(Paths.get("/home/test", ".pemdas-calc", "history"), config.getHistoryFile());
    assertEquals(0, config.getPrecision());
    assertEquals("calc> ", config.getPrompt());
  }

  @Test
  void overridesFromProperties() {
    Properties props = new Properties();
    props.setProperty(ShellConfig.HISTORY_PROPERTY, "/tmp/calc-history");
    props.setProperty(ShellConfig.PRECISION_PROPERTY, "6");
    props.setProperty(ShellConfig.PROMPT_PROPERTY, "> ");

    ShellConfig config = ShellConfig.from(props);

    assertEquals(Paths.get("/tmp/calc-history"), config.getHistoryFile());
    assertEquals(6, config.getPrecision());
    assertEquals("> ", config.getPrompt());
  }

  @Test
  void invalidPrecisionFallsBackToDefault() {
    Properties props = new Properties();
    props.setProperty(ShellConfig.PRECISION_PROPERTY, "six");
    assertEquals(0, ShellConfig.from(props).getPrecision());

    props.setProperty(ShellConfig.PRECISION_PROPERTY, "-3");
    assertEquals(0, ShellConfig.from(props).getPrecision());
  }

  @Test
  void withPrecisionKeepsOtherSettings() {
    ShellConfig config = new ShellConfig(Paths.get("h"), 0, "p> ").withPrecision(4);
    assertEquals(4, config.getPrecision());
    assertEquals(Paths.get("h"), config.getHistoryFile());
    assertEquals("p> ", config.getPrompt());
  }
}
