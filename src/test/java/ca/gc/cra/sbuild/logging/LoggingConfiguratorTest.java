package ca.gc.cra.sbuild.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {
  private Level original;

  @BeforeEach
  void rememberLevel() {
    original = ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).getLevel();
  }

  @AfterEach
  void restoreLevel() {
    ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(original);
  }

  @Test
  void verboseModeLowersRootToDebug() {
    LoggingConfigurator.setRootLevel(Level.WARN);
    assertEquals("WARN", LoggingConfigurator.rootLevel());

    LoggingConfigurator.enableVerboseLogging();

    assertEquals("DEBUG", LoggingConfigurator.rootLevel());
  }
}
