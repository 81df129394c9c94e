package ca.gc.cra.beacon.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

  @Test
  void enableVerboseLoggingLowersCategoryToDebug() {
    Logger logger = (Logger) LoggerFactory.getLogger("beacon.console.verbose-test");
    Level original = logger.getLevel();
    try {
      assertTrue(LoggingConfigurator.enableVerboseLogging("beacon.console.verbose-test"));
      assertEquals(Level.DEBUG, logger.getLevel());
      assertTrue(logger.isDebugEnabled());
    } finally {
      logger.setLevel(original);
    }
  }

  @Test
  void enableVerboseLoggingRequiresCategory() {
    assertThrows(NullPointerException.class, () -> LoggingConfigurator.enableVerboseLogging(null));
  }
}
