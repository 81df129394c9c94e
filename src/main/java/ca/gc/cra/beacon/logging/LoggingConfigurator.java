package ca.gc.cra.beacon.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Objects;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the Logback level of console sink categories at runtime.
 * <p><strong>Why:</strong> {@code DEBUG} console entries are dropped by the default Logback configuration;
 * verbose loggers need their sink category opened up without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for logger bootstrap; concurrent Logback reconfiguration may race.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the level of the given logger category to DEBUG.
   *
   * @param category SLF4J logger name; never {@code null}
   * @return {@code true} when the backend applied the change
   */
  public static boolean enableVerboseLogging(String category) {
    Objects.requireNonNull(category, "category");
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(category);
      if (!Level.DEBUG.equals(logger.getLevel())) {
        logger.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose console logging requested for {} but backend {} does not support dynamic level updates",
        category, factory.getClass().getName());
    return false;
  }
}
