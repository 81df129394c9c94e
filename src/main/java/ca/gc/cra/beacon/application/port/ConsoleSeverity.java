package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.log.LogLevel;

/**
 * Severity tags understood by the platform console facility.
 *
 * @since 0.1.0
 */
public enum ConsoleSeverity {
  /** Debug-only output. */
  DEBUG,
  /** Informational output. */
  INFO,
  /** Normal output with no specific severity. */
  DEFAULT,
  /** Error-level output. */
  ERROR,
  /** Highest severity; a fault in the application. */
  FAULT;

  /**
   * Maps a log level to its console severity.
   *
   * @param level log level; never {@code null}
   * @return console severity
   */
  public static ConsoleSeverity forLevel(LogLevel level) {
    return switch (level) {
      case DEBUG -> DEBUG;
      case INFO -> INFO;
      case NOTICE -> DEFAULT;
      case WARN, ERROR -> ERROR;
      case CRITICAL -> FAULT;
    };
  }
}
