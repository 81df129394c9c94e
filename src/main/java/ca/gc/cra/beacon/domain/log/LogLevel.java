package ca.gc.cra.beacon.domain.log;

import java.util.Locale;

/**
 * <strong>What:</strong> Ordered severity classification of a log record.
 * <p><strong>Why:</strong> Drives console severity mapping and the {@code status} field of encoded logs.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum LogLevel {
  /** Diagnostic detail. */
  DEBUG,
  /** Routine information. */
  INFO,
  /** Normal but significant condition. */
  NOTICE,
  /** Something unexpected that the application recovered from. */
  WARN,
  /** Operation failed. */
  ERROR,
  /** Application-wide failure. */
  CRITICAL;

  /**
   * Returns the lowercase name used in encoded logs (e.g., {@code warn}).
   *
   * @return wire status name
   */
  public String statusName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Returns the uppercase name used in short console lines (e.g., {@code WARN}).
   *
   * @return display name
   */
  public String displayName() {
    return name();
  }

  /**
   * Parses a level name case-insensitively.
   *
   * @param value textual level such as {@code "warn"}
   * @return parsed level
   * @throws IllegalArgumentException if the value is blank or not a known level
   */
  public static LogLevel fromString(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("level must not be blank");
    }
    try {
      return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown log level: " + value, ex);
    }
  }
}
