package ca.gc.cra.beacon.testutil;

import ca.gc.cra.beacon.domain.log.Log;
import ca.gc.cra.beacon.domain.log.LogAttributes;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.log.UserInfo;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Builders for {@link Log} records used across formatter tests.
 */
public final class LogFixtures {
  /** Epoch plus 12345 ms; renders as {@code 00:00:12.345} in UTC. */
  public static final Instant DATE = Instant.ofEpochMilli(12_345L);

  private LogFixtures() {}

  public static Log log(LogLevel level, String message) {
    return log(level, message, LogAttributes.EMPTY, Set.of());
  }

  public static Log log(LogLevel level, String message, Map<String, Object> userAttributes) {
    return log(level, message, LogAttributes.of(userAttributes), Set.of());
  }

  public static Log log(LogLevel level, String message, LogAttributes attributes, Set<String> tags) {
    return logAt(DATE, level, message, attributes, tags);
  }

  public static Log logAt(Instant date, LogLevel level, String message) {
    return logAt(date, level, message, LogAttributes.EMPTY, Set.of());
  }

  private static Log logAt(
      Instant date, LogLevel level, String message, LogAttributes attributes, Set<String> tags) {
    return new Log(
        date,
        level,
        message,
        "checkout-service",
        "staging",
        "checkout",
        "0.1.0",
        "main",
        "2.4.1",
        UserInfo.EMPTY,
        attributes,
        tags);
  }
}
