package ca.gc.cra.beacon.infrastructure.console;

import ca.gc.cra.beacon.domain.log.Log;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Formats logs as {@code {prefix}{HH:mm:ss.SSS} [{STATUS}] {message}}.
 *
 * <p>Attributes and tags are left out of the short form. The time is rendered in the configured zone; an
 * instant outside the local date-time range falls back to its ISO-8601 form.</p>
 *
 * @since 0.1.0
 */
public final class ShortLogFormatter implements ConsoleLogFormatter {
  static final String TIME_PATTERN = "HH:mm:ss.SSS";

  private final DateTimeFormatter timeFormatter;
  private final String prefix;

  /**
   * Creates a formatter without prefix.
   *
   * @param timeZone display zone; never {@code null}
   */
  public ShortLogFormatter(ZoneId timeZone) {
    this(timeZone, "");
  }

  /**
   * Creates a formatter.
   *
   * @param timeZone display zone; never {@code null}
   * @param prefix literal prefix; {@code null} treated as empty
   */
  public ShortLogFormatter(ZoneId timeZone, String prefix) {
    this.timeFormatter = DateTimeFormatter.ofPattern(TIME_PATTERN, Locale.ROOT)
        .withZone(Objects.requireNonNull(timeZone, "timeZone"));
    this.prefix = prefix == null ? "" : prefix;
  }

  @Override
  public String format(Log log) {
    return prefix + renderTime(log) + " [" + log.status().displayName() + "] " + log.message();
  }

  private String renderTime(Log log) {
    try {
      return timeFormatter.format(log.date());
    } catch (DateTimeException ex) {
      return log.date().toString();
    }
  }
}
