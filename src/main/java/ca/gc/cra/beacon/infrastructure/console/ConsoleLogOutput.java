package ca.gc.cra.beacon.infrastructure.console;

import ca.gc.cra.beacon.application.logging.ConsoleLogFormat;
import ca.gc.cra.beacon.application.logging.LogBuilder;
import ca.gc.cra.beacon.application.port.ConsoleSeverity;
import ca.gc.cra.beacon.application.port.ConsoleSink;
import ca.gc.cra.beacon.application.port.LogOutput;
import ca.gc.cra.beacon.domain.log.Log;
import ca.gc.cra.beacon.domain.log.LogAttributes;
import ca.gc.cra.beacon.domain.log.LogLevel;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> {@link LogOutput} that prints each log to the platform console.
 * <p><strong>Why:</strong> Gives developers an immediate view of what the application logs, in either a short
 * readable line or the full JSON record.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve the {@link ConsoleLogFormat} into one formatter at construction.</li>
 *   <li>Build, format, and emit exactly one console entry per write, synchronously.</li>
 *   <li>Map {@link LogLevel} to {@link ConsoleSeverity}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds no mutable state; concurrent writes are safe when the console sink is.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleLogOutput implements LogOutput {
  private final LogBuilder logBuilder;
  private final ConsoleLogFormatter formatter;
  private final ConsoleSink sink;

  /**
   * Creates a console output.
   *
   * @param logBuilder builder producing canonical records; never {@code null}
   * @param format console format; never {@code null}
   * @param timeZone zone for short-format times; never {@code null}
   * @param sink console facility; never {@code null}
   */
  public ConsoleLogOutput(LogBuilder logBuilder, ConsoleLogFormat format, ZoneId timeZone, ConsoleSink sink) {
    this.logBuilder = Objects.requireNonNull(logBuilder, "logBuilder");
    this.formatter = formatterFor(Objects.requireNonNull(format, "format"), timeZone);
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  @Override
  public void writeLogWith(
      LogLevel level, String message, Instant date, LogAttributes attributes, Set<String> tags) {
    Log log = logBuilder.createLogWith(level, message, date, attributes, tags);
    String text = formatter.format(log);
    sink.emit(ConsoleSeverity.forLevel(level), text);
  }

  static ConsoleLogFormatter formatterFor(ConsoleLogFormat format, ZoneId timeZone) {
    if (format instanceof ConsoleLogFormat.ShortFormat shortFormat) {
      return new ShortLogFormatter(Objects.requireNonNull(timeZone, "timeZone"), shortFormat.prefix());
    }
    if (format instanceof ConsoleLogFormat.JsonFormat jsonFormat) {
      return new JsonLogFormatter(jsonFormat.prefix());
    }
    throw new IllegalArgumentException("Unsupported console format: " + format);
  }
}
