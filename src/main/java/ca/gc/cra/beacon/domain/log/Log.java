package ca.gc.cra.beacon.domain.log;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Canonical immutable record of one logging call.
 * <p><strong>Why:</strong> Formatters and outputs observe a fully formed value instead of raw call-site
 * arguments, so every rendering of a write sees the same data.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads.</p>
 *
 * @param date time of the event; never {@code null}
 * @param status severity; never {@code null}
 * @param message human-readable text; never {@code null}
 * @param serviceName service that produced the log; never {@code null}
 * @param environment deployment environment; may be {@code null}
 * @param loggerName name of the emitting logger; never {@code null}
 * @param loggerVersion version of the logging SDK; never {@code null}
 * @param threadName name of the thread that called the logger; never {@code null}
 * @param applicationVersion version of the host application; never {@code null}
 * @param userInfo current application user; never {@code null}
 * @param attributes user and internal attributes; never {@code null}
 * @param tags tags without duplicates and without defined order; never {@code null}
 * @since 0.1.0
 */
public record Log(
    Instant date,
    LogLevel status,
    String message,
    String serviceName,
    String environment,
    String loggerName,
    String loggerVersion,
    String threadName,
    String applicationVersion,
    UserInfo userInfo,
    LogAttributes attributes,
    Set<String> tags) {

  /**
   * Validates constructor invariants and defensively copies the tag set.
   */
  public Log {
    date = Objects.requireNonNull(date, "date");
    status = Objects.requireNonNull(status, "status");
    message = Objects.requireNonNull(message, "message");
    serviceName = Objects.requireNonNull(serviceName, "serviceName");
    loggerName = Objects.requireNonNull(loggerName, "loggerName");
    loggerVersion = Objects.requireNonNull(loggerVersion, "loggerVersion");
    threadName = Objects.requireNonNull(threadName, "threadName");
    applicationVersion = Objects.requireNonNull(applicationVersion, "applicationVersion");
    userInfo = userInfo == null ? UserInfo.EMPTY : userInfo;
    attributes = attributes == null ? LogAttributes.EMPTY : attributes;
    tags = tags == null ? Set.of() : Set.copyOf(tags);
  }
}
