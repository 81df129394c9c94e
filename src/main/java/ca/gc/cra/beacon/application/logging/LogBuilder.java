package ca.gc.cra.beacon.application.logging;

import ca.gc.cra.beacon.domain.log.Log;
import ca.gc.cra.beacon.domain.log.LogAttributes;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.log.UserInfo;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Turns raw call-site arguments into canonical {@link Log} records.
 * <p><strong>Why:</strong> Outputs need the logger-wide context (service, environment, versions, user)
 * stamped on every record without each output resolving it again.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for concurrent use provided the
 * user info supplier is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class LogBuilder {
  private final String serviceName;
  private final String environment;
  private final String loggerName;
  private final String loggerVersion;
  private final String applicationVersion;
  private final Supplier<UserInfo> userInfoProvider;

  /**
   * Creates a builder stamping the supplied context on every record.
   *
   * @param serviceName service name; never {@code null}
   * @param environment deployment environment; {@code null} or blank disables the {@code env:} tag
   * @param loggerName logger name; never {@code null}
   * @param loggerVersion SDK version; never {@code null}
   * @param applicationVersion host application version; never {@code null}
   * @param userInfoProvider supplier of the current user; {@code null} means no user information
   */
  public LogBuilder(
      String serviceName,
      String environment,
      String loggerName,
      String loggerVersion,
      String applicationVersion,
      Supplier<UserInfo> userInfoProvider) {
    this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
    this.environment = environment == null || environment.isBlank() ? null : environment.trim();
    this.loggerName = Objects.requireNonNull(loggerName, "loggerName");
    this.loggerVersion = Objects.requireNonNull(loggerVersion, "loggerVersion");
    this.applicationVersion = Objects.requireNonNull(applicationVersion, "applicationVersion");
    this.userInfoProvider = userInfoProvider == null ? () -> UserInfo.EMPTY : userInfoProvider;
  }

  /**
   * Builds the canonical record for one logging call. The thread name is taken from the calling thread.
   *
   * @param level severity; never {@code null}
   * @param message message text; never {@code null}
   * @param date event time; never {@code null}
   * @param attributes call attributes; {@code null} treated as empty
   * @param tags call tags; {@code null} treated as empty
   * @return immutable log record
   */
  public Log createLogWith(
      LogLevel level, String message, Instant date, LogAttributes attributes, Set<String> tags) {
    Set<String> allTags = new LinkedHashSet<>();
    if (tags != null) {
      allTags.addAll(tags);
    }
    if (environment != null) {
      allTags.add("env:" + environment);
    }
    UserInfo userInfo = userInfoProvider.get();
    return new Log(
        date,
        level,
        message,
        serviceName,
        environment,
        loggerName,
        loggerVersion,
        Thread.currentThread().getName(),
        applicationVersion,
        userInfo == null ? UserInfo.EMPTY : userInfo,
        attributes,
        allTags);
  }
}
