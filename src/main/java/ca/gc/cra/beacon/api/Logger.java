package ca.gc.cra.beacon.api;

import ca.gc.cra.beacon.application.logging.ConsoleLogFormat;
import ca.gc.cra.beacon.application.logging.LogBuilder;
import ca.gc.cra.beacon.application.port.ClockPort;
import ca.gc.cra.beacon.application.port.ConsoleSink;
import ca.gc.cra.beacon.application.port.LogOutput;
import ca.gc.cra.beacon.domain.log.LogAttributes;
import ca.gc.cra.beacon.domain.log.LogLevel;
import ca.gc.cra.beacon.domain.log.UserInfo;
import ca.gc.cra.beacon.infrastructure.console.ConsoleLogOutput;
import ca.gc.cra.beacon.infrastructure.console.Slf4jConsoleSink;
import ca.gc.cra.beacon.infrastructure.output.CombinedLogOutput;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Application-facing logger writing records at six severities to its outputs.
 * <p><strong>Why:</strong> Host code logs through one object that carries service context, logger-wide
 * attributes and tags, while outputs (console, fan-out) stay pluggable.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Merge logger attributes with call-site attributes; call-site values win.</li>
 *   <li>Translate a {@link Throwable} into {@code error.kind}, {@code error.message} and
 *   {@code error.stack} internal attributes.</li>
 *   <li>Timestamp each call through {@link ClockPort}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Attribute and tag mutation is synchronized; each write observes a consistent
 * snapshot. Writes are synchronous; an output failure is logged at warn and never reaches the caller.</p>
 *
 * @since 0.1.0
 */
public final class Logger {
  /** Version stamped into {@code logger.version}. */
  public static final String SDK_VERSION = "0.1.0";

  static final String ERROR_KIND = "error.kind";
  static final String ERROR_MESSAGE = "error.message";
  static final String ERROR_STACK = "error.stack";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(Logger.class);

  private final LogOutput output;
  private final ClockPort clock;
  private final Object lock = new Object();
  private final Map<String, Object> attributes = new LinkedHashMap<>();
  private final Set<String> tags = new LinkedHashSet<>();

  Logger(LogOutput output, ClockPort clock) {
    this.output = Objects.requireNonNull(output, "output");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates a builder with default settings (console printing disabled).
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Writes a {@link LogLevel#DEBUG} log.
   *
   * @param message message text
   */
  public void debug(String message) {
    log(LogLevel.DEBUG, message, null, null);
  }

  /**
   * Writes a {@link LogLevel#DEBUG} log carrying error attributes for {@code error}.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   */
  public void debug(String message, Throwable error) {
    log(LogLevel.DEBUG, message, error, null);
  }

  /**
   * Writes a {@link LogLevel#DEBUG} log with call-site attributes.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   * @param attributes attributes for this call only; may be {@code null}
   */
  public void debug(String message, Throwable error, Map<String, Object> attributes) {
    log(LogLevel.DEBUG, message, error, attributes);
  }

  /**
   * Writes a {@link LogLevel#INFO} log.
   *
   * @param message message text
   */
  public void info(String message) {
    log(LogLevel.INFO, message, null, null);
  }

  /**
   * Writes a {@link LogLevel#INFO} log carrying error attributes for {@code error}.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   */
  public void info(String message, Throwable error) {
    log(LogLevel.INFO, message, error, null);
  }

  /**
   * Writes a {@link LogLevel#INFO} log with call-site attributes.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   * @param attributes attributes for this call only; may be {@code null}
   */
  public void info(String message, Throwable error, Map<String, Object> attributes) {
    log(LogLevel.INFO, message, error, attributes);
  }

  /**
   * Writes a {@link LogLevel#NOTICE} log.
   *
   * @param message message text
   */
  public void notice(String message) {
    log(LogLevel.NOTICE, message, null, null);
  }

  /**
   * Writes a {@link LogLevel#NOTICE} log carrying error attributes for {@code error}.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   */
  public void notice(String message, Throwable error) {
    log(LogLevel.NOTICE, message, error, null);
  }

  /**
   * Writes a {@link LogLevel#NOTICE} log with call-site attributes.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   * @param attributes attributes for this call only; may be {@code null}
   */
  public void notice(String message, Throwable error, Map<String, Object> attributes) {
    log(LogLevel.NOTICE, message, error, attributes);
  }

  /**
   * Writes a {@link LogLevel#WARN} log.
   *
   * @param message message text
   */
  public void warn(String message) {
    log(LogLevel.WARN, message, null, null);
  }

  /**
   * Writes a {@link LogLevel#WARN} log carrying error attributes for {@code error}.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   */
  public void warn(String message, Throwable error) {
    log(LogLevel.WARN, message, error, null);
  }

  /**
   * Writes a {@link LogLevel#WARN} log with call-site attributes.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   * @param attributes attributes for this call only; may be {@code null}
   */
  public void warn(String message, Throwable error, Map<String, Object> attributes) {
    log(LogLevel.WARN, message, error, attributes);
  }

  /**
   * Writes a {@link LogLevel#ERROR} log.
   *
   * @param message message text
   */
  public void error(String message) {
    log(LogLevel.ERROR, message, null, null);
  }

  /**
   * Writes a {@link LogLevel#ERROR} log carrying error attributes for {@code error}.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   */
  public void error(String message, Throwable error) {
    log(LogLevel.ERROR, message, error, null);
  }

  /**
   * Writes a {@link LogLevel#ERROR} log with call-site attributes.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   * @param attributes attributes for this call only; may be {@code null}
   */
  public void error(String message, Throwable error, Map<String, Object> attributes) {
    log(LogLevel.ERROR, message, error, attributes);
  }

  /**
   * Writes a {@link LogLevel#CRITICAL} log.
   *
   * @param message message text
   */
  public void critical(String message) {
    log(LogLevel.CRITICAL, message, null, null);
  }

  /**
   * Writes a {@link LogLevel#CRITICAL} log carrying error attributes for {@code error}.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   */
  public void critical(String message, Throwable error) {
    log(LogLevel.CRITICAL, message, error, null);
  }

  /**
   * Writes a {@link LogLevel#CRITICAL} log with call-site attributes.
   *
   * @param message message text
   * @param error failure to describe; may be {@code null}
   * @param attributes attributes for this call only; may be {@code null}
   */
  public void critical(String message, Throwable error, Map<String, Object> attributes) {
    log(LogLevel.CRITICAL, message, error, attributes);
  }

  /**
   * Writes one log record to the configured outputs.
   *
   * @param level severity; never {@code null}
   * @param message message text; {@code null} is written as an empty string
   * @param error optional throwable describing a failure
   * @param callAttributes optional attributes for this call only; override logger attributes
   */
  public void log(LogLevel level, String message, Throwable error, Map<String, Object> callAttributes) {
    Objects.requireNonNull(level, "level");
    Map<String, Object> userAttributes;
    Set<String> tagSnapshot;
    synchronized (lock) {
      userAttributes = new LinkedHashMap<>(attributes);
      tagSnapshot = new LinkedHashSet<>(tags);
    }
    if (callAttributes != null) {
      userAttributes.putAll(callAttributes);
    }
    Map<String, Object> internalAttributes = error == null ? Map.of() : errorAttributes(error);
    try {
      output.writeLogWith(
          level,
          message == null ? "" : message,
          Instant.ofEpochMilli(clock.nowMillis()),
          new LogAttributes(userAttributes, internalAttributes),
          tagSnapshot);
    } catch (RuntimeException ex) {
      log.warn("Log output failed for {} log", level, ex);
    }
  }

  /**
   * Adds or replaces a logger-wide attribute sent with every subsequent log.
   *
   * @param key attribute key; never {@code null}
   * @param value attribute value; may be {@code null}
   */
  public void addAttribute(String key, Object value) {
    Objects.requireNonNull(key, "key");
    synchronized (lock) {
      attributes.put(key, value);
    }
  }

  /**
   * Removes a logger-wide attribute.
   *
   * @param key attribute key
   */
  public void removeAttribute(String key) {
    synchronized (lock) {
      attributes.remove(key);
    }
  }

  /**
   * Adds a tag sent with every subsequent log.
   *
   * @param tag tag value; never {@code null}
   */
  public void addTag(String tag) {
    Objects.requireNonNull(tag, "tag");
    synchronized (lock) {
      tags.add(tag);
    }
  }

  /**
   * Adds a {@code key:value} tag.
   *
   * @param key tag key; never {@code null}
   * @param value tag value; never {@code null}
   */
  public void addTag(String key, String value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    addTag(key + ':' + value);
  }

  /**
   * Removes a tag.
   *
   * @param tag tag value
   */
  public void removeTag(String tag) {
    synchronized (lock) {
      tags.remove(tag);
    }
  }

  /**
   * Removes every {@code key:value} tag with the given key.
   *
   * @param key tag key; never {@code null}
   */
  public void removeTagsWithKey(String key) {
    Objects.requireNonNull(key, "key");
    String keyPrefix = key + ':';
    synchronized (lock) {
      tags.removeIf(tag -> tag.startsWith(keyPrefix));
    }
  }

  private static Map<String, Object> errorAttributes(Throwable error) {
    Map<String, Object> internal = new LinkedHashMap<>();
    internal.put(ERROR_KIND, error.getClass().getName());
    internal.put(ERROR_MESSAGE, error.getMessage());
    StringWriter stack = new StringWriter();
    error.printStackTrace(new PrintWriter(stack));
    internal.put(ERROR_STACK, stack.toString());
    return internal;
  }

  /**
   * Fluent configuration of a {@link Logger}.
   *
   * <p>Not thread-safe; build on one thread and share the resulting logger.</p>
   */
  public static final class Builder {
    private String serviceName = "beacon";
    private String environment;
    private String loggerName = "beacon";
    private String loggerVersion = SDK_VERSION;
    private String applicationVersion = "unknown";
    private Supplier<UserInfo> userInfoProvider;
    private boolean printLogsToConsole;
    private ConsoleLogFormat consoleFormat = ConsoleLogFormat.shortFormat();
    private ZoneId timeZone = ZoneOffset.UTC;
    private ConsoleSink consoleSink;
    private ClockPort clock = ClockPort.SYSTEM;
    private final List<LogOutput> additionalOutputs = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the service name written as {@code service}; defaults to {@code beacon}.
     *
     * @param serviceName service name; never {@code null}
     * @return this builder
     */
    public Builder serviceName(String serviceName) {
      this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
      return this;
    }

    /**
     * Sets the environment added as the {@code env:<environment>} tag.
     *
     * @param environment environment; {@code null} adds no tag
     * @return this builder
     */
    public Builder environment(String environment) {
      this.environment = environment;
      return this;
    }

    /**
     * Sets the logger name written as {@code logger.name}; defaults to {@code beacon}.
     *
     * @param loggerName logger name; never {@code null}
     * @return this builder
     */
    public Builder loggerName(String loggerName) {
      this.loggerName = Objects.requireNonNull(loggerName, "loggerName");
      return this;
    }

    /**
     * Sets the version written as {@code logger.version}; defaults to {@link Logger#SDK_VERSION}.
     *
     * @param loggerVersion logger version; never {@code null}
     * @return this builder
     */
    public Builder loggerVersion(String loggerVersion) {
      this.loggerVersion = Objects.requireNonNull(loggerVersion, "loggerVersion");
      return this;
    }

    /**
     * Sets the application version written as {@code version}; defaults to {@code unknown}.
     *
     * @param applicationVersion application version; never {@code null}
     * @return this builder
     */
    public Builder applicationVersion(String applicationVersion) {
      this.applicationVersion = Objects.requireNonNull(applicationVersion, "applicationVersion");
      return this;
    }

    /**
     * Sets the supplier queried for the current user on every write.
     *
     * @param userInfoProvider supplier; {@code null} disables user information
     * @return this builder
     */
    public Builder userInfo(Supplier<UserInfo> userInfoProvider) {
      this.userInfoProvider = userInfoProvider;
      return this;
    }

    /**
     * Enables or disables printing to the console sink in the given format.
     *
     * @param enabled whether console printing is on
     * @param format console format; never {@code null}
     * @return this builder
     */
    public Builder printLogsToConsole(boolean enabled, ConsoleLogFormat format) {
      this.printLogsToConsole = enabled;
      this.consoleFormat = Objects.requireNonNull(format, "format");
      return this;
    }

    /**
     * Enables or disables console printing, keeping the current format.
     *
     * @param enabled whether console printing is on
     * @return this builder
     */
    public Builder printLogsToConsole(boolean enabled) {
      return printLogsToConsole(enabled, consoleFormat);
    }

    /**
     * Sets the zone used to render times in the short console format.
     *
     * @param timeZone display zone; never {@code null}
     * @return this builder
     */
    public Builder timeZone(ZoneId timeZone) {
      this.timeZone = Objects.requireNonNull(timeZone, "timeZone");
      return this;
    }

    /**
     * Overrides the console facility; defaults to {@link Slf4jConsoleSink}.
     *
     * @param consoleSink console sink; never {@code null}
     * @return this builder
     */
    public Builder consoleSink(ConsoleSink consoleSink) {
      this.consoleSink = Objects.requireNonNull(consoleSink, "consoleSink");
      return this;
    }

    /**
     * Sets the time source stamped on each write; defaults to {@link ClockPort#SYSTEM}.
     *
     * @param clock clock; never {@code null}
     * @return this builder
     */
    public Builder clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Adds an output receiving every write next to the console.
     *
     * @param output extra output; never {@code null}
     * @return this builder
     */
    public Builder addOutput(LogOutput output) {
      additionalOutputs.add(Objects.requireNonNull(output, "output"));
      return this;
    }

    /**
     * Builds the logger.
     *
     * @return configured logger
     */
    public Logger build() {
      LogBuilder logBuilder = new LogBuilder(
          serviceName, environment, loggerName, loggerVersion, applicationVersion, userInfoProvider);

      List<LogOutput> outputs = new ArrayList<>();
      if (printLogsToConsole) {
        ConsoleSink sink = consoleSink == null ? new Slf4jConsoleSink() : consoleSink;
        outputs.add(new ConsoleLogOutput(logBuilder, consoleFormat, timeZone, sink));
      }
      outputs.addAll(additionalOutputs);

      LogOutput output = switch (outputs.size()) {
        case 0 -> LogOutput.NO_OP;
        case 1 -> outputs.get(0);
        default -> new CombinedLogOutput(outputs);
      };
      log.debug("Built logger {} for service {} (console={}, format={}, outputs={})",
          loggerName, serviceName, printLogsToConsole, consoleFormat, outputs.size());
      return new Logger(output, clock);
    }
  }
}
