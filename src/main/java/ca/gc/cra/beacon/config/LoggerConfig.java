package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.application.logging.ConsoleLogFormat;
import ca.gc.cra.beacon.infrastructure.console.Slf4jConsoleSink;
import ca.gc.cra.beacon.validation.Strings;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable settings for one logger: service context, tags, and console output.
 * <p><strong>Why:</strong> Lets applications switch console format, prefix and display zone from a YAML file
 * instead of code.</p>
 * <p><strong>Keys:</strong> {@code service} (required), {@code environment}, {@code loggerName},
 * {@code loggerVersion}, {@code applicationVersion}, {@code tags}, {@code console.enabled},
 * {@code console.format}, {@code console.prefix}, {@code console.timeZone}, {@code console.sinkLogger},
 * {@code console.verbose}.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed; safe for concurrent reads.</p>
 *
 * @since 0.1.0
 * @see Loggers
 */
public final class LoggerConfig {
  private final String serviceName;
  private final String environment;
  private final String loggerName;
  private final String loggerVersion;
  private final String applicationVersion;
  private final Set<String> tags;
  private final boolean consoleEnabled;
  private final ConsoleLogFormat consoleFormat;
  private final ZoneId timeZone;
  private final String sinkCategory;
  private final boolean verbose;

  private LoggerConfig(
      String serviceName,
      String environment,
      String loggerName,
      String loggerVersion,
      String applicationVersion,
      Set<String> tags,
      boolean consoleEnabled,
      ConsoleLogFormat consoleFormat,
      ZoneId timeZone,
      String sinkCategory,
      boolean verbose) {
    this.serviceName = Objects.requireNonNull(serviceName, "serviceName");
    this.environment = environment;
    this.loggerName = Objects.requireNonNull(loggerName, "loggerName");
    this.loggerVersion = loggerVersion;
    this.applicationVersion = applicationVersion;
    this.tags = Set.copyOf(tags);
    this.consoleEnabled = consoleEnabled;
    this.consoleFormat = Objects.requireNonNull(consoleFormat, "consoleFormat");
    this.timeZone = Objects.requireNonNull(timeZone, "timeZone");
    this.sinkCategory = Objects.requireNonNull(sinkCategory, "sinkCategory");
    this.verbose = verbose;
  }

  /**
   * Builds a configuration from flattened key/value pairs.
   *
   * @param args flattened configuration (see {@link YamlConfigLoader}); must not be {@code null}
   * @return normalized configuration
   * @throws IllegalArgumentException if a value is missing or invalid; the message names the key
   */
  public static LoggerConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    String service = args.get("service");
    if (service == null || service.isBlank()) {
      throw new IllegalArgumentException("service is required");
    }
    String serviceName = Strings.requireNonBlank("service", service);
    String loggerName = Strings.optionalNonBlank("loggerName", args.get("loggerName"));

    String formatName = args.getOrDefault("console.format", "short");
    String prefix = Strings.requireNoControl("console.prefix", args.get("console.prefix"));
    ConsoleLogFormat format;
    try {
      format = ConsoleLogFormat.fromString(formatName, prefix);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("console.format is invalid: " + formatName, ex);
    }

    return new LoggerConfig(
        serviceName,
        Strings.optionalNonBlank("environment", args.get("environment")),
        loggerName == null ? serviceName : loggerName,
        Strings.optionalNonBlank("loggerVersion", args.get("loggerVersion")),
        Strings.optionalNonBlank("applicationVersion", args.get("applicationVersion")),
        parseTags(args.get("tags")),
        parseBoolean("console.enabled", args.get("console.enabled"), false),
        format,
        parseZone(args.get("console.timeZone")),
        Objects.requireNonNullElse(
            Strings.optionalNonBlank("console.sinkLogger", args.get("console.sinkLogger")),
            Slf4jConsoleSink.DEFAULT_CATEGORY),
        parseBoolean("console.verbose", args.get("console.verbose"), false));
  }

  public String serviceName() {
    return serviceName;
  }

  /**
   * Deployment environment.
   *
   * @return environment or {@code null} when not configured
   */
  public String environment() {
    return environment;
  }

  public String loggerName() {
    return loggerName;
  }

  /**
   * SDK version override.
   *
   * @return version or {@code null} to use the built-in SDK version
   */
  public String loggerVersion() {
    return loggerVersion;
  }

  /**
   * Host application version.
   *
   * @return version or {@code null} when not configured
   */
  public String applicationVersion() {
    return applicationVersion;
  }

  public Set<String> tags() {
    return tags;
  }

  public boolean consoleEnabled() {
    return consoleEnabled;
  }

  public ConsoleLogFormat consoleFormat() {
    return consoleFormat;
  }

  public ZoneId timeZone() {
    return timeZone;
  }

  public String sinkCategory() {
    return sinkCategory;
  }

  public boolean verbose() {
    return verbose;
  }

  private static Set<String> parseTags(String raw) {
    Set<String> tags = new LinkedHashSet<>();
    if (raw == null || raw.isBlank()) {
      return tags;
    }
    for (String token : raw.split(",")) {
      String tag = token.trim();
      if (!tag.isEmpty()) {
        tags.add(Strings.requireNonBlank("tags", tag));
      }
    }
    return tags;
  }

  private static boolean parseBoolean(String key, String raw, boolean defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(key + " must be a boolean but was '" + raw + "'");
    };
  }

  private static ZoneId parseZone(String raw) {
    if (raw == null || raw.isBlank()) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(raw.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("console.timeZone is not a valid zone id: " + raw, ex);
    }
  }
}
