package ca.gc.cra.beacon.config;

import ca.gc.cra.beacon.api.Logger;
import ca.gc.cra.beacon.infrastructure.console.Slf4jConsoleSink;
import ca.gc.cra.beacon.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root wiring {@link Logger} instances from {@link LoggerConfig}.
 * <p><strong>Why:</strong> Keeps console sink selection, verbosity and tag seeding out of application code.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class Loggers {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(Loggers.class);

  private Loggers() {}

  /**
   * Builds a logger from configuration.
   *
   * @param config logger configuration; never {@code null}
   * @return configured logger
   */
  public static Logger fromConfig(LoggerConfig config) {
    Objects.requireNonNull(config, "config");
    Logger.Builder builder = Logger.builder()
        .serviceName(config.serviceName())
        .environment(config.environment())
        .loggerName(config.loggerName())
        .printLogsToConsole(config.consoleEnabled(), config.consoleFormat())
        .timeZone(config.timeZone())
        .consoleSink(new Slf4jConsoleSink(config.sinkCategory()));
    if (config.loggerVersion() != null) {
      builder.loggerVersion(config.loggerVersion());
    }
    if (config.applicationVersion() != null) {
      builder.applicationVersion(config.applicationVersion());
    }
    if (config.consoleEnabled() && config.verbose()) {
      LoggingConfigurator.enableVerboseLogging(config.sinkCategory());
    }

    Logger logger = builder.build();
    config.tags().forEach(logger::addTag);
    return logger;
  }

  /**
   * Loads the {@code common} and {@code loggerName} sections of a YAML file and builds a logger.
   *
   * <p>A missing file yields a logger named {@code loggerName} with default settings. When the file sets no
   * {@code service}, the logger name is used.</p>
   *
   * @param path YAML configuration path; never {@code null}
   * @param loggerName logger section and default logger name; never {@code null}
   * @return configured logger
   * @throws IOException if the file exists but cannot be read
   * @throws IllegalArgumentException if the YAML or any value is invalid
   */
  public static Logger fromYaml(Path path, String loggerName) throws IOException {
    Objects.requireNonNull(loggerName, "loggerName");
    Map<String, String> args = new LinkedHashMap<>();
    args.put("service", loggerName);
    args.put("loggerName", loggerName);
    YamlConfigLoader.load(path, loggerName).ifPresentOrElse(
        args::putAll,
        () -> log.debug("Logger config {} not found; using defaults for {}", path, loggerName));
    return fromConfig(LoggerConfig.fromMap(args));
  }
}
