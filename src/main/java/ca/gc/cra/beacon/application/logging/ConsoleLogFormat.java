package ca.gc.cra.beacon.application.logging;

import java.util.Locale;
import java.util.Objects;

/**
 * Console rendering style chosen once when a logger is built.
 *
 * <p>Four configurations exist: {@code short}, {@code shortWithPrefix}, {@code json} and
 * {@code jsonWithPrefix}. The prefixed forms are the same variants carrying a non-empty prefix.</p>
 *
 * @since 0.1.0
 */
public sealed interface ConsoleLogFormat permits ConsoleLogFormat.ShortFormat, ConsoleLogFormat.JsonFormat {

  /**
   * Literal text placed before every rendered log.
   *
   * @return prefix; never {@code null}, possibly empty
   */
  String prefix();

  /**
   * Short single-line format without prefix.
   *
   * @return short format
   */
  static ConsoleLogFormat shortFormat() {
    return new ShortFormat("");
  }

  /**
   * Short single-line format with the given prefix.
   *
   * @param prefix literal prefix; never {@code null}
   * @return short format
   */
  static ConsoleLogFormat shortWith(String prefix) {
    return new ShortFormat(prefix);
  }

  /**
   * Pretty-printed JSON format without prefix.
   *
   * @return JSON format
   */
  static ConsoleLogFormat json() {
    return new JsonFormat("");
  }

  /**
   * Pretty-printed JSON format with the given prefix. The prefix is not part of the JSON document.
   *
   * @param prefix literal prefix; never {@code null}
   * @return JSON format
   */
  static ConsoleLogFormat jsonWith(String prefix) {
    return new JsonFormat(prefix);
  }

  /**
   * Parses a configured format name.
   *
   * @param name one of {@code short}, {@code shortWithPrefix}, {@code json}, {@code jsonWithPrefix};
   *     blank defaults to {@code short}
   * @param prefix prefix for the {@code *WithPrefix} forms; ignored otherwise
   * @return parsed format
   * @throws IllegalArgumentException if the name is unknown
   */
  static ConsoleLogFormat fromString(String name, String prefix) {
    if (name == null || name.isBlank()) {
      return shortFormat();
    }
    String safePrefix = prefix == null ? "" : prefix;
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "short" -> shortFormat();
      case "shortwithprefix", "shortwith" -> shortWith(safePrefix);
      case "json" -> json();
      case "jsonwithprefix", "jsonwith" -> jsonWith(safePrefix);
      default -> throw new IllegalArgumentException("Unknown console format: " + name);
    };
  }

  /**
   * Human-readable {@code HH:mm:ss.SSS [STATUS] message} lines.
   *
   * @param prefix literal prefix
   */
  record ShortFormat(String prefix) implements ConsoleLogFormat {
    /** Rejects a {@code null} prefix. */
    public ShortFormat {
      Objects.requireNonNull(prefix, "prefix");
    }
  }

  /**
   * Full log record encoded as pretty-printed JSON.
   *
   * @param prefix literal prefix
   */
  record JsonFormat(String prefix) implements ConsoleLogFormat {
    /** Rejects a {@code null} prefix. */
    public JsonFormat {
      Objects.requireNonNull(prefix, "prefix");
    }
  }
}
