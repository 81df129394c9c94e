package ca.gc.cra.beacon.infrastructure.console;

import ca.gc.cra.beacon.domain.log.Log;

/**
 * Renders a {@link Log} into the text shown on the console.
 *
 * <p>Implementations are pure functions of their configuration and input and must never throw; any
 * internal failure degrades to a best-effort string.</p>
 *
 * @since 0.1.0
 */
public interface ConsoleLogFormatter {
  /**
   * Formats the log.
   *
   * @param log log record; never {@code null}
   * @return display text; never {@code null}
   */
  String format(Log log);
}
