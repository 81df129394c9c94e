package ca.gc.cra.beacon.application.port;

import ca.gc.cra.beacon.domain.log.LogAttributes;
import ca.gc.cra.beacon.domain.log.LogLevel;
import java.time.Instant;
import java.util.Set;

/**
 * <strong>What:</strong> Outbound port receiving one log-write request per logging call.
 * <p><strong>Why:</strong> Keeps the {@code Logger} facade decoupled from where records end up (console,
 * fan-out, test recorders).</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent invocations from application
 * threads.</p>
 *
 * @since 0.1.0
 */
public interface LogOutput {
  /**
   * Writes a single log request. Implementations must not propagate failures to the caller.
   *
   * @param level severity; never {@code null}
   * @param message log message; never {@code null}
   * @param date event time; never {@code null}
   * @param attributes user and internal attributes; never {@code null}
   * @param tags tags attached to the call; never {@code null}
   */
  void writeLogWith(LogLevel level, String message, Instant date, LogAttributes attributes, Set<String> tags);

  /**
   * Output that discards every write.
   */
  LogOutput NO_OP = (level, message, date, attributes, tags) -> {};
}
