package ca.gc.cra.beacon.infrastructure.output;

import ca.gc.cra.beacon.application.port.LogOutput;
import ca.gc.cra.beacon.domain.log.LogAttributes;
import ca.gc.cra.beacon.domain.log.LogLevel;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards every write to each wrapped output, in order.
 *
 * <p>A failing output is logged at warn and does not stop the outputs after it.</p>
 *
 * @since 0.1.0
 */
public final class CombinedLogOutput implements LogOutput {
  private static final Logger log = LoggerFactory.getLogger(CombinedLogOutput.class);

  private final List<LogOutput> outputs;

  /**
   * Creates a fan-out output.
   *
   * @param outputs outputs to combine; never {@code null}, no {@code null} elements
   */
  public CombinedLogOutput(List<LogOutput> outputs) {
    this.outputs = List.copyOf(Objects.requireNonNull(outputs, "outputs"));
  }

  @Override
  public void writeLogWith(
      LogLevel level, String message, Instant date, LogAttributes attributes, Set<String> tags) {
    for (LogOutput output : outputs) {
      try {
        output.writeLogWith(level, message, date, attributes, tags);
      } catch (RuntimeException ex) {
        log.warn("Log output {} failed for {} log", output, level, ex);
      }
    }
  }

  /**
   * Returns the wrapped outputs.
   *
   * @return immutable list of outputs
   */
  public List<LogOutput> outputs() {
    return outputs;
  }
}
