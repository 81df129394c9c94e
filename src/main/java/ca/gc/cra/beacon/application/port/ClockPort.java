package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to loggers.
 * <p><strong>Why:</strong> Lets tests pin the {@code date} of emitted logs.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; loggers read the clock from any
 * calling thread.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
