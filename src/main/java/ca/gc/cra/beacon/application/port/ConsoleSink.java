package ca.gc.cra.beacon.application.port;

/**
 * <strong>What:</strong> Port onto the platform console facility that displays log text.
 * <p><strong>Why:</strong> Injected rather than reached through a global so console outputs can be tested
 * against a recording sink.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use when loggers are shared
 * across threads.</p>
 *
 * @since 0.1.0
 */
public interface ConsoleSink {
  /**
   * Emits one line (or block) of text. Fire-and-forget; must not throw.
   *
   * @param severity console severity tag; never {@code null}
   * @param text rendered text; never {@code null}
   */
  void emit(ConsoleSeverity severity, String text);
}
