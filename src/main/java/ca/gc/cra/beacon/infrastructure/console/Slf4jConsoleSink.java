package ca.gc.cra.beacon.infrastructure.console;

import ca.gc.cra.beacon.application.port.ConsoleSeverity;
import ca.gc.cra.beacon.application.port.ConsoleSink;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * {@link ConsoleSink} backed by an SLF4J logger category.
 *
 * <p>{@code DEBUG} and {@code INFO} map to the matching SLF4J levels, {@code DEFAULT} to {@code info},
 * {@code ERROR} to {@code error}, and {@code FAULT} to {@code error} carrying the {@value #FAULT_MARKER_NAME}
 * marker. Text is passed as a single argument so braces in rendered JSON are never treated as
 * placeholders.</p>
 *
 * @since 0.1.0
 */
public final class Slf4jConsoleSink implements ConsoleSink {
  /** Default logger category. */
  public static final String DEFAULT_CATEGORY = "beacon.console";
  /** Marker attached to fault-level entries. */
  public static final String FAULT_MARKER_NAME = "FAULT";

  private static final Marker FAULT = MarkerFactory.getMarker(FAULT_MARKER_NAME);

  private final Logger console;

  /**
   * Creates a sink writing to {@value #DEFAULT_CATEGORY}.
   */
  public Slf4jConsoleSink() {
    this(DEFAULT_CATEGORY);
  }

  /**
   * Creates a sink writing to the given logger category.
   *
   * @param category SLF4J logger name; never {@code null}
   */
  public Slf4jConsoleSink(String category) {
    this.console = LoggerFactory.getLogger(Objects.requireNonNull(category, "category"));
  }

  @Override
  public void emit(ConsoleSeverity severity, String text) {
    switch (severity) {
      case DEBUG -> console.debug("{}", text);
      case INFO, DEFAULT -> console.info("{}", text);
      case ERROR -> console.error("{}", text);
      case FAULT -> console.error(FAULT, "{}", text);
    }
  }
}
