package ca.gc.cra.beacon.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings read from logger configuration.
 * <p><strong>Why:</strong> Service names, logger names and prefixes end up in every emitted log; control
 * characters or blank identifiers would corrupt console output.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    if (containsControl(trimmed)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return trimmed;
  }

  /**
   * Returns the trimmed value, or {@code null} when the input is {@code null} or blank.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; may be {@code null}
   * @return trimmed value or {@code null}
   * @throws IllegalArgumentException if the value contains ISO control characters
   */
  public static String optionalNonBlank(String name, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return requireNonBlank(name, value);
  }

  /**
   * Ensures a string contains no ISO control characters. Whitespace is preserved as given.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; {@code null} returned as empty
   * @return the value unchanged, or {@code ""} for {@code null}
   * @throws IllegalArgumentException if the value contains ISO control characters
   */
  public static String requireNoControl(String name, String value) {
    if (value == null) {
      return "";
    }
    if (containsControl(value)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    return value;
  }

  private static boolean containsControl(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + ' ' + suffix;
  }
}
