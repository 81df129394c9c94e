package ca.gc.cra.beacon.domain.log;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attributes attached to a single log record.
 *
 * <p>{@code userAttributes} come from the caller and the logger; {@code internalAttributes} are set by
 * the SDK itself (for example {@code error.kind}). Values may be {@code null}, so both maps are
 * unmodifiable copies rather than {@link Map#copyOf(Map)} results.</p>
 *
 * @param userAttributes attributes supplied by the application; never {@code null}
 * @param internalAttributes attributes supplied by the SDK; never {@code null}
 * @since 0.1.0
 */
public record LogAttributes(Map<String, Object> userAttributes, Map<String, Object> internalAttributes) {

  /** Attributes with no entries. */
  public static final LogAttributes EMPTY = new LogAttributes(Map.of(), Map.of());

  /**
   * Copies both maps into unmodifiable views.
   */
  public LogAttributes {
    userAttributes = copy(userAttributes);
    internalAttributes = copy(internalAttributes);
  }

  /**
   * Creates attributes carrying only user-supplied entries.
   *
   * @param userAttributes application attributes; {@code null} treated as empty
   * @return attributes instance
   */
  public static LogAttributes of(Map<String, Object> userAttributes) {
    return new LogAttributes(userAttributes, Map.of());
  }

  /**
   * Returns whether neither map holds an entry.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return userAttributes.isEmpty() && internalAttributes.isEmpty();
  }

  private static Map<String, Object> copy(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
