package ca.gc.cra.beacon.domain.log;

/**
 * Application user associated with emitted logs. Every component is optional.
 *
 * @param id user identifier; may be {@code null}
 * @param name display name; may be {@code null}
 * @param email email address; may be {@code null}
 * @since 0.1.0
 */
public record UserInfo(String id, String name, String email) {

  /** No user information. */
  public static final UserInfo EMPTY = new UserInfo(null, null, null);

  /**
   * Returns whether no component is set.
   *
   * @return {@code true} when id, name and email are all absent
   */
  public boolean isEmpty() {
    return id == null && name == null && email == null;
  }
}
