package ca.gc.cra.warden.domain.moderation;

import java.util.Locale;
import java.util.Objects;

/**
 * Normalizes usernames into user ids.
 *
 * @since 0.1.0
 */
public final class UserIds {
  private UserIds() {
    // Utility
  }

  /**
   * Converts a username to its id form (trimmed, lowercase).
   *
   * @param username display username; must not be {@code null}
   * @return normalized id
   */
  public static String normalize(String username) {
    return Objects.requireNonNull(username, "username").trim().toLowerCase(Locale.ROOT);
  }
}
