package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.moderation.User;
import java.util.Optional;

/**
 * Read-only user lookup.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface UserDirectory {
  /**
   * Resolves a user by username (case-insensitive).
   *
   * @param username username as stored on reports
   * @return user, or empty for deleted or unknown accounts
   */
  Optional<User> byUsername(String username);
}
