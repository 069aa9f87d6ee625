package ca.gc.cra.warden.domain.moderation;

import java.time.Instant;
import java.util.Objects;

/**
 * Full user record of a reported account.
 *
 * @param id normalized user id
 * @param username display username
 * @param title optional title; may be {@code null}
 * @param enabled whether the account is open
 * @param engine marked as engine (cheater)
 * @param booster marked as rating booster
 * @param troll marked as troll (shadowbanned)
 * @param createdAt account creation time
 * @since 0.1.0
 */
public record User(
    String id,
    String username,
    String title,
    boolean enabled,
    boolean engine,
    boolean booster,
    boolean troll,
    Instant createdAt) {

  public User {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public LightUser light() {
    return new LightUser(id, username, title);
  }
}
