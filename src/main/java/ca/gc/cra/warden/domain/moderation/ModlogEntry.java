package ca.gc.cra.warden.domain.moderation;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A past moderation action recorded against a user.
 *
 * @param moderatorId id of the acting moderator
 * @param userId id of the affected user
 * @param action action key such as {@code engine} or {@code closeAccount}
 * @param details optional free-text details; may be {@code null}
 * @param createdAt time the action was taken
 * @since 0.1.0
 */
public record ModlogEntry(
    String moderatorId, String userId, String action, String details, Instant createdAt) {

  public ModlogEntry {
    Objects.requireNonNull(moderatorId, "moderatorId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public Optional<String> detailsOption() {
    return Optional.ofNullable(details);
  }
}
