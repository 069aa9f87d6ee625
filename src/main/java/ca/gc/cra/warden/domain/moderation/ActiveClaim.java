package ca.gc.cra.warden.domain.moderation;

import java.time.Instant;
import java.util.Objects;

/**
 * Marker left on a report while a moderator has it open.
 *
 * @param moderatorId id of the moderator holding the claim
 * @param seenAt instant the moderator opened the report
 * @since 0.1.0
 */
public record ActiveClaim(String moderatorId, Instant seenAt) {
  public ActiveClaim {
    Objects.requireNonNull(moderatorId, "moderatorId");
    Objects.requireNonNull(seenAt, "seenAt");
  }
}
