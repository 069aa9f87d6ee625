package ca.gc.cra.warden.domain.moderation;

import java.time.Instant;
import java.util.Objects;

/**
 * Annotation written by a moderator (or user) about a user.
 *
 * @param author id of the writer
 * @param userId id of the user the note is about
 * @param text note body
 * @param modOnly visible to moderators only
 * @param createdAt creation time
 * @since 0.1.0
 */
public record Note(String author, String userId, String text, boolean modOnly, Instant createdAt) {
  public Note {
    Objects.requireNonNull(author, "author");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(createdAt, "createdAt");
    text = text == null ? "" : text;
  }
}
