package ca.gc.cra.warden.infrastructure.store;

import ca.gc.cra.warden.domain.moderation.Moderator;
import ca.gc.cra.warden.domain.moderation.ModlogEntry;
import ca.gc.cra.warden.domain.moderation.Note;
import ca.gc.cra.warden.domain.moderation.Report;
import ca.gc.cra.warden.domain.moderation.User;
import ca.gc.cra.warden.domain.moderation.UserIds;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable point-in-time copy of moderation data.
 *
 * @param moderators known moderators
 * @param users user records
 * @param reports all reports, open and processed
 * @param notes notes about users
 * @param modlog moderation-log entries
 * @since 0.1.0
 */
public record ModerationSnapshot(
    List<Moderator> moderators,
    List<User> users,
    List<Report> reports,
    List<Note> notes,
    List<ModlogEntry> modlog) {

  public ModerationSnapshot {
    moderators = List.copyOf(Objects.requireNonNull(moderators, "moderators"));
    users = List.copyOf(Objects.requireNonNull(users, "users"));
    reports = List.copyOf(Objects.requireNonNull(reports, "reports"));
    notes = List.copyOf(Objects.requireNonNull(notes, "notes"));
    modlog = List.copyOf(Objects.requireNonNull(modlog, "modlog"));
  }

  /**
   * Returns a snapshot without any data.
   *
   * @return empty snapshot
   */
  public static ModerationSnapshot empty() {
    return new ModerationSnapshot(List.of(), List.of(), List.of(), List.of(), List.of());
  }

  /**
   * Finds a moderator by id or username, case-insensitively.
   *
   * @param idOrName moderator id or username
   * @return moderator or empty
   */
  public Optional<Moderator> moderator(String idOrName) {
    String id = UserIds.normalize(idOrName);
    return moderators.stream().filter(m -> m.id().equals(id)).findFirst();
  }
}
