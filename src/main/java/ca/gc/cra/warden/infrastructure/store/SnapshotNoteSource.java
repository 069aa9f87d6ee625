package ca.gc.cra.warden.infrastructure.store;

import ca.gc.cra.warden.application.port.NoteSource;
import ca.gc.cra.warden.domain.moderation.Note;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@link NoteSource} returning a user's notes newest first.
 *
 * @since 0.1.0
 */
public final class SnapshotNoteSource implements NoteSource {
  private final Map<String, List<Note>> byUser;

  public SnapshotNoteSource(ModerationSnapshot snapshot) {
    this.byUser = Objects.requireNonNull(snapshot, "snapshot").notes().stream()
        .sorted(Comparator.comparing(Note::createdAt).reversed())
        .collect(Collectors.groupingBy(Note::userId, Collectors.toUnmodifiableList()));
  }

  @Override
  public List<Note> notesFor(String userId) {
    return byUser.getOrDefault(Objects.requireNonNull(userId, "userId"), List.of());
  }
}
