package ca.gc.cra.warden.infrastructure.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.moderation.ModlogEntry;
import ca.gc.cra.warden.domain.moderation.Note;
import ca.gc.cra.warden.domain.moderation.User;
import java.util.List;
import org.junit.jupiter.api.Test;

class SnapshotLookupsTest {
  private final ModerationSnapshot snapshot = SnapshotFixtures.basic();

  @Test
  void usersResolveCaseInsensitively() {
    SnapshotUserDirectory users = new SnapshotUserDirectory(snapshot);

    User u2 = users.byUsername("u2").orElseThrow();
    assertEquals("U2", u2.username());
    assertEquals("FM", u2.title());
    assertTrue(u2.engine());
    assertEquals(u2, users.byUsername(" U2 ").orElseThrow());
    assertTrue(users.byUsername("Ghost").isEmpty());
    assertTrue(users.byUsername("").isEmpty());
  }

  @Test
  void notesAreNewestFirstPerUser() {
    SnapshotNoteSource notes = new SnapshotNoteSource(snapshot);

    List<String> texts = notes.notesFor("u1").stream().map(Note::text).toList();

    assertEquals(List.of("second look", "first look"), texts);
    assertEquals(1, notes.notesFor("u2").size());
    assertTrue(notes.notesFor("ghost").isEmpty());
  }

  @Test
  void historyIsNewestFirstPerUser() {
    SnapshotModerationLog log = new SnapshotModerationLog(snapshot);

    List<ModlogEntry> u1 = log.historyFor("u1");

    assertEquals(1, u1.size());
    assertEquals("alert", u1.get(0).action());
    assertEquals("warned about assistance", u1.get(0).detailsOption().orElseThrow());
    assertTrue(log.historyFor("u2").get(0).detailsOption().isEmpty());
    assertTrue(log.historyFor("ghost").isEmpty());
  }
}
