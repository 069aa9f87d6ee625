package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.moderation.Note;
import java.util.List;

/**
 * Read-only access to notes written about users.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface NoteSource {
  /**
   * Returns notes about the user, in the store's order.
   *
   * @param userId normalized user id
   * @return notes; may be empty
   */
  List<Note> notesFor(String userId);
}
