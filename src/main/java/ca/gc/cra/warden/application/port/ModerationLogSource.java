package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.moderation.ModlogEntry;
import java.util.List;

/**
 * Read-only access to the moderation log.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ModerationLogSource {
  /**
   * Returns past moderation actions against the user, in the log's order.
   *
   * @param userId normalized user id
   * @return history entries; may be empty
   */
  List<ModlogEntry> historyFor(String userId);
}
