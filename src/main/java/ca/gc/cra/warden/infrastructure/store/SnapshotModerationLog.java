package ca.gc.cra.warden.infrastructure.store;

import ca.gc.cra.warden.application.port.ModerationLogSource;
import ca.gc.cra.warden.domain.moderation.ModlogEntry;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@link ModerationLogSource} returning a user's history newest first.
 *
 * @since 0.1.0
 */
public final class SnapshotModerationLog implements ModerationLogSource {
  private final Map<String, List<ModlogEntry>> byUser;

  public SnapshotModerationLog(ModerationSnapshot snapshot) {
    this.byUser = Objects.requireNonNull(snapshot, "snapshot").modlog().stream()
        .sorted(Comparator.comparing(ModlogEntry::createdAt).reversed())
        .collect(Collectors.groupingBy(ModlogEntry::userId, Collectors.toUnmodifiableList()));
  }

  @Override
  public List<ModlogEntry> historyFor(String userId) {
    return byUser.getOrDefault(Objects.requireNonNull(userId, "userId"), List.of());
  }
}
