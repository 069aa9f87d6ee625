package ca.gc.cra.warden.infrastructure.store;

import ca.gc.cra.warden.application.port.UserDirectory;
import ca.gc.cra.warden.domain.moderation.User;
import ca.gc.cra.warden.domain.moderation.UserIds;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link UserDirectory} indexed by normalized user id.
 *
 * @since 0.1.0
 */
public final class SnapshotUserDirectory implements UserDirectory {
  private final Map<String, User> byId;

  public SnapshotUserDirectory(ModerationSnapshot snapshot) {
    Map<String, User> index = new LinkedHashMap<>();
    for (User user : Objects.requireNonNull(snapshot, "snapshot").users()) {
      index.putIfAbsent(user.id(), user);
    }
    this.byId = Map.copyOf(index);
  }

  @Override
  public Optional<User> byUsername(String username) {
    if (username == null || username.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(byId.get(UserIds.normalize(username)));
  }
}
