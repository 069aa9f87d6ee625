package ca.gc.cra.warden.domain.moderation;

import ca.gc.cra.warden.domain.security.Permission;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Identity of the moderator requesting an inquiry.
 * <p><strong>Why:</strong> Carries the granted permissions consulted by the capability gate and the
 * display fields copied into the produced inquiry.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the permission set is copied on construction.</p>
 *
 * @param id normalized moderator id; must not be {@code null}
 * @param username display name; must not be {@code null}
 * @param title optional title; may be {@code null}
 * @param enabled whether the account is active; disabled accounts hold no capability
 * @param permissions directly granted permissions (roles)
 * @since 0.1.0
 */
public record Moderator(
    String id,
    String username,
    String title,
    boolean enabled,
    Set<Permission> permissions) {

  public Moderator {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(username, "username");
    permissions = permissions == null || permissions.isEmpty()
        ? Set.of()
        : Set.copyOf(EnumSet.copyOf(permissions));
  }

  /**
   * Creates an enabled, untitled moderator whose id is derived from the username.
   *
   * @param username display name
   * @param permissions granted permissions
   * @return moderator identity
   */
  public static Moderator of(String username, Set<Permission> permissions) {
    return new Moderator(UserIds.normalize(username), username, null, true, permissions);
  }

  /**
   * Produces the lightweight display form embedded in an inquiry.
   *
   * @return light user view of this moderator
   */
  public LightUser light() {
    return new LightUser(id, username, title);
  }
}
