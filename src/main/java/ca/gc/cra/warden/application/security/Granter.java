package ca.gc.cra.warden.application.security;

import ca.gc.cra.warden.application.port.CapabilityCheck;
import ca.gc.cra.warden.domain.moderation.Moderator;
import ca.gc.cra.warden.domain.security.Permission;
import java.util.Objects;

/**
 * Capability check over a moderator's granted permissions and everything they imply.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class Granter implements CapabilityCheck {

  /**
   * Returns {@code true} when the moderator is enabled and one of its permissions grants
   * {@code capability}.
   *
   * @param moderator moderator identity; must not be {@code null}
   * @param capability capability to test; must not be {@code null}
   * @return whether the capability is held
   */
  @Override
  public boolean hasCapability(Moderator moderator, Permission capability) {
    Objects.requireNonNull(moderator, "moderator");
    Objects.requireNonNull(capability, "capability");
    if (!moderator.enabled()) {
      return false;
    }
    for (Permission granted : moderator.permissions()) {
      if (granted.grants(capability)) {
        return true;
      }
    }
    return false;
  }
}
