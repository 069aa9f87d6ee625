package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.moderation.Moderator;
import ca.gc.cra.warden.domain.security.Permission;

/**
 * <strong>What:</strong> Predicate deciding whether a moderator holds a capability.
 * <p><strong>Why:</strong> Keeps the permission registry behind an injected seam so the inquiry gate can be
 * exercised with substitute policies.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be pure and thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.warden.application.security.Granter
 */
@FunctionalInterface
public interface CapabilityCheck {
  /**
   * Checks the capability.
   *
   * @param moderator acting moderator; never {@code null}
   * @param capability required capability; never {@code null}
   * @return {@code true} when granted
   */
  boolean hasCapability(Moderator moderator, Permission capability);
}
