/**
 * <strong>Purpose:</strong> Capability vocabulary shared by moderators and the inquiry gate.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.domain.security;
