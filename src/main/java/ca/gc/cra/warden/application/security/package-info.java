/**
 * <strong>Purpose:</strong> Default {@link ca.gc.cra.warden.application.port.CapabilityCheck} implementation
 * based on the {@link ca.gc.cra.warden.domain.security.Permission} hierarchy.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application.security;
