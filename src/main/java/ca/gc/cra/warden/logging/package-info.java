/**
 * <strong>Purpose:</strong> Logging helpers: backend level control and log-safe rendering of free text.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.logging;
