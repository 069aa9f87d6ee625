/**
 * Executor construction for inquiry fan-out.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.exec;
