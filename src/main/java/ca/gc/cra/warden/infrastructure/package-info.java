/**
 * <strong>Purpose:</strong> Adapters behind the application ports: snapshot stores, JSON helpers, executors
 * and telemetry.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure;
