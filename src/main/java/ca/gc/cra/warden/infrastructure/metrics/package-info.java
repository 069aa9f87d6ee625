/**
 * OpenTelemetry-backed implementation of {@link ca.gc.cra.warden.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.metrics;
