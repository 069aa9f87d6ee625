/**
 * <strong>Purpose:</strong> Collaborator contracts consumed by the inquiry core.
 * <p><strong>Pipeline role:</strong> Application layer; store, permission and telemetry adapters implement
 * these interfaces.</p>
 * <p><strong>Concurrency:</strong> Implementations are invoked concurrently from fan-out workers and must be
 * thread-safe.</p>
 * <p><strong>Failure:</strong> Absence is expressed with empty {@code Optional}s and lists; exceptions are
 * reserved for infrastructure faults.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application.port;
