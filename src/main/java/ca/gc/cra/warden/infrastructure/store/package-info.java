/**
 * <strong>Purpose:</strong> Read-only adapters over an in-memory {@link ca.gc.cra.warden.infrastructure.store.ModerationSnapshot}.
 * <p><strong>Pipeline role:</strong> Implements the report, user, note and moderation-log ports for the CLI
 * and for integration tests.</p>
 * <p><strong>Concurrency:</strong> Snapshots are immutable, so every adapter is thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.store;
