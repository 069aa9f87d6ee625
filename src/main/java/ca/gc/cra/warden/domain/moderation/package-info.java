/**
 * <strong>Purpose:</strong> Immutable moderation records read by the inquiry core.
 * <p><strong>Pipeline role:</strong> Domain layer; values flow from store adapters through ports into
 * {@link ca.gc.cra.warden.domain.moderation.Inquiry}.</p>
 * <p><strong>Concurrency:</strong> All types are immutable records and safe to share across fan-out threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.domain.moderation;
