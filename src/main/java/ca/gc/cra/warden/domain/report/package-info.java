/**
 * <strong>Purpose:</strong> Pure scoring over reports: similarity ranking and reporter accuracy.
 * <p><strong>Pipeline role:</strong> Domain services consumed by report-source adapters.</p>
 * <p><strong>Concurrency:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.domain.report;
