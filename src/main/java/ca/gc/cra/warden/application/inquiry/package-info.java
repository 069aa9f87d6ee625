/**
 * <strong>Purpose:</strong> Inquiry use case: capability gate, active-claim lookup and concurrent fan-out
 * over the report, user, note and moderation-log ports.
 * <p><strong>Concurrency:</strong> The sequential phase runs on the caller thread; fan-out runs on an
 * injected executor and is joined before returning.</p>
 * <p><strong>Observability:</strong> Emits {@code inquiry.*} counters and logs with the {@code moderator} MDC
 * key.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application.inquiry;
