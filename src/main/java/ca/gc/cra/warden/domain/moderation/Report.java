package ca.gc.cra.warden.domain.moderation;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> A complaint filed against a subject user.
 * <p><strong>Why:</strong> The primary report anchors an inquiry; related reports, notes and history are
 * all keyed by its subject.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param id unique report id
 * @param subject username of the reported user
 * @param reporter id of the filing user
 * @param reason filing reason
 * @param text free-text description; never {@code null}, may be empty
 * @param createdAt filing time
 * @param processedBy id of the moderator who closed the report; {@code null} while open
 * @param actioned whether processing led to a moderation action
 * @param claim active claim when a moderator has the report open; may be {@code null}
 * @since 0.1.0
 */
public record Report(
    String id,
    String subject,
    String reporter,
    ReportReason reason,
    String text,
    Instant createdAt,
    String processedBy,
    boolean actioned,
    ActiveClaim claim) {

  public Report {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(reporter, "reporter");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(createdAt, "createdAt");
    text = text == null ? "" : text;
  }

  /**
   * Returns the normalized id of the reported user.
   *
   * @return subject user id
   */
  public String subjectId() {
    return UserIds.normalize(subject);
  }

  public boolean isOpen() {
    return processedBy == null;
  }

  public boolean isProcessed() {
    return processedBy != null;
  }

  /**
   * Tests whether the given moderator currently holds the claim on this report.
   *
   * @param moderatorId moderator id
   * @return {@code true} when the report is open and claimed by {@code moderatorId}
   */
  public boolean isClaimedBy(String moderatorId) {
    return isOpen() && claim != null && claim.moderatorId().equals(moderatorId);
  }
}
