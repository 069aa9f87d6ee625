package ca.gc.cra.warden.application.port;

import ca.gc.cra.warden.domain.moderation.Report;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Read access to reports: active claims, similar reports and accuracy scores.
 * <p><strong>Role:</strong> Port implemented by report-store adapters; the report subsystem owns claim
 * lifecycle (including any expiry).</p>
 * <p><strong>Thread-safety:</strong> Methods may be called concurrently.</p>
 *
 * @since 0.1.0
 */
public interface ReportSource {
  /**
   * Returns the report currently opened by the moderator, if any.
   *
   * @param moderatorId moderator id
   * @return claimed report or empty
   */
  Optional<Report> activeInquiryFor(String moderatorId);

  /**
   * Returns reports similar to {@code report}, at most {@code limit} entries, in a stable order.
   *
   * @param report reference report
   * @param limit maximum number of results
   * @return related reports; empty when none match
   */
  List<Report> moreLike(Report report, int limit);

  /**
   * Returns the accuracy score (0-100) of the report, when it can be scored.
   *
   * @param report report to score
   * @return score or empty
   */
  OptionalInt accuracyScore(Report report);
}
