package ca.gc.cra.warden.infrastructure.store;

import ca.gc.cra.warden.application.port.ReportSource;
import ca.gc.cra.warden.domain.moderation.Report;
import ca.gc.cra.warden.domain.report.ReportSimilarity;
import ca.gc.cra.warden.domain.report.ReporterAccuracy;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * {@link ReportSource} over the reports of a snapshot.
 * <ul>
 *   <li>Active claim: the open report claimed by the moderator; the most recently claimed one wins.</li>
 *   <li>Similar reports: {@link ReportSimilarity} over open reports.</li>
 *   <li>Accuracy: {@link ReporterAccuracy} over every report.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class SnapshotReportSource implements ReportSource {
  private final List<Report> reports;
  private final List<Report> openReports;
  private final ReportSimilarity similarity;
  private final ReporterAccuracy accuracy;

  /**
   * Creates a report source with default scoring.
   *
   * @param snapshot data snapshot
   */
  public SnapshotReportSource(ModerationSnapshot snapshot) {
    this(snapshot, new ReportSimilarity(), new ReporterAccuracy());
  }

  /**
   * Creates a report source.
   *
   * @param snapshot data snapshot
   * @param similarity similarity ranking
   * @param accuracy reporter accuracy scoring
   */
  public SnapshotReportSource(
      ModerationSnapshot snapshot, ReportSimilarity similarity, ReporterAccuracy accuracy) {
    this.reports = Objects.requireNonNull(snapshot, "snapshot").reports();
    this.openReports = reports.stream().filter(Report::isOpen).toList();
    this.similarity = Objects.requireNonNull(similarity, "similarity");
    this.accuracy = Objects.requireNonNull(accuracy, "accuracy");
  }

  @Override
  public Optional<Report> activeInquiryFor(String moderatorId) {
    Objects.requireNonNull(moderatorId, "moderatorId");
    return openReports.stream()
        .filter(report -> report.isClaimedBy(moderatorId))
        .max(Comparator.comparing((Report report) -> report.claim().seenAt())
            .thenComparing(Report::id));
  }

  @Override
  public List<Report> moreLike(Report report, int limit) {
    return similarity.moreLike(report, openReports, limit);
  }

  @Override
  public OptionalInt accuracyScore(Report report) {
    return accuracy.score(report, reports);
  }
}
