package ca.gc.cra.warden.domain.report;

import ca.gc.cra.warden.domain.moderation.Report;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * <strong>What:</strong> Scores a report by the track record of whoever filed it.
 * <p><strong>Why:</strong> Reporters whose past reports usually led to action deserve more attention; the
 * percentage is shown next to the report being worked.</p>
 * <p><strong>Rule:</strong> Over the reporter's {@code window} most recent processed reports (the scored
 * report excluded), the share that were actioned, rounded half up to a whole percent. Fewer than
 * {@code minimumSample} processed reports, or a system reporter, leaves the report unscored.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ReporterAccuracy {
  /** Default number of recent processed reports considered. */
  public static final int DEFAULT_WINDOW = 20;
  /** Default minimum number of processed reports before a score is produced. */
  public static final int DEFAULT_MINIMUM_SAMPLE = 4;

  private final int window;
  private final int minimumSample;
  private final Set<String> systemReporters;

  /**
   * Creates a scorer with default window and sample size and no system reporters.
   */
  public ReporterAccuracy() {
    this(DEFAULT_WINDOW, DEFAULT_MINIMUM_SAMPLE, Set.of());
  }

  /**
   * Creates a scorer.
   *
   * @param window number of recent processed reports considered; must be positive
   * @param minimumSample minimum processed reports required; must be positive and not exceed {@code window}
   * @param systemReporters reporter ids of automated reporters that are never scored
   */
  public ReporterAccuracy(int window, int minimumSample, Set<String> systemReporters) {
    if (window <= 0) {
      throw new IllegalArgumentException("window must be positive");
    }
    if (minimumSample <= 0 || minimumSample > window) {
      throw new IllegalArgumentException("minimumSample must be between 1 and window");
    }
    this.window = window;
    this.minimumSample = minimumSample;
    this.systemReporters = Set.copyOf(Objects.requireNonNull(systemReporters, "systemReporters"));
  }

  /**
   * Computes the accuracy of {@code report} from the reporter's history in {@code allReports}.
   *
   * @param report report being scored; must not be {@code null}
   * @param allReports every known report; must not be {@code null}
   * @return percentage 0-100, or empty when the reporter cannot be scored
   */
  public OptionalInt score(Report report, Iterable<Report> allReports) {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(allReports, "allReports");
    if (systemReporters.contains(report.reporter())) {
      return OptionalInt.empty();
    }
    List<Report> processed = new ArrayList<>();
    for (Report candidate : allReports) {
      if (candidate.isProcessed()
          && candidate.reporter().equals(report.reporter())
          && !candidate.id().equals(report.id())) {
        processed.add(candidate);
      }
    }
    if (processed.size() < minimumSample) {
      return OptionalInt.empty();
    }
    processed.sort(Comparator.comparing(Report::createdAt).reversed());
    List<Report> recent = processed.subList(0, Math.min(window, processed.size()));
    long actioned = recent.stream().filter(Report::actioned).count();
    return OptionalInt.of((int) Math.round(actioned * 100d / recent.size()));
  }
}
