package ca.gc.cra.warden.domain.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.domain.moderation.Report;
import ca.gc.cra.warden.domain.moderation.ReportReason;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ReporterAccuracyTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  @Test
  void percentageOfActionedProcessedReports() {
    Report scored = open("R0", "alice");
    List<Report> all = new ArrayList<>(List.of(scored));
    // 7 of 8 actioned -> 87.5 -> 88
    for (int i = 0; i < 8; i++) {
      all.add(processed("P" + i, "alice", i != 0, T0.minusSeconds(i)));
    }

    assertEquals(OptionalInt.of(88), new ReporterAccuracy().score(scored, all));
  }

  @Test
  void tooFewProcessedReportsLeavesScoreEmpty() {
    Report scored = open("R0", "alice");
    List<Report> all = List.of(scored,
        processed("P1", "alice", true, T0),
        processed("P2", "alice", true, T0),
        processed("P3", "alice", true, T0),
        open("R9", "alice"),
        processed("P4", "bob", true, T0));

    assertTrue(new ReporterAccuracy().score(scored, all).isEmpty());
  }

  @Test
  void onlyMostRecentWindowCounts() {
    Report scored = open("R0", "alice");
    List<Report> all = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      all.add(processed("NEW" + i, "alice", true, T0.minusSeconds(i)));
    }
    for (int i = 0; i < 4; i++) {
      all.add(processed("OLD" + i, "alice", false, T0.minusSeconds(1_000 + i)));
    }

    assertEquals(OptionalInt.of(100), new ReporterAccuracy(4, 4, Set.of()).score(scored, all));
  }

  @Test
  void systemReportersAreNeverScored() {
    Report scored = open("R0", "lichess");
    List<Report> all = new ArrayList<>(List.of(scored));
    for (int i = 0; i < 10; i++) {
      all.add(processed("P" + i, "lichess", true, T0));
    }

    assertTrue(new ReporterAccuracy(20, 4, Set.of("lichess")).score(scored, all).isEmpty());
  }

  @Test
  void scoredReportIsExcludedFromItsOwnHistory() {
    Report scored = processed("R0", "alice", false, T0);
    List<Report> all = List.of(scored,
        processed("P1", "alice", true, T0),
        processed("P2", "alice", true, T0),
        processed("P3", "alice", true, T0),
        processed("P4", "alice", true, T0));

    assertEquals(OptionalInt.of(100), new ReporterAccuracy().score(scored, all));
  }

  @Test
  void rejectsInconsistentWindow() {
    assertThrows(IllegalArgumentException.class, () -> new ReporterAccuracy(0, 1, Set.of()));
    assertThrows(IllegalArgumentException.class, () -> new ReporterAccuracy(3, 4, Set.of()));
  }

  private static Report open(String id, String reporter) {
    return new Report(id, "U1", reporter, ReportReason.CHEAT, "", T0, null, false, null);
  }

  private static Report processed(String id, String reporter, boolean actioned, Instant createdAt) {
    return new Report(id, "U1", reporter, ReportReason.CHEAT, "", createdAt, "mod", actioned, null);
  }
}
