package ca.gc.cra.warden.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.domain.moderation.ActiveClaim;
import ca.gc.cra.warden.domain.moderation.Inquiry;
import ca.gc.cra.warden.domain.moderation.Moderator;
import ca.gc.cra.warden.domain.moderation.Report;
import ca.gc.cra.warden.domain.moderation.ReportReason;
import ca.gc.cra.warden.domain.moderation.User;
import ca.gc.cra.warden.domain.security.Permission;
import ca.gc.cra.warden.infrastructure.store.ModerationSnapshot;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  @Test
  void wiresAssemblerOverSnapshotAndClosesPool() throws Exception {
    Moderator mod = new Moderator("m", "M", null, true, Set.of(Permission.HUNTER));
    Report report = new Report("R1", "U1", "alice", ReportReason.CHEAT, "engine", T0, null, false,
        new ActiveClaim("m", T0));
    User user = new User("u1", "U1", null, true, false, false, false, T0);
    ModerationSnapshot snapshot = new ModerationSnapshot(
        List.of(mod), List.of(user), List.of(report), List.of(), List.of());
    InquiryConfig config = InquiryConfig.fromMap(Map.of("snapshot", "s.json", "mod", "m", "fanOutThreads", "2"));

    CompositionRoot root = new CompositionRoot(config, snapshot, MetricsPort.NO_OP);
    Inquiry inquiry;
    try {
      inquiry = root.inquiryAssembler().forModerator(mod).orElseThrow();
      assertSame(snapshot, root.snapshot());
      assertSame(MetricsPort.NO_OP, root.metrics());
      assertFalse(root.isFanOutPoolShutdown());
    } finally {
      root.close();
    }

    assertEquals("R1", inquiry.report().id());
    assertTrue(inquiry.accuracy().isEmpty());
    assertTrue(root.isFanOutPoolShutdown());
  }

  @Test
  void capabilityFromConfigGatesInquiry() throws Exception {
    Moderator hunter = new Moderator("m", "M", null, true, Set.of(Permission.HUNTER));
    InquiryConfig config = InquiryConfig.fromMap(Map.of("snapshot", "s.json", "mod", "m", "capability", "ADMIN"));

    try (CompositionRoot root = new CompositionRoot(config, ModerationSnapshot.empty())) {
      assertTrue(root.inquiryAssembler().forModerator(hunter).isEmpty());
    }
  }
}
