package ca.gc.cra.warden.application.inquiry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.port.CapabilityCheck;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.ModerationLogSource;
import ca.gc.cra.warden.application.port.NoteSource;
import ca.gc.cra.warden.application.port.ReportSource;
import ca.gc.cra.warden.application.port.UserDirectory;
import ca.gc.cra.warden.application.security.Granter;
import ca.gc.cra.warden.domain.moderation.ActiveClaim;
import ca.gc.cra.warden.domain.moderation.Inquiry;
import ca.gc.cra.warden.domain.moderation.Moderator;
import ca.gc.cra.warden.domain.moderation.ModlogEntry;
import ca.gc.cra.warden.domain.moderation.Note;
import ca.gc.cra.warden.domain.moderation.Report;
import ca.gc.cra.warden.domain.moderation.ReportReason;
import ca.gc.cra.warden.domain.moderation.User;
import ca.gc.cra.warden.domain.security.Permission;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class InquiryAssemblerTest {
  private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

  private final Moderator mod = new Moderator("m", "M", "NM", true, Set.of(Permission.HUNTER));
  private final Report r1 = report("R1", "U1", "Reporter1", "engine use in blitz", new ActiveClaim("m", T0));
  private final Report r2 = report("R2", "U1", "Reporter2", "engine again", null);
  private final Report r3 = report("R3", "U1", "Reporter3", "suspicious blitz", null);
  private final User u1 = new User("u1", "U1", null, true, false, false, false, T0.minusSeconds(86_400));
  private final Note n1 = new Note("other", "u1", "watch this account", true, T0.minusSeconds(60));

  private ExecutorService pool;
  private RecordingMetrics metrics;
  private FakeReports reports;
  private FakeUsers users;
  private FakeNotes notes;
  private FakeHistory history;

  @BeforeEach
  void setUp() {
    pool = ExecutorFactories.newFanOutPool(5, "test-fanout", null);
    metrics = new RecordingMetrics();
    reports = new FakeReports();
    users = new FakeUsers();
    notes = new FakeNotes();
    history = new FakeHistory();
    reports.active = Optional.of(r1);
    reports.similar = () -> List.of(r2, r3);
    reports.accuracy = () -> OptionalInt.of(87);
    users.user = () -> Optional.of(u1);
    notes.notes = () -> List.of(n1);
    history.entries = List::of;
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    ExecutorFactories.shutdownGracefully(pool, 1_000);
    MDC.clear();
  }

  @Test
  void assemblesInquiryForClaimedReport() throws Exception {
    Optional<Inquiry> result = assembler(new Granter()).forModerator(mod);

    assertTrue(result.isPresent());
    Inquiry inquiry = result.orElseThrow();
    assertEquals(mod.light(), inquiry.mod());
    assertSame(r1, inquiry.report());
    assertEquals(OptionalInt.of(87), inquiry.accuracy());
    assertEquals(List.of(r2, r3), inquiry.moreReports());
    assertEquals(List.of(n1), inquiry.notes());
    assertEquals(List.of(), inquiry.history());
    assertSame(u1, inquiry.user());
    assertEquals(List.of(r1, r2, r3), inquiry.allReports());

    assertEquals(1L, metrics.counter("inquiry.requested"));
    assertEquals(1L, metrics.counter("inquiry.assembled"));
    assertEquals(1, metrics.observations("inquiry.latencyNanos"));
  }

  @Test
  void fanOutFetchesUseSubjectOfActiveReport() throws Exception {
    assembler(new Granter()).forModerator(mod);

    assertEquals(List.of("m"), reports.activeLookups);
    assertSame(r1, reports.moreLikeReport.get());
    assertEquals(InquirySettings.DEFAULT_MORE_LIKE_LIMIT, reports.moreLikeLimit.get());
    assertSame(r1, reports.accuracyReport.get());
    assertEquals("U1", users.lookedUp.get());
    assertEquals("u1", notes.lookedUp.get());
    assertEquals("u1", history.lookedUp.get());
  }

  @Test
  void configuredLimitIsPassedToMoreLike() throws Exception {
    InquiryAssembler assembler = new InquiryAssembler(new Granter(), reports, users, notes, history, pool,
        metrics, new InquirySettings(Permission.HUNTER, 3));

    assembler.forModerator(mod);

    assertEquals(3, reports.moreLikeLimit.get());
  }

  @Test
  void missingCapabilityReturnsEmptyWithoutTouchingSources() throws Exception {
    Moderator shusher = new Moderator("s", "S", null, true, Set.of(Permission.SHUSHER));

    Optional<Inquiry> result = assembler(new Granter()).forModerator(shusher);

    assertTrue(result.isEmpty());
    assertEquals(0, reports.calls.get());
    assertEquals(0, users.calls.get());
    assertEquals(0, notes.calls.get());
    assertEquals(0, history.calls.get());
    assertEquals(1L, metrics.counter("inquiry.unauthorized"));
    assertEquals(0L, metrics.counter("inquiry.assembled"));
  }

  @Test
  void noActiveClaimMakesExactlyOneReportLookup() throws Exception {
    reports.active = Optional.empty();

    Optional<Inquiry> result = assembler(new Granter()).forModerator(mod);

    assertTrue(result.isEmpty());
    assertEquals(1, reports.calls.get());
    assertEquals(0, users.calls.get());
    assertEquals(0, notes.calls.get());
    assertEquals(0, history.calls.get());
    assertEquals(1L, metrics.counter("inquiry.noActiveClaim"));
  }

  @Test
  void missingAccuracyStillProducesInquiry() throws Exception {
    reports.accuracy = OptionalInt::empty;

    Inquiry inquiry = assembler(new Granter()).forModerator(mod).orElseThrow();

    assertTrue(inquiry.accuracy().isEmpty());
    assertEquals(List.of(r2, r3), inquiry.moreReports());
  }

  @Test
  void unresolvedSubjectReturnsEmpty() throws Exception {
    users.user = Optional::empty;

    Optional<Inquiry> result = assembler(new Granter()).forModerator(mod);

    assertTrue(result.isEmpty());
    assertEquals(1L, metrics.counter("inquiry.danglingSubject"));
    assertEquals(0L, metrics.counter("inquiry.assembled"));
  }

  @Test
  void collaboratorFailureFailsWholeCall() {
    IllegalStateException boom = new IllegalStateException("notes store down");
    notes.notes = () -> {
      throw boom;
    };

    InquiryAssemblyException ex = assertThrows(InquiryAssemblyException.class,
        () -> assembler(new Granter()).forModerator(mod));

    assertEquals(Fetch.NOTES, ex.fetch());
    assertSame(boom, ex.getCause());
    assertEquals(1L, metrics.counter("inquiry.failed"));
    assertEquals(0L, metrics.counter("inquiry.assembled"));
  }

  @Test
  void failingActiveLookupIsWrapped() {
    reports.activeFailure = new IllegalStateException("report store down");

    InquiryAssemblyException ex = assertThrows(InquiryAssemblyException.class,
        () -> assembler(new Granter()).forModerator(mod));

    assertEquals(Fetch.ACTIVE_REPORT, ex.fetch());
    assertSame(reports.activeFailure, ex.getCause());
    assertEquals(0, users.calls.get());
  }

  @Test
  void failingCapabilityCheckIsWrapped() {
    CapabilityCheck broken = (m, p) -> {
      throw new IllegalStateException("directory unavailable");
    };

    InquiryAssemblyException ex = assertThrows(InquiryAssemblyException.class,
        () -> assembler(broken).forModerator(mod));

    assertEquals(Fetch.CAPABILITY, ex.fetch());
    assertEquals(0, reports.calls.get());
  }

  @Test
  void nullFromCollaboratorIsTreatedAsFailure() {
    history.entries = () -> null;

    InquiryAssemblyException ex = assertThrows(InquiryAssemblyException.class,
        () -> assembler(new Granter()).forModerator(mod));

    assertEquals(Fetch.HISTORY, ex.fetch());
    assertInstanceOf(NullPointerException.class, ex.getCause());
  }

  @Test
  void outOfRangeAccuracyIsTreatedAsFailure() {
    reports.accuracy = () -> OptionalInt.of(150);

    InquiryAssemblyException ex = assertThrows(InquiryAssemblyException.class,
        () -> assembler(new Granter()).forModerator(mod));

    assertEquals(Fetch.ACCURACY, ex.fetch());
    assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    assertEquals(1L, metrics.counter("inquiry.failed"));
  }

  @Test
  void nullElementInRelatedReportsIsTreatedAsFailure() {
    reports.similar = () -> Arrays.asList(r2, null);

    InquiryAssemblyException ex = assertThrows(InquiryAssemblyException.class,
        () -> assembler(new Granter()).forModerator(mod));

    assertEquals(Fetch.MORE_LIKE, ex.fetch());
    assertInstanceOf(NullPointerException.class, ex.getCause());
    assertEquals(1L, metrics.counter("inquiry.failed"));
  }

  @Test
  void shutDownExecutorFailsInsteadOfBlocking() throws Exception {
    InquiryAssembler assembler = assembler(new Granter());
    ExecutorFactories.shutdownGracefully(pool, 1_000);

    InquiryAssemblyException ex = assertTimeoutPreemptively(Duration.ofSeconds(5),
        () -> assertThrows(InquiryAssemblyException.class, () -> assembler.forModerator(mod)));

    assertEquals(Fetch.MORE_LIKE, ex.fetch());
    assertInstanceOf(RejectedExecutionException.class, ex.getCause());
    assertEquals(1L, metrics.counter("inquiry.failed"));
  }

  @Test
  void fanOutFetchesRunConcurrently() throws Exception {
    CyclicBarrier barrier = new CyclicBarrier(5);
    reports.similar = () -> {
      awaitBarrier(barrier);
      return List.of(r2, r3);
    };
    reports.accuracy = () -> {
      awaitBarrier(barrier);
      return OptionalInt.of(87);
    };
    notes.notes = () -> {
      awaitBarrier(barrier);
      return List.of(n1);
    };
    history.entries = () -> {
      awaitBarrier(barrier);
      return List.of();
    };
    users.user = () -> {
      awaitBarrier(barrier);
      return Optional.of(u1);
    };

    Inquiry inquiry = assembler(new Granter()).forModerator(mod).orElseThrow();

    assertEquals(List.of(r2, r3), inquiry.moreReports());
  }

  @Test
  void interruptCancelsInFlightFetches() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch cancelled = new CountDownLatch(1);
    notes.notes = () -> {
      started.countDown();
      try {
        new CountDownLatch(1).await();
      } catch (InterruptedException ex) {
        cancelled.countDown();
        Thread.currentThread().interrupt();
      }
      return List.of();
    };
    InquiryAssembler assembler = assembler(new Granter());
    AtomicReference<Throwable> thrown = new AtomicReference<>();
    AtomicBoolean flagSetAfterThrow = new AtomicBoolean();

    Thread caller = new Thread(() -> {
      try {
        assembler.forModerator(mod);
      } catch (Throwable ex) {
        thrown.set(ex);
        flagSetAfterThrow.set(Thread.currentThread().isInterrupted());
      }
    }, "inquiry-caller");
    caller.start();
    assertTrue(started.await(5, TimeUnit.SECONDS));
    caller.interrupt();
    caller.join(5_000);

    assertFalse(caller.isAlive());
    assertInstanceOf(InterruptedException.class, thrown.get());
    assertFalse(flagSetAfterThrow.get(), "exception is the only interrupt signal");
    assertTrue(cancelled.await(5, TimeUnit.SECONDS), "blocked fetch should be interrupted");
    assertEquals(0L, metrics.counter("inquiry.assembled"));
  }

  @Test
  void moderatorMdcIsRestoredAfterCall() throws Exception {
    MDC.put(InquiryAssembler.MDC_MODERATOR, "outer");
    assembler(new Granter()).forModerator(mod);
    assertEquals("outer", MDC.get(InquiryAssembler.MDC_MODERATOR));

    MDC.remove(InquiryAssembler.MDC_MODERATOR);
    assembler(new Granter()).forModerator(mod);
    assertNull(MDC.get(InquiryAssembler.MDC_MODERATOR));
  }

  @Test
  void rejectsNullModerator() {
    assertThrows(NullPointerException.class, () -> assembler(new Granter()).forModerator(null));
  }

  private InquiryAssembler assembler(CapabilityCheck check) {
    return new InquiryAssembler(check, reports, users, notes, history, pool, metrics,
        InquirySettings.defaults());
  }

  private static void awaitBarrier(CyclicBarrier barrier) {
    try {
      barrier.await(5, TimeUnit.SECONDS);
    } catch (Exception ex) {
      throw new IllegalStateException("fetches did not run concurrently", ex);
    }
  }

  private static Report report(String id, String subject, String reporter, String text, ActiveClaim claim) {
    return new Report(id, subject, reporter, ReportReason.CHEAT, text, T0, null, false, claim);
  }

  private static final class FakeReports implements ReportSource {
    final AtomicInteger calls = new AtomicInteger();
    final List<String> activeLookups = Collections.synchronizedList(new ArrayList<>());
    final AtomicReference<Report> moreLikeReport = new AtomicReference<>();
    final AtomicReference<Report> accuracyReport = new AtomicReference<>();
    final AtomicInteger moreLikeLimit = new AtomicInteger(-1);
    volatile Optional<Report> active = Optional.empty();
    volatile RuntimeException activeFailure;
    volatile Supplier<List<Report>> similar = List::of;
    volatile Supplier<OptionalInt> accuracy = OptionalInt::empty;

    @Override
    public Optional<Report> activeInquiryFor(String moderatorId) {
      calls.incrementAndGet();
      activeLookups.add(moderatorId);
      if (activeFailure != null) {
        throw activeFailure;
      }
      return active;
    }

    @Override
    public List<Report> moreLike(Report report, int limit) {
      calls.incrementAndGet();
      moreLikeReport.set(report);
      moreLikeLimit.set(limit);
      return similar.get();
    }

    @Override
    public OptionalInt accuracyScore(Report report) {
      calls.incrementAndGet();
      accuracyReport.set(report);
      return accuracy.get();
    }
  }

  private static final class FakeUsers implements UserDirectory {
    final AtomicInteger calls = new AtomicInteger();
    final AtomicReference<String> lookedUp = new AtomicReference<>();
    volatile Supplier<Optional<User>> user = Optional::empty;

    @Override
    public Optional<User> byUsername(String username) {
      calls.incrementAndGet();
      lookedUp.set(username);
      return user.get();
    }
  }

  private static final class FakeNotes implements NoteSource {
    final AtomicInteger calls = new AtomicInteger();
    final AtomicReference<String> lookedUp = new AtomicReference<>();
    volatile Supplier<List<Note>> notes = List::of;

    @Override
    public List<Note> notesFor(String userId) {
      calls.incrementAndGet();
      lookedUp.set(userId);
      return notes.get();
    }
  }

  private static final class FakeHistory implements ModerationLogSource {
    final AtomicInteger calls = new AtomicInteger();
    final AtomicReference<String> lookedUp = new AtomicReference<>();
    volatile Supplier<List<ModlogEntry>> entries = List::of;

    @Override
    public List<ModlogEntry> historyFor(String userId) {
      calls.incrementAndGet();
      lookedUp.set(userId);
      return entries.get();
    }
  }

  private static final class RecordingMetrics implements MetricsPort {
    private final Map<String, Long> counters = new ConcurrentHashMap<>();
    private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.merge(key, 1L, Long::sum);
    }

    @Override
    public void observe(String key, long value) {
      observations.computeIfAbsent(key, k -> Collections.synchronizedList(new ArrayList<>())).add(value);
    }

    long counter(String key) {
      return counters.getOrDefault(key, 0L);
    }

    int observations(String key) {
      return observations.getOrDefault(key, List.of()).size();
    }
  }
}
