package ca.gc.cra.warden.application.inquiry;

import ca.gc.cra.warden.application.port.CapabilityCheck;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.port.ModerationLogSource;
import ca.gc.cra.warden.application.port.NoteSource;
import ca.gc.cra.warden.application.port.ReportSource;
import ca.gc.cra.warden.application.port.UserDirectory;
import ca.gc.cra.warden.domain.moderation.Inquiry;
import ca.gc.cra.warden.domain.moderation.Moderator;
import ca.gc.cra.warden.domain.moderation.ModlogEntry;
import ca.gc.cra.warden.domain.moderation.Note;
import ca.gc.cra.warden.domain.moderation.Report;
import ca.gc.cra.warden.domain.moderation.User;
import ca.gc.cra.warden.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Builds the {@link Inquiry} for the report a moderator currently has open.
 * <p><strong>Why:</strong> The moderation dashboard needs the report, related reports, the subject's record,
 * notes and history at once; fetching them one after another would add the latencies of every store.</p>
 * <p><strong>Role:</strong> Application use case over the collaborator ports.</p>
 * <p><strong>Algorithm:</strong>
 * <ol>
 *   <li>Capability gate: without the configured capability the result is empty and no store is touched.</li>
 *   <li>Active claim: the report source is asked once for the moderator's open report; none means empty.</li>
 *   <li>Fan-out: related reports, accuracy, notes, history and the subject user are fetched concurrently.</li>
 *   <li>Combine: an unresolved subject user yields empty; otherwise the inquiry is built.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Stateless between calls; concurrent {@link #forModerator(Moderator)}
 * invocations share only the executor.</p>
 * <p><strong>Observability:</strong> Counters {@code inquiry.requested}, {@code inquiry.unauthorized},
 * {@code inquiry.noActiveClaim}, {@code inquiry.danglingSubject}, {@code inquiry.assembled},
 * {@code inquiry.failed}; histogram {@code inquiry.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class InquiryAssembler {
  private static final Logger log = LoggerFactory.getLogger(InquiryAssembler.class);
  static final String MDC_MODERATOR = "moderator";
  private static final int LOGGED_TEXT_BYTES = 120;

  private final CapabilityCheck capabilityCheck;
  private final ReportSource reports;
  private final UserDirectory users;
  private final NoteSource notes;
  private final ModerationLogSource moderationLog;
  private final ExecutorService fanOutExecutor;
  private final MetricsPort metrics;
  private final InquirySettings settings;

  /**
   * Creates an assembler.
   *
   * @param capabilityCheck permission predicate
   * @param reports report source
   * @param users user directory
   * @param notes note source
   * @param moderationLog moderation-log source
   * @param fanOutExecutor executor running the concurrent fetches; owned by the caller
   * @param metrics metrics sink; use {@link MetricsPort#NO_OP} to disable
   * @param settings gate capability and related-report limit
   */
  public InquiryAssembler(
      CapabilityCheck capabilityCheck,
      ReportSource reports,
      UserDirectory users,
      NoteSource notes,
      ModerationLogSource moderationLog,
      ExecutorService fanOutExecutor,
      MetricsPort metrics,
      InquirySettings settings) {
    this.capabilityCheck = Objects.requireNonNull(capabilityCheck, "capabilityCheck");
    this.reports = Objects.requireNonNull(reports, "reports");
    this.users = Objects.requireNonNull(users, "users");
    this.notes = Objects.requireNonNull(notes, "notes");
    this.moderationLog = Objects.requireNonNull(moderationLog, "moderationLog");
    this.fanOutExecutor = Objects.requireNonNull(fanOutExecutor, "fanOutExecutor");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Assembles the inquiry for the report {@code mod} is working.
   *
   * @param mod acting moderator; must not be {@code null}
   * @return the inquiry, or empty when the moderator lacks the capability, has no open report, or the
   *     report's subject no longer resolves
   * @throws InquiryAssemblyException when a collaborator fails
   * @throws InterruptedException when the calling thread is interrupted while waiting on the fan-out;
   *     in-flight fetches are cancelled first and the interrupt flag is left cleared
   */
  public Optional<Inquiry> forModerator(Moderator mod) throws InterruptedException {
    Objects.requireNonNull(mod, "mod");
    metrics.increment("inquiry.requested");
    long started = System.nanoTime();
    String previousModerator = MDC.get(MDC_MODERATOR);
    MDC.put(MDC_MODERATOR, mod.id());
    try {
      Optional<Report> active = activeReport(mod);
      if (active.isEmpty()) {
        return Optional.empty();
      }
      return fanOut(mod, active.get());
    } catch (InquiryAssemblyException ex) {
      metrics.increment("inquiry.failed");
      log.warn("Inquiry for {} failed during {} fetch", mod.id(), ex.fetch().key(), ex);
      throw ex;
    } finally {
      metrics.observe("inquiry.latencyNanos", System.nanoTime() - started);
      if (previousModerator == null) {
        MDC.remove(MDC_MODERATOR);
      } else {
        MDC.put(MDC_MODERATOR, previousModerator);
      }
    }
  }

  private Optional<Report> activeReport(Moderator mod) {
    boolean granted = call(Fetch.CAPABILITY,
        () -> capabilityCheck.hasCapability(mod, settings.requiredCapability()));
    if (!granted) {
      metrics.increment("inquiry.unauthorized");
      log.debug("Moderator {} lacks {}; no inquiry", mod.id(), settings.requiredCapability());
      return Optional.empty();
    }
    Optional<Report> active = call(Fetch.ACTIVE_REPORT, () -> reports.activeInquiryFor(mod.id()));
    if (active.isEmpty()) {
      metrics.increment("inquiry.noActiveClaim");
      log.debug("Moderator {} has no open report", mod.id());
      return Optional.empty();
    }
    Report report = active.get();
    log.debug("Moderator {} working report {} on {} ({}): {}",
        mod.id(), report.id(), report.subject(), report.reason().key(),
        Logs.truncate(report.text(), LOGGED_TEXT_BYTES));
    return active;
  }

  private Optional<Inquiry> fanOut(Moderator mod, Report report) throws InterruptedException {
    String subjectId = report.subjectId();
    List<Future<?>> pending = new ArrayList<>(5);
    try {
      Future<List<Report>> moreLike =
          submit(pending, Fetch.MORE_LIKE, () -> reports.moreLike(report, settings.moreLikeLimit()));
      Future<OptionalInt> accuracy = submit(pending, Fetch.ACCURACY, () -> reports.accuracyScore(report));
      Future<List<Note>> subjectNotes = submit(pending, Fetch.NOTES, () -> notes.notesFor(subjectId));
      Future<List<ModlogEntry>> history =
          submit(pending, Fetch.HISTORY, () -> moderationLog.historyFor(subjectId));
      Future<Optional<User>> user = submit(pending, Fetch.USER, () -> users.byUsername(report.subject()));

      List<Report> moreReports = copyOf(Fetch.MORE_LIKE, await(Fetch.MORE_LIKE, moreLike));
      OptionalInt score = requireScoreInRange(await(Fetch.ACCURACY, accuracy));
      List<Note> noteList = copyOf(Fetch.NOTES, await(Fetch.NOTES, subjectNotes));
      List<ModlogEntry> historyList = copyOf(Fetch.HISTORY, await(Fetch.HISTORY, history));
      Optional<User> subject = await(Fetch.USER, user);

      if (subject.isEmpty()) {
        metrics.increment("inquiry.danglingSubject");
        log.info("Report {} subject {} does not resolve; no inquiry", report.id(), report.subject());
        return Optional.empty();
      }
      Inquiry inquiry = new Inquiry(
          mod.light(), report, score, moreReports, noteList, historyList, subject.get());
      metrics.increment("inquiry.assembled");
      log.debug("Inquiry for report {} assembled with {} related reports, {} notes, {} history entries",
          report.id(), moreReports.size(), noteList.size(), historyList.size());
      return Optional.of(inquiry);
    } catch (InterruptedException ex) {
      cancelAll(pending);
      log.warn("Inquiry for report {} interrupted; cancelled {} fetches", report.id(), pending.size());
      throw ex;
    } catch (RuntimeException ex) {
      cancelAll(pending);
      throw ex;
    }
  }

  private <T> Future<T> submit(List<Future<?>> pending, Fetch fetch, Supplier<T> supplier) {
    Callable<T> task = () -> Objects.requireNonNull(supplier.get(), () -> fetch.key() + " returned null");
    Future<T> future;
    try {
      future = fanOutExecutor.submit(task);
    } catch (RejectedExecutionException ex) {
      throw new InquiryAssemblyException(fetch, ex);
    }
    pending.add(future);
    return future;
  }

  private static <T> T await(Fetch fetch, Future<T> future) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      throw new InquiryAssemblyException(fetch, ex.getCause());
    } catch (CancellationException ex) {
      throw new InquiryAssemblyException(fetch, ex);
    }
  }

  private static <T> List<T> copyOf(Fetch fetch, List<T> values) {
    try {
      return List.copyOf(values);
    } catch (NullPointerException ex) {
      throw new InquiryAssemblyException(fetch, ex);
    }
  }

  private static OptionalInt requireScoreInRange(OptionalInt score) {
    if (score.isPresent() && (score.getAsInt() < 0 || score.getAsInt() > 100)) {
      throw new InquiryAssemblyException(Fetch.ACCURACY,
          new IllegalArgumentException("accuracy out of range: " + score.getAsInt()));
    }
    return score;
  }

  private static <T> T call(Fetch fetch, Supplier<T> supplier) {
    T result;
    try {
      result = supplier.get();
    } catch (RuntimeException ex) {
      throw new InquiryAssemblyException(fetch, ex);
    }
    if (result == null) {
      throw new InquiryAssemblyException(fetch, new NullPointerException(fetch.key() + " returned null"));
    }
    return result;
  }

  private static void cancelAll(List<Future<?>> pending) {
    for (Future<?> future : pending) {
      future.cancel(true);
    }
  }
}
