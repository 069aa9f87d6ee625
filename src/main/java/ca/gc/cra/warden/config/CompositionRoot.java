package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.inquiry.InquiryAssembler;
import ca.gc.cra.warden.application.port.MetricsPort;
import ca.gc.cra.warden.application.security.Granter;
import ca.gc.cra.warden.domain.report.ReportSimilarity;
import ca.gc.cra.warden.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.warden.infrastructure.metrics.OpenTelemetryBootstrap;
import ca.gc.cra.warden.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.warden.infrastructure.store.ModerationSnapshot;
import ca.gc.cra.warden.infrastructure.store.SnapshotModerationLog;
import ca.gc.cra.warden.infrastructure.store.SnapshotNoteSource;
import ca.gc.cra.warden.infrastructure.store.SnapshotReportSource;
import ca.gc.cra.warden.infrastructure.store.SnapshotUserDirectory;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the inquiry use case to the snapshot adapters, the fan-out pool and metrics.
 * <p><strong>Role:</strong> Adapter composition root for the {@code inquiry} command.</p>
 * <p><strong>Lifecycle:</strong> Owns the fan-out pool and, when it created it, the metrics adapter; both are
 * released by {@link #close()}.</p>
 * <p><strong>Thread-safety:</strong> Construct and close on a single thread; the assembler it exposes is safe
 * for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  static final long SHUTDOWN_GRACE_MILLIS = 2_000L;

  private final ModerationSnapshot snapshot;
  private final MetricsPort metrics;
  private final AutoCloseable ownedMetrics;
  private final ExecutorService fanOutPool;
  private final InquiryAssembler assembler;

  /**
   * Creates a root that exports metrics according to {@code config.telemetry()}.
   *
   * @param config validated command configuration
   * @param snapshot loaded moderation data
   */
  public CompositionRoot(InquiryConfig config, ModerationSnapshot snapshot) {
    this(config, snapshot, new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.initialize(config.telemetry())),
        true);
  }

  /**
   * Creates a root with a caller-supplied metrics sink that the root does not close.
   *
   * @param config validated command configuration
   * @param snapshot loaded moderation data
   * @param metrics metrics sink
   */
  public CompositionRoot(InquiryConfig config, ModerationSnapshot snapshot, MetricsPort metrics) {
    this(config, snapshot, metrics, false);
  }

  private CompositionRoot(
      InquiryConfig config, ModerationSnapshot snapshot, MetricsPort metrics, boolean ownsMetrics) {
    Objects.requireNonNull(config, "config");
    this.snapshot = Objects.requireNonNull(snapshot, "snapshot");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.ownedMetrics = ownsMetrics && metrics instanceof AutoCloseable closeable ? closeable : null;
    this.fanOutPool = ExecutorFactories.newFanOutPool(
        config.fanOutThreads(),
        "warden-fanout",
        (thread, ex) -> log.error("Uncaught exception on {}", thread.getName(), ex));
    this.assembler = new InquiryAssembler(
        new Granter(),
        new SnapshotReportSource(snapshot, new ReportSimilarity(), config.reporterAccuracy()),
        new SnapshotUserDirectory(snapshot),
        new SnapshotNoteSource(snapshot),
        new SnapshotModerationLog(snapshot),
        fanOutPool,
        metrics,
        config.inquirySettings());
    log.debug("Inquiry wiring ready: capability={}, moreLikeLimit={}, fanOutThreads={}",
        config.capability(), config.moreLikeLimit(), config.fanOutThreads());
  }

  /**
   * Returns the assembler bound to this root's adapters.
   *
   * @return inquiry assembler
   */
  public InquiryAssembler inquiryAssembler() {
    return assembler;
  }

  /**
   * Returns the snapshot the adapters read from.
   *
   * @return moderation snapshot
   */
  public ModerationSnapshot snapshot() {
    return snapshot;
  }

  /**
   * Returns the metrics sink shared by the wired components.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Stops the fan-out pool and closes the metrics adapter when owned.
   * <p>If interrupted while waiting for the pool, the interrupt flag is restored and the pool is
   * force-stopped.</p>
   */
  @Override
  public void close() {
    try {
      if (!ExecutorFactories.shutdownGracefully(fanOutPool, SHUTDOWN_GRACE_MILLIS)) {
        log.warn("Fan-out pool did not stop within {} ms; remaining fetches interrupted", SHUTDOWN_GRACE_MILLIS);
      }
    } catch (InterruptedException ex) {
      fanOutPool.shutdownNow();
      Thread.currentThread().interrupt();
    } finally {
      closeMetrics();
    }
  }

  private void closeMetrics() {
    if (ownedMetrics == null) {
      return;
    }
    try {
      ownedMetrics.close();
    } catch (Exception ex) {
      log.warn("Failed to close metrics adapter", ex);
    }
  }

  boolean isFanOutPoolShutdown() {
    return fanOutPool.isShutdown();
  }
}
