package ca.gc.cra.warden.application.port;

/**
 * <strong>What:</strong> Port for counting inquiry outcomes and recording latencies.
 * <p><strong>Why:</strong> Absent results (unauthorized, no claim, dangling subject) are normal returns; the
 * counters are what lets operators tell them apart from failures.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests and
 * disabled telemetry.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent calls.</p>
 *
 * @implNote Keys use dotted names such as {@code inquiry.assembled}; {@code null} keys are rejected.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Adds one to the named counter.
   *
   * @param key counter name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records a sample for the named histogram.
   *
   * @param key histogram name; must not be {@code null}
   * @param value observed value, unit implied by the key (e.g. {@code inquiry.latencyNanos})
   */
  void observe(String key, long value);

  /** Discards every update. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
