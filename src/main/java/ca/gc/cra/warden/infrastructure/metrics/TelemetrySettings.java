package ca.gc.cra.warden.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Exporter choice and resource attributes for the OpenTelemetry bootstrap.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint (used when {@code exporter} is {@link Exporter#OTLP})
 * @param resourceAttributes extra {@code key=value,key=value} resource attributes; may be blank
 * @since 0.1.0
 */
public record TelemetrySettings(Exporter exporter, String endpoint, String resourceAttributes) {
  /** Default OTLP gRPC collector endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Settings that disable export entirely.
   *
   * @return exporter {@code none}
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(Exporter.NONE, DEFAULT_ENDPOINT, "");
  }

  /** Supported metric exporters. */
  public enum Exporter {
    OTLP,
    NONE;

    /**
     * Parses {@code otlp} or {@code none}, case-insensitively.
     *
     * @param raw exporter name
     * @return exporter
     * @throws IllegalArgumentException for other values
     */
    public static Exporter parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      };
    }
  }
}
