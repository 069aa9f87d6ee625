package ca.gc.cra.warden.config;

import ca.gc.cra.warden.application.inquiry.InquirySettings;
import ca.gc.cra.warden.domain.report.ReporterAccuracy;
import ca.gc.cra.warden.domain.security.Permission;
import ca.gc.cra.warden.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.warden.validation.Numbers;
import ca.gc.cra.warden.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Validated settings for the {@code inquiry} command.
 * <p><strong>Role:</strong> Built from the merged CLI/YAML/default map by {@link #fromMap(Map)} and handed to
 * {@link CompositionRoot}.</p>
 *
 * @param snapshot snapshot JSON file
 * @param moderator moderator id or username the inquiry is assembled for
 * @param capability capability required to open an inquiry
 * @param moreLikeLimit maximum related reports
 * @param fanOutThreads worker threads for the concurrent fetches
 * @param accuracyWindow recent processed reports considered for reporter accuracy
 * @param accuracyMinimumSample processed reports required before accuracy is shown
 * @param systemReporters automated reporter ids that are never scored
 * @param telemetry metrics exporter settings
 * @param logLevel optional root log level override
 * @param pretty whether the printed JSON is indented
 * @since 0.1.0
 */
public record InquiryConfig(
    Path snapshot,
    String moderator,
    Permission capability,
    int moreLikeLimit,
    int fanOutThreads,
    int accuracyWindow,
    int accuracyMinimumSample,
    Set<String> systemReporters,
    TelemetrySettings telemetry,
    Optional<String> logLevel,
    boolean pretty) {

  static final int MAX_FAN_OUT_THREADS = 64;
  static final int MAX_ACCURACY_WINDOW = 1_000;
  private static final int MAX_IDENTIFIER_LENGTH = 64;
  private static final int MAX_ENDPOINT_LENGTH = 512;

  /** Keys the {@code inquiry} command accepts from YAML or the command line. */
  public static final Set<String> KEYS = Set.of(
      "snapshot",
      "mod",
      "capability",
      "moreLikeLimit",
      "fanOutThreads",
      "accuracy.window",
      "accuracy.minimumSample",
      "accuracy.systemReporters",
      "metricsExporter",
      "otelEndpoint",
      "otelResourceAttributes",
      "logLevel",
      "pretty",
      "verbose");

  public InquiryConfig {
    systemReporters = Set.copyOf(systemReporters);
    logLevel = logLevel == null ? Optional.empty() : logLevel;
  }

  /**
   * Returns the embedded defaults as a flat map, the lowest layer for {@link ConfigMerger}.
   *
   * @return unmodifiable default key/value pairs
   */
  public static Map<String, String> defaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("capability", InquirySettings.DEFAULT_CAPABILITY.name());
    map.put("moreLikeLimit", Integer.toString(InquirySettings.DEFAULT_MORE_LIKE_LIMIT));
    map.put("fanOutThreads", "5");
    map.put("accuracy.window", Integer.toString(ReporterAccuracy.DEFAULT_WINDOW));
    map.put("accuracy.minimumSample", Integer.toString(ReporterAccuracy.DEFAULT_MINIMUM_SAMPLE));
    map.put("accuracy.systemReporters", "lichess");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("pretty", "true");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  /**
   * Parses and validates the merged configuration map.
   *
   * @param values merged key/value pairs
   * @return validated configuration
   * @throws IllegalArgumentException naming the offending key when a value is missing or invalid
   */
  public static InquiryConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = new LinkedHashMap<>(defaults());
    if (values != null) {
      kv.putAll(values);
    }

    Path snapshot = parsePath("snapshot", required(kv, "snapshot"));
    String moderator = Strings.requireIdentifier("mod", required(kv, "mod"));
    if (moderator.length() > MAX_IDENTIFIER_LENGTH) {
      throw new IllegalArgumentException("mod must be at most " + MAX_IDENTIFIER_LENGTH + " characters");
    }
    Permission capability = Permission.parse(Strings.requireNonBlank("capability", kv.get("capability")));
    int moreLikeLimit = Numbers.parseIntInRange(
        "moreLikeLimit", kv.get("moreLikeLimit"), 1, InquirySettings.MAX_MORE_LIKE_LIMIT);
    int fanOutThreads = Numbers.parseIntInRange("fanOutThreads", kv.get("fanOutThreads"), 1, MAX_FAN_OUT_THREADS);
    int window = Numbers.parseIntInRange("accuracy.window", kv.get("accuracy.window"), 1, MAX_ACCURACY_WINDOW);
    int minimumSample = Numbers.parseIntInRange(
        "accuracy.minimumSample", kv.get("accuracy.minimumSample"), 1, window);
    Set<String> systemReporters = parseList(kv.get("accuracy.systemReporters"));

    String endpoint = kv.get("otelEndpoint");
    if (endpoint != null && !endpoint.isBlank()) {
      endpoint = Strings.requirePrintableAscii("otelEndpoint", endpoint, MAX_ENDPOINT_LENGTH);
    }
    TelemetrySettings telemetry = new TelemetrySettings(
        TelemetrySettings.Exporter.parse(kv.get("metricsExporter")),
        endpoint,
        kv.get("otelResourceAttributes"));

    String rawLevel = kv.get("logLevel");
    Optional<String> logLevel = rawLevel == null || rawLevel.isBlank()
        ? Optional.empty()
        : Optional.of(rawLevel.trim());

    return new InquiryConfig(
        snapshot,
        moderator,
        capability,
        moreLikeLimit,
        fanOutThreads,
        window,
        minimumSample,
        systemReporters,
        telemetry,
        logLevel,
        parseBoolean("pretty", kv.get("pretty")));
  }

  /**
   * Gate and related-report settings for the assembler.
   *
   * @return assembler settings
   */
  public InquirySettings inquirySettings() {
    return new InquirySettings(capability, moreLikeLimit);
  }

  /**
   * Reporter accuracy scoring derived from the {@code accuracy.*} keys.
   *
   * @return configured scorer
   */
  public ReporterAccuracy reporterAccuracy() {
    return new ReporterAccuracy(accuracyWindow, accuracyMinimumSample, systemReporters);
  }

  private static String required(Map<String, String> kv, String key) {
    String value = kv.get(key);
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(key + " is required");
    }
    return value;
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static Set<String> parseList(String value) {
    if (value == null || value.isBlank()) {
      return Set.of();
    }
    Set<String> items = new LinkedHashSet<>();
    Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(item -> !item.isEmpty())
        .forEach(items::add);
    return items;
  }

  private static boolean parseBoolean(String name, String value) {
    String normalized = Strings.requireNonBlank(name, value).trim();
    if (normalized.equalsIgnoreCase("true")) {
      return true;
    }
    if (normalized.equalsIgnoreCase("false")) {
      return false;
    }
    throw new IllegalArgumentException(name + " must be true or false (was '" + normalized + "')");
  }
}
