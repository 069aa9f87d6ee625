package ca.gc.cra.warden.api;

import ca.gc.cra.warden.application.inquiry.InquiryAssemblyException;
import ca.gc.cra.warden.config.CompositionRoot;
import ca.gc.cra.warden.config.ConfigMerger;
import ca.gc.cra.warden.config.InquiryConfig;
import ca.gc.cra.warden.config.YamlConfigLoader;
import ca.gc.cra.warden.domain.moderation.Inquiry;
import ca.gc.cra.warden.domain.moderation.Moderator;
import ca.gc.cra.warden.infrastructure.json.InquiryJsonWriter;
import ca.gc.cra.warden.infrastructure.store.ModerationSnapshot;
import ca.gc.cra.warden.infrastructure.store.SnapshotLoader;
import ca.gc.cra.warden.logging.LoggingConfigurator;
import ca.gc.cra.warden.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints the inquiry a moderator is currently working on, read from a moderation snapshot.
 *
 * @since 0.1.0
 */
public final class InquiryCli {
  private static final Logger log = LoggerFactory.getLogger(InquiryCli.class);
  static final String COMMAND = "inquiry";
  private static final String SUMMARY_USAGE =
      "usage: inquiry snapshot=PATH mod=ID [config=PATH] [capability=NAME] [moreLikeLimit=N] "
          + "[fanOutThreads=N] [metricsExporter=otlp|none] [otelEndpoint=URL] [--compact] [--verbose]";
  private static final String HELP_TEXT = """
      WARDEN inquiry

      Usage:
        inquiry snapshot=PATH mod=ID [options]

      Required:
        snapshot=PATH                 Moderation snapshot (JSON)
        mod=ID                        Moderator id or username

      Options:
        config=PATH                   YAML file with 'common' and 'inquiry' sections
        capability=NAME               Capability required to open an inquiry (default HUNTER)
        moreLikeLimit=N               Related reports to include, 1-100 (default 10)
        fanOutThreads=N               Worker threads for concurrent lookups, 1-64 (default 5)
        accuracy.window=N             Recent processed reports used for reporter accuracy (default 20)
        accuracy.minimumSample=N      Processed reports needed before accuracy is shown (default 4)
        accuracy.systemReporters=IDS  Comma-separated automated reporters (default lichess)
        metricsExporter=otlp|none     Metrics export (default none)
        otelEndpoint=URL              OTLP gRPC endpoint (default http://localhost:4317)
        otelResourceAttributes=K=V,.. Extra OpenTelemetry resource attributes
        logLevel=LEVEL                Root log level (TRACE, DEBUG, INFO, WARN, ERROR, OFF)
        --compact                     Print JSON on a single line
        --verbose                     Enable DEBUG logging
        --help                        Show this message

      Output:
        The inquiry as JSON on stdout, or a single 'no inquiry' line when the moderator
        lacks the capability, has no open report, or the reported user is unknown.
      """;

  private InquiryCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Runs the command and returns its exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for inquiry CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--compact")) {
      kv.put("pretty", "false");
    }

    Optional<Map<String, String>> yaml;
    String configPath = kv.remove("config");
    try {
      yaml = loadYaml(configPath);
    } catch (IOException ex) {
      log.error("Unable to read config file {}", configPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid config file: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    InquiryConfig config;
    try {
      Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
          yaml, kv, InquiryConfig.defaults(), InquiryConfig.KEYS, log::warn);
      config = InquiryConfig.fromMap(merged);
      applyLogging(config, input.verbose() || Boolean.parseBoolean(merged.get("verbose")));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid inquiry configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    ModerationSnapshot snapshot;
    try {
      Path file = Paths.requireReadableFile("snapshot", config.snapshot());
      snapshot = new SnapshotLoader().load(file);
    } catch (IOException ex) {
      log.error("Unable to read snapshot {}", config.snapshot(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      if (!Files.isReadable(config.snapshot())) {
        log.error("Snapshot is not readable: {}", ex.getMessage());
        return ExitCode.IO_ERROR;
      }
      log.error("Invalid snapshot {}: {}", config.snapshot(), ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    Optional<Moderator> moderator = snapshot.moderator(config.moderator());
    if (moderator.isEmpty()) {
      log.error("Unknown moderator: {}", config.moderator());
      return ExitCode.CONFIG_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(config, snapshot)) {
      Optional<Inquiry> inquiry = root.inquiryAssembler().forModerator(moderator.get());
      if (inquiry.isPresent()) {
        CliPrinter.println(new InquiryJsonWriter(config.pretty()).toJson(inquiry.get()));
      } else {
        CliPrinter.println("no inquiry for " + moderator.get().id());
      }
      return ExitCode.SUCCESS;
    } catch (InquiryAssemblyException ex) {
      log.error("Inquiry failed during {} lookup", ex.fetch().key(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Inquiry interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in inquiry", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static Optional<Map<String, String>> loadYaml(String configPath) throws IOException {
    if (configPath == null || configPath.isBlank()) {
      return Optional.empty();
    }
    Path path;
    try {
      path = Path.of(configPath.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("config is not a valid path: " + configPath, ex);
    }
    Optional<Map<String, String>> loaded = YamlConfigLoader.load(path, COMMAND);
    if (loaded.isEmpty()) {
      throw new IllegalArgumentException("config file not found: " + path);
    }
    log.debug("Loaded {} settings from {}", loaded.get().size(), path);
    return loaded;
  }

  private static void applyLogging(InquiryConfig config, boolean verbose) {
    if (verbose) {
      LoggingConfigurator.enableVerboseLogging();
      return;
    }
    config.logLevel().ifPresent(LoggingConfigurator::applyRootLevel);
  }
}
