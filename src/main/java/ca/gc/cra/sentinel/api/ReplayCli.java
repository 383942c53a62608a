package ca.gc.cra.sentinel.api;

import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.registry.AlertRegistryStats;
import ca.gc.cra.sentinel.application.registry.ThreatRegistryStats;
import ca.gc.cra.sentinel.application.replay.MutationLogReplayer;
import ca.gc.cra.sentinel.application.replay.ReplayReport;
import ca.gc.cra.sentinel.config.CompositionRoot;
import ca.gc.cra.sentinel.config.ConfigMerger;
import ca.gc.cra.sentinel.config.RegistryConfig;
import ca.gc.cra.sentinel.config.RegistryEngine;
import ca.gc.cra.sentinel.config.YamlConfigLoader;
import ca.gc.cra.sentinel.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.sentinel.logging.LoggingConfigurator;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a newline-delimited JSON mutation log against a freshly wired registry engine and prints the
 * resulting statistics.
 *
 * @since 0.1.0
 */
public final class ReplayCli {
  private static final Logger log = LoggerFactory.getLogger(ReplayCli.class);
  private static final String SECTION = "replay";
  private static final String SUMMARY_USAGE =
      "usage: replay log=PATH [config=PATH] [strict=true] [owner=ID] [emergencyThreshold=1-5] "
          + "[recentWindowCapacity=N] [eventSink=LOG|KAFKA|NONE] [kafkaBootstrap=HOST:PORT] "
          + "[kafkaTopic=TOPIC] [metricsExporter=none|otlp] [otlpEndpoint=URL]";
  private static final String HELP_TEXT = """
      SENTINEL mutation-log replay

      Usage:
        replay log=PATH [options]

      Input:
        log=PATH                  Newline-delimited JSON commands; blank lines and # comments are skipped

      Options:
        config=PATH               YAML file; keys from 'common' and 'replay' sections
        strict=true|--strict      Stop at the first rejected command (exit 5)
        owner=ID                  Initial owner principal (default owner)
        emergencyThreshold=1-5    Severity at or above which alerts are emergencies (default 4)
        recentWindowCapacity=N    Alerts kept in the recent window (default 1000)
        eventSink=LOG|KAFKA|NONE  Event destination (default LOG); KAFKA requires kafkaBootstrap
        kafkaTopic=TOPIC          Topic for KAFKA sink (default sentinel.registry.events)
        metricsExporter=none|otlp Metrics exporter (default none)
        otlpEndpoint=URL          OTLP gRPC endpoint
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ReplayCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return run(args, new SystemClockAdapter(), null);
  }

  static ExitCode run(String[] args, ClockPort clock, MetricsPort metrics) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for replay CLI");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String logPath = kv.remove("log");
    String configPath = kv.remove("config");
    boolean strict = input.hasFlag("--strict") || Boolean.parseBoolean(kv.remove("strict"));
    if (logPath == null || logPath.isBlank()) {
      log.error("Missing required argument: log");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    RegistryConfig config;
    try {
      Optional<Map<String, String>> yaml = configPath == null
          ? Optional.empty()
          : YamlConfigLoader.load(Path.of(configPath), SECTION);
      if (configPath != null && yaml.isEmpty()) {
        log.error("Config file not found: {}", configPath);
        return ExitCode.CONFIG_ERROR;
      }
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          RegistryConfig.defaultsAsFlatMap(), yaml, kv, message -> log.warn(message));
      config = RegistryConfig.fromMap(effective);
      if (Boolean.parseBoolean(effective.getOrDefault("verbose", "false"))) {
        LoggingConfigurator.enableVerboseLogging();
      }
    } catch (IOException ex) {
      log.error("Unable to read config {}", configPath, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid replay configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    Path logFile = Path.of(logPath);
    if (!Files.isReadable(logFile)) {
      log.error("Mutation log is not readable: {}", logFile);
      return ExitCode.IO_ERROR;
    }

    try (RegistryEngine engine = new CompositionRoot(config, clock, metrics).build();
        BufferedReader reader = Files.newBufferedReader(logFile, StandardCharsets.UTF_8)) {
      MutationLogReplayer replayer = new MutationLogReplayer(engine.access(), engine.threats(), engine.alerts());
      ReplayReport report = replayer.replay(reader, strict);
      printReport(report, engine.threats().stats(), engine.alerts().stats());
      return report.halted() ? ExitCode.RUNTIME_FAILURE : ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Failed reading mutation log {}", logFile, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during replay", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printReport(ReplayReport report, ThreatRegistryStats threats, AlertRegistryStats alerts) {
    Map<String, Object> outcome = new LinkedHashMap<>();
    outcome.put("applied", report.applied());
    outcome.put("rejected", report.rejected());
    CliPrinter.printSummary(report.halted() ? "Replay halted" : "Replay complete", outcome);
    for (ReplayReport.Rejection rejection : report.rejections()) {
      CliPrinter.println(String.format(Locale.ROOT, " line %d %s: %s %s",
          rejection.lineNumber(), rejection.op(), rejection.kind(), rejection.message()));
    }

    Map<String, Object> threatFields = new LinkedHashMap<>();
    threatFields.put("total", threats.total());
    threatFields.put("active", threats.active());
    threatFields.put("resolved", threats.resolved());
    threatFields.put("verified", threats.verified());
    threatFields.put("critical", threats.critical());
    CliPrinter.printSummary("Threats", threatFields);

    Map<String, Object> alertFields = new LinkedHashMap<>();
    alertFields.put("total", alerts.total());
    alertFields.put("delivered", alerts.successful());
    alertFields.put("failed", alerts.failed());
    alertFields.put("pending", alerts.pending());
    alertFields.put("emergency", alerts.emergencyCount());
    alertFields.put("avgDeliveryMillis", alerts.averageDeliveryTime().toMillis());
    alertFields.put("successRate", String.format(Locale.ROOT, "%.1f%%", alerts.successRate()));
    CliPrinter.printSummary("Alerts", alertFields);
  }
}
