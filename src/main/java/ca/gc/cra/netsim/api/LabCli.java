package ca.gc.cra.netsim.api;

import ca.gc.cra.netsim.application.port.SimulationEventSink;
import ca.gc.cra.netsim.application.sim.LabReport;
import ca.gc.cra.netsim.application.sim.LabScenario;
import ca.gc.cra.netsim.application.sim.SimulationContext;
import ca.gc.cra.netsim.config.ConfigMerger;
import ca.gc.cra.netsim.config.SimulationConfig;
import ca.gc.cra.netsim.config.YamlConfigLoader;
import ca.gc.cra.netsim.infrastructure.events.LoggingSimulationEventSink;
import ca.gc.cra.netsim.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.netsim.infrastructure.time.ScheduledExecutorTimerAdapter;
import ca.gc.cra.netsim.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.netsim.infrastructure.time.VirtualClock;
import ca.gc.cra.netsim.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a chain of OSPF routers with a host at each end, runs it on a virtual clock (or in real time with
 * {@code clock=wall}) and reports the outcome.
 *
 * @since 0.1.0
 */
public final class LabCli {
  private static final Logger log = LoggerFactory.getLogger(LabCli.class);
  private static final String SUMMARY_USAGE =
      "usage: lab [routers=N] [seconds=S] [config=PATH] [format=text|json] [clock=virtual|wall] [ospf.*=...] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...] [--verbose]";
  private static final String HELP_TEXT = """
      NETSIM lab runner

      Usage:
        lab routers=3 seconds=60 [options]

      Topology:
        hostA 192.168.1.10 - R1 - R2 - ... - Rn - hostB 192.168.2.10
        Transit links are point-to-point OSPF in area 0; LAN interfaces are passive.

      Options:
        routers=N                  Routers in the chain, 1-254 (default 3)
        seconds=S                  Simulated seconds before the ping, 1-86400 (default 60)
        format=text|json           Report format (default text)
        clock=virtual|wall         Simulated time, or real time on a timer thread (default virtual)
        config=PATH                YAML file; 'common' and 'lab' sections are merged
        ospf.helloIntervalSeconds=N  Any simulation key overrides YAML and defaults
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Exit status is 0 when every adjacency is Full and the ping is answered, 1 otherwise.
      """;
  private static final String PROFILE = "lab";
  private static final Set<String> KNOWN_FLAGS = Set.of("--help", "--verbose");
  static final int DEFAULT_ROUTERS = 3;
  static final int DEFAULT_SECONDS = 60;
  private static final int MAX_SECONDS = 86_400;

  private LabCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs a lab and returns the exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for lab CLI");
    }
    for (String flag : input.flags()) {
      if (!KNOWN_FLAGS.contains(flag)) {
        log.error("Unknown flag: {}", flag);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, PROFILE);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    SimulationConfig config;
    int routers;
    int seconds;
    boolean json;
    boolean wallClock;
    try {
      effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(yamlConfig, kv, SimulationConfig.defaultsAsFlatMap(), log::warn));
      TelemetryConfigurator.configureMetrics(effective);
      routers = ConfigCliUtils.parseInt(effective, "routers", DEFAULT_ROUTERS, 1, LabScenario.MAX_ROUTERS);
      seconds = ConfigCliUtils.parseInt(effective, "seconds", DEFAULT_SECONDS, 1, MAX_SECONDS);
      json = parseFormat(effective.getOrDefault("format", "text"));
      wallClock = parseClock(effective.getOrDefault("clock", "virtual"));
      config = SimulationConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid lab arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      log.info("Running lab: {} router(s) for {} simulated second(s), hello {}s dead {}s", routers, seconds,
          config.helloIntervalSeconds(), config.deadIntervalSeconds());
      LabReport report = wallClock
          ? executeWallClock(config, metrics, routers, seconds)
          : execute(config, metrics, routers, seconds);
      if (json) {
        CliPrinter.println(LabReportRenderer.json(report));
      } else {
        CliPrinter.printLines(LabReportRenderer.text(report));
      }
      if (!report.converged() || !report.ping().replied()) {
        log.warn("Lab did not succeed: converged={}, ping={}", report.converged(), report.ping().summary());
        return ExitCode.LAB_FAILED;
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to render lab report", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Lab interrupted");
      return ExitCode.INTERRUPTED;
    } catch (ExecutionException ex) {
      log.error("Lab failed on the simulation thread", ex.getCause());
      return ExitCode.RUNTIME_FAILURE;
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Lab configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in lab", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static LabReport execute(SimulationConfig config, OpenTelemetryMetricsAdapter metrics, int routers, int seconds) {
    VirtualClock clock = new VirtualClock();
    SimulationEventSink events = new LoggingSimulationEventSink(metrics, config.metricKey("events"));
    SimulationContext context = new SimulationContext(config, clock, clock, metrics, events);
    LabScenario lab = LabScenario.chain(context, routers);
    try {
      clock.advanceBy(seconds * 1_000L);
      return lab.report(lab.pingAcross());
    } finally {
      lab.shutdown();
    }
  }

  static LabReport executeWallClock(SimulationConfig config, OpenTelemetryMetricsAdapter metrics, int routers,
      int seconds) throws ExecutionException, InterruptedException {
    try (ScheduledExecutorTimerAdapter timers = new ScheduledExecutorTimerAdapter()) {
      SimulationEventSink events = new LoggingSimulationEventSink(metrics, config.metricKey("events"));
      SimulationContext context =
          new SimulationContext(config, new SystemClockAdapter(), timers, metrics, events);
      // Device state is confined to the timer thread; build, ping and stop there too.
      LabScenario lab = timers.call(() -> LabScenario.chain(context, routers));
      try {
        Thread.sleep(seconds * 1_000L);
        return timers.call(() -> lab.report(lab.pingAcross()));
      } finally {
        timers.call(() -> {
          lab.shutdown();
          return null;
        });
      }
    }
  }

  private static boolean parseClock(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "wall" -> true;
      case "virtual" -> false;
      default -> throw new IllegalArgumentException("clock must be 'virtual' or 'wall' (was '" + raw + "')");
    };
  }

  private static boolean parseFormat(String raw) {
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "json" -> true;
      case "text" -> false;
      default -> throw new IllegalArgumentException("format must be 'text' or 'json' (was '" + raw + "')");
    };
  }
}
