package ca.gc.cra.rendezvous.api;

import ca.gc.cra.rendezvous.application.signaling.SignalingService;
import ca.gc.cra.rendezvous.config.CompositionRoot;
import ca.gc.cra.rendezvous.config.ConfigMerger;
import ca.gc.cra.rendezvous.config.DefaultsForMode;
import ca.gc.cra.rendezvous.config.SignalingConfig;
import ca.gc.cra.rendezvous.config.YamlConfigLoader;
import ca.gc.cra.rendezvous.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.rendezvous.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rendezvous.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.rendezvous.infrastructure.transport.NettySignalingServer;
import ca.gc.cra.rendezvous.logging.LoggingConfigurator;
import ca.gc.cra.rendezvous.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the WebSocket signaling server from CLI key-value arguments and an optional YAML file.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final String MODE = "serve";
  private static final Set<String> KNOWN_FLAGS = Set.of("--dry-run");
  private static final String SUMMARY_USAGE =
      "usage: serve [config=PATH] [listen=HOST:PORT] [path=/PREFIX] [maxFrameBytes=N] "
          + "[rateLimit.connections.max=N] [rateLimit.messages.max=N] [auth.mode=echo|hmac] "
          + "[auth.secret=TEXT] [--dry-run] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      Rendezvous WebSocket signaling server

      Usage:
        serve [options]

      Optional (validated):
        config=PATH                            YAML file with common/serve sections; CLI values win
        listen=HOST:PORT                       Bind address (default 0.0.0.0:8765)
        path=/PREFIX                           WebSocket path prefix (default /)
        maxFrameBytes=256-1048576              Largest inbound frame (default 8192)
        maxQueuedFrames=1-4096                 Pending outbound frames per peer (default 32)
        pingIntervalSeconds=1-3600             Idle time before a keep-alive ping (default 30)
        pingTimeoutSeconds=1-3600              Wait for any frame after a ping (default 10)
        rateLimit.connections.max=N            Connections per address per window (default 10)
        rateLimit.connections.windowSeconds=N  Connection window (default 60)
        rateLimit.messages.max=N               Messages per peer per window (default 50)
        rateLimit.messages.windowSeconds=N     Message window (default 60)
        auth.mode=echo|hmac                    Challenge verification scheme (default echo)
        auth.secret=TEXT                       Shared secret for hmac, at least 16 characters
        bossThreads=1-16                       Acceptor threads (default 1)
        workerThreads=0-256                    I/O threads, 0 lets Netty decide (default 0)
        statsIntervalSeconds=0-86400           Housekeeping and stats period, 0 disables (default 60)
        metricsExporter=otlp|none              Metrics exporter (default otlp)
        otelEndpoint=URL                       OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V,...         Extra OTel resource attributes
        --dry-run                              Validate and print the effective settings, then exit
        --verbose                              Enable DEBUG logging
        --help                                 Show this message
      """;

  private ServeCli() {}

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
   * Resolves the configuration and runs the server until it is closed or the JVM shuts down.
   *
   * @param args raw CLI arguments
   * @return exit code signalling success or failure
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for serve CLI");
    }
    List<String> unknownFlags = input.unknownFlags(KNOWN_FLAGS);
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown flag(s): {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> cli;
    try {
      cli = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String configPath = ConfigCliUtils.extractConfigPath(cli);
    Map<String, String> defaults = DefaultsForMode.asFlatMap(MODE);
    List<String> unknownKeys = unknownKeys(cli, defaults);
    if (!unknownKeys.isEmpty()) {
      log.error("Unknown argument(s): {}", unknownKeys);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--dry-run")) {
      cli.put("dryRun", "true");
    }

    Optional<Map<String, String>> yaml;
    if (configPath == null) {
      yaml = Optional.empty();
    } else {
      try {
        yaml = YamlConfigLoader.load(Path.of(configPath), MODE);
      } catch (IOException ex) {
        log.error("Unable to read config file {}: {}", Logs.sanitize(configPath), ex.getMessage());
        return ExitCode.IO_ERROR;
      } catch (IllegalArgumentException ex) {
        log.error("Invalid config file {}: {}", Logs.sanitize(configPath), ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
      if (yaml.isEmpty()) {
        log.warn("Config file {} not found; using defaults and CLI values", Logs.sanitize(configPath));
      }
      List<String> unknownYaml = unknownKeys(yaml.orElse(Map.of()), defaults);
      if (!unknownYaml.isEmpty()) {
        log.error("Unknown key(s) in config file {}: {}", Logs.sanitize(configPath), unknownYaml);
        return ExitCode.CONFIG_ERROR;
      }
    }

    SignalingConfig config;
    boolean dryRun;
    try {
      Map<String, String> effective = new HashMap<>(
          ConfigMerger.buildEffectiveConfig(MODE, yaml, cli, defaults, log::warn));
      if (ConfigCliUtils.parseBoolean(effective, "verbose") && !input.verbose()) {
        LoggingConfigurator.enableVerboseLogging();
      }
      dryRun = ConfigCliUtils.parseBoolean(effective, "dryRun");
      TelemetryConfigurator.configureMetrics(effective);
      config = SignalingConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }
    return serve(config);
  }

  private static ExitCode serve(SignalingConfig config) {
    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    CompositionRoot root = new CompositionRoot(config, metrics, new SystemClockAdapter());
    NettySignalingServer server = root.signalingServer();
    SignalingService service = root.signalingService();
    ScheduledExecutorService housekeeping = null;
    Thread hook = new Thread(server::close, "rendezvous-shutdown");
    try {
      server.start();
      Runtime.getRuntime().addShutdownHook(hook);
      if (config.statsIntervalSeconds() > 0) {
        housekeeping = ExecutorFactories.newHousekeepingScheduler("rendezvous-housekeeping", null);
        housekeeping.scheduleAtFixedRate(
            service::housekeeping, config.statsIntervalSeconds(), config.statsIntervalSeconds(), TimeUnit.SECONDS);
      }
      log.info("Bound {} with {} challenge verification", server.boundAddress(), root.challengeVerifier().name());
      server.awaitClose();
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to start signaling server on {}: {}", config.listen(), ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Signaling server interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in signaling server", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (housekeeping != null) {
        housekeeping.shutdownNow();
      }
      server.close();
      removeHook(hook);
      metrics.close();
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("Shutdown already in progress; hook left registered");
    }
  }

  private static List<String> unknownKeys(Map<String, String> values, Map<String, String> defaults) {
    List<String> unknown = new ArrayList<>();
    for (String key : values.keySet()) {
      if (!defaults.containsKey(key)) {
        unknown.add(key);
      }
    }
    return unknown;
  }

  private static void printDryRunPlan(SignalingConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("Serve dry-run: no listener will be bound.");
    config.describe().forEach((key, value) -> lines.add(String.format(" %-28s: %s", key, value)));
    lines.add(" Re-run without --dry-run to start the server.");
    CliPrinter.printLines(lines.toArray(String[]::new));
  }
}
