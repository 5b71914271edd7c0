package ca.gc.cra.rendezvous.config;

import ca.gc.cra.rendezvous.application.matchmaking.MatchmakingEngine;
import ca.gc.cra.rendezvous.application.port.ClockPort;
import ca.gc.cra.rendezvous.application.port.MetricsPort;
import ca.gc.cra.rendezvous.application.port.WireCodec;
import ca.gc.cra.rendezvous.application.ratelimit.SlidingWindowRateLimiter;
import ca.gc.cra.rendezvous.application.registry.PeerRegistry;
import ca.gc.cra.rendezvous.application.signaling.MessageRouter;
import ca.gc.cra.rendezvous.application.signaling.ServerStats;
import ca.gc.cra.rendezvous.application.signaling.SignalingService;
import ca.gc.cra.rendezvous.application.trust.ChallengeAuthenticator;
import ca.gc.cra.rendezvous.application.trust.ChallengeVerifier;
import ca.gc.cra.rendezvous.application.trust.EchoChallengeVerifier;
import ca.gc.cra.rendezvous.application.trust.HmacChallengeVerifier;
import ca.gc.cra.rendezvous.application.trust.ReputationLedger;
import ca.gc.cra.rendezvous.infrastructure.json.JacksonWireCodec;
import ca.gc.cra.rendezvous.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.rendezvous.infrastructure.time.SystemClockAdapter;
import ca.gc.cra.rendezvous.infrastructure.transport.NettySignalingServer;
import ca.gc.cra.rendezvous.infrastructure.transport.TransportSettings;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * <strong>What:</strong> Wires the signaling service and its transport from a validated {@link SignalingConfig}.
 * <p><strong>Why:</strong> One place translates configuration into the object graph, so the registry and limiters
 * are shared explicitly rather than through global state.</p>
 * <p><strong>Role:</strong> Adapter composition root used by the {@code serve} CLI and by integration tests.</p>
 * <p><strong>Thread-safety:</strong> Build the graph on one thread during startup; the resulting service is
 * thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final SignalingConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private SignalingService service;

  /**
   * Creates a composition root exporting metrics through OpenTelemetry and reading the system clock.
   *
   * @param config validated configuration
   */
  public CompositionRoot(SignalingConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter());
  }

  /**
   * Creates a composition root with explicit metrics and clock adapters.
   *
   * @param config validated configuration
   * @param metrics metrics adapter
   * @param clock time source
   */
  public CompositionRoot(SignalingConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the signaling service, building it on first use.
   *
   * @return shared service instance
   */
  public synchronized SignalingService signalingService() {
    if (service == null) {
      service = buildService();
    }
    return service;
  }

  /**
   * Creates the WebSocket server bound to the shared service; not started.
   *
   * @return server adapter
   */
  public NettySignalingServer signalingServer() {
    return new NettySignalingServer(transportSettings(), signalingService());
  }

  /**
   * Maps configuration onto the transport settings.
   *
   * @return listener settings
   */
  public TransportSettings transportSettings() {
    return new TransportSettings(
        config.listen(),
        config.path(),
        config.maxFrameBytes(),
        config.maxQueuedFrames(),
        config.pingIntervalSeconds(),
        config.pingTimeoutSeconds(),
        config.bossThreads(),
        config.workerThreads());
  }

  /**
   * Selects the challenge verifier for {@code auth.mode}.
   *
   * @return verifier
   */
  public ChallengeVerifier challengeVerifier() {
    return switch (config.authMode()) {
      case ECHO -> new EchoChallengeVerifier();
      case HMAC -> new HmacChallengeVerifier(config.authSecret().orElseThrow(
          () -> new IllegalStateException("auth.secret missing for hmac")));
    };
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public SignalingConfig config() {
    return config;
  }

  private SignalingService buildService() {
    WireCodec codec = new JacksonWireCodec();
    PeerRegistry registry = new PeerRegistry(clock, codec);
    ReputationLedger ledger = new ReputationLedger(metrics);
    ServerStats stats = new ServerStats(clock);
    ChallengeAuthenticator authenticator = new ChallengeAuthenticator(clock, challengeVerifier(), ledger, metrics);
    MessageRouter router = new MessageRouter(
        registry, new MatchmakingEngine(registry), authenticator, ledger, stats, clock, metrics);
    SlidingWindowRateLimiter connectionLimiter = new SlidingWindowRateLimiter(
        config.connectionRateMax(), TimeUnit.SECONDS.toMillis(config.connectionRateWindowSeconds()), clock);
    SlidingWindowRateLimiter messageLimiter = new SlidingWindowRateLimiter(
        config.messageRateMax(), TimeUnit.SECONDS.toMillis(config.messageRateWindowSeconds()), clock);
    return new SignalingService(
        registry, connectionLimiter, messageLimiter, codec, router, ledger, stats, clock, metrics,
        config.maxFrameBytes());
  }
}
