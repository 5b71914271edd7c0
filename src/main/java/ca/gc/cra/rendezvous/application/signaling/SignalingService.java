package ca.gc.cra.rendezvous.application.signaling;

import ca.gc.cra.rendezvous.application.port.ClockPort;
import ca.gc.cra.rendezvous.application.port.MetricsPort;
import ca.gc.cra.rendezvous.application.port.PeerTransport;
import ca.gc.cra.rendezvous.application.port.WireCodec;
import ca.gc.cra.rendezvous.application.ratelimit.SlidingWindowRateLimiter;
import ca.gc.cra.rendezvous.application.registry.PeerRegistry;
import ca.gc.cra.rendezvous.application.trust.ReputationLedger;
import ca.gc.cra.rendezvous.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Entry point the transport adapter uses to admit connections and open sessions.
 * <p><strong>Role:</strong> Application facade assembled by the composition root; holds the shared registry, both
 * rate limiters and the per-frame pipeline components.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; every collaborator is.</p>
 *
 * @since 0.1.0
 */
public final class SignalingService {
  private static final Logger log = LoggerFactory.getLogger(SignalingService.class);
  /** Close reason sent on process shutdown. */
  public static final String SHUTDOWN_REASON = "Server shutting down";

  private final PeerRegistry registry;
  private final SlidingWindowRateLimiter connectionLimiter;
  private final SlidingWindowRateLimiter messageLimiter;
  private final WireCodec codec;
  private final InputValidator validator;
  private final MessageRouter router;
  private final ReputationLedger ledger;
  private final ServerStats stats;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final int maxMessageSize;

  public SignalingService(
      PeerRegistry registry,
      SlidingWindowRateLimiter connectionLimiter,
      SlidingWindowRateLimiter messageLimiter,
      WireCodec codec,
      MessageRouter router,
      ReputationLedger ledger,
      ServerStats stats,
      ClockPort clock,
      MetricsPort metrics,
      int maxMessageSize) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.connectionLimiter = Objects.requireNonNull(connectionLimiter, "connectionLimiter");
    this.messageLimiter = Objects.requireNonNull(messageLimiter, "messageLimiter");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.router = Objects.requireNonNull(router, "router");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.validator = new InputValidator();
    this.maxMessageSize = maxMessageSize;
  }

  /**
   * Consults the address-keyed limiter before a peer is registered.
   *
   * @param remoteAddress connecting address
   * @return {@code false} when the connection must be refused
   */
  public boolean admit(String remoteAddress) {
    String key = remoteAddress == null ? "unknown" : remoteAddress;
    if (connectionLimiter.isAllowed(key)) {
      return true;
    }
    stats.connectionRejected();
    metrics.increment("signaling.connection.rejected");
    log.warn("Connection rate limit exceeded for {}", Logs.sanitize(key));
    return false;
  }

  /**
   * Registers a peer for an admitted connection and sends its {@code welcome}.
   *
   * @param transport connection handle
   * @return session driving the connection
   */
  public SignalingSession open(PeerTransport transport) {
    SignalingSession session = new SignalingSession(
        transport, registry, messageLimiter, codec, validator, router, ledger, stats, clock, metrics,
        maxMessageSize);
    session.open();
    return session;
  }

  /** Sweeps expired rate-limit keys and logs a statistics snapshot. */
  public void housekeeping() {
    int connectionKeys = connectionLimiter.cleanup();
    int messageKeys = messageLimiter.cleanup();
    ServerStats.Snapshot snapshot = stats.snapshot(registry);
    log.info(
        "Stats: peers={} helpers={} clients={} uptime={}s total={} active={} rejected={} violations={}"
            + " (swept {} address / {} peer limiter keys)",
        snapshot.totalPeers(), snapshot.helpers(), snapshot.clients(), snapshot.uptimeSeconds(),
        snapshot.totalConnections(), snapshot.activeConnections(), snapshot.rejectedConnections(),
        snapshot.securityViolations(), connectionKeys, messageKeys);
  }

  /** Closes every peer connection with status 1001. */
  public void shutdown() {
    registry.closeAll(PeerTransport.GOING_AWAY, SHUTDOWN_REASON);
  }

  public ServerStats.Snapshot stats() {
    return stats.snapshot(registry);
  }

  public PeerRegistry registry() {
    return registry;
  }
}
