package ca.gc.cra.rendezvous.application.signaling;

import ca.gc.cra.rendezvous.application.port.ClockPort;
import ca.gc.cra.rendezvous.application.port.MetricsPort;
import ca.gc.cra.rendezvous.application.port.PeerTransport;
import ca.gc.cra.rendezvous.application.port.WireCodec;
import ca.gc.cra.rendezvous.application.ratelimit.SlidingWindowRateLimiter;
import ca.gc.cra.rendezvous.application.registry.PeerRegistry;
import ca.gc.cra.rendezvous.application.trust.ReputationLedger;
import ca.gc.cra.rendezvous.domain.message.InboundMessage;
import ca.gc.cra.rendezvous.domain.message.OutboundMessage;
import ca.gc.cra.rendezvous.domain.peer.Peer;
import ca.gc.cra.rendezvous.domain.peer.ReputationEvent;
import ca.gc.cra.rendezvous.logging.Logs;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Per-connection protocol state machine.
 * <p><strong>Why:</strong> Owns the lifecycle of one peer: registration and welcome on open, the
 * rate-limit/decode/validate/dispatch pipeline for each frame, and exactly one registry removal on close.</p>
 * <p><strong>Role:</strong> Created by {@link SignalingService#open(PeerTransport)} and driven by the transport
 * adapter.</p>
 * <p><strong>Thread-safety:</strong> {@link #onFrame(String)} must be called sequentially for one connection (the
 * transport's event loop guarantees receipt order). {@link #close()} may be called from any thread and is
 * idempotent.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code peerId} while a frame is processed; counts
 * {@code signaling.message.*} and records {@code signaling.dispatch.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class SignalingSession {
  private static final Logger log = LoggerFactory.getLogger(SignalingSession.class);
  static final String MDC_PEER_ID = "peerId";
  static final String RATE_LIMIT_REASON = "Rate limit exceeded";

  /** Connection states. */
  public enum State {
    CONNECTING,
    CONNECTED_UNAUTHENTICATED,
    CONNECTED_AUTHENTICATED,
    CLOSED
  }

  private final PeerTransport transport;
  private final PeerRegistry registry;
  private final SlidingWindowRateLimiter messageLimiter;
  private final WireCodec codec;
  private final InputValidator validator;
  private final MessageRouter router;
  private final ReputationLedger ledger;
  private final ServerStats stats;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final int maxMessageSize;
  private final AtomicBoolean closed = new AtomicBoolean();

  private volatile Peer peer;
  private volatile boolean silenced;

  SignalingSession(
      PeerTransport transport,
      PeerRegistry registry,
      SlidingWindowRateLimiter messageLimiter,
      WireCodec codec,
      InputValidator validator,
      MessageRouter router,
      ReputationLedger ledger,
      ServerStats stats,
      ClockPort clock,
      MetricsPort metrics,
      int maxMessageSize) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.registry = registry;
    this.messageLimiter = messageLimiter;
    this.codec = codec;
    this.validator = validator;
    this.router = router;
    this.ledger = ledger;
    this.stats = stats;
    this.clock = clock;
    this.metrics = metrics;
    this.maxMessageSize = maxMessageSize;
  }

  /**
   * Registers the peer and sends {@code welcome}.
   *
   * @return the registered peer
   * @throws IllegalStateException when called twice
   */
  Peer open() {
    if (peer != null) {
      throw new IllegalStateException("session already opened");
    }
    Peer registered = registry.register(transport);
    peer = registered;
    stats.connectionOpened();
    metrics.increment("signaling.connection.accepted");
    registry.send(registered.id(), OutboundMessage.welcome(registered.id(), clock.nowSeconds(), maxMessageSize));
    return registered;
  }

  /**
   * Processes one inbound frame.
   *
   * @param text frame payload
   */
  public void onFrame(String text) {
    handle(Objects.requireNonNull(text, "text"), null);
  }

  /**
   * Processes one inbound frame whose bytes are not valid text; it counts as malformed framing.
   *
   * @param reason decoding failure, for the log
   */
  public void onUndecodableFrame(String reason) {
    handle(null, Objects.requireNonNull(reason, "reason"));
  }

  private void handle(String text, String undecodableReason) {
    Peer current = peer;
    if (current == null || closed.get() || silenced) {
      return;
    }
    String previousPeerId = MDC.get(MDC_PEER_ID);
    long started = System.nanoTime();
    try {
      MDC.put(MDC_PEER_ID, current.id().value());
      process(current, text, undecodableReason);
    } finally {
      metrics.observe("signaling.dispatch.latencyNanos", System.nanoTime() - started);
      if (previousPeerId == null) {
        MDC.remove(MDC_PEER_ID);
      } else {
        MDC.put(MDC_PEER_ID, previousPeerId);
      }
    }
  }

  private void process(Peer current, String text, String undecodableReason) {
    metrics.increment("signaling.message.received");
    if (!messageLimiter.isAllowed(current.id().value())) {
      silenced = true;
      int reputation = ledger.apply(current, ReputationEvent.RATE_LIMIT_EXCEEDED);
      metrics.increment("signaling.message.ratelimited");
      log.warn("Message rate limit exceeded for peer {} (reputation {})", current.id(), reputation);
      transport.close(PeerTransport.POLICY_VIOLATION, RATE_LIMIT_REASON);
      return;
    }

    if (text == null) {
      penalizeMalformed(current);
      log.warn("Undecodable frame from {}: {}", current.id(), undecodableReason);
      return;
    }

    Object decoded;
    try {
      decoded = codec.decode(text);
    } catch (IllegalArgumentException ex) {
      penalizeMalformed(current);
      log.warn("Invalid JSON from {}: {}", current.id(), ex.getMessage());
      log.debug("Rejected frame from {}: {}", current.id(), Logs.sanitize(Logs.truncate(text, 256)));
      return;
    }

    Optional<String> rejection = validator.rejectionReason(decoded);
    if (rejection.isPresent()) {
      ledger.apply(current, ReputationEvent.VALIDATION_REJECTED);
      stats.securityViolation();
      metrics.increment("signaling.message.invalid");
      log.warn("Invalid message from peer {}: {}", current.id(), rejection.get());
      return;
    }

    try {
      @SuppressWarnings("unchecked")
      Map<String, Object> fields = (Map<String, Object>) decoded;
      router.route(current, InboundMessage.from(fields));
      current.recordActivity(clock.nowMillis());
    } catch (RuntimeException ex) {
      ledger.apply(current, ReputationEvent.PROTOCOL_MISUSE);
      log.error("Error handling message from {}", current.id(), ex);
    }
  }

  private void penalizeMalformed(Peer current) {
    ledger.apply(current, ReputationEvent.MALFORMED_FRAME);
    metrics.increment("signaling.message.malformed");
  }

  /** Drives cleanup: removes the peer from the registry exactly once. */
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    Peer current = peer;
    if (current == null) {
      return;
    }
    registry.remove(current.id());
    stats.connectionClosed();
    metrics.increment("signaling.connection.closed");
    log.info("Peer {} disconnected after {} message(s)", current.id(), current.messageCount());
  }

  /**
   * Reports the current protocol state.
   *
   * @return state derived from registration, authentication and closure
   */
  public State state() {
    Peer current = peer;
    if (closed.get()) {
      return State.CLOSED;
    }
    if (current == null) {
      return State.CONNECTING;
    }
    return current.isAuthenticated() ? State.CONNECTED_AUTHENTICATED : State.CONNECTED_UNAUTHENTICATED;
  }

  /**
   * Returns the registered peer.
   *
   * @return peer, or empty before {@code open}
   */
  public Optional<Peer> peer() {
    return Optional.ofNullable(peer);
  }

  /**
   * Indicates whether the message limiter has silenced this connection.
   *
   * @return {@code true} once a frame exceeded the per-peer limit
   */
  public boolean isSilenced() {
    return silenced;
  }
}
