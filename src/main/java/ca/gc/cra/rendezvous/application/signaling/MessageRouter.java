package ca.gc.cra.rendezvous.application.signaling;

import ca.gc.cra.rendezvous.application.matchmaking.MatchmakingEngine;
import ca.gc.cra.rendezvous.application.port.ClockPort;
import ca.gc.cra.rendezvous.application.port.MetricsPort;
import ca.gc.cra.rendezvous.application.registry.PeerRegistry;
import ca.gc.cra.rendezvous.application.trust.ChallengeAuthenticator;
import ca.gc.cra.rendezvous.application.trust.ReputationLedger;
import ca.gc.cra.rendezvous.domain.message.InboundMessage;
import ca.gc.cra.rendezvous.domain.message.InboundMessage.AuthRequest;
import ca.gc.cra.rendezvous.domain.message.InboundMessage.AuthResponse;
import ca.gc.cra.rendezvous.domain.message.InboundMessage.HelperAvailable;
import ca.gc.cra.rendezvous.domain.message.InboundMessage.Ping;
import ca.gc.cra.rendezvous.domain.message.InboundMessage.Relay;
import ca.gc.cra.rendezvous.domain.message.InboundMessage.RequestHelp;
import ca.gc.cra.rendezvous.domain.message.OutboundMessage;
import ca.gc.cra.rendezvous.domain.peer.Peer;
import ca.gc.cra.rendezvous.domain.peer.PeerId;
import ca.gc.cra.rendezvous.domain.peer.PeerRole;
import ca.gc.cra.rendezvous.domain.peer.ReputationEvent;
import ca.gc.cra.rendezvous.logging.Logs;
import ca.gc.cra.rendezvous.validation.Net;
import ca.gc.cra.rendezvous.validation.Strings;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Dispatches validated inbound messages to their handlers.
 * <p><strong>Why:</strong> Each handler enforces its own authentication and trust gate, so adding a message type
 * cannot silently bypass them.</p>
 * <p><strong>Role:</strong> Fourth step of the per-frame pipeline run by {@link SignalingSession}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Run the challenge-response handshake.</li>
 *   <li>Answer {@code auth_required} for anything but {@code ping} until the peer authenticates.</li>
 *   <li>Register helpers, match clients and relay negotiation payloads between trusted peers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; invoked concurrently from every connection's event loop. Peers are
 * re-resolved through the registry on every relay.</p>
 *
 * @since 0.1.0
 */
public final class MessageRouter {
  private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

  private final PeerRegistry registry;
  private final MatchmakingEngine matchmaking;
  private final ChallengeAuthenticator authenticator;
  private final ReputationLedger ledger;
  private final ServerStats stats;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public MessageRouter(
      PeerRegistry registry,
      MatchmakingEngine matchmaking,
      ChallengeAuthenticator authenticator,
      ReputationLedger ledger,
      ServerStats stats,
      ClockPort clock,
      MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.matchmaking = Objects.requireNonNull(matchmaking, "matchmaking");
    this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Handles one message from {@code peer}.
   *
   * @param peer sending peer
   * @param message validated message
   */
  public void route(Peer peer, InboundMessage message) {
    Objects.requireNonNull(peer, "peer");
    Objects.requireNonNull(message, "message");
    if (message instanceof AuthRequest) {
      String challenge = authenticator.issueChallenge(peer);
      registry.send(peer.id(), OutboundMessage.authChallenge(challenge));
      return;
    }
    if (message instanceof AuthResponse response) {
      ChallengeAuthenticator.Outcome outcome =
          authenticator.verify(peer, response.challenge(), response.response());
      registry.send(peer.id(), OutboundMessage.authResult(outcome.success()));
      return;
    }
    if (!peer.isAuthenticated() && !(message instanceof Ping)) {
      requireAuthentication(peer, message);
      return;
    }
    if (message instanceof HelperAvailable helper) {
      onHelperAvailable(peer, helper);
    } else if (message instanceof RequestHelp request) {
      onRequestHelp(peer, request);
    } else if (message instanceof Relay relay) {
      onRelay(peer, relay);
    } else if (message instanceof Ping) {
      registry.send(peer.id(), OutboundMessage.pong(clock.nowSeconds()));
    } else {
      log.warn("Unknown message type {} from {}", message.type(), peer.id());
      ledger.apply(peer, ReputationEvent.PROTOCOL_MISUSE);
    }
  }

  private void requireAuthentication(Peer peer, InboundMessage message) {
    if (message.type().sensitive()) {
      log.warn("Unauthenticated peer {} attempted {}", peer.id(), message.type().wireName());
      ledger.apply(peer, ReputationEvent.VALIDATION_REJECTED);
      stats.securityViolation();
    }
    metrics.increment("signaling.auth.required");
    registry.send(peer.id(), OutboundMessage.authRequired());
  }

  private void onHelperAvailable(Peer peer, HelperAvailable message) {
    String country = message.country();
    if (!country.isEmpty() && !Net.isHostname(country)
        && (country.length() > 2 || !isAlphabetic(country))) {
      log.warn("Invalid country {} from peer {}", Logs.sanitize(country), peer.id());
      return;
    }
    String locale = locale(country);
    if (!registry.setRole(peer.id(), PeerRole.HELPER, locale, message.advertisedBandwidth())) {
      return;
    }
    metrics.increment("signaling.helper.registered");
    log.info("Helper {} available from {} (bandwidth {})", peer.id(), locale, peer.bandwidth());
    registry.send(peer.id(), OutboundMessage.helperRegistered(registry.helperCount()));
  }

  private void onRequestHelp(Peer client, RequestHelp message) {
    String locale = locale(message.country());
    if (!registry.setRole(client.id(), PeerRole.CLIENT, locale, null)) {
      return;
    }
    log.info("Client {} requesting help from {}", client.id(), locale);
    Optional<Peer> best = matchmaking.findBestHelper(client);
    if (best.isEmpty()) {
      metrics.increment("signaling.match.none");
      registry.send(client.id(), OutboundMessage.noHelperAvailable(OutboundMessage.NO_HELPERS_TEXT));
      return;
    }
    Peer helper = best.get();
    if (!helper.isTrusted()) {
      log.warn("Helper {} not trusted, skipping", helper.id());
      metrics.increment("signaling.match.none");
      registry.send(client.id(), OutboundMessage.noHelperAvailable(OutboundMessage.NO_TRUSTED_HELPERS_TEXT));
      return;
    }
    if (!registry.send(helper.id(), OutboundMessage.helperRequest(client.id(), locale))) {
      metrics.increment("signaling.match.none");
      registry.send(client.id(), OutboundMessage.noHelperAvailable(OutboundMessage.NO_HELPERS_TEXT));
      return;
    }
    metrics.increment("signaling.match.found");
    log.info("Matched client {} with helper {}", client.id(), helper.id());
    registry.send(client.id(), OutboundMessage.helperFound(helper.id(), helper.locale()));
  }

  private void onRelay(Peer sender, Relay relay) {
    String kind = relay.type().wireName();
    if (relay.target().isEmpty()) {
      log.warn("Invalid target ID in {} from {}", kind, sender.id());
      ledger.apply(sender, ReputationEvent.PROTOCOL_MISUSE);
      metrics.increment("signaling.relay.dropped");
      return;
    }
    PeerId targetId = relay.target().get();
    Optional<Peer> target = registry.get(targetId);
    if (target.isEmpty()) {
      log.debug("Target peer {} not found for {} from {}", targetId, kind, sender.id());
      metrics.increment("signaling.relay.dropped");
      return;
    }
    if (!sender.isTrusted() || !target.get().isTrusted()) {
      log.warn("Untrusted peers attempting {}: {} -> {}", kind, sender.id(), targetId);
      metrics.increment("signaling.relay.dropped");
      return;
    }
    if (registry.send(targetId, OutboundMessage.relay(relay.type(), sender.id(), relay.payload()))) {
      metrics.increment("signaling.relay.forwarded");
    } else {
      metrics.increment("signaling.relay.dropped");
    }
  }

  private static String locale(String country) {
    String cut = country.length() > 2 ? country.substring(0, 2) : country;
    return Strings.sanitizeForWire(cut, 2);
  }

  private static boolean isAlphabetic(String value) {
    for (int i = 0; i < value.length(); i++) {
      if (!Character.isLetter(value.charAt(i))) {
        return false;
      }
    }
    return true;
  }
}
