package ca.gc.cra.rendezvous.application.trust;

import ca.gc.cra.rendezvous.application.port.ClockPort;
import ca.gc.cra.rendezvous.application.port.MetricsPort;
import ca.gc.cra.rendezvous.domain.peer.Peer;
import ca.gc.cra.rendezvous.domain.peer.ReputationEvent;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the challenge-response handshake for one peer.
 * <p><strong>Why:</strong> Authentication is an anti-automation gate: only peers that complete it (and keep their
 * reputation) may announce as helpers or relay offers.</p>
 * <p><strong>Role:</strong> Application service invoked by the router on {@code auth_request} and
 * {@code auth_response}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Issue challenges bound to the current second and the peer id prefix.</li>
 *   <li>Accept a response only for the challenge most recently issued to that peer.</li>
 *   <li>Reward the first successful authentication; never penalize a failed attempt.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; the check and the state change happen under the peer's monitor.</p>
 *
 * @since 0.1.0
 */
public final class ChallengeAuthenticator {
  private static final Logger log = LoggerFactory.getLogger(ChallengeAuthenticator.class);
  private static final int ID_PREFIX_LENGTH = 8;

  /** Result of one {@code auth_response}. */
  public enum Outcome {
    /** Response verified; the peer is now authenticated and rewarded. */
    AUTHENTICATED,
    /** The peer was already authenticated; nothing changed. */
    ALREADY_AUTHENTICATED,
    /** Missing fields, unknown challenge or wrong response. */
    REJECTED;

    /**
     * Value of {@code auth_result.success}.
     *
     * @return {@code true} unless rejected
     */
    public boolean success() {
      return this != REJECTED;
    }
  }

  private final ClockPort clock;
  private final ChallengeVerifier verifier;
  private final ReputationLedger ledger;
  private final MetricsPort metrics;

  public ChallengeAuthenticator(
      ClockPort clock, ChallengeVerifier verifier, ReputationLedger ledger, MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.verifier = Objects.requireNonNull(verifier, "verifier");
    this.ledger = Objects.requireNonNull(ledger, "ledger");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Issues a new challenge, replacing any outstanding one.
   *
   * @param peer requesting peer
   * @return challenge text {@code challenge-<epochSeconds>-<id prefix>}
   */
  public String issueChallenge(Peer peer) {
    long epochSeconds = clock.nowMillis() / 1000L;
    String challenge = "challenge-" + epochSeconds + "-" + peer.id().prefix(ID_PREFIX_LENGTH);
    peer.issueChallenge(challenge);
    log.debug("Issued challenge to {}", peer.id());
    return challenge;
  }

  /**
   * Verifies a response.
   *
   * @param peer responding peer
   * @param challenge challenge the peer claims to answer
   * @param response peer's response
   * @return outcome; only {@link Outcome#AUTHENTICATED} changes peer state
   */
  public Outcome verify(Peer peer, String challenge, String response) {
    Objects.requireNonNull(peer, "peer");
    Outcome outcome;
    synchronized (peer) {
      outcome = evaluate(peer, challenge, response);
      if (outcome == Outcome.AUTHENTICATED) {
        peer.markAuthenticated();
        ledger.apply(peer, ReputationEvent.AUTHENTICATED);
      }
    }
    if (outcome == Outcome.REJECTED) {
      metrics.increment("signaling.auth.failure");
      log.warn("Authentication failed for {}", peer.id());
    } else if (outcome == Outcome.AUTHENTICATED) {
      metrics.increment("signaling.auth.success");
      log.info("Peer {} authenticated (reputation {})", peer.id(), peer.reputation());
    }
    return outcome;
  }

  /**
   * Returns the configured verifier name.
   *
   * @return verifier name
   */
  public String verifierName() {
    return verifier.name();
  }

  private Outcome evaluate(Peer peer, String challenge, String response) {
    if (peer.isAuthenticated()) {
      return Outcome.ALREADY_AUTHENTICATED;
    }
    if (challenge == null || challenge.isEmpty() || response == null || response.isEmpty()) {
      return Outcome.REJECTED;
    }
    Optional<String> issued = peer.pendingChallenge();
    if (issued.isEmpty() || !issued.get().equals(challenge)) {
      return Outcome.REJECTED;
    }
    return verifier.verify(challenge, response) ? Outcome.AUTHENTICATED : Outcome.REJECTED;
  }
}
