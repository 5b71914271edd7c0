package ca.gc.cra.rendezvous.application.trust;

import ca.gc.cra.rendezvous.application.port.MetricsPort;
import ca.gc.cra.rendezvous.domain.peer.Peer;
import ca.gc.cra.rendezvous.domain.peer.ReputationEvent;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies reputation changes to peers and answers the trust query.
 * <p><strong>Why:</strong> Centralizes the penalty and reward schedule so every caller clamps the same way and the
 * change is counted once.</p>
 * <p><strong>Role:</strong> Application service used by the signaling session, the router and the authenticator.
 * The ledger never decides when to penalize; callers apply the schedule in {@link ReputationEvent}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the metrics port; per-peer atomicity comes from
 * {@link Peer}'s monitor.</p>
 *
 * @since 0.1.0
 */
public final class ReputationLedger {
  private static final Logger log = LoggerFactory.getLogger(ReputationLedger.class);

  private final MetricsPort metrics;

  /**
   * Creates a ledger.
   *
   * @param metrics metrics sink for reward and penalty counters
   */
  public ReputationLedger(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Applies a raw delta, clamping the result into {@code [0, 100]}.
   *
   * @param peer peer to adjust
   * @param delta signed change
   * @return resulting reputation
   */
  public int adjust(Peer peer, int delta) {
    Objects.requireNonNull(peer, "peer");
    int result = peer.adjustReputation(delta);
    log.debug("Reputation of {} adjusted by {} to {}", peer.id(), delta, result);
    return result;
  }

  /**
   * Applies one scheduled event and counts it.
   *
   * @param peer peer to adjust
   * @param event reason for the change
   * @return resulting reputation
   */
  public int apply(Peer peer, ReputationEvent event) {
    Objects.requireNonNull(event, "event");
    int result = adjust(peer, event.delta());
    metrics.increment(event.metricKey());
    return result;
  }

  /**
   * Evaluates the trust predicate on the peer's current state.
   *
   * @param peer peer to check
   * @return {@code true} when authenticated with reputation of at least 60
   */
  public boolean isTrusted(Peer peer) {
    return peer != null && peer.isTrusted();
  }
}
