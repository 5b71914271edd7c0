package ca.gc.cra.rendezvous.domain.peer;

/**
 * <strong>What:</strong> Reputation bounds and the trust predicate gating sensitive operations.
 * <p><strong>Why:</strong> Trust is derived, never stored: a peer is trusted exactly when it is authenticated and its
 * reputation is at or above {@link #TRUST_THRESHOLD}. Low reputation therefore disables relaying and helper matching
 * without a separate ban list.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class TrustPolicy {
  /** Lowest reputation score. */
  public static final int MIN_REPUTATION = 0;
  /** Highest reputation score. */
  public static final int MAX_REPUTATION = 100;
  /** Score assigned to a freshly connected peer. */
  public static final int INITIAL_REPUTATION = 50;
  /** Minimum score an authenticated peer needs to be trusted. */
  public static final int TRUST_THRESHOLD = 60;

  private TrustPolicy() {}

  /**
   * Evaluates the trust predicate.
   *
   * @param authenticated whether the peer completed challenge-response
   * @param reputation current score
   * @return {@code true} when the peer may take part in relays and matchmaking
   */
  public static boolean isTrusted(boolean authenticated, int reputation) {
    return authenticated && reputation >= TRUST_THRESHOLD;
  }

  /**
   * Clamps a candidate score into {@code [MIN_REPUTATION, MAX_REPUTATION]}.
   *
   * @param score unclamped score
   * @return score within bounds
   */
  public static int clampReputation(long score) {
    return (int) Math.max(MIN_REPUTATION, Math.min(MAX_REPUTATION, score));
  }
}
