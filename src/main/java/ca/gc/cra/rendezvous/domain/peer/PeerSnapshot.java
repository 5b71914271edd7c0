package ca.gc.cra.rendezvous.domain.peer;

/**
 * Point-in-time copy of a {@link Peer}'s ranking and reporting fields.
 *
 * @param id peer identifier
 * @param role announced role
 * @param locale two-letter locale tag, possibly empty
 * @param bandwidth advertised bandwidth in {@code [0, 10000]}
 * @param connectedAtMillis accept time in epoch milliseconds
 * @param authenticated whether challenge-response completed
 * @param reputation score in {@code [0, 100]}
 * @param messageCount processed inbound messages
 * @since 0.1.0
 */
public record PeerSnapshot(
    PeerId id,
    PeerRole role,
    String locale,
    double bandwidth,
    long connectedAtMillis,
    boolean authenticated,
    int reputation,
    long messageCount) {

  /**
   * Evaluates the trust predicate on the captured values.
   *
   * @return {@code true} when the captured state is trusted
   */
  public boolean trusted() {
    return TrustPolicy.isTrusted(authenticated, reputation);
  }
}
