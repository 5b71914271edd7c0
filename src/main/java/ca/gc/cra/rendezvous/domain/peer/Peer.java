package ca.gc.cra.rendezvous.domain.peer;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Mutable state of one live connection.
 * <p><strong>Why:</strong> Holds everything the trust, matchmaking and relay policies need to know about a peer:
 * its role, locale, advertised bandwidth, authentication state and reputation.</p>
 * <p><strong>Role:</strong> Domain entity owned exclusively by the peer registry; other components hold
 * {@link PeerId}s and re-resolve through the registry.</p>
 * <p><strong>Thread-safety:</strong> Every accessor and mutator synchronizes on the instance. The same monitor is the
 * per-peer lock the registry holds while moving the peer between role sets, so field updates and role-set
 * transitions for one peer never interleave. Multi-field reads should use {@link #snapshot()}.</p>
 *
 * @since 0.1.0
 */
public final class Peer {
  /** Upper bound of advertised bandwidth. */
  public static final double MAX_BANDWIDTH = 10_000d;
  /** Maximum locale tag length. */
  public static final int LOCALE_LENGTH = 2;

  private final PeerId id;
  private final String remoteAddress;
  private final long connectedAtMillis;

  private PeerRole role = PeerRole.NONE;
  private String locale = "";
  private double bandwidth;
  private long lastActivityMillis;
  private long messageCount;
  private boolean authenticated;
  private int reputation = TrustPolicy.INITIAL_REPUTATION;
  private String pendingChallenge;
  private boolean removed;

  /**
   * Creates the record for a newly accepted connection.
   *
   * @param id server-issued identifier
   * @param remoteAddress textual remote network address
   * @param connectedAtMillis accept time in epoch milliseconds
   */
  public Peer(PeerId id, String remoteAddress, long connectedAtMillis) {
    this.id = Objects.requireNonNull(id, "id");
    this.remoteAddress = remoteAddress == null ? "unknown" : remoteAddress;
    this.connectedAtMillis = connectedAtMillis;
    this.lastActivityMillis = connectedAtMillis;
  }

  public PeerId id() {
    return id;
  }

  public String remoteAddress() {
    return remoteAddress;
  }

  public long connectedAtMillis() {
    return connectedAtMillis;
  }

  public synchronized PeerRole role() {
    return role;
  }

  public synchronized String locale() {
    return locale;
  }

  public synchronized double bandwidth() {
    return bandwidth;
  }

  public synchronized long lastActivityMillis() {
    return lastActivityMillis;
  }

  public synchronized long messageCount() {
    return messageCount;
  }

  public synchronized boolean isAuthenticated() {
    return authenticated;
  }

  public synchronized int reputation() {
    return reputation;
  }

  /**
   * Evaluates {@link TrustPolicy#isTrusted(boolean, int)} against a consistent view of this peer.
   *
   * @return {@code true} when authenticated with reputation at or above the threshold
   */
  public synchronized boolean isTrusted() {
    return TrustPolicy.isTrusted(authenticated, reputation);
  }

  /**
   * Indicates whether the registry has dropped this peer.
   *
   * @return {@code true} after removal
   */
  public synchronized boolean isRemoved() {
    return removed;
  }

  /**
   * Applies a reputation delta, clamping to the documented bounds.
   *
   * @param delta signed change
   * @return resulting score
   */
  public synchronized int adjustReputation(int delta) {
    reputation = TrustPolicy.clampReputation((long) reputation + delta);
    return reputation;
  }

  /**
   * Sets the role together with its announcement attributes. Called by the registry while it holds this peer's
   * monitor and updates the role sets.
   *
   * @param newRole role being announced
   * @param newLocale sanitized locale tag
   * @param newBandwidth advertised bandwidth, or {@code null} to leave it unchanged
   */
  public synchronized void assignRole(PeerRole newRole, String newLocale, Double newBandwidth) {
    this.role = Objects.requireNonNull(newRole, "newRole");
    this.locale = newLocale == null ? "" : newLocale;
    if (newBandwidth != null) {
      this.bandwidth = clampBandwidth(newBandwidth);
    }
  }

  /** Records that challenge-response completed. */
  public synchronized void markAuthenticated() {
    authenticated = true;
    pendingChallenge = null;
  }

  /**
   * Stores the challenge most recently issued to this peer.
   *
   * @param challenge challenge text
   */
  public synchronized void issueChallenge(String challenge) {
    pendingChallenge = challenge;
  }

  /**
   * Returns the outstanding challenge.
   *
   * @return challenge issued and not yet answered successfully
   */
  public synchronized Optional<String> pendingChallenge() {
    return Optional.ofNullable(pendingChallenge);
  }

  /**
   * Records a processed inbound message.
   *
   * @param nowMillis processing time in epoch milliseconds
   */
  public synchronized void recordActivity(long nowMillis) {
    lastActivityMillis = nowMillis;
    messageCount++;
  }

  /** Marks the peer as dropped from the registry. */
  public synchronized void markRemoved() {
    removed = true;
  }

  /**
   * Captures a consistent copy of the fields used for ranking and reporting.
   *
   * @return immutable snapshot
   */
  public synchronized PeerSnapshot snapshot() {
    return new PeerSnapshot(
        id, role, locale, bandwidth, connectedAtMillis, authenticated, reputation, messageCount);
  }

  /**
   * Limits a bandwidth figure to {@code [0, MAX_BANDWIDTH]}; non-finite or negative input maps to zero.
   *
   * @param value advertised value
   * @return clamped value
   */
  public static double clampBandwidth(double value) {
    if (Double.isNaN(value) || value < 0d || Double.isInfinite(value)) {
      return 0d;
    }
    return Math.min(value, MAX_BANDWIDTH);
  }

  @Override
  public String toString() {
    return "Peer[" + id + "]";
  }
}
