package ca.gc.cra.rendezvous.application.signaling;

import ca.gc.cra.rendezvous.application.port.ClockPort;
import ca.gc.cra.rendezvous.application.registry.PeerRegistry;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Connection and policy counters for the running server.
 *
 * <p>Thread-safe; counters are independent atomics, so a {@link Snapshot} is not a cross-counter transaction.</p>
 *
 * @since 0.1.0
 */
public final class ServerStats {
  private final ClockPort clock;
  private final long startedAtMillis;
  private final AtomicLong totalConnections = new AtomicLong();
  private final AtomicLong activeConnections = new AtomicLong();
  private final AtomicLong rejectedConnections = new AtomicLong();
  private final AtomicLong securityViolations = new AtomicLong();

  public ServerStats(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.startedAtMillis = clock.nowMillis();
  }

  void connectionOpened() {
    totalConnections.incrementAndGet();
    activeConnections.incrementAndGet();
  }

  void connectionClosed() {
    activeConnections.decrementAndGet();
  }

  void connectionRejected() {
    rejectedConnections.incrementAndGet();
  }

  void securityViolation() {
    securityViolations.incrementAndGet();
  }

  /**
   * Captures counters together with registry sizes.
   *
   * @param registry registry supplying peer, helper and client counts
   * @return point-in-time view
   */
  public Snapshot snapshot(PeerRegistry registry) {
    return new Snapshot(
        registry.size(),
        registry.helperCount(),
        registry.clientCount(),
        Math.max(0L, clock.nowMillis() - startedAtMillis) / 1000L,
        totalConnections.get(),
        activeConnections.get(),
        rejectedConnections.get(),
        securityViolations.get());
  }

  /**
   * Point-in-time server statistics.
   *
   * @param totalPeers registered peers
   * @param helpers peers in the helper set
   * @param clients peers in the client set
   * @param uptimeSeconds seconds since the stats were created
   * @param totalConnections admitted connections since start
   * @param activeConnections admitted connections not yet cleaned up
   * @param rejectedConnections connections refused by the admission limiter
   * @param securityViolations frames rejected by input validation
   */
  public record Snapshot(
      int totalPeers,
      int helpers,
      int clients,
      long uptimeSeconds,
      long totalConnections,
      long activeConnections,
      long rejectedConnections,
      long securityViolations) {}
}
