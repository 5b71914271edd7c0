package ca.gc.cra.rendezvous.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to the rate limiter, challenge issuance and peer
 * bookkeeping.
 * <p><strong>Why:</strong> Sliding windows and challenge texts depend on time; tests inject a manual clock to make
 * window expiry deterministic.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; every connection's event loop reads it.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.rendezvous.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Returns the current epoch time in fractional seconds, as carried by {@code welcome} and {@code pong}.
   *
   * @return seconds since the epoch
   */
  default double nowSeconds() {
    return nowMillis() / 1000d;
  }

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
