package ca.gc.cra.rendezvous.infrastructure.time;

import ca.gc.cra.rendezvous.application.port.ClockPort;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()}.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  /** Creates a system clock adapter. */
  public SystemClockAdapter() {}

  /**
   * Returns the current epoch milliseconds.
   *
   * @return current epoch milliseconds
   * @implNote Delegates to {@link System#currentTimeMillis()} without smoothing.
   */
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }
}
