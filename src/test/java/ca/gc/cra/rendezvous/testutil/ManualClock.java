package ca.gc.cra.rendezvous.testutil;

import ca.gc.cra.rendezvous.application.port.ClockPort;
import java.util.concurrent.atomic.AtomicLong;

/** Clock advanced explicitly by tests. */
public final class ManualClock implements ClockPort {
  private final AtomicLong nowMillis;

  public ManualClock(long startMillis) {
    this.nowMillis = new AtomicLong(startMillis);
  }

  @Override
  public long nowMillis() {
    return nowMillis.get();
  }

  public void advance(long millis) {
    nowMillis.addAndGet(millis);
  }

  public void set(long millis) {
    nowMillis.set(millis);
  }
}
