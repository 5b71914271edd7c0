package ca.gc.cra.rendezvous.application.ratelimit;

import ca.gc.cra.rendezvous.application.port.ClockPort;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <strong>What:</strong> Sliding-window request counter keyed by an identity string.
 * <p><strong>Why:</strong> Bounds how often one remote address may connect and how many frames one peer may send.</p>
 * <p><strong>Role:</strong> Two instances are wired by the composition root: one keyed by remote address for
 * admission, one keyed by peer id for message throughput.</p>
 * <p><strong>Thread-safety:</strong> Keys live in a {@link ConcurrentHashMap}; each key's timestamp deque is guarded by
 * its own monitor, so different keys never contend.</p>
 * <p><strong>Performance:</strong> {@link #isAllowed(String)} is amortized O(1); each timestamp is evicted once.</p>
 *
 * @since 0.1.0
 */
public final class SlidingWindowRateLimiter {
  private final int maxRequests;
  private final long windowMillis;
  private final ClockPort clock;
  private final Map<String, ArrayDeque<Long>> windows = new ConcurrentHashMap<>();

  /**
   * Creates a limiter.
   *
   * @param maxRequests requests allowed inside one window; must be positive
   * @param windowMillis trailing window length in milliseconds; must be positive
   * @param clock time source
   * @throws IllegalArgumentException when a bound is not positive
   */
  public SlidingWindowRateLimiter(int maxRequests, long windowMillis, ClockPort clock) {
    if (maxRequests <= 0) {
      throw new IllegalArgumentException("maxRequests must be positive");
    }
    if (windowMillis <= 0) {
      throw new IllegalArgumentException("windowMillis must be positive");
    }
    this.maxRequests = maxRequests;
    this.windowMillis = windowMillis;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Evicts expired timestamps for {@code key}, then admits the request when fewer than {@code maxRequests} remain.
   * Admitted requests record the current time; refused ones record nothing.
   *
   * @param key identity (remote address or peer id)
   * @return {@code true} when the request is within the limit
   */
  public boolean isAllowed(String key) {
    Objects.requireNonNull(key, "key");
    while (true) {
      ArrayDeque<Long> window = windows.computeIfAbsent(key, k -> new ArrayDeque<>());
      synchronized (window) {
        // swept between lookup and lock; retry with the live deque
        if (windows.get(key) != window) {
          continue;
        }
        long now = clock.nowMillis();
        evictExpired(window, now);
        if (window.size() >= maxRequests) {
          return false;
        }
        window.addLast(now);
        return true;
      }
    }
  }

  /**
   * Counts requests currently inside the window for {@code key}.
   *
   * @param key identity
   * @return number of live timestamps
   */
  public int currentCount(String key) {
    ArrayDeque<Long> window = windows.get(key);
    if (window == null) {
      return 0;
    }
    synchronized (window) {
      evictExpired(window, clock.nowMillis());
      return window.size();
    }
  }

  /**
   * Drops keys whose windows have fully expired.
   *
   * @return number of keys removed
   */
  public int cleanup() {
    long now = clock.nowMillis();
    int removed = 0;
    Iterator<Map.Entry<String, ArrayDeque<Long>>> it = windows.entrySet().iterator();
    while (it.hasNext()) {
      Map.Entry<String, ArrayDeque<Long>> entry = it.next();
      ArrayDeque<Long> window = entry.getValue();
      synchronized (window) {
        evictExpired(window, now);
        if (window.isEmpty()) {
          it.remove();
          removed++;
        }
      }
    }
    return removed;
  }

  /**
   * Reports how many keys are tracked.
   *
   * @return tracked key count
   */
  public int trackedKeys() {
    return windows.size();
  }

  public int maxRequests() {
    return maxRequests;
  }

  public long windowMillis() {
    return windowMillis;
  }

  private void evictExpired(ArrayDeque<Long> window, long now) {
    while (!window.isEmpty() && now - window.peekFirst() >= windowMillis) {
      window.pollFirst();
    }
  }
}
