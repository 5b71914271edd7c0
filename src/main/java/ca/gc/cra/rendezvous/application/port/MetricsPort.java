package ca.gc.cra.rendezvous.application.port;

/**
 * <strong>What:</strong> Port abstracting signaling metrics emission.
 * <p><strong>Why:</strong> Lets sessions and handlers count connections, policy violations and relays without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; tests use recording doubles.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every event loop.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code signaling.relay.forwarded}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code signaling.message.ratelimited}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., nanoseconds); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
