package ca.gc.cra.rendezvous.domain.peer;

/**
 * <strong>What:</strong> Behavioural events that move a peer's reputation, with their score deltas.
 * <p><strong>Role:</strong> Penalty schedule applied by the signaling session through the reputation ledger.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ReputationEvent {
  /** Per-peer message limit exceeded. */
  RATE_LIMIT_EXCEEDED(-10, "trust.penalty.rate_limit"),
  /** Decoded message failed input validation. */
  VALIDATION_REJECTED(-5, "trust.penalty.validation"),
  /** Frame could not be decoded at all. */
  MALFORMED_FRAME(-2, "trust.penalty.malformed"),
  /** Recognised frame that could not be acted on (missing target, handler failure). */
  PROTOCOL_MISUSE(-1, "trust.penalty.misuse"),
  /** Challenge-response completed successfully. */
  AUTHENTICATED(10, "trust.reward.authenticated");

  private final int delta;
  private final String metricKey;

  ReputationEvent(int delta, String metricKey) {
    this.delta = delta;
    this.metricKey = metricKey;
  }

  /**
   * Returns the signed score change applied for this event.
   *
   * @return reputation delta
   */
  public int delta() {
    return delta;
  }

  /**
   * Returns the counter name incremented whenever the event is applied.
   *
   * @return dotted metric key
   */
  public String metricKey() {
    return metricKey;
  }
}
