package ca.gc.cra.rendezvous.application.port;

/**
 * <strong>What:</strong> Per-connection handle used to deliver frames to one peer and to close its connection.
 * <p><strong>Why:</strong> Keeps the registry and the protocol handler independent of the WebSocket stack.</p>
 * <p><strong>Role:</strong> Implemented by {@code NettyPeerTransport}; tests use a recording double.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept calls from any thread; a relay is sent from the
 * sender's event loop to the target's transport.</p>
 *
 * @since 0.1.0
 */
public interface PeerTransport {
  /** Close status for policy violations such as admission rate limiting. */
  int POLICY_VIOLATION = 1008;
  /** Close status used on server shutdown. */
  int GOING_AWAY = 1001;

  /**
   * Queues one text frame for delivery without blocking.
   *
   * @param text serialized message
   * @return {@code false} when the transport is closed or refused the frame; the caller then treats the peer as gone
   */
  boolean sendText(String text);

  /**
   * Closes the connection with a status code and reason. Idempotent.
   *
   * @param code WebSocket close status
   * @param reason short human-readable reason
   */
  void close(int code, String reason);

  /**
   * Reports whether frames can still be delivered.
   *
   * @return {@code true} while the connection is open
   */
  boolean isOpen();

  /**
   * Returns the remote network address without port, used as the admission rate-limit key.
   *
   * @return textual address, or {@code "unknown"}
   */
  String remoteAddress();
}
