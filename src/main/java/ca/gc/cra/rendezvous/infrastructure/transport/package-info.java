/**
 * <strong>Purpose:</strong> Netty WebSocket transport adapter.
 * <p>Each channel's frames are processed on its event loop; admission, frame size limits, outbound queue limits and
 * keep-alive are enforced here before and around the signaling session.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.infrastructure.transport;
