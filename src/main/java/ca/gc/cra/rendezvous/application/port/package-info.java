/**
 * Ports separating signaling logic from clocks, metrics, the wire codec and the WebSocket transport.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.application.port;
