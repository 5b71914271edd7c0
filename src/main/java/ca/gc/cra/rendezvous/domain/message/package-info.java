/**
 * Signaling message catalogue: the inbound tagged union and server-authored outbound messages.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.domain.message;
