/**
 * <strong>Purpose:</strong> Signaling protocol handling: input validation, the per-connection session state machine
 * and message routing.
 * <p><strong>Pipeline:</strong> rate limit, decode, validate, dispatch, record activity.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.application.signaling;
