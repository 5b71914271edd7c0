/**
 * <strong>Purpose:</strong> Reputation bookkeeping and the challenge-response authentication handshake.
 * <p>Verification is pluggable through {@link ca.gc.cra.rendezvous.application.trust.ChallengeVerifier}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.rendezvous.application.trust;
