package ca.gc.cra.rendezvous.application.trust;

/**
 * Strategy deciding whether a response answers a challenge.
 *
 * <p>Implementations must be stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ChallengeVerifier {
  /**
   * Checks a peer's response.
   *
   * @param challenge challenge previously issued to the peer
   * @param response response sent by the peer
   * @return {@code true} when the response is correct
   */
  boolean verify(String challenge, String response);

  /**
   * Short name used in logs and the dry-run plan.
   *
   * @return verifier name
   */
  String name();
}
