package ca.gc.cra.rendezvous.application.trust;

import java.util.Objects;

/**
 * Accepts {@code stealthflow-<challenge>-verified}, the publicly computable transform existing clients send.
 *
 * <p>Only deters naive automation; it proves nothing about the peer. Use {@link HmacChallengeVerifier} where
 * clients share a secret.</p>
 *
 * @since 0.1.0
 */
public final class EchoChallengeVerifier implements ChallengeVerifier {
  private static final String PREFIX = "stealthflow-";
  private static final String SUFFIX = "-verified";

  /**
   * Computes the response clients are expected to send.
   *
   * @param challenge issued challenge
   * @return expected response
   */
  public static String expectedResponse(String challenge) {
    return PREFIX + Objects.requireNonNull(challenge, "challenge") + SUFFIX;
  }

  @Override
  public boolean verify(String challenge, String response) {
    if (challenge == null || response == null) {
      return false;
    }
    return expectedResponse(challenge).equals(response);
  }

  @Override
  public String name() {
    return "echo";
  }
}
