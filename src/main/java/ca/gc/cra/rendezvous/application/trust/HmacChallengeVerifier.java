package ca.gc.cra.rendezvous.application.trust;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * <strong>What:</strong> Verifies responses computed as the lower-case hex HMAC-SHA256 of the challenge under a
 * shared secret.
 * <p><strong>Why:</strong> Unlike the echo transform, a correct response requires knowledge of the deployment
 * secret.</p>
 * <p><strong>Thread-safety:</strong> A fresh {@link Mac} is created per call; instances are immutable.</p>
 *
 * @since 0.1.0
 */
public final class HmacChallengeVerifier implements ChallengeVerifier {
  private static final String ALGORITHM = "HmacSHA256";
  /** Shortest accepted secret. */
  public static final int MIN_SECRET_LENGTH = 16;

  private final SecretKeySpec key;

  /**
   * Creates a verifier.
   *
   * @param secret shared secret; at least {@value #MIN_SECRET_LENGTH} characters
   * @throws IllegalArgumentException when the secret is too short
   */
  public HmacChallengeVerifier(String secret) {
    Objects.requireNonNull(secret, "secret");
    if (secret.length() < MIN_SECRET_LENGTH) {
      throw new IllegalArgumentException("auth.secret must have at least " + MIN_SECRET_LENGTH + " characters");
    }
    this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
  }

  /**
   * Computes the response a client holding the secret sends.
   *
   * @param challenge issued challenge
   * @return lower-case hex digest
   */
  public String expectedResponse(String challenge) {
    return HexFormat.of().formatHex(digest(challenge));
  }

  @Override
  public boolean verify(String challenge, String response) {
    if (challenge == null || response == null) {
      return false;
    }
    byte[] expected = expectedResponse(challenge).getBytes(StandardCharsets.US_ASCII);
    byte[] actual = response.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
    return MessageDigest.isEqual(expected, actual);
  }

  @Override
  public String name() {
    return "hmac";
  }

  private byte[] digest(String challenge) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(key);
      return mac.doFinal(challenge.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException(ALGORITHM + " unavailable", ex);
    }
  }
}
