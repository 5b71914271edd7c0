package ca.gc.cra.rendezvous.application.trust;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.junit.jupiter.api.Test;

class HmacChallengeVerifierTest {
  private static final String SECRET = "0123456789abcdef-shared";
  private static final String CHALLENGE = "challenge-1700000000-3f2b8c1e";

  private final HmacChallengeVerifier verifier = new HmacChallengeVerifier(SECRET);

  @Test
  void expectedResponseIsHexHmacSha256() throws Exception {
    Mac mac = Mac.getInstance("HmacSHA256");
    mac.init(new SecretKeySpec(SECRET.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
    String expected = HexFormat.of().formatHex(mac.doFinal(CHALLENGE.getBytes(StandardCharsets.UTF_8)));

    assertEquals(expected, verifier.expectedResponse(CHALLENGE));
    assertEquals(64, expected.length());
  }

  @Test
  void verifyAcceptsEitherHexCase() {
    String response = verifier.expectedResponse(CHALLENGE);

    assertTrue(verifier.verify(CHALLENGE, response));
    assertTrue(verifier.verify(CHALLENGE, response.toUpperCase(Locale.ROOT)));
  }

  @Test
  void verifyRejectsEchoStyleAndOtherSecrets() {
    assertFalse(verifier.verify(CHALLENGE, EchoChallengeVerifier.expectedResponse(CHALLENGE)));
    HmacChallengeVerifier other = new HmacChallengeVerifier("another-secret-value");
    assertFalse(verifier.verify(CHALLENGE, other.expectedResponse(CHALLENGE)));
    assertFalse(verifier.verify(CHALLENGE, null));
  }

  @Test
  void shortSecretIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new HmacChallengeVerifier("short"));
  }

  @Test
  void echoVerifierRequiresExactText() {
    EchoChallengeVerifier echo = new EchoChallengeVerifier();
    assertTrue(echo.verify("c-1", "stealthflow-c-1-verified"));
    assertFalse(echo.verify("c-1", "STEALTHFLOW-c-1-verified"));
    assertEquals("echo", echo.name());
    assertEquals("hmac", verifier.name());
  }
}
