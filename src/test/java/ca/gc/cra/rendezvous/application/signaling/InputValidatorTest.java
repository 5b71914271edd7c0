package ca.gc.cra.rendezvous.application.signaling;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class InputValidatorTest {
  private static final String TARGET = "3f2b8c1e-9d4a-4b7e-8a61-0c5d2e7f9a10";

  private final InputValidator validator = new InputValidator();

  @Test
  void acceptsEveryPeerSendableType() {
    for (String type : List.of(
        "auth_request", "auth_response", "helper_available", "request_help", "ice_candidate", "ping")) {
      assertTrue(validator.validate(Map.of("type", type)), type);
    }
    assertTrue(validator.validate(Map.of("type", "offer", "to", TARGET)));
    assertTrue(validator.validate(Map.of("type", "answer", "to", TARGET)));
  }

  @Test
  void rejectsNonObjectsAndMissingType() {
    assertEquals("payload is not an object", validator.rejectionReason(List.of("ping")).orElseThrow());
    assertEquals("payload is not an object", validator.rejectionReason("ping").orElseThrow());
    assertEquals("type missing", validator.rejectionReason(Map.of("to", TARGET)).orElseThrow());
    assertEquals("type missing", validator.rejectionReason(Map.of("type", 7)).orElseThrow());
  }

  @Test
  void rejectsServerOnlyAndUnknownTypes() {
    assertFalse(validator.validate(Map.of("type", "welcome")));
    assertFalse(validator.validate(Map.of("type", "helper_request")));
    assertFalse(validator.validate(Map.of("type", "Ping")));
    assertFalse(validator.validate(Map.of("type", "shutdown")));
  }

  @Test
  void rejectsOversizedTopLevelStrings() {
    assertTrue(validator.validate(Map.of("type", "request_help", "country", "x".repeat(1024))));
    assertFalse(validator.validate(Map.of("type", "request_help", "country", "x".repeat(1025))));
  }

  @Test
  void rejectsNulAndSubstituteCharacters() {
    assertFalse(validator.validate(Map.of("type", "request_help", "country", "C\0A")));
    assertFalse(validator.validate(Map.of("type", "request_help", "country", "C\u001aA")));
  }

  @Test
  void nestedPayloadStringsAreNotLengthChecked() {
    Map<String, Object> offer = Map.of("type", "offer", "sdp", "v=0\r\n" + "a=x\r\n".repeat(400));

    assertTrue(validator.validate(Map.of("type", "offer", "to", TARGET, "offer", offer)));
  }

  @Test
  void offerAndAnswerRequireUuidTarget() {
    assertEquals("target missing or malformed",
        validator.rejectionReason(Map.of("type", "offer")).orElseThrow());
    assertFalse(validator.validate(Map.of("type", "answer", "to", "peer-2")));
    assertFalse(validator.validate(Map.of("type", "answer", "to", 12)));
  }

  @Test
  void rejectsNonTextFieldNames() {
    Map<Object, Object> fields = new HashMap<>();
    fields.put("type", "ping");
    fields.put(1, "x");

    assertEquals("non-text field name", validator.rejectionReason(fields).orElseThrow());
  }
}
