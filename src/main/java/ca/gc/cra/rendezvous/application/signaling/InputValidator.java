package ca.gc.cra.rendezvous.application.signaling;

import ca.gc.cra.rendezvous.domain.message.MessageType;
import ca.gc.cra.rendezvous.validation.Strings;
import java.util.Map;
import java.util.Optional;

/**
 * <strong>What:</strong> Stateless shape, type, length and character-set rules for decoded inbound frames.
 * <p><strong>Why:</strong> Rejects hostile input before any handler touches it; the session applies the validation
 * penalty when a frame is rejected.</p>
 * <p><strong>Role:</strong> Third step of the per-frame pipeline (after rate limiting and decoding). Checks that need
 * peer context, such as the authentication gate, live in {@link MessageRouter}.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class InputValidator {
  /** Longest string value accepted in any top-level field. */
  public static final int MAX_STRING_LENGTH = 1024;

  /**
   * Checks a decoded frame.
   *
   * @param decoded output of the wire codec
   * @return {@code true} when the frame may be dispatched
   */
  public boolean validate(Object decoded) {
    return rejectionReason(decoded).isEmpty();
  }

  /**
   * Explains why a frame would be rejected.
   *
   * @param decoded output of the wire codec
   * @return reason suitable for logging, or empty when the frame is acceptable
   */
  public Optional<String> rejectionReason(Object decoded) {
    if (!(decoded instanceof Map<?, ?> fields)) {
      return Optional.of("payload is not an object");
    }
    Object rawType = fields.get("type");
    if (!(rawType instanceof String typeName)) {
      return Optional.of("type missing");
    }
    Optional<MessageType> type = MessageType.fromWireName(typeName).filter(MessageType::acceptedFromPeers);
    if (type.isEmpty()) {
      return Optional.of("type not allowed");
    }
    for (Map.Entry<?, ?> entry : fields.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        return Optional.of("non-text field name");
      }
      if (entry.getValue() instanceof String value) {
        if (value.length() > MAX_STRING_LENGTH) {
          return Optional.of("field '" + entry.getKey() + "' too long");
        }
        if (value.indexOf('\0') >= 0 || value.indexOf('\u001a') >= 0) {
          return Optional.of("field '" + entry.getKey() + "' contains control characters");
        }
      }
    }
    MessageType resolved = type.get();
    if (resolved == MessageType.OFFER || resolved == MessageType.ANSWER) {
      Object to = fields.get("to");
      if (!(to instanceof String target) || !Strings.isUuid(target)) {
        return Optional.of("target missing or malformed");
      }
    }
    return Optional.empty();
  }
}
