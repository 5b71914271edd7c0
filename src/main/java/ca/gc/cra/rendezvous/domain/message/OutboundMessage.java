package ca.gc.cra.rendezvous.domain.message;

import ca.gc.cra.rendezvous.domain.peer.PeerId;
import ca.gc.cra.rendezvous.validation.Strings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Server-authored message destined for one peer.
 * <p><strong>Why:</strong> Keeps the outbound catalogue in one place so field names and server-authored texts cannot
 * drift between handlers.</p>
 * <p><strong>Role:</strong> Built by the signaling handlers, sanitized and serialized by the peer registry.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the field map is an unmodifiable insertion-ordered copy.</p>
 *
 * @param type outbound message type, serialized as the {@code type} field
 * @param fields remaining fields in wire order
 * @param opaqueField name of a relay payload field forwarded verbatim, if any
 * @since 0.1.0
 */
public record OutboundMessage(MessageType type, Map<String, Object> fields, Optional<String> opaqueField) {
  /** Maximum length of server-authored string fields after sanitization. */
  public static final int MAX_FIELD_LENGTH = 1024;
  /** Text of the {@code auth_required} notice. */
  public static final String AUTH_REQUIRED_TEXT = "Authentication required for this operation";
  /** Text of {@code no_helper_available} when no trusted helper is registered. */
  public static final String NO_HELPERS_TEXT = "No helpers currently available";
  /** Text of {@code no_helper_available} when the selected helper lost trust before notification. */
  public static final String NO_TRUSTED_HELPERS_TEXT = "No trusted helpers currently available";

  public OutboundMessage {
    Objects.requireNonNull(type, "type");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
    opaqueField = Objects.requireNonNullElse(opaqueField, Optional.empty());
  }

  public static OutboundMessage welcome(PeerId peerId, double serverTimeSeconds, int maxMessageSize) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("peer_id", peerId.value());
    fields.put("server_time", serverTimeSeconds);
    fields.put("max_message_size", maxMessageSize);
    return of(MessageType.WELCOME, fields);
  }

  public static OutboundMessage authChallenge(String challenge) {
    return of(MessageType.AUTH_CHALLENGE, Map.of("challenge", challenge));
  }

  public static OutboundMessage authResult(boolean success) {
    return of(MessageType.AUTH_RESULT, Map.of("success", success));
  }

  public static OutboundMessage authRequired() {
    return of(MessageType.AUTH_REQUIRED, Map.of("message", AUTH_REQUIRED_TEXT));
  }

  public static OutboundMessage helperRegistered(int helperCount) {
    return of(MessageType.HELPER_REGISTERED, Map.of("helper_count", helperCount));
  }

  public static OutboundMessage helperFound(PeerId helperId, String helperCountry) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("helper_id", helperId.value());
    fields.put("helper_country", helperCountry);
    return of(MessageType.HELPER_FOUND, fields);
  }

  public static OutboundMessage helperRequest(PeerId clientId, String clientCountry) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("from", clientId.value());
    fields.put("client_country", clientCountry);
    return of(MessageType.HELPER_REQUEST, fields);
  }

  public static OutboundMessage noHelperAvailable(String reason) {
    return of(MessageType.NO_HELPER_AVAILABLE, Map.of("message", reason));
  }

  public static OutboundMessage pong(double timestampSeconds) {
    return of(MessageType.PONG, Map.of("timestamp", timestampSeconds));
  }

  /**
   * Rewrites a relay for its target: the sender's identifier replaces {@code to}, the payload is carried verbatim.
   *
   * @param type {@code OFFER}, {@code ANSWER} or {@code ICE_CANDIDATE}
   * @param from sending peer
   * @param payload opaque payload; {@code null} is forwarded as JSON null
   * @return relay message
   */
  public static OutboundMessage relay(MessageType type, PeerId from, Object payload) {
    String payloadField = type.relayPayloadField()
        .orElseThrow(() -> new IllegalArgumentException(type + " is not a relay type"));
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("from", from.value());
    fields.put(payloadField, payload);
    return new OutboundMessage(type, fields, Optional.of(payloadField));
  }

  /**
   * Returns a copy whose string fields are restricted to safe printable ASCII and cut to
   * {@link #MAX_FIELD_LENGTH}. The opaque relay payload is left untouched.
   *
   * @return sanitized copy
   */
  public OutboundMessage sanitized() {
    Map<String, Object> copy = new LinkedHashMap<>();
    fields.forEach((name, value) -> {
      if (value instanceof String text && !opaqueField.filter(name::equals).isPresent()) {
        copy.put(name, Strings.sanitizeForWire(text, MAX_FIELD_LENGTH));
      } else {
        copy.put(name, value);
      }
    });
    return new OutboundMessage(type, copy, opaqueField);
  }

  private static OutboundMessage of(MessageType type, Map<String, Object> fields) {
    return new OutboundMessage(type, fields, Optional.empty());
  }
}
