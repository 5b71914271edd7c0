package ca.gc.cra.rendezvous.domain.message;

import ca.gc.cra.rendezvous.domain.peer.PeerId;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Typed view of a validated inbound frame, one variant per peer-sendable type.
 * <p><strong>Why:</strong> Handlers receive explicit fields instead of probing an untyped map; conversion happens once,
 * after validation, and fails closed for anything outside the catalogue.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records. Opaque relay payloads are forwarded as-is and
 * must not be mutated.</p>
 *
 * @since 0.1.0
 */
public sealed interface InboundMessage {

  /**
   * Returns the catalogue entry this variant represents.
   *
   * @return message type
   */
  MessageType type();

  /**
   * Converts a validated key-value frame into its variant.
   *
   * @param fields decoded frame that passed input validation
   * @return typed message
   * @throws IllegalArgumentException when the {@code type} is not peer-sendable
   */
  static InboundMessage from(Map<String, Object> fields) {
    Objects.requireNonNull(fields, "fields");
    Object rawType = fields.get("type");
    MessageType type = MessageType.fromWireName(rawType instanceof String s ? s : null)
        .filter(MessageType::acceptedFromPeers)
        .orElseThrow(() -> new IllegalArgumentException("unsupported message type"));
    return switch (type) {
      case AUTH_REQUEST -> new AuthRequest();
      case AUTH_RESPONSE -> new AuthResponse(text(fields.get("challenge")), text(fields.get("response")));
      case HELPER_AVAILABLE -> new HelperAvailable(text(fields.get("country")), fields.get("bandwidth"));
      case REQUEST_HELP -> new RequestHelp(text(fields.get("country")));
      case OFFER, ANSWER, ICE_CANDIDATE -> new Relay(
          type,
          PeerId.parse(fields.get("to")),
          fields.get(type.relayPayloadField().orElseThrow()));
      case PING -> new Ping();
      default -> throw new IllegalArgumentException("unsupported message type");
    };
  }

  private static String text(Object value) {
    return value instanceof String s ? s : "";
  }

  /** Request for an authentication challenge. */
  record AuthRequest() implements InboundMessage {
    @Override
    public MessageType type() {
      return MessageType.AUTH_REQUEST;
    }
  }

  /**
   * Answer to a previously issued challenge.
   *
   * @param challenge challenge the peer claims to answer; empty when absent
   * @param response computed response; empty when absent
   */
  record AuthResponse(String challenge, String response) implements InboundMessage {
    @Override
    public MessageType type() {
      return MessageType.AUTH_RESPONSE;
    }
  }

  /**
   * Helper announcement.
   *
   * @param country locale tag as sent; empty when absent
   * @param bandwidth raw bandwidth field; numeric values are honoured, anything else counts as zero
   */
  record HelperAvailable(String country, Object bandwidth) implements InboundMessage {
    @Override
    public MessageType type() {
      return MessageType.HELPER_AVAILABLE;
    }

    /**
     * Interprets the raw bandwidth field; values that are not numbers or fall outside {@code [0, 10000]} count as
     * zero.
     *
     * @return advertised bandwidth
     */
    public double advertisedBandwidth() {
      if (bandwidth instanceof Number number) {
        double value = number.doubleValue();
        if (value >= 0d && value <= 10_000d) {
          return value;
        }
      }
      return 0d;
    }
  }

  /**
   * Client request for a helper.
   *
   * @param country client's locale tag as sent; empty when absent
   */
  record RequestHelp(String country) implements InboundMessage {
    @Override
    public MessageType type() {
      return MessageType.REQUEST_HELP;
    }
  }

  /**
   * Offer, answer or candidate addressed to another peer.
   *
   * @param type one of {@code OFFER}, {@code ANSWER}, {@code ICE_CANDIDATE}
   * @param target addressed peer when {@code to} held a UUID-shaped identifier
   * @param payload opaque negotiation payload, forwarded verbatim
   */
  record Relay(MessageType type, Optional<PeerId> target, Object payload) implements InboundMessage {
    public Relay {
      Objects.requireNonNull(type, "type");
      if (type.relayPayloadField().isEmpty()) {
        throw new IllegalArgumentException(type + " is not a relay type");
      }
      target = Objects.requireNonNullElse(target, Optional.empty());
    }
  }

  /** Liveness probe answered with {@code pong}. */
  record Ping() implements InboundMessage {
    @Override
    public MessageType type() {
      return MessageType.PING;
    }
  }
}
