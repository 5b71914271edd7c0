package ca.gc.cra.rendezvous.domain.message;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * <strong>What:</strong> Catalogue of signaling message types and their wire names.
 * <p><strong>Role:</strong> Shared by the input validator (which types a peer may send), the router (dispatch) and
 * the outbound message factories.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum MessageType {
  WELCOME("welcome", false, false),
  AUTH_REQUEST("auth_request", true, false),
  AUTH_CHALLENGE("auth_challenge", false, false),
  AUTH_RESPONSE("auth_response", true, false),
  AUTH_RESULT("auth_result", false, false),
  AUTH_REQUIRED("auth_required", false, false),
  HELPER_AVAILABLE("helper_available", true, true),
  HELPER_REGISTERED("helper_registered", false, false),
  REQUEST_HELP("request_help", true, false),
  HELPER_FOUND("helper_found", false, false),
  HELPER_REQUEST("helper_request", false, false),
  NO_HELPER_AVAILABLE("no_helper_available", false, false),
  OFFER("offer", true, true),
  ANSWER("answer", true, true),
  ICE_CANDIDATE("ice_candidate", true, false),
  PING("ping", true, false),
  PONG("pong", false, false);

  private static final Map<String, MessageType> BY_WIRE_NAME = Stream.of(values())
      .collect(Collectors.toUnmodifiableMap(MessageType::wireName, Function.identity()));

  private final String wireName;
  private final boolean acceptedFromPeers;
  private final boolean sensitive;

  MessageType(String wireName, boolean acceptedFromPeers, boolean sensitive) {
    this.wireName = wireName;
    this.acceptedFromPeers = acceptedFromPeers;
    this.sensitive = sensitive;
  }

  /**
   * Returns the value carried in the {@code type} field.
   *
   * @return wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Indicates whether peers may send this type to the server.
   *
   * @return {@code true} for the inbound catalogue
   */
  public boolean acceptedFromPeers() {
    return acceptedFromPeers;
  }

  /**
   * Indicates whether the type is refused outright for unauthenticated peers (with a reputation penalty) rather
   * than merely answered with {@code auth_required}.
   *
   * @return {@code true} for {@code helper_available}, {@code offer} and {@code answer}
   */
  public boolean sensitive() {
    return sensitive;
  }

  /**
   * Names the field carrying the opaque payload for relay types.
   *
   * @return payload field for {@code offer}, {@code answer} and {@code ice_candidate}
   */
  public Optional<String> relayPayloadField() {
    return switch (this) {
      case OFFER -> Optional.of("offer");
      case ANSWER -> Optional.of("answer");
      case ICE_CANDIDATE -> Optional.of("candidate");
      default -> Optional.empty();
    };
  }

  /**
   * Resolves a wire name exactly (case-sensitive, as peers must send it).
   *
   * @param wireName candidate name; may be {@code null}
   * @return matching type
   */
  public static Optional<MessageType> fromWireName(String wireName) {
    if (wireName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
  }

  @Override
  public String toString() {
    return wireName.toUpperCase(Locale.ROOT);
  }
}
