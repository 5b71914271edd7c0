package ca.gc.cra.rendezvous.application.port;

import ca.gc.cra.rendezvous.domain.message.OutboundMessage;

/**
 * <strong>What:</strong> Port converting between frame text and message structures.
 * <p><strong>Role:</strong> Implemented by {@code JacksonWireCodec}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface WireCodec {
  /**
   * Decodes one frame.
   *
   * @param text frame payload
   * @return decoded value: a {@code Map<String, Object>} for objects; lists, strings, numbers, booleans or
   *     {@code null} for other JSON documents
   * @throws IllegalArgumentException when the text is not a single well-formed document
   */
  Object decode(String text);

  /**
   * Serializes a message with {@code type} as the first field.
   *
   * @param message message to encode
   * @return frame text
   * @throws IllegalStateException when a field value cannot be represented
   */
  String encode(OutboundMessage message);
}
