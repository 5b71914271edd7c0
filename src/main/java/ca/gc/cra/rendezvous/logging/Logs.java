package ca.gc.cra.rendezvous.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers for values that originate from untrusted peers.
 * <p><strong>Why:</strong> Peer-supplied countries, identifiers and payload fragments must not forge log lines or
 * flood the log with oversized frames.
 * <p><strong>Role:</strong> Cross-cutting utility used by the signaling pipeline and transport adapters.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Escape line breaks and NUL characters so one log event stays one log line.</li>
 *   <li>Truncate UTF-8 payloads to a safe byte budget while preserving readability.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} to avoid exceptions when truncating mid-codepoint.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final int MAX_SANITIZED_LENGTH = 1_000;

  private Logs() {
    // Utility
  }

  /**
   * Escapes CR, LF and NUL characters and caps the result at 1000 characters.
   *
   * @param value peer-controlled text; {@code null} results in {@code "<null>"}
   * @return single-line representation safe to interpolate into log messages
   */
  public static String sanitize(Object value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    String text = value.toString();
    StringBuilder out = new StringBuilder(Math.min(text.length() + 8, MAX_SANITIZED_LENGTH + 8));
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      switch (c) {
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\0' -> out.append("\\0");
        default -> out.append(c);
      }
    }
    if (out.length() > MAX_SANITIZED_LENGTH) {
      out.setLength(MAX_SANITIZED_LENGTH - 3);
      out.append("...");
    }
    return out.toString();
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length metadata.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "? (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      String utf16Safe = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return utf16Safe + "? (truncated)";
    }
  }
}
