package ca.gc.cra.rendezvous.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation and sanitization utilities shared by the configuration layer and the
 * signaling pipeline.
 * <p><strong>Why:</strong> Configuration values and peer-authored wire fields must be free of control characters and
 * markup before they reach loggers, peers, or network sockets.
 * <p><strong>Role:</strong> Domain support utilities invoked before adapters allocate resources and before
 * server-authored messages are serialized.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Recognize canonical UUID text used as peer identifiers.</li>
 *   <li>Strip dangerous characters from outbound string fields.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans with a single builder allocation when sanitizing.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Net
 */
public final class Strings {
  private static final Pattern UUID_PATTERN = Pattern.compile(
      "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");
  private static final String DANGEROUS_CHARS = "<>\"'`\n\r\0\u001a";

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Ensures a value contains only printable ASCII characters and is within the supplied length budget.
   *
   * @param name logical name for diagnostics
   * @param value candidate string; must be non-null
   * @param maxLength maximum permitted length in characters
   * @return validated value containing only characters {@code 0x20-0x7E}
   * @throws IllegalArgumentException if the value exceeds {@code maxLength} or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  /**
   * Tests whether {@code value} is a canonical 8-4-4-4-12 hexadecimal UUID.
   *
   * @param value candidate identifier; {@code null} yields {@code false}
   * @return {@code true} when the text is UUID-shaped
   */
  public static boolean isUuid(String value) {
    return value != null && UUID_PATTERN.matcher(value).matches();
  }

  /**
   * Produces a wire-safe copy of a server-authored string field.
   *
   * <p>Control characters other than tab are removed along with {@code < > " ' `}, CR, LF, NUL and SUB. The
   * result is restricted to ASCII, cut to {@code maxLength} characters and trimmed.</p>
   *
   * @param value text to clean; {@code null} returns an empty string
   * @param maxLength maximum length retained; must be non-negative
   * @return sanitized text
   */
  public static String sanitizeForWire(String value, int maxLength) {
    if (value == null) {
      return "";
    }
    if (maxLength < 0) {
      throw new IllegalArgumentException("maxLength must be >= 0");
    }
    StringBuilder out = new StringBuilder(Math.min(value.length(), maxLength));
    for (int i = 0; i < value.length() && out.length() < maxLength; i++) {
      char c = value.charAt(i);
      if (c < 0x20 && c != '\t') {
        continue;
      }
      if (c > 0x7E || DANGEROUS_CHARS.indexOf(c) >= 0) {
        continue;
      }
      out.append(c);
    }
    return out.toString().trim();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
