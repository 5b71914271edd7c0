package ca.gc.cra.rendezvous.api;

import ca.gc.cra.rendezvous.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {}

  /**
   * Converts arguments into a mutable map split on the first {@code '='}; a later duplicate key wins.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable insertion-ordered map
   * @throws IllegalArgumentException when an argument is not {@code key=value} or carries control characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      validateValue(key, value);
      map.put(key, value);
    }
    return map;
  }

  private static void validateValue(String key, String value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        throw new IllegalArgumentException("argument " + key + " must not contain control characters");
      }
    }
    // Empty values reset a YAML setting to its default.
    if (!value.isEmpty()) {
      Strings.requireNonBlank(key, value);
    }
  }
}
