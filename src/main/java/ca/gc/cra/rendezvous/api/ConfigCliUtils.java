package ca.gc.cra.rendezvous.api;

import java.util.Locale;
import java.util.Map;

/**
 * Helpers shared by commands that layer CLI arguments over a YAML file.
 */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config=PATH} argument.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent or blank
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    if (value == null || value.isBlank()) {
      return false;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("true") && !normalized.equals("false")) {
      throw new IllegalArgumentException(key + " must be true or false (was " + value.trim() + ")");
    }
    return Boolean.parseBoolean(normalized);
  }
}
