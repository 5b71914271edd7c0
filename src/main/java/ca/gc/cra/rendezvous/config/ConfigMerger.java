package ca.gc.cra.rendezvous.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and cross-field rules.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    AuthMode mode = AuthMode.fromString(effective.get("auth.mode"));
    if (mode == AuthMode.HMAC && trim(effective.get("auth.secret")).isEmpty()) {
      throw new IllegalArgumentException("auth.secret is required when auth.mode=hmac");
    }
    if (mode == AuthMode.ECHO && !trim(effective.get("auth.secret")).isEmpty()) {
      throw new IllegalArgumentException("auth.secret is only used when auth.mode=hmac");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
