package ca.gc.cra.rendezvous.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads configuration from a YAML document and flattens the {@code common} and mode sections into dotted keys.
 *
 * <p>Nested mappings become dotted keys ({@code rateLimit: {messages: {max: 50}}} yields
 * {@code rateLimit.messages.max=50}). A scalar written exactly as {@code ${NAME}} is replaced by the environment
 * variable {@code NAME}, so secrets need not be stored in the file.</p>
 */
public final class YamlConfigLoader {
  private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} using the process environment for {@code ${NAME}} references.
   *
   * @param path location of the YAML configuration
   * @param mode CLI mode whose section is merged over {@code common}
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String mode) throws IOException {
    return load(path, mode, System::getenv);
  }

  static Optional<Map<String, String>> load(Path path, String mode, UnaryOperator<String> env)
      throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(env, "env");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    String normalizedMode = mode.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");
      Map<String, String> flattened = new LinkedHashMap<>();
      Object common = findSection(root, "common");
      if (common != null) {
        flatten(asMap(common, "common"), "", flattened, env);
      }
      Object modeSection = findSection(root, normalizedMode);
      if (modeSection != null) {
        flatten(asMap(modeSection, normalizedMode), "", flattened, env);
      }
      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(
      Map<String, Object> source, String prefix, Map<String, String> target, UnaryOperator<String> env) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target, env);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, resolve(composite, value.toString(), env));
      }
    }
  }

  private static String resolve(String key, String value, UnaryOperator<String> env) {
    Matcher matcher = ENV_REFERENCE.matcher(value.trim());
    if (!matcher.matches()) {
      return value;
    }
    String resolved = env.apply(matcher.group(1));
    if (resolved == null) {
      throw new IllegalArgumentException(
          "Environment variable " + matcher.group(1) + " referenced by " + key + " is not set");
    }
    return resolved;
  }
}
