package ca.gc.cra.rendezvous.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI overrides.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code serve})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    if (!"serve".equals(normalized)) {
      throw new IllegalArgumentException("Unsupported mode: " + mode);
    }
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(buildServeDefaults());
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildServeDefaults() {
    SignalingConfig defaults = SignalingConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("listen", defaults.listen().toString());
    map.put("path", defaults.path());
    map.put("maxFrameBytes", Integer.toString(defaults.maxFrameBytes()));
    map.put("maxQueuedFrames", Integer.toString(defaults.maxQueuedFrames()));
    map.put("pingIntervalSeconds", Integer.toString(defaults.pingIntervalSeconds()));
    map.put("pingTimeoutSeconds", Integer.toString(defaults.pingTimeoutSeconds()));
    map.put("rateLimit.connections.max", Integer.toString(defaults.connectionRateMax()));
    map.put("rateLimit.connections.windowSeconds", Integer.toString(defaults.connectionRateWindowSeconds()));
    map.put("rateLimit.messages.max", Integer.toString(defaults.messageRateMax()));
    map.put("rateLimit.messages.windowSeconds", Integer.toString(defaults.messageRateWindowSeconds()));
    map.put("auth.mode", "echo");
    map.put("auth.secret", "");
    map.put("bossThreads", Integer.toString(defaults.bossThreads()));
    map.put("workerThreads", Integer.toString(defaults.workerThreads()));
    map.put("statsIntervalSeconds", Integer.toString(defaults.statsIntervalSeconds()));
    map.put("dryRun", "false");
    return map;
  }
}
