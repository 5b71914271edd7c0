package ca.gc.cra.rendezvous.config;

import ca.gc.cra.rendezvous.validation.Net;
import ca.gc.cra.rendezvous.validation.Net.HostPort;
import ca.gc.cra.rendezvous.validation.Numbers;
import ca.gc.cra.rendezvous.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings of the {@code serve} mode.
 * <p><strong>Why:</strong> Every knob is range-checked once at startup so the server never binds with a nonsensical
 * frame limit or rate window.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param listen bind address and port
 * @param path WebSocket path prefix; starts with {@code /}
 * @param maxFrameBytes largest accepted inbound frame, also advertised in {@code welcome}
 * @param maxQueuedFrames pending outbound frames tolerated per connection
 * @param pingIntervalSeconds inbound silence before a keep-alive ping
 * @param pingTimeoutSeconds wait after a ping before the connection is dropped
 * @param connectionRateMax connections admitted per address per window
 * @param connectionRateWindowSeconds admission window
 * @param messageRateMax frames accepted per peer per window
 * @param messageRateWindowSeconds message window
 * @param authMode challenge verification scheme
 * @param authSecret shared secret for {@link AuthMode#HMAC}
 * @param bossThreads acceptor threads
 * @param workerThreads I/O threads; {@code 0} lets Netty choose
 * @param statsIntervalSeconds housekeeping period; {@code 0} disables it
 * @since 0.1.0
 */
public record SignalingConfig(
    HostPort listen,
    String path,
    int maxFrameBytes,
    int maxQueuedFrames,
    int pingIntervalSeconds,
    int pingTimeoutSeconds,
    int connectionRateMax,
    int connectionRateWindowSeconds,
    int messageRateMax,
    int messageRateWindowSeconds,
    AuthMode authMode,
    Optional<String> authSecret,
    int bossThreads,
    int workerThreads,
    int statsIntervalSeconds) {

  private static final int MIN_SECRET_LENGTH = 16;

  /**
   * Validates ranges and cross-field rules.
   *
   * @throws IllegalArgumentException naming the offending key
   */
  public SignalingConfig {
    Objects.requireNonNull(listen, "listen");
    path = Strings.requirePrintableAscii("path", path, 256);
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/'");
    }
    Numbers.requireRange("maxFrameBytes", maxFrameBytes, 256, 1_048_576);
    Numbers.requireRange("maxQueuedFrames", maxQueuedFrames, 1, 4096);
    Numbers.requireRange("pingIntervalSeconds", pingIntervalSeconds, 1, 3600);
    Numbers.requireRange("pingTimeoutSeconds", pingTimeoutSeconds, 1, 3600);
    Numbers.requireRange("rateLimit.connections.max", connectionRateMax, 1, 100_000);
    Numbers.requireRange("rateLimit.connections.windowSeconds", connectionRateWindowSeconds, 1, 86_400);
    Numbers.requireRange("rateLimit.messages.max", messageRateMax, 1, 100_000);
    Numbers.requireRange("rateLimit.messages.windowSeconds", messageRateWindowSeconds, 1, 86_400);
    Numbers.requireRange("bossThreads", bossThreads, 1, 16);
    Numbers.requireRange("workerThreads", workerThreads, 0, 256);
    Numbers.requireRange("statsIntervalSeconds", statsIntervalSeconds, 0, 86_400);
    authMode = Objects.requireNonNullElse(authMode, AuthMode.ECHO);
    authSecret = Objects.requireNonNullElse(authSecret, Optional.<String>empty()).filter(s -> !s.isBlank());
    if (authMode == AuthMode.HMAC
        && authSecret.map(String::length).orElse(0) < MIN_SECRET_LENGTH) {
      throw new IllegalArgumentException(
          "auth.secret of at least " + MIN_SECRET_LENGTH + " characters is required when auth.mode=hmac");
    }
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default configuration listening on {@code 0.0.0.0:8765}
   */
  public static SignalingConfig defaults() {
    return new SignalingConfig(
        new HostPort("0.0.0.0", 8765),
        "/",
        8192,
        32,
        30,
        10,
        10,
        60,
        50,
        60,
        AuthMode.ECHO,
        Optional.empty(),
        1,
        0,
        60);
  }

  /**
   * Builds a configuration from flattened key/value pairs; absent keys keep their defaults.
   *
   * @param options merged defaults, YAML and CLI values
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static SignalingConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SignalingConfig d = defaults();
    String listenRaw = trimToNull(options.get("listen"));
    HostPort listen = listenRaw == null ? d.listen() : Net.parseHostPort(listenRaw);
    String path = Optional.ofNullable(trimToNull(options.get("path"))).orElse(d.path());
    return new SignalingConfig(
        listen,
        path,
        intValue(options, "maxFrameBytes", d.maxFrameBytes()),
        intValue(options, "maxQueuedFrames", d.maxQueuedFrames()),
        intValue(options, "pingIntervalSeconds", d.pingIntervalSeconds()),
        intValue(options, "pingTimeoutSeconds", d.pingTimeoutSeconds()),
        intValue(options, "rateLimit.connections.max", d.connectionRateMax()),
        intValue(options, "rateLimit.connections.windowSeconds", d.connectionRateWindowSeconds()),
        intValue(options, "rateLimit.messages.max", d.messageRateMax()),
        intValue(options, "rateLimit.messages.windowSeconds", d.messageRateWindowSeconds()),
        AuthMode.fromString(options.get("auth.mode")),
        Optional.ofNullable(trimToNull(options.get("auth.secret"))),
        intValue(options, "bossThreads", d.bossThreads()),
        intValue(options, "workerThreads", d.workerThreads()),
        intValue(options, "statsIntervalSeconds", d.statsIntervalSeconds()));
  }

  /**
   * Renders the configuration as ordered key/value pairs for the dry-run plan; the secret is masked.
   *
   * @return display map
   */
  public Map<String, String> describe() {
    Map<String, String> out = new LinkedHashMap<>();
    out.put("listen", listen.toString());
    out.put("path", path);
    out.put("maxFrameBytes", Integer.toString(maxFrameBytes));
    out.put("maxQueuedFrames", Integer.toString(maxQueuedFrames));
    out.put("pingIntervalSeconds", Integer.toString(pingIntervalSeconds));
    out.put("pingTimeoutSeconds", Integer.toString(pingTimeoutSeconds));
    out.put("rateLimit.connections", connectionRateMax + "/" + connectionRateWindowSeconds + "s");
    out.put("rateLimit.messages", messageRateMax + "/" + messageRateWindowSeconds + "s");
    out.put("auth.mode", authMode.name().toLowerCase(Locale.ROOT));
    out.put("auth.secret", authSecret.isPresent() ? "****" : "(none)");
    out.put("bossThreads", Integer.toString(bossThreads));
    out.put("workerThreads", workerThreads == 0 ? "auto" : Integer.toString(workerThreads));
    out.put("statsIntervalSeconds", Integer.toString(statsIntervalSeconds));
    return out;
  }

  private static int intValue(Map<String, String> options, String key, int defaultValue) {
    String raw = trimToNull(options.get(key));
    if (raw == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(raw);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
