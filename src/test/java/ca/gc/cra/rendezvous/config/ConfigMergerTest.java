package ca.gc.cra.rendezvous.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("serve");
    Map<String, String> yaml = Map.of("listen", "0.0.0.0:9000", "path", "/ws");
    Map<String, String> cli = Map.of("listen", "127.0.0.1:9001", "maxFrameBytes", "4096");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "serve",
        Optional.of(yaml),
        cli,
        defaults,
        warnings::add);

    assertEquals("127.0.0.1:9001", merged.get("listen"));
    assertEquals("/ws", merged.get("path"));
    assertEquals("4096", merged.get("maxFrameBytes"));
    assertEquals("30", merged.get("pingIntervalSeconds"));
    assertEquals(List.of("CLI overrides YAML for key: listen"), warnings);
  }

  @Test
  void emptyCliValueResetsYamlSetting() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "serve",
        Optional.of(Map.of("auth.mode", "hmac", "auth.secret", "0123456789abcdef")),
        Map.of("auth.mode", "", "auth.secret", ""),
        DefaultsForMode.asFlatMap("serve"),
        msg -> {});

    assertEquals("", merged.get("auth.secret"));
    assertEquals(AuthMode.ECHO, SignalingConfig.fromMap(merged).authMode());
  }

  @Test
  void hmacRequiresSecret() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "serve",
            Optional.empty(),
            Map.of("auth.mode", "hmac"),
            DefaultsForMode.asFlatMap("serve"),
            msg -> {}));
  }

  @Test
  void secretWithoutHmacIsRejected() {
    IllegalArgumentException ex = assertThrows(
        IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(
            "serve",
            Optional.of(Map.of("auth.secret", "0123456789abcdef")),
            Map.of(),
            DefaultsForMode.asFlatMap("serve"),
            msg -> {}));
    assertTrue(ex.getMessage().contains("auth.mode=hmac"));
  }
}
