package ca.gc.cra.rendezvous.api;

import ca.gc.cra.rendezvous.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies telemetry settings from the effective configuration into the {@code otel.*} system properties read by the
 * OpenTelemetry bootstrap. The consumed keys are removed from the map.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    String exporter = trimmed(args.remove("metricsExporter"));
    if (!exporter.isEmpty()) {
      String normalized = exporter.toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty("otel.metrics.exporter", normalized);
    }

    String endpoint = trimmed(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String resourceAttributes = trimmed(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OTEL resource attributes override");
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimmed(String value) {
    return value == null ? "" : value.trim();
  }
}
