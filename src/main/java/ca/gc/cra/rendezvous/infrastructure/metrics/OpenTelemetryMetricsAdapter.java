package ca.gc.cra.rendezvous.infrastructure.metrics;

import ca.gc.cra.rendezvous.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards signaling counters and histograms to OpenTelemetry.
 *
 * <p>Instruments are created lazily on first use and cached per key. When the exporter is disabled the adapter
 * drops every update.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE =
      AttributeKey.stringKey("rendezvous.metric.key");
  private static final String FALLBACK_METRIC_NAME = "rendezvous.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final boolean noop;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter wired to the exporter configured through system properties or the environment. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    this.noop = bootstrap.isNoop();
    if (noop) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    if (noop) {
      return;
    }
    CounterInstrument instrument = counters.computeIfAbsent(key, this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    if (noop) {
      return;
    }
    HistogramInstrument instrument = histograms.computeIfAbsent(key, this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts the meter provider down. */
  @Override
  public void close() {
    bootstrap.close();
  }

  private CounterInstrument createCounter(String key) {
    String name = metricName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit("1")
        .setDescription("Rendezvous counter for " + key)
        .build();
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    String name = metricName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setDescription("Rendezvous observation for " + key)
        .build();
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String metricName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String name = result.toString();
    if (!name.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, name);
    }
    return name;
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
