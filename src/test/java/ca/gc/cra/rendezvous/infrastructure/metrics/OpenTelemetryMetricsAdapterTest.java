package ca.gc.cra.rendezvous.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("rendezvous.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("signaling.relay.forwarded");
    adapter.increment("signaling.relay.forwarded");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "signaling.relay.forwarded");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("signaling.relay.forwarded", point.getAttributes().get(METRIC_KEY));
    assertEquals("rendezvous", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("signaling.dispatch.latencyNanos", 1_000L);
    adapter.observe("signaling.dispatch.latencyNanos", 3_000L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "signaling.dispatch.latencynanos");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(4_000d, point.getSum());
    assertEquals("signaling.dispatch.latencyNanos", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void metricNamesAreSanitized() {
    assertEquals("trust.penalty.rate_limit", OpenTelemetryMetricsAdapter.metricName("trust.penalty.rate_limit"));
    assertEquals("m9.lives", OpenTelemetryMetricsAdapter.metricName("9.lives"));
    assertEquals("peer_count_", OpenTelemetryMetricsAdapter.metricName("Peer Count!"));
    assertEquals("rendezvous.metric", OpenTelemetryMetricsAdapter.metricName(" "));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("Expected metric " + name + " in " + metrics));
  }
}
