package io.wxpanel.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("wxpanel.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(
        OpenTelemetryBootstrap.open(reader, Attributes.of(AttributeKey.stringKey("site"), "taipei")));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithOriginalKey() {
    adapter.increment("panel.unit.fetchFailed");
    adapter.increment("panel.unit.fetchFailed");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "panel.unit.fetchfailed");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("panel.unit.fetchFailed", point.getAttributes().get(METRIC_KEY));
    assertEquals("wxpanel", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("taipei", counter.getResource().getAttribute(AttributeKey.stringKey("site")));
  }

  @Test
  void observeRecordsLatencyHistogramInMilliseconds() {
    adapter.observe("panel.fetch.latencyMillis", 120L);
    adapter.observe("panel.fetch.latencyMillis", 80L);
    adapter.forceFlush();

    MetricData histogram = find(reader.collectAllMetrics(), "panel.fetch.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(200.0, point.getSum());
  }

  @Test
  void instrumentNameLowercasesAndReplacesIllegalCharacters() {
    assertEquals("panel.canvas.savefailed", OpenTelemetryMetricsAdapter.instrumentName("panel.canvas.saveFailed"));
    assertEquals("m9.unit_x", OpenTelemetryMetricsAdapter.instrumentName("9.unit x"));
    assertEquals("panel.metric", OpenTelemetryMetricsAdapter.instrumentName(" "));
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("site=taipei, broken, =x,env=prod");

    assertEquals(2, attributes.size());
    assertEquals("taipei", attributes.get(AttributeKey.stringKey("site")));
    assertEquals("prod", attributes.get(AttributeKey.stringKey("env")));
  }

  @Test
  void noopHandleAcceptsMeasurements() {
    OpenTelemetryBootstrap.MeterHandle handle = OpenTelemetryBootstrap.MeterHandle.noop();
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(handle)) {
      noop.increment("panel.unit.skipped");
      noop.observe("panel.composite.latencyMillis", 3L);
      noop.forceFlush();
    }
    assertFalse(handle.enabled());
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream().filter(m -> m.getName().equals(name)).findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name);
    return match.orElseThrow();
  }
}
