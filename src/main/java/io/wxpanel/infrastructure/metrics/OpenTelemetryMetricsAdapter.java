package io.wxpanel.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.wxpanel.application.port.MetricsPort;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link MetricsPort} backed by OpenTelemetry.
 *
 * <p>{@code panel.*} keys become lower-case instrument names; the original key travels as the
 * {@code wxpanel.metric.key} attribute. Keys ending in {@code Millis} are histograms in {@code ms}.
 * Instruments are created on first use. {@link #close()} exports the final values.</p>
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("wxpanel.metric.key");

  private final OpenTelemetryBootstrap.MeterHandle handle;
  private final Map<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final Map<String, LongHistogram> histograms = new ConcurrentHashMap<>();

  /** Opens the exporter selected by the {@code otel.*} settings. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.open());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.MeterHandle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    log.debug("Panel metrics {}", handle.enabled() ? "enabled" : "disabled");
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, k -> handle.meter().counterBuilder(instrumentName(k))
            .setUnit("1")
            .setDescription("Panel events: " + k)
            .build())
        .add(1, Attributes.of(METRIC_KEY, key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, k -> handle.meter().histogramBuilder(instrumentName(k))
            .ofLongs()
            .setUnit(k.endsWith("Millis") ? "ms" : "1")
            .setDescription("Panel timings: " + k)
            .build())
        .record(value, Attributes.of(METRIC_KEY, key));
  }

  /** Exports pending values without closing. */
  public void forceFlush() {
    handle.flush();
  }

  @Override
  public void close() {
    handle.close();
  }

  /**
   * Maps a key to a legal instrument name: lower case, a leading letter, and only letters, digits,
   * {@code _ - .}; a blank key becomes {@code panel.metric}.
   */
  static String instrumentName(String key) {
    if (key == null || key.isBlank()) {
      return "panel.metric";
    }
    String lower = key.strip().toLowerCase(Locale.ROOT);
    StringBuilder name = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      name.append('m');
    }
    lower.chars().forEach(c -> name.append(
        Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? (char) c : '_'));
    return name.toString();
  }
}
