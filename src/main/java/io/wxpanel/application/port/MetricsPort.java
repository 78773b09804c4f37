package io.wxpanel.application.port;

/**
 * <strong>What:</strong> Port abstracting panel metrics emission.
 * <p><strong>Why:</strong> Lets the run orchestrator count unit outcomes and time fetches without binding
 * to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} for tests
 * and dry runs.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from fetch
 * workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code panel.unit.composited},
 * {@code panel.fetch.latencyMillis}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value, e.g. milliseconds
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
