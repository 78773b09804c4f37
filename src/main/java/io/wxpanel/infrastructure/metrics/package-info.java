/**
 * Metrics adapter bridging {@link io.wxpanel.application.port.MetricsPort} to OpenTelemetry.
 * <p><strong>Concurrency:</strong> Thread-safe; fetch workers record latencies concurrently.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code panel.*} namespace, lower-cased by the
 * sanitizer (for example {@code panel.unit.fetchfailed}); the original key is kept as the
 * {@code wxpanel.metric.key} attribute.</p>
 */
package io.wxpanel.infrastructure.metrics;
