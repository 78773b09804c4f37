/**
 * <strong>Purpose:</strong> Product run orchestration: canvas routing, per-run issuance caching, unit
 * fetch and composite stages, and the run report.
 * <p><strong>Pipeline role:</strong> Application layer; depends on ports only, wired by
 * {@code io.wxpanel.config.CompositionRoot}.</p>
 * <p><strong>Concurrency:</strong> Fetching may run on a worker pool; compositing and saving stay on the
 * calling thread.</p>
 * <p><strong>Telemetry:</strong> Emits {@code panel.*} metrics and tags logs with MDC key {@code unit}.</p>
 *
 * @since 0.1.0
 */
package io.wxpanel.application.pipeline;
