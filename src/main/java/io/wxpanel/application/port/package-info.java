/**
 * <strong>Purpose:</strong> Ports between the panel pipeline and the outside world: issuance feeds, chart
 * downloads, overlay sources, canvas storage, and metrics.
 * <p><strong>Pipeline role:</strong> Application layer; adapters in {@code io.wxpanel.infrastructure}
 * implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Fetch-side ports must be thread-safe; canvas storage is used from one
 * thread.</p>
 *
 * @since 0.1.0
 */
package io.wxpanel.application.port;
