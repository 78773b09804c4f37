/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep remote payloads short.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; the pipeline tags unit work with the
 * {@code unit} MDC key.
 *
 * @since 0.1.0
 */
package io.wxpanel.logging;
