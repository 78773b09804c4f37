/**
 * <strong>Purpose:</strong> Input validation helpers for CLI arguments, configuration values, and
 * layout catalog entries.
 * <p><strong>Concurrency:</strong> Stateless utilities.</p>
 *
 * @since 0.1.0
 */
package io.wxpanel.validation;
