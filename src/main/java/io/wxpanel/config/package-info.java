/**
 * Configuration loading and wiring: embedded defaults, YAML settings, CLI overrides, the layout catalog,
 * and the composition root.
 *
 * @since 0.1.0
 */
package io.wxpanel.config;
