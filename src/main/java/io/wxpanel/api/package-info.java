/**
 * Command-line entry points. {@link io.wxpanel.api.Main} dispatches to {@link io.wxpanel.api.PanelCli},
 * which merges settings, prints dry-run plans, and maps failures to {@link io.wxpanel.api.ExitCode}.
 *
 * @since 0.1.0
 */
package io.wxpanel.api;
