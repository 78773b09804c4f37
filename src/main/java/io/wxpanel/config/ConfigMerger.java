package io.wxpanel.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML, and CLI settings (CLI wins, then YAML, then defaults).
 *
 * @since 0.1.0
 */
public final class ConfigMerger {
  /** Settings understood by {@link PanelConfig} and the telemetry configurator. */
  static final Set<String> KNOWN_KEYS = Set.of(
      "backgroundDir",
      "outDir",
      "overlayDir",
      "whiteThreshold",
      "fetchTimeoutMillis",
      "issuanceTimeoutMillis",
      "fetchWorkers",
      "layouts",
      "metricsExporter",
      "otelEndpoint",
      "otelResourceAttributes");

  private ConfigMerger() {}

  /**
   * Builds the effective configuration of a run.
   *
   * @param product product being run
   * @param yaml settings from the YAML file, if any
   * @param cli settings from {@code key=value} arguments
   * @param defaults embedded defaults
   * @param warn sink for override and unknown-key warnings; may be {@code null}
   * @return immutable merged settings
   */
  public static Map<String, String> buildEffectiveConfig(
      Product product,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(product, "product");
    Objects.requireNonNull(yaml, "yaml");
    Consumer<String> warnings = warn == null ? message -> {} : warn;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        warnings.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    for (String key : merged.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        warnings.accept("Ignoring unknown setting for " + product.cliName() + ": " + key);
      }
    }
    merged.keySet().retainAll(KNOWN_KEYS);
    return Map.copyOf(merged);
  }
}
