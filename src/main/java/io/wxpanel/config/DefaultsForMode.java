package io.wxpanel.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Embedded defaults for each product, used as the lowest-precedence configuration layer.
 *
 * <p>{@code whiteThreshold} has no entry here: the layout catalog carries each product's threshold and
 * the setting only exists as an override.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private DefaultsForMode() {
    // Utility
  }

  /**
   * Returns the defaults of a product as flat key/value pairs.
   *
   * @param product product being run
   * @return immutable defaults map
   */
  public static Map<String, String> asFlatMap(Product product) {
    Objects.requireNonNull(product, "product");
    Map<String, String> defaults = new LinkedHashMap<>();
    defaults.put("backgroundDir", ".");
    defaults.put("outDir", "./outputs/Output");
    defaults.put("overlayDir", "./outputs/aqi");
    defaults.put("fetchTimeoutMillis", "15000");
    defaults.put("issuanceTimeoutMillis", "10000");
    defaults.put("fetchWorkers", "1");
    defaults.put("layouts", "");
    defaults.put("metricsExporter", "none");
    return Map.copyOf(defaults);
  }
}
