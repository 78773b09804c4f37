package io.wxpanel.config;

import java.util.Locale;
import java.util.OptionalInt;

/**
 * Infographic products the CLI can build.
 *
 * @since 0.1.0
 */
public enum Product {
  /** Four models, tomorrow and the day after, one canvas per day. */
  TWO_DAY("two-day", OptionalInt.of(200)),
  /** ECMWF WRF days 1 to 7 across two canvases. */
  SEVEN_DAY("seven-day", OptionalInt.of(220)),
  /** Three days of pre-rendered air-quality overlays; no white filter. */
  AQI("aqi", OptionalInt.empty());

  private final String cliName;
  private final OptionalInt defaultWhiteThreshold;

  Product(String cliName, OptionalInt defaultWhiteThreshold) {
    this.cliName = cliName;
    this.defaultWhiteThreshold = defaultWhiteThreshold;
  }

  /** Name used on the command line and in configuration files. */
  public String cliName() {
    return cliName;
  }

  public OptionalInt defaultWhiteThreshold() {
    return defaultWhiteThreshold;
  }

  /**
   * Resolves a product from its command-line name, ignoring case.
   *
   * @param raw name such as {@code two-day}
   * @return matching product
   * @throws IllegalArgumentException when unknown
   */
  public static Product fromCliName(String raw) {
    if (raw != null) {
      String normalized = raw.trim().toLowerCase(Locale.ROOT);
      for (Product product : values()) {
        if (product.cliName.equals(normalized)) {
          return product;
        }
      }
    }
    throw new IllegalArgumentException("Unknown product: " + raw + " (expected two-day, seven-day or aqi)");
  }
}
