package io.wxpanel.config;

import io.wxpanel.validation.Numbers;
import io.wxpanel.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Validated settings of one product run.
 * <p><strong>Role:</strong> Built by the CLI from merged defaults, YAML, and arguments; consumed by
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param product product to build
 * @param backgroundDirectory directory holding background images
 * @param outputDirectory directory receiving finished canvases
 * @param overlayDirectory directory holding pre-rendered overlays
 * @param whiteThresholdOverride threshold replacing the catalog value for filtered units, if set
 * @param fetchTimeout chart request timeout
 * @param issuanceTimeout issuance feed request timeout
 * @param fetchWorkers parallel fetch workers
 * @param layoutCatalog layout catalog file, or empty for the bundled catalog
 * @since 0.1.0
 */
public record PanelConfig(
    Product product,
    Path backgroundDirectory,
    Path outputDirectory,
    Path overlayDirectory,
    OptionalInt whiteThresholdOverride,
    Duration fetchTimeout,
    Duration issuanceTimeout,
    int fetchWorkers,
    Optional<Path> layoutCatalog) {

  public static final int MAX_FETCH_WORKERS = 16;
  private static final int MAX_TIMEOUT_MILLIS = 600_000;

  public PanelConfig {
    Objects.requireNonNull(product, "product");
    Objects.requireNonNull(backgroundDirectory, "backgroundDirectory");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    Objects.requireNonNull(overlayDirectory, "overlayDirectory");
    Objects.requireNonNull(fetchTimeout, "fetchTimeout");
    Objects.requireNonNull(issuanceTimeout, "issuanceTimeout");
    whiteThresholdOverride = whiteThresholdOverride == null ? OptionalInt.empty() : whiteThresholdOverride;
    layoutCatalog = layoutCatalog == null ? Optional.empty() : layoutCatalog;
    Numbers.requireRange("fetchWorkers", fetchWorkers, 1, MAX_FETCH_WORKERS);
  }

  /**
   * Embedded defaults for a product.
   *
   * @param product product to build
   * @return default configuration
   */
  public static PanelConfig defaults(Product product) {
    return fromMap(product, DefaultsForMode.asFlatMap(product));
  }

  /**
   * Parses and validates merged settings.
   *
   * @param product product to build
   * @param settings merged key/value settings
   * @return validated configuration
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static PanelConfig fromMap(Product product, Map<String, String> settings) {
    Objects.requireNonNull(product, "product");
    Map<String, String> map = settings == null ? Map.of() : settings;
    Map<String, String> defaults = DefaultsForMode.asFlatMap(product);

    Path backgroundDir = path(map, defaults, "backgroundDir");
    Path outDir = path(map, defaults, "outDir");
    Path overlayDir = path(map, defaults, "overlayDir");

    OptionalInt threshold = OptionalInt.empty();
    String rawThreshold = map.get("whiteThreshold");
    if (rawThreshold != null && !rawThreshold.isBlank()) {
      threshold = OptionalInt.of(Numbers.parseIntInRange("whiteThreshold", rawThreshold, 0, 255));
    }

    Duration fetchTimeout = Duration.ofMillis(
        Numbers.parseIntInRange("fetchTimeoutMillis", value(map, defaults, "fetchTimeoutMillis"), 1, MAX_TIMEOUT_MILLIS));
    Duration issuanceTimeout = Duration.ofMillis(
        Numbers.parseIntInRange("issuanceTimeoutMillis", value(map, defaults, "issuanceTimeoutMillis"), 1, MAX_TIMEOUT_MILLIS));
    int workers = Numbers.parseIntInRange("fetchWorkers", value(map, defaults, "fetchWorkers"), 1, MAX_FETCH_WORKERS);

    String layouts = map.getOrDefault("layouts", "");
    Optional<Path> catalog = layouts == null || layouts.isBlank()
        ? Optional.empty()
        : Optional.of(Path.of(Strings.requireNonBlank("layouts", layouts)));

    return new PanelConfig(
        product, backgroundDir, outDir, overlayDir, threshold, fetchTimeout, issuanceTimeout, workers, catalog);
  }

  private static Path path(Map<String, String> map, Map<String, String> defaults, String key) {
    return Path.of(Strings.requireNonBlank(key, value(map, defaults, key)));
  }

  private static String value(Map<String, String> map, Map<String, String> defaults, String key) {
    String raw = map.get(key);
    return raw == null || raw.isBlank() ? defaults.get(key) : raw;
  }
}
