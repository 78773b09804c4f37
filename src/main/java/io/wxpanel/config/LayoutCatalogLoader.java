package io.wxpanel.config;

import io.wxpanel.domain.forecast.ForecastModel;
import io.wxpanel.domain.layout.CanvasSpec;
import io.wxpanel.domain.layout.Placement;
import io.wxpanel.domain.layout.ProductLayout;
import io.wxpanel.domain.layout.UnitSpec;
import io.wxpanel.domain.raster.PixelRect;
import io.wxpanel.validation.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * <strong>What:</strong> Reads product layouts (canvases, units, rectangles) from YAML.
 * <p><strong>Format:</strong>
 * <pre>{@code
 * products:
 *   two-day:
 *     whiteThreshold: 200
 *     canvases:
 *       - {id: tomorrow, background: twodays_background_1.png, output: Model_Forecast_Tomorrow.png}
 *     units:
 *       - model: cwa_qpf
 *         day: 1
 *         canvas: tomorrow
 *         geometry: &cwa
 *           layout: {x: 190.5, y: 572.6, width: 904.1, height: 1629}
 *           keep: {x: ..., y: ..., width: ..., height: ...}      # optional
 *           masks:
 *             - {x: 189.9, y: 572.6, width: 415.4, height: 189.4}
 *       - {model: cwa_qpf, day: 2, canvas: day-after, geometry: *cwa}
 * }</pre>
 * <p>A product without {@code whiteThreshold} falls back to {@link Product#defaultWhiteThreshold()}; a
 * unit may override it with its own {@code whiteThreshold}, or disable the filter with
 * {@code whiteThreshold: none}. Unit {@code id} defaults to {@code <model>-d<day>}. The
 * {@code layout}, {@code keep} and {@code masks} entries may sit directly on the unit or under a
 * {@code geometry} mapping, which YAML anchors can share between units. {@code paste: direct} pastes the
 * chart straight onto the canvas instead of through a masked layer; such units take no keep-region or
 * masks.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class LayoutCatalogLoader {
  private static final Logger log = LoggerFactory.getLogger(LayoutCatalogLoader.class);

  /** Classpath location of the bundled catalog. */
  public static final String BUNDLED_RESOURCE = "/wxpanel-layouts.yaml";

  private LayoutCatalogLoader() {}

  /**
   * Loads a product from a catalog file, or from the bundled catalog when no file is given.
   *
   * @param catalog optional catalog file
   * @param product product to load
   * @return validated layout
   * @throws IOException if the catalog cannot be read
   * @throws IllegalArgumentException if the catalog is malformed or lacks the product
   */
  public static ProductLayout load(Optional<Path> catalog, Product product) throws IOException {
    Objects.requireNonNull(catalog, "catalog");
    if (catalog.isEmpty()) {
      return loadBundled(product);
    }
    Path file = catalog.get();
    if (!Files.isRegularFile(file)) {
      throw new IOException("layout catalog not found: " + file);
    }
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return parse(reader, file.toString(), product);
    }
  }

  /**
   * Loads a product from the bundled catalog.
   *
   * @param product product to load
   * @return validated layout
   * @throws IOException if the bundled resource is missing
   */
  public static ProductLayout loadBundled(Product product) throws IOException {
    InputStream in = LayoutCatalogLoader.class.getResourceAsStream(BUNDLED_RESOURCE);
    if (in == null) {
      throw new IOException("bundled layout catalog " + BUNDLED_RESOURCE + " missing from classpath");
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return parse(reader, "classpath:" + BUNDLED_RESOURCE, product);
    }
  }

  /**
   * Parses a catalog document.
   *
   * @param reader YAML source
   * @param source description used in error messages
   * @param product product to extract
   * @return validated layout
   * @throws IllegalArgumentException if the document is malformed or lacks the product
   */
  public static ProductLayout parse(Reader reader, String source, Product product) {
    Objects.requireNonNull(reader, "reader");
    Objects.requireNonNull(product, "product");
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse layout catalog " + source, ex);
    }
    Map<?, ?> root = map(document, source);
    Map<?, ?> products = map(root.get("products"), source + ": products");
    Object section = products.get(product.cliName());
    if (section == null) {
      throw new IllegalArgumentException(source + " defines no layout for product " + product.cliName());
    }
    String context = source + ": products." + product.cliName();
    Map<?, ?> productMap = map(section, context);

    OptionalInt productThreshold = productMap.containsKey("whiteThreshold")
        ? threshold(productMap.get("whiteThreshold"), context + ".whiteThreshold")
        : product.defaultWhiteThreshold();

    List<CanvasSpec> canvases = new ArrayList<>();
    List<?> canvasNodes = list(productMap.get("canvases"), context + ".canvases");
    for (int i = 0; i < canvasNodes.size(); i++) {
      String at = context + ".canvases[" + i + "]";
      Map<?, ?> node = map(canvasNodes.get(i), at);
      canvases.add(new CanvasSpec(
          text(node, "id", at),
          Strings.requireFileName(at + ".background", text(node, "background", at)),
          Strings.requireFileName(at + ".output", text(node, "output", at))));
    }

    List<UnitSpec> units = new ArrayList<>();
    List<?> unitNodes = list(productMap.get("units"), context + ".units");
    for (int i = 0; i < unitNodes.size(); i++) {
      units.add(unit(map(unitNodes.get(i), context + ".units[" + i + "]"), context + ".units[" + i + "]",
          productThreshold));
    }

    ProductLayout layout;
    try {
      layout = new ProductLayout(product.cliName(), canvases, units);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(context + ": " + ex.getMessage(), ex);
    }
    log.debug("Loaded {} canvas(es) and {} unit(s) for {} from {}",
        canvases.size(), units.size(), product.cliName(), source);
    return layout;
  }

  private static UnitSpec unit(Map<?, ?> node, String at, OptionalInt productThreshold) {
    ForecastModel model;
    try {
      model = ForecastModel.fromId(text(node, "model", at));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(at + ".model: " + ex.getMessage(), ex);
    }
    int day = integer(node.get("day"), at + ".day");
    String id = node.containsKey("id") ? text(node, "id", at) : UnitSpec.defaultId(model, day);
    String geometryAt = node.containsKey("geometry") ? at + ".geometry" : at;
    Map<?, ?> geometry = node.containsKey("geometry") ? map(node.get("geometry"), geometryAt) : node;
    PixelRect layout = rect(geometry.get("layout"), geometryAt + ".layout");
    Optional<PixelRect> keep = geometry.get("keep") == null
        ? Optional.empty()
        : Optional.of(rect(geometry.get("keep"), geometryAt + ".keep"));
    List<PixelRect> masks = new ArrayList<>();
    if (geometry.get("masks") != null) {
      List<?> maskNodes = list(geometry.get("masks"), geometryAt + ".masks");
      for (int i = 0; i < maskNodes.size(); i++) {
        masks.add(rect(maskNodes.get(i), geometryAt + ".masks[" + i + "]"));
      }
    }
    Placement.Paste paste = Placement.Paste.LAYERED;
    if (geometry.get("paste") != null) {
      try {
        paste = Placement.Paste.fromId(String.valueOf(geometry.get("paste")));
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(geometryAt + ".paste: " + ex.getMessage(), ex);
      }
    }
    OptionalInt threshold = node.containsKey("whiteThreshold")
        ? threshold(node.get("whiteThreshold"), at + ".whiteThreshold")
        : productThreshold;
    try {
      return new UnitSpec(id, model, day, text(node, "canvas", at), new Placement(layout, keep, masks, paste), threshold);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(at + ": " + ex.getMessage(), ex);
    }
  }

  private static PixelRect rect(Object node, String at) {
    Map<?, ?> map = map(node, at);
    try {
      return new PixelRect(
          number(map.get("x"), at + ".x"),
          number(map.get("y"), at + ".y"),
          number(map.get("width"), at + ".width"),
          number(map.get("height"), at + ".height"));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(at + ": " + ex.getMessage(), ex);
    }
  }

  private static OptionalInt threshold(Object node, String at) {
    if (node == null || "none".equals(String.valueOf(node).trim())) {
      return OptionalInt.empty();
    }
    int value = integer(node, at);
    if (value < 0 || value > 255) {
      throw new IllegalArgumentException(at + " must be between 0 and 255 (was " + value + ")");
    }
    return OptionalInt.of(value);
  }

  private static double number(Object node, String at) {
    if (node instanceof Number number) {
      return number.doubleValue();
    }
    throw new IllegalArgumentException(at + " must be a number (was " + node + ")");
  }

  private static int integer(Object node, String at) {
    if (node instanceof Integer || node instanceof Long) {
      return ((Number) node).intValue();
    }
    throw new IllegalArgumentException(at + " must be an integer (was " + node + ")");
  }

  private static String text(Map<?, ?> node, String key, String at) {
    Object value = node.get(key);
    if (value == null) {
      throw new IllegalArgumentException(at + "." + key + " is required");
    }
    return Strings.requireNonBlank(at + "." + key, value.toString());
  }

  private static Map<?, ?> map(Object node, String at) {
    if (node instanceof Map<?, ?> map) {
      return map;
    }
    throw new IllegalArgumentException(at + " must be a mapping");
  }

  private static List<?> list(Object node, String at) {
    if (node instanceof List<?> list) {
      return list;
    }
    throw new IllegalArgumentException(at + " must be a list");
  }
}
