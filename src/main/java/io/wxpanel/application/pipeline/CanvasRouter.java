package io.wxpanel.application.pipeline;

import io.wxpanel.application.port.CanvasStorePort;
import io.wxpanel.application.port.MissingBackgroundException;
import io.wxpanel.domain.layout.CanvasSpec;
import io.wxpanel.domain.layout.ProductLayout;
import io.wxpanel.domain.layout.UnitSpec;
import io.wxpanel.domain.raster.PixelBounds;
import io.wxpanel.domain.raster.RasterImage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Holds the loaded canvases of a run and maps each unit to its destination.
 * <p><strong>Role:</strong> Built once per run before any network activity; owns canvas lifetime until
 * the orchestrator saves them.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; canvases are mutated only by the orchestrating
 * thread.</p>
 *
 * @since 0.1.0
 */
final class CanvasRouter {
  private static final Logger log = LoggerFactory.getLogger(CanvasRouter.class);

  private final ProductLayout layout;
  private final Map<String, RasterImage> canvases;

  CanvasRouter(ProductLayout layout, Map<String, RasterImage> canvases) {
    this.layout = Objects.requireNonNull(layout, "layout");
    Objects.requireNonNull(canvases, "canvases");
    for (CanvasSpec spec : layout.canvases()) {
      if (!canvases.containsKey(spec.id())) {
        throw new IllegalArgumentException("no image loaded for canvas " + spec.id());
      }
    }
    this.canvases = new LinkedHashMap<>(canvases);
  }

  /**
   * Loads every background of a product, failing on the first missing one.
   *
   * @param layout product layout
   * @param store canvas storage
   * @return router over the loaded canvases
   * @throws MissingBackgroundException if any background is absent or unreadable
   */
  static CanvasRouter load(ProductLayout layout, CanvasStorePort store) throws MissingBackgroundException {
    Map<String, RasterImage> loaded = new LinkedHashMap<>();
    for (CanvasSpec spec : layout.canvases()) {
      RasterImage image = store.load(spec);
      log.debug("Loaded canvas {} from {} ({}x{})", spec.id(), spec.background(), image.width(), image.height());
      loaded.put(spec.id(), image);
    }
    return new CanvasRouter(layout, loaded);
  }

  /**
   * Destination canvas of a unit.
   *
   * @param unit unit of this product
   * @return live canvas image
   * @throws IllegalArgumentException if the unit targets an unknown canvas
   */
  RasterImage canvasFor(UnitSpec unit) {
    RasterImage canvas = canvases.get(unit.canvasId());
    if (canvas == null) {
      throw new IllegalArgumentException("unit " + unit.id() + " targets unknown canvas " + unit.canvasId());
    }
    return canvas;
  }

  /**
   * Lists units whose rounded layout extends past their canvas, logging each at WARN.
   *
   * <p>Out-of-bounds pixels are clipped during compositing; the warning only flags likely layout
   * mistakes.</p>
   *
   * @return identifiers of out-of-bounds units
   */
  List<String> warnOutOfBounds() {
    List<String> flagged = new ArrayList<>();
    for (UnitSpec unit : layout.units()) {
      RasterImage canvas = canvasFor(unit);
      PixelBounds bounds = unit.placement().layout().toBounds();
      if (!bounds.fitsWithin(canvas.width(), canvas.height())) {
        log.warn(
            "Layout of {} ({},{} {}x{}) exceeds canvas {} ({}x{}); outside pixels will be clipped",
            unit.id(), bounds.x(), bounds.y(), bounds.width(), bounds.height(),
            unit.canvasId(), canvas.width(), canvas.height());
        flagged.add(unit.id());
      }
    }
    return flagged;
  }

  /** Canvases in save order, keyed by canvas definition. */
  Map<CanvasSpec, RasterImage> canvases() {
    Map<CanvasSpec, RasterImage> ordered = new LinkedHashMap<>();
    for (CanvasSpec spec : layout.canvases()) {
      ordered.put(spec, canvases.get(spec.id()));
    }
    return Collections.unmodifiableMap(ordered);
  }
}
