package io.wxpanel.domain.layout;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Canvases and units of one product, in configured order.
 *
 * <p>Construction checks that canvas and unit identifiers are unique and that every unit targets a
 * declared canvas.</p>
 *
 * @param product product name
 * @param canvases canvases in save order
 * @param units units in compositing order
 * @since 0.1.0
 */
public record ProductLayout(String product, List<CanvasSpec> canvases, List<UnitSpec> units) {
  public ProductLayout {
    Objects.requireNonNull(product, "product");
    canvases = List.copyOf(Objects.requireNonNull(canvases, "canvases"));
    units = List.copyOf(Objects.requireNonNull(units, "units"));
    if (canvases.isEmpty()) {
      throw new IllegalArgumentException("product " + product + " declares no canvases");
    }
    Set<String> canvasIds = new HashSet<>();
    for (CanvasSpec canvas : canvases) {
      if (!canvasIds.add(canvas.id())) {
        throw new IllegalArgumentException("duplicate canvas id '" + canvas.id() + "' in " + product);
      }
    }
    Set<String> unitIds = new HashSet<>();
    for (UnitSpec unit : units) {
      if (!unitIds.add(unit.id())) {
        throw new IllegalArgumentException("duplicate unit id '" + unit.id() + "' in " + product);
      }
      if (!canvasIds.contains(unit.canvasId())) {
        throw new IllegalArgumentException(
            "unit " + unit.id() + " targets unknown canvas '" + unit.canvasId() + "'");
      }
    }
  }

  public Optional<CanvasSpec> canvas(String id) {
    return canvases.stream().filter(c -> c.id().equals(id)).findFirst();
  }

  /**
   * Groups units by destination canvas, keeping canvas and unit order.
   *
   * @return canvas id to units
   */
  public Map<String, List<UnitSpec>> unitsByCanvas() {
    Map<String, List<UnitSpec>> grouped = new LinkedHashMap<>();
    for (CanvasSpec canvas : canvases) {
      grouped.put(canvas.id(), units.stream().filter(u -> u.canvasId().equals(canvas.id())).toList());
    }
    return grouped;
  }

  /**
   * Replaces the white threshold of every unit that filters.
   *
   * <p>Units without a threshold keep skipping the filter.</p>
   *
   * @param threshold new threshold in {@code [0, 255]}
   * @return updated layout
   */
  public ProductLayout withWhiteThreshold(int threshold) {
    List<UnitSpec> updated = units.stream()
        .map(u -> u.whiteThreshold().isPresent() ? u.withWhiteThreshold(OptionalInt.of(threshold)) : u)
        .toList();
    return new ProductLayout(product, canvases, updated);
  }
}
