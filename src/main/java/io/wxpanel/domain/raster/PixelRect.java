package io.wxpanel.domain.raster;

/**
 * <strong>What:</strong> Rectangle in fractional canvas pixel coordinates as written in layout
 * configuration.
 * <p><strong>Role:</strong> Used for layout placement, keep-regions, and mask rectangles.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param x left edge in canvas pixels
 * @param y top edge in canvas pixels
 * @param width horizontal extent; must not be negative
 * @param height vertical extent; must not be negative
 * @implNote Rounding uses {@link Math#rint(double)} (nearest, ties to even) so that configured
 *     coordinates such as {@code 190.5} land on the same pixel as the published layouts.
 * @since 0.1.0
 */
public record PixelRect(double x, double y, double width, double height) {

  /**
   * Validates finite, non-negative extents.
   *
   * @throws IllegalArgumentException if any coordinate is not finite or an extent is negative
   */
  public PixelRect {
    if (!Double.isFinite(x) || !Double.isFinite(y) || !Double.isFinite(width) || !Double.isFinite(height)) {
      throw new IllegalArgumentException("rectangle coordinates must be finite");
    }
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("rectangle extents must not be negative (was " + width + "x" + height + ")");
    }
  }

  /**
   * Rounds every component to whole pixels.
   *
   * @return integer pixel bounds
   */
  public PixelBounds toBounds() {
    return new PixelBounds(round(x), round(y), round(width), round(height));
  }

  private static int round(double value) {
    return (int) Math.rint(value);
  }
}
