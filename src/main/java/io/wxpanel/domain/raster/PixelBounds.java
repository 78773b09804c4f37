package io.wxpanel.domain.raster;

/**
 * Integer pixel rectangle obtained by rounding a {@link PixelRect}.
 *
 * @param x left column
 * @param y top row
 * @param width width in pixels
 * @param height height in pixels
 * @since 0.1.0
 */
public record PixelBounds(int x, int y, int width, int height) {

  public PixelBounds {
    if (width < 0 || height < 0) {
      throw new IllegalArgumentException("bounds extents must not be negative");
    }
  }

  /** Column of the far edge, {@code x + width}. */
  public int right() {
    return x + width;
  }

  /** Row of the far edge, {@code y + height}. */
  public int bottom() {
    return y + height;
  }

  /**
   * Reports whether the half-open area {@code [x, right) x [y, bottom)} lies within a canvas.
   *
   * @param canvasWidth canvas width
   * @param canvasHeight canvas height
   * @return {@code true} when fully inside
   */
  public boolean fitsWithin(int canvasWidth, int canvasHeight) {
    return x >= 0 && y >= 0 && right() <= canvasWidth && bottom() <= canvasHeight;
  }
}
