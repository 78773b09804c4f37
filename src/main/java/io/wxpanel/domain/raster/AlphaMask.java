package io.wxpanel.domain.raster;

import java.util.Objects;

/**
 * Editable single-channel alpha plane extracted from a layer.
 *
 * <p>Rectangle edits are inclusive of both edges, so clearing {@code (x, y, w, h)} zeroes columns
 * {@code x..x+w} and rows {@code y..y+h}. Coordinates falling outside the plane are ignored.</p>
 *
 * @since 0.1.0
 */
public final class AlphaMask {
  private final int width;
  private final int height;
  private final byte[] alpha;

  private AlphaMask(int width, int height, byte[] alpha) {
    this.width = width;
    this.height = height;
    this.alpha = alpha;
  }

  /**
   * Copies the alpha channel of a layer.
   *
   * @param layer source image; must not be {@code null}
   * @return independent mask of the same size
   */
  public static AlphaMask from(RasterImage layer) {
    Objects.requireNonNull(layer, "layer");
    int[] px = layer.pixels();
    byte[] a = new byte[px.length];
    for (int i = 0; i < px.length; i++) {
      a[i] = (byte) RasterImage.alphaOf(px[i]);
    }
    return new AlphaMask(layer.width(), layer.height(), a);
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  public int get(int x, int y) {
    return alpha[y * width + x] & 0xFF;
  }

  /**
   * Zeroes the inclusive area {@code [x, x+w] x [y, y+h]} clipped to the plane.
   *
   * @param bounds rectangle to clear
   */
  public void clear(PixelBounds bounds) {
    Objects.requireNonNull(bounds, "bounds");
    clearInclusive(bounds.x(), bounds.y(), bounds.right(), bounds.bottom());
  }

  /**
   * Zeroes everything except the strict interior of a keep-region.
   *
   * <p>Four inclusive strips are cleared: rows {@code 0..y}, rows {@code y+h..end}, and within rows
   * {@code y..y+h} columns {@code 0..x} and {@code x+w..end}. Only pixels with
   * {@code x < px < x+w} and {@code y < py < y+h} survive.</p>
   *
   * @param keep region whose interior is kept
   */
  public void clearOutside(PixelBounds keep) {
    Objects.requireNonNull(keep, "keep");
    int lastCol = width - 1;
    int lastRow = height - 1;
    clearInclusive(0, 0, lastCol, keep.y());
    clearInclusive(0, keep.bottom(), lastCol, lastRow);
    clearInclusive(0, keep.y(), keep.x(), keep.bottom());
    clearInclusive(keep.right(), keep.y(), lastCol, keep.bottom());
  }

  /**
   * Writes this mask into the alpha channel of a layer, keeping its colour channels.
   *
   * @param layer layer of identical size
   * @throws IllegalArgumentException if sizes differ
   */
  public void applyTo(RasterImage layer) {
    Objects.requireNonNull(layer, "layer");
    if (layer.width() != width || layer.height() != height) {
      throw new IllegalArgumentException("mask " + width + "x" + height + " does not match " + layer);
    }
    int[] px = layer.pixels();
    for (int i = 0; i < px.length; i++) {
      px[i] = RasterImage.withAlpha(px[i], alpha[i] & 0xFF);
    }
  }

  private void clearInclusive(int x0, int y0, int x1, int y1) {
    int fromX = Math.max(0, x0);
    int fromY = Math.max(0, y0);
    int toX = Math.min(width - 1, x1);
    int toY = Math.min(height - 1, y1);
    if (fromX > toX || fromY > toY) {
      return;
    }
    for (int y = fromY; y <= toY; y++) {
      int row = y * width;
      for (int x = fromX; x <= toX; x++) {
        alpha[row + x] = 0;
      }
    }
  }
}
