package io.wxpanel.domain.raster;

import java.util.Arrays;

/**
 * <strong>What:</strong> Mutable width x height grid of 8-bit RGBA pixels stored as packed,
 * non-premultiplied ARGB integers.
 * <p><strong>Why:</strong> Gives the filter, resampler, and compositor a single pixel buffer type that
 * does not depend on AWT.</p>
 * <p><strong>Role:</strong> Domain value shared by the fetch, filter, and composite stages; background
 * canvases are long-lived instances mutated in place.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. An image is owned by exactly one component at a
 * time and must not be shared across threads while being mutated.</p>
 * <p><strong>Performance:</strong> Backed by a single {@code int[]}; accessors are constant-time.</p>
 *
 * @since 0.1.0
 */
public final class RasterImage {
  private final int width;
  private final int height;
  private final int[] argb;

  /**
   * Allocates a fully transparent image.
   *
   * @param width pixel width; must be positive
   * @param height pixel height; must be positive
   * @throws IllegalArgumentException if either dimension is not positive
   */
  public RasterImage(int width, int height) {
    this(width, height, new int[checkedArea(width, height)]);
  }

  private RasterImage(int width, int height, int[] argb) {
    this.width = width;
    this.height = height;
    this.argb = argb;
  }

  /**
   * Wraps an existing ARGB array without copying; the caller hands over ownership.
   *
   * @param width pixel width; must be positive
   * @param height pixel height; must be positive
   * @param argb row-major packed pixels of length {@code width * height}
   * @return image backed by {@code argb}
   * @throws IllegalArgumentException if the dimensions do not match the array length
   */
  public static RasterImage wrap(int width, int height, int[] argb) {
    int area = checkedArea(width, height);
    if (argb == null || argb.length != area) {
      throw new IllegalArgumentException(
          "pixel array must hold " + area + " entries for " + width + "x" + height);
    }
    return new RasterImage(width, height, argb);
  }

  /**
   * Creates an image filled with a single packed ARGB value.
   *
   * @param width pixel width
   * @param height pixel height
   * @param argb fill colour
   * @return new filled image
   */
  public static RasterImage filled(int width, int height, int argb) {
    RasterImage image = new RasterImage(width, height);
    Arrays.fill(image.argb, argb);
    return image;
  }

  public int width() {
    return width;
  }

  public int height() {
    return height;
  }

  /**
   * Returns the live backing array (row-major, {@code y * width + x}).
   *
   * @return backing pixels; writes are visible through this image
   */
  public int[] pixels() {
    return argb;
  }

  public int get(int x, int y) {
    return argb[index(x, y)];
  }

  public void set(int x, int y, int value) {
    argb[index(x, y)] = value;
  }

  public int alpha(int x, int y) {
    return alphaOf(get(x, y));
  }

  /**
   * Reports whether another image has the same pixel dimensions.
   *
   * @param other image to compare
   * @return {@code true} when widths and heights match
   */
  public boolean sameSize(RasterImage other) {
    return other != null && other.width == width && other.height == height;
  }

  public boolean contains(int x, int y) {
    return x >= 0 && y >= 0 && x < width && y < height;
  }

  /**
   * Returns a deep copy of this image.
   *
   * @return independent image with identical pixels
   */
  public RasterImage copy() {
    return new RasterImage(width, height, argb.clone());
  }

  /**
   * Compares pixel content with another image.
   *
   * @param other image to compare
   * @return {@code true} when dimensions and every pixel match
   */
  public boolean samePixels(RasterImage other) {
    return sameSize(other) && Arrays.equals(argb, other.argb);
  }

  public static int pack(int a, int r, int g, int b) {
    return (a & 0xFF) << 24 | (r & 0xFF) << 16 | (g & 0xFF) << 8 | (b & 0xFF);
  }

  public static int alphaOf(int argb) {
    return argb >>> 24;
  }

  public static int redOf(int argb) {
    return (argb >> 16) & 0xFF;
  }

  public static int greenOf(int argb) {
    return (argb >> 8) & 0xFF;
  }

  public static int blueOf(int argb) {
    return argb & 0xFF;
  }

  public static int withAlpha(int argb, int alpha) {
    return (alpha & 0xFF) << 24 | (argb & 0x00FFFFFF);
  }

  @Override
  public String toString() {
    return "RasterImage{" + width + "x" + height + "}";
  }

  private int index(int x, int y) {
    if (!contains(x, y)) {
      throw new IndexOutOfBoundsException("(" + x + "," + y + ") outside " + width + "x" + height);
    }
    return y * width + x;
  }

  private static int checkedArea(int width, int height) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("image dimensions must be positive (was " + width + "x" + height + ")");
    }
    long area = (long) width * height;
    if (area > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("image too large: " + width + "x" + height);
    }
    return (int) area;
  }
}
