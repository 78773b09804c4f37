package io.wxpanel.domain.raster;

import java.util.Objects;

/**
 * <strong>What:</strong> Makes near-white pixels fully transparent.
 * <p><strong>Why:</strong> Published rain charts carry a white map background that would otherwise hide
 * the infographic canvas beneath them.</p>
 * <p><strong>Behaviour:</strong> A pixel whose red, green, and blue channels are each strictly greater
 * than the threshold has its alpha set to {@code 0}; its colour channels are kept. Every other pixel is
 * left untouched, including its alpha.</p>
 * <p><strong>Thread-safety:</strong> Stateless; callers must not share the image being filtered.</p>
 *
 * @since 0.1.0
 */
public final class WhiteToTransparencyFilter {
  /** Largest threshold accepted; at this value no pixel can qualify. */
  public static final int MAX_THRESHOLD = 255;

  private WhiteToTransparencyFilter() {
    // Utility
  }

  /**
   * Applies the threshold pass in place.
   *
   * @param image image to mutate; must not be {@code null}
   * @param threshold channel threshold in {@code [0, 255]}
   * @return number of pixels whose alpha was cleared
   * @throws IllegalArgumentException if {@code threshold} is outside {@code [0, 255]}
   */
  public static int apply(RasterImage image, int threshold) {
    Objects.requireNonNull(image, "image");
    validateThreshold(threshold);
    int[] px = image.pixels();
    int cleared = 0;
    for (int i = 0; i < px.length; i++) {
      int p = px[i];
      if (RasterImage.redOf(p) > threshold
          && RasterImage.greenOf(p) > threshold
          && RasterImage.blueOf(p) > threshold) {
        if (RasterImage.alphaOf(p) != 0) {
          cleared++;
        }
        px[i] = p & 0x00FFFFFF;
      }
    }
    return cleared;
  }

  /**
   * Checks that a threshold lies in {@code [0, 255]}.
   *
   * @param threshold value to check
   * @return the same value
   * @throws IllegalArgumentException when out of range
   */
  public static int validateThreshold(int threshold) {
    if (threshold < 0 || threshold > MAX_THRESHOLD) {
      throw new IllegalArgumentException("white threshold must be between 0 and 255 (was " + threshold + ")");
    }
    return threshold;
  }
}
