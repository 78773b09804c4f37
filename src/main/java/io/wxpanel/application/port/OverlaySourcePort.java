package io.wxpanel.application.port;

import io.wxpanel.domain.raster.RasterImage;
import java.io.IOException;
import java.util.Optional;

/**
 * Supplies finished overlay images (for example air-quality maps) by forecast day.
 *
 * @since 0.1.0
 */
public interface OverlaySourcePort {
  /**
   * Returns the overlay for a day.
   *
   * @param dayOffset forecast day, {@code 1} for tomorrow
   * @return overlay, or empty when none has been rendered for that day
   * @throws IOException if an overlay exists but cannot be read
   */
  Optional<RasterImage> overlay(int dayOffset) throws IOException;
}
