package io.wxpanel.application.port;

import io.wxpanel.domain.raster.RasterImage;

/**
 * Retrieves and decodes a remote chart image.
 *
 * <p>Implementations must be safe for concurrent calls from fetch workers.</p>
 *
 * @since 0.1.0
 */
public interface ImageFetchPort {
  /**
   * Downloads and decodes an image.
   *
   * @param url absolute image URL
   * @return decoded RGBA image
   * @throws FetchFailedException on transport error, timeout, non-2xx status, or undecodable body
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  RasterImage fetch(String url) throws FetchFailedException, InterruptedException;
}
