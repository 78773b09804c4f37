package io.wxpanel.application.port;

import io.wxpanel.domain.layout.CanvasSpec;
import io.wxpanel.domain.raster.RasterImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Loads background canvases and persists finished ones.
 * <p><strong>Role:</strong> Output port of the run orchestrator; the file adapter reads from
 * {@code backgroundDir} and writes PNG files to {@code outDir}.</p>
 * <p><strong>Thread-safety:</strong> Called only from the orchestrating thread.</p>
 *
 * @since 0.1.0
 */
public interface CanvasStorePort {
  /**
   * Loads the background image for a canvas.
   *
   * @param canvas canvas description
   * @return decoded RGBA canvas
   * @throws MissingBackgroundException if the file is absent or cannot be decoded
   */
  RasterImage load(CanvasSpec canvas) throws MissingBackgroundException;

  /**
   * Persists a finished canvas.
   *
   * @param canvas canvas description
   * @param image finished image
   * @return path written
   * @throws IOException if the image cannot be written
   */
  Path save(CanvasSpec canvas, RasterImage image) throws IOException;
}
