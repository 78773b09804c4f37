package io.wxpanel.infrastructure.image;

import io.wxpanel.application.port.CanvasStorePort;
import io.wxpanel.application.port.MissingBackgroundException;
import io.wxpanel.domain.layout.CanvasSpec;
import io.wxpanel.domain.raster.RasterImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> File-system canvas storage.
 * <p><strong>Role:</strong> Reads backgrounds from {@code backgroundDir} and writes finished canvases as
 * PNG files under {@code outDir}, creating it when missing.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its two directories; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class FileCanvasStore implements CanvasStorePort {
  private static final Logger log = LoggerFactory.getLogger(FileCanvasStore.class);

  private final Path backgroundDirectory;
  private final Path outputDirectory;

  /**
   * @param backgroundDirectory directory holding background images
   * @param outputDirectory directory receiving finished canvases
   */
  public FileCanvasStore(Path backgroundDirectory, Path outputDirectory) {
    this.backgroundDirectory = Objects.requireNonNull(backgroundDirectory, "backgroundDirectory");
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
  }

  @Override
  public RasterImage load(CanvasSpec canvas) throws MissingBackgroundException {
    Path file = backgroundDirectory.resolve(canvas.background());
    if (!Files.isRegularFile(file)) {
      throw new MissingBackgroundException(file, "background for canvas " + canvas.id() + " not found: " + file, null);
    }
    try {
      return ImageCodec.read(file);
    } catch (IOException ex) {
      throw new MissingBackgroundException(
          file, "background for canvas " + canvas.id() + " unreadable: " + file + " (" + ex.getMessage() + ")", ex);
    }
  }

  @Override
  public Path save(CanvasSpec canvas, RasterImage image) throws IOException {
    ensureDirectory();
    Path file = outputDirectory.resolve(canvas.output());
    ImageCodec.writePng(image, file);
    log.debug("Wrote {} ({}x{})", file, image.width(), image.height());
    return file;
  }

  private void ensureDirectory() throws IOException {
    if (!Files.exists(outputDirectory)) {
      Files.createDirectories(outputDirectory);
    }
  }
}
