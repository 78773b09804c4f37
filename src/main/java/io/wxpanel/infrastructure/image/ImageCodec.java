package io.wxpanel.infrastructure.image;

import io.wxpanel.domain.raster.RasterImage;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import javax.imageio.ImageIO;

/**
 * Converts between encoded image files and {@link RasterImage} using ImageIO.
 *
 * <p>Any readable format (PNG, GIF, JPEG, BMP) decodes to non-premultiplied RGBA. Output is always
 * PNG.</p>
 *
 * @since 0.1.0
 */
public final class ImageCodec {
  static {
    ImageIO.setUseCache(false);
  }

  private ImageCodec() {
    // Utility
  }

  /**
   * Decodes an encoded image.
   *
   * @param encoded image bytes
   * @return RGBA raster
   * @throws IOException if no ImageIO reader recognises the bytes
   */
  public static RasterImage decode(byte[] encoded) throws IOException {
    Objects.requireNonNull(encoded, "encoded");
    try (InputStream in = new ByteArrayInputStream(encoded)) {
      return toRaster(ImageIO.read(in));
    }
  }

  /**
   * Reads and decodes an image file.
   *
   * @param file image file
   * @return RGBA raster
   * @throws IOException if the file cannot be read or decoded
   */
  public static RasterImage read(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    try (InputStream in = Files.newInputStream(file)) {
      return toRaster(ImageIO.read(in));
    }
  }

  /**
   * Encodes an image as PNG and writes it, replacing any existing file.
   *
   * <p>The image is written to a sibling temporary file first and then moved into place.</p>
   *
   * @param image image to write
   * @param file destination
   * @throws IOException if encoding or writing fails
   */
  public static void writePng(RasterImage image, Path file) throws IOException {
    Objects.requireNonNull(image, "image");
    Objects.requireNonNull(file, "file");
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
    try {
      if (!ImageIO.write(toBuffered(image), "png", temp.toFile())) {
        throw new IOException("no PNG writer available");
      }
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  static RasterImage toRaster(BufferedImage decoded) throws IOException {
    if (decoded == null) {
      throw new IOException("unsupported or corrupt image data");
    }
    int width = decoded.getWidth();
    int height = decoded.getHeight();
    if (width <= 0 || height <= 0) {
      throw new IOException("image has no pixels");
    }
    int[] argb = decoded.getRGB(0, 0, width, height, null, 0, width);
    return RasterImage.wrap(width, height, argb);
  }

  static BufferedImage toBuffered(RasterImage image) {
    BufferedImage out = new BufferedImage(image.width(), image.height(), BufferedImage.TYPE_INT_ARGB);
    out.setRGB(0, 0, image.width(), image.height(), image.pixels(), 0, image.width());
    return out;
  }
}
