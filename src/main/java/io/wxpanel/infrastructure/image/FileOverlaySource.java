package io.wxpanel.infrastructure.image;

import io.wxpanel.application.port.OverlaySourcePort;
import io.wxpanel.domain.raster.RasterImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads pre-rendered overlays named {@code aqi_day1.png}, {@code aqi_day2.png}, ... from a directory.
 *
 * @since 0.1.0
 */
public final class FileOverlaySource implements OverlaySourcePort {
  /** File name pattern; {@code %d} is the forecast day. */
  public static final String DEFAULT_PATTERN = "aqi_day%d.png";

  private final Path directory;
  private final String pattern;

  public FileOverlaySource(Path directory) {
    this(directory, DEFAULT_PATTERN);
  }

  public FileOverlaySource(Path directory, String pattern) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.pattern = Objects.requireNonNull(pattern, "pattern");
  }

  /** File consulted for a day. */
  public Path fileFor(int dayOffset) {
    return directory.resolve(String.format(pattern, dayOffset));
  }

  @Override
  public Optional<RasterImage> overlay(int dayOffset) throws IOException {
    Path file = fileFor(dayOffset);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    return Optional.of(ImageCodec.read(file));
  }
}
