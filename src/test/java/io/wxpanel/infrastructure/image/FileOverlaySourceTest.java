package io.wxpanel.infrastructure.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.wxpanel.domain.raster.RasterImage;
import io.wxpanel.testutil.ImageFixtures;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileOverlaySourceTest {
  @TempDir Path tempDir;

  @Test
  void readsOverlayByDay() throws Exception {
    ImageFixtures.writePng(tempDir.resolve("aqi_day2.png"), RasterImage.filled(4, 3, RasterImage.pack(255, 0, 200, 0)));
    FileOverlaySource source = new FileOverlaySource(tempDir);

    RasterImage overlay = source.overlay(2).orElseThrow();

    assertEquals(4, overlay.width());
    assertEquals(tempDir.resolve("aqi_day2.png"), source.fileFor(2));
    assertTrue(source.overlay(1).isEmpty());
  }

  @Test
  void unreadableOverlayFails() throws Exception {
    Files.writeString(tempDir.resolve("day3.png"), "garbage");
    FileOverlaySource source = new FileOverlaySource(tempDir, "day%d.png");

    assertThrows(IOException.class, () -> source.overlay(3));
  }
}
