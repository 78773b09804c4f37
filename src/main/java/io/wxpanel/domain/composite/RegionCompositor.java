package io.wxpanel.domain.composite;

import io.wxpanel.domain.layout.Placement;
import io.wxpanel.domain.raster.AlphaMask;
import io.wxpanel.domain.raster.LanczosResampler;
import io.wxpanel.domain.raster.PixelBounds;
import io.wxpanel.domain.raster.PixelRect;
import io.wxpanel.domain.raster.RasterImage;
import java.util.Objects;

/**
 * <strong>What:</strong> Places one chart onto a canvas region, hiding the parts outside its keep-region
 * and under its mask rectangles.
 * <p><strong>Steps:</strong>
 * <ol>
 *   <li>Resize the chart to the rounded layout size (Lanczos-3).</li>
 *   <li>Paste it onto a transparent layer the size of the canvas at the rounded layout origin, using the
 *   chart's own alpha as paste mask; pixels beyond the canvas are dropped.</li>
 *   <li>Extract the layer alpha, clear everything outside the keep-region, then clear each mask
 *   rectangle.</li>
 *   <li>Write the edited alpha back and blend the layer over the canvas (Porter-Duff source-over).</li>
 * </ol>
 * <p>A {@link Placement.Paste#DIRECT} placement skips the layer: the resized chart is pasted straight onto
 * the canvas with its own alpha as paste mask, blending every canvas channel (alpha included).</p>
 * <p><strong>Failure atomicity:</strong> Every check runs and the complete layer is built before the
 * canvas is written, so a {@link CompositeFailedException} leaves the canvas untouched.</p>
 * <p><strong>Thread-safety:</strong> Stateless; a canvas must only be composited by one thread at a
 * time.</p>
 *
 * @since 0.1.0
 */
public class RegionCompositor {

  /**
   * Composites a chart onto a canvas in place.
   *
   * @param canvas destination canvas; mutated on success
   * @param chart chart image; not modified
   * @param placement layout, keep-region, and masks
   * @return number of canvas pixels touched by a visible layer pixel
   * @throws CompositeFailedException if the layout rounds to an empty size or the chart cannot be resized
   */
  public int composite(RasterImage canvas, RasterImage chart, Placement placement)
      throws CompositeFailedException {
    Objects.requireNonNull(canvas, "canvas");
    Objects.requireNonNull(chart, "chart");
    Objects.requireNonNull(placement, "placement");

    if (placement.paste() == Placement.Paste.DIRECT) {
      PixelBounds target = placement.layout().toBounds();
      return paste(canvas, resize(chart, target), target.x(), target.y());
    }
    RasterImage layer = buildLayer(canvas.width(), canvas.height(), chart, placement);
    return blendOver(canvas, layer, placement.layout().toBounds());
  }

  /**
   * Builds the masked scratch layer without touching any canvas.
   *
   * @param canvasWidth layer width
   * @param canvasHeight layer height
   * @param chart chart image
   * @param placement placement to apply
   * @return masked layer
   * @throws CompositeFailedException if the layout rounds to an empty size
   */
  RasterImage buildLayer(int canvasWidth, int canvasHeight, RasterImage chart, Placement placement)
      throws CompositeFailedException {
    PixelBounds target = placement.layout().toBounds();
    RasterImage resized = resize(chart, target);

    RasterImage layer = new RasterImage(canvasWidth, canvasHeight);
    paste(layer, resized, target.x(), target.y());

    AlphaMask mask = AlphaMask.from(layer);
    placement.keep().map(PixelRect::toBounds).ifPresent(mask::clearOutside);
    for (PixelRect rect : placement.masks()) {
      mask.clear(rect.toBounds());
    }
    mask.applyTo(layer);
    return layer;
  }

  private static RasterImage resize(RasterImage chart, PixelBounds target) throws CompositeFailedException {
    if (target.width() <= 0 || target.height() <= 0) {
      throw new CompositeFailedException(
          "layout rounds to an empty target " + target.width() + "x" + target.height());
    }
    try {
      return LanczosResampler.resize(chart, target.width(), target.height());
    } catch (IllegalArgumentException ex) {
      throw new CompositeFailedException("unable to resize chart to " + target, ex);
    }
  }

  /**
   * Pastes {@code image} onto {@code layer}, blending every channel by the image's own alpha.
   *
   * @return number of destination pixels under a non-transparent image pixel
   */
  private static int paste(RasterImage layer, RasterImage image, int originX, int originY) {
    int[] dst = layer.pixels();
    int[] src = image.pixels();
    int fromX = Math.max(0, originX);
    int fromY = Math.max(0, originY);
    int toX = Math.min(layer.width(), originX + image.width());
    int toY = Math.min(layer.height(), originY + image.height());
    int touched = 0;
    for (int y = fromY; y < toY; y++) {
      int srcRow = (y - originY) * image.width();
      int dstRow = y * layer.width();
      for (int x = fromX; x < toX; x++) {
        int p = src[srcRow + x - originX];
        int a = RasterImage.alphaOf(p);
        if (a == 0) {
          continue;
        }
        touched++;
        int d = dst[dstRow + x];
        dst[dstRow + x] = RasterImage.pack(
            blend(a, RasterImage.alphaOf(d), a),
            blend(RasterImage.redOf(p), RasterImage.redOf(d), a),
            blend(RasterImage.greenOf(p), RasterImage.greenOf(d), a),
            blend(RasterImage.blueOf(p), RasterImage.blueOf(d), a));
      }
    }
    return touched;
  }

  private static int blend(int in, int base, int mask) {
    return base + Math.round((in - base) * mask / 255f);
  }

  private static int blendOver(RasterImage canvas, RasterImage layer, PixelBounds region) {
    int[] dst = canvas.pixels();
    int[] src = layer.pixels();
    int width = canvas.width();
    int fromX = Math.max(0, region.x());
    int fromY = Math.max(0, region.y());
    int toX = Math.min(width, region.right());
    int toY = Math.min(canvas.height(), region.bottom());
    int touched = 0;
    for (int y = fromY; y < toY; y++) {
      int row = y * width;
      for (int x = fromX; x < toX; x++) {
        int i = row + x;
        int l = src[i];
        int la = RasterImage.alphaOf(l);
        if (la == 0) {
          continue;
        }
        touched++;
        if (la == 255) {
          dst[i] = l;
          continue;
        }
        dst[i] = over(l, dst[i]);
      }
    }
    return touched;
  }

  /** Straight-alpha source-over of one layer pixel onto one canvas pixel. */
  static int over(int layer, int canvas) {
    float la = RasterImage.alphaOf(layer) / 255f;
    float ca = RasterImage.alphaOf(canvas) / 255f;
    float oa = la + ca * (1f - la);
    if (oa <= 0f) {
      return 0;
    }
    float cw = ca * (1f - la);
    return RasterImage.pack(
        Math.round(oa * 255f),
        channel(RasterImage.redOf(layer), RasterImage.redOf(canvas), la, cw, oa),
        channel(RasterImage.greenOf(layer), RasterImage.greenOf(canvas), la, cw, oa),
        channel(RasterImage.blueOf(layer), RasterImage.blueOf(canvas), la, cw, oa));
  }

  private static int channel(int l, int c, float la, float cw, float oa) {
    int v = Math.round((l * la + c * cw) / oa);
    return Math.max(0, Math.min(255, v));
  }
}
