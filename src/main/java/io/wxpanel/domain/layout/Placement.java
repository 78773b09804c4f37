package io.wxpanel.domain.layout;

import io.wxpanel.domain.raster.PixelRect;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Where a chart lands on its canvas and which parts of it are hidden.
 *
 * @param layout target rectangle; the chart is resized to its rounded size
 * @param keep optional keep-region; only pixels strictly inside it survive
 * @param masks rectangles cleared after the keep-region clip, in order
 * @param paste how the resized chart reaches the canvas
 * @since 0.1.0
 */
public record Placement(PixelRect layout, Optional<PixelRect> keep, List<PixelRect> masks, Paste paste) {

  /** Compositing path for a placement. */
  public enum Paste {
    /** Paste onto a transparent layer, edit its alpha, then blend the layer over the canvas. */
    LAYERED,
    /** Paste straight onto the canvas using the chart's alpha as paste mask; no keep-region or masks. */
    DIRECT;

    /**
     * Parses {@code layered} or {@code direct}, ignoring case.
     *
     * @param raw configured value
     * @return matching mode
     * @throws IllegalArgumentException for any other value
     */
    public static Paste fromId(String raw) {
      String id = raw == null ? "" : raw.strip().toLowerCase(Locale.ROOT);
      return switch (id) {
        case "layered" -> LAYERED;
        case "direct" -> DIRECT;
        default -> throw new IllegalArgumentException("paste must be layered or direct (was '" + raw + "')");
      };
    }
  }

  public Placement {
    Objects.requireNonNull(layout, "layout");
    keep = keep == null ? Optional.empty() : keep;
    masks = masks == null ? List.of() : List.copyOf(masks);
    paste = paste == null ? Paste.LAYERED : paste;
    if (paste == Paste.DIRECT && (keep.isPresent() || !masks.isEmpty())) {
      throw new IllegalArgumentException("direct paste does not support keep-region or masks");
    }
  }

  public Placement(PixelRect layout, Optional<PixelRect> keep, List<PixelRect> masks) {
    this(layout, keep, masks, Paste.LAYERED);
  }

  /**
   * Layered placement without keep-region or masks.
   *
   * @param layout target rectangle
   * @return plain placement
   */
  public static Placement at(PixelRect layout) {
    return new Placement(layout, Optional.empty(), List.of(), Paste.LAYERED);
  }

  /**
   * Placement pasted straight onto the canvas.
   *
   * @param layout target rectangle
   * @return direct placement
   */
  public static Placement direct(PixelRect layout) {
    return new Placement(layout, Optional.empty(), List.of(), Paste.DIRECT);
  }
}
