package io.wxpanel.domain.layout;

import io.wxpanel.domain.forecast.ForecastModel;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> One (model, day) compositing job.
 * <p><strong>Role:</strong> Immutable unit of work built at startup from the layout catalog and routed to
 * exactly one canvas.</p>
 *
 * @param id stable identifier used in logs and reports, e.g. {@code gfs_fnv3-d2}
 * @param model chart source
 * @param dayOffset forecast day, {@code 1} for tomorrow
 * @param canvasId destination canvas
 * @param placement layout, keep-region, and masks
 * @param whiteThreshold white filter threshold, or empty to skip the filter
 * @since 0.1.0
 */
public record UnitSpec(
    String id,
    ForecastModel model,
    int dayOffset,
    String canvasId,
    Placement placement,
    OptionalInt whiteThreshold) {

  public UnitSpec {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(canvasId, "canvasId");
    Objects.requireNonNull(placement, "placement");
    whiteThreshold = whiteThreshold == null ? OptionalInt.empty() : whiteThreshold;
    if (dayOffset < 1) {
      throw new IllegalArgumentException("dayOffset must be >= 1 (was " + dayOffset + ")");
    }
    if (whiteThreshold.isPresent()
        && (whiteThreshold.getAsInt() < 0 || whiteThreshold.getAsInt() > 255)) {
      throw new IllegalArgumentException("whiteThreshold must be between 0 and 255");
    }
  }

  /** Default identifier for a model and day, e.g. {@code ecmwf_wrf-d3}. */
  public static String defaultId(ForecastModel model, int dayOffset) {
    return model.id() + "-d" + dayOffset;
  }

  /**
   * Copy of this unit with a different threshold.
   *
   * @param threshold new threshold, or empty to disable the filter
   * @return updated unit
   */
  public UnitSpec withWhiteThreshold(OptionalInt threshold) {
    return new UnitSpec(id, model, dayOffset, canvasId, placement, threshold);
  }
}
