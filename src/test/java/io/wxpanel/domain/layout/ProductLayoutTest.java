package io.wxpanel.domain.layout;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.wxpanel.domain.forecast.ForecastModel;
import io.wxpanel.domain.raster.PixelRect;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

class ProductLayoutTest {
  private static final Placement PLACEMENT = Placement.at(new PixelRect(0, 0, 10, 10));

  @Test
  void groupsUnitsByCanvasInDeclaredOrder() {
    ProductLayout layout = new ProductLayout("two-day",
        List.of(new CanvasSpec("b", "b.png", "b-out.png"), new CanvasSpec("a", "a.png", "a-out.png")),
        List.of(unit(ForecastModel.ECMWF_WRF, 1, "a"), unit(ForecastModel.GSM_AI, 1, "b"),
            unit(ForecastModel.ECMWF_WRF, 2, "b")));

    Map<String, List<UnitSpec>> grouped = layout.unitsByCanvas();

    assertEquals(List.of("b", "a"), List.copyOf(grouped.keySet()));
    assertEquals(List.of("gsm_ai-d1", "ecmwf_wrf-d2"),
        grouped.get("b").stream().map(UnitSpec::id).toList());
  }

  @Test
  void rejectsUnitOnUnknownCanvas() {
    assertThrows(IllegalArgumentException.class, () -> new ProductLayout("p",
        List.of(new CanvasSpec("a", "a.png", "o.png")),
        List.of(unit(ForecastModel.ECMWF_WRF, 1, "missing"))));
  }

  @Test
  void rejectsDuplicateIds() {
    CanvasSpec canvas = new CanvasSpec("a", "a.png", "o.png");
    assertThrows(IllegalArgumentException.class,
        () -> new ProductLayout("p", List.of(canvas, canvas), List.of()));
    assertThrows(IllegalArgumentException.class, () -> new ProductLayout("p", List.of(canvas),
        List.of(unit(ForecastModel.ECMWF_WRF, 1, "a"), unit(ForecastModel.ECMWF_WRF, 1, "a"))));
  }

  @Test
  void thresholdOverrideOnlyTouchesFilteringUnits() {
    UnitSpec filtered = unit(ForecastModel.ECMWF_WRF, 1, "a").withWhiteThreshold(OptionalInt.of(200));
    UnitSpec plain = unit(ForecastModel.AQI, 1, "a");
    ProductLayout layout = new ProductLayout("p",
        List.of(new CanvasSpec("a", "a.png", "o.png")), List.of(filtered, plain));

    ProductLayout updated = layout.withWhiteThreshold(180);

    assertEquals(OptionalInt.of(180), updated.units().get(0).whiteThreshold());
    assertTrue(updated.units().get(1).whiteThreshold().isEmpty());
  }

  @Test
  void unitRejectsDayZero() {
    assertThrows(IllegalArgumentException.class,
        () -> new UnitSpec("x", ForecastModel.AQI, 0, "a", PLACEMENT, OptionalInt.empty()));
  }

  private static UnitSpec unit(ForecastModel model, int day, String canvas) {
    return new UnitSpec(UnitSpec.defaultId(model, day), model, day, canvas, PLACEMENT, OptionalInt.empty());
  }
}
