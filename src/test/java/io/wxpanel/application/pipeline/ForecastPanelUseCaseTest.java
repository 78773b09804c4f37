package io.wxpanel.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.wxpanel.application.port.MissingBackgroundException;
import io.wxpanel.domain.composite.RegionCompositor;
import io.wxpanel.domain.forecast.ForecastModel;
import io.wxpanel.domain.forecast.IssuanceTime;
import io.wxpanel.domain.layout.CanvasSpec;
import io.wxpanel.domain.layout.Placement;
import io.wxpanel.domain.layout.ProductLayout;
import io.wxpanel.domain.layout.UnitSpec;
import io.wxpanel.domain.raster.PixelRect;
import io.wxpanel.domain.raster.RasterImage;
import io.wxpanel.testutil.FakePorts;
import java.util.List;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ForecastPanelUseCaseTest {
  private static final String RUN = "2024061012";
  private static final int WHITE = RasterImage.pack(255, 255, 255, 255);
  private static final int RED = RasterImage.pack(255, 255, 0, 0);
  private static final int BLUE = RasterImage.pack(255, 0, 0, 255);

  private FakePorts.Issuance issuance;
  private FakePorts.Images images;
  private FakePorts.Overlays overlays;
  private FakePorts.Canvases canvases;
  private FakePorts.Metrics metrics;

  @BeforeEach
  void setUp() {
    issuance = new FakePorts.Issuance();
    images = new FakePorts.Images();
    overlays = new FakePorts.Overlays();
    canvases = new FakePorts.Canvases()
        .background("a.png", RasterImage.filled(20, 20, WHITE))
        .background("b.png", RasterImage.filled(20, 20, WHITE));
    metrics = new FakePorts.Metrics();
  }

  @Test
  void failedAndSkippedUnitsDoNotBlockTheRest() throws Exception {
    issuance.answer(feed(ForecastModel.ECMWF_WRF), RUN).answer(feed(ForecastModel.CWA_QPF), RUN)
        .answer(feed(ForecastModel.GSM_AI), RUN);
    images.serve(url(ForecastModel.ECMWF_WRF, "01"), RasterImage.filled(4, 4, RED));
    ProductLayout layout = layout(
        unit(ForecastModel.ECMWF_WRF, 1, "a", 0, 0),
        unit(ForecastModel.CWA_QPF, 1, "a", 10, 0),
        unit(ForecastModel.GSM_AI, 1, "a", 0, 10));

    RunReport report = useCase(1).run(layout);

    assertEquals(UnitOutcome.COMPOSITED, report.unit("ecmwf_wrf-d1").orElseThrow().outcome());
    assertEquals(UnitOutcome.SKIPPED_NO_STEP, report.unit("cwa_qpf-d1").orElseThrow().outcome());
    assertEquals(UnitOutcome.FETCH_FAILED, report.unit("gsm_ai-d1").orElseThrow().outcome());
    assertEquals(List.of("a-out.png", "b-out.png"), List.copyOf(canvases.saved().keySet()));
    RasterImage out = canvases.saved().get("a-out.png");
    assertEquals(RED, out.get(5, 5));
    assertEquals(WHITE, out.get(15, 5));
    assertEquals(WHITE, out.get(5, 15));
    assertFalse(report.hasSaveFailures());
    assertEquals(1, metrics.count("panel.unit.composited"));
    assertEquals(1, metrics.count("panel.unit.skipped"));
    assertEquals(1, metrics.count("panel.unit.fetchFailed"));
    assertEquals(2, metrics.count("panel.canvas.saved"));
  }

  @Test
  void sharedFeedIsQueriedOnceAndItsFailureSkipsEveryUnit() throws Exception {
    ProductLayout layout = layout(
        unit(ForecastModel.GFS_FNV3, 1, "a", 0, 0),
        unit(ForecastModel.GSM_AI, 1, "b", 0, 0));

    RunReport report = useCase(1).run(layout);

    assertEquals(2, report.count(UnitOutcome.ISSUANCE_FAILED));
    assertEquals(List.of(feed(ForecastModel.GFS_FNV3)), issuance.calls());
    assertTrue(images.calls().isEmpty());
    assertEquals(2, canvases.saved().size());
  }

  @Test
  void missingBackgroundAbortsBeforeAnyNetworkCall() {
    ProductLayout layout = new ProductLayout("p",
        List.of(new CanvasSpec("a", "a.png", "a-out.png"), new CanvasSpec("c", "missing.png", "c-out.png")),
        List.of(unit(ForecastModel.ECMWF_WRF, 1, "a", 0, 0)));

    MissingBackgroundException ex =
        assertThrows(MissingBackgroundException.class, () -> useCase(1).run(layout));

    assertEquals("missing.png", ex.path().toString());
    assertTrue(issuance.calls().isEmpty());
    assertTrue(canvases.saved().isEmpty());
  }

  @Test
  void whiteFilterMakesChartBackgroundTransparent() throws Exception {
    issuance.answer(feed(ForecastModel.ECMWF_WRF), RUN);
    RasterImage chart = RasterImage.filled(10, 10, RasterImage.pack(255, 250, 250, 250));
    chart.set(5, 5, BLUE);
    images.serve(url(ForecastModel.ECMWF_WRF, "02"), chart);
    RasterImage background = RasterImage.filled(20, 20, RED);
    canvases.background("a.png", background);
    UnitSpec unit = unit(ForecastModel.ECMWF_WRF, 2, "a", 0, 0).withWhiteThreshold(OptionalInt.of(200));

    RunReport report = useCase(1).run(layout(unit));

    assertEquals(1, report.count(UnitOutcome.COMPOSITED));
    RasterImage out = canvases.saved().get("a-out.png");
    assertEquals(RED, out.get(1, 1));
    assertEquals(BLUE, out.get(5, 5));
  }

  @Test
  void saveFailureIsReportedAndOtherCanvasesAreStillWritten() throws Exception {
    canvases.failSaving("a-out.png");

    RunReport report = useCase(1).run(layout());

    assertEquals(List.of("a"), report.failedCanvases());
    assertTrue(report.hasSaveFailures());
    assertEquals(List.of("b-out.png"), List.copyOf(canvases.saved().keySet()));
    assertEquals(1, metrics.count("panel.canvas.saveFailed"));
  }

  @Test
  void missingOverlaySkipsOnlyThatDay() throws Exception {
    overlays.put(1, RasterImage.filled(5, 5, BLUE)).put(3, RasterImage.filled(5, 5, RED));
    ProductLayout layout = layout(
        unit(ForecastModel.AQI, 1, "a", 0, 0),
        unit(ForecastModel.AQI, 2, "a", 10, 0),
        unit(ForecastModel.AQI, 3, "b", 0, 0));

    RunReport report = useCase(1).run(layout);

    assertEquals(UnitOutcome.SKIPPED_NO_OVERLAY, report.unit("aqi-d2").orElseThrow().outcome());
    assertEquals(2, report.count(UnitOutcome.COMPOSITED));
    assertEquals(BLUE, canvases.saved().get("a-out.png").get(2, 2));
    assertEquals(WHITE, canvases.saved().get("a-out.png").get(12, 2));
    assertEquals(RED, canvases.saved().get("b-out.png").get(2, 2));
    assertTrue(issuance.calls().isEmpty());
  }

  @Test
  void emptyLayoutIsReportedAsCompositeFailure() throws Exception {
    issuance.answer(feed(ForecastModel.ECMWF_WRF), RUN);
    images.serve(url(ForecastModel.ECMWF_WRF, "01"), RasterImage.filled(4, 4, RED));
    UnitSpec degenerate = new UnitSpec("ecmwf_wrf-d1", ForecastModel.ECMWF_WRF, 1, "a",
        Placement.at(new PixelRect(0, 0, 0.2, 10)), OptionalInt.empty());

    RunReport report = useCase(1).run(layout(degenerate));

    assertEquals(UnitOutcome.COMPOSITE_FAILED, report.unit("ecmwf_wrf-d1").orElseThrow().outcome());
    assertEquals(2, canvases.saved().size());
    assertEquals(1, metrics.count("panel.unit.compositeFailed"));
  }

  @Test
  void parallelFetchKeepsUnitOrderAndResults() throws Exception {
    issuance.answer(feed(ForecastModel.ECMWF_WRF), RUN);
    for (int day = 1; day <= 4; day++) {
      images.serve(url(ForecastModel.ECMWF_WRF, "0" + day), RasterImage.filled(3, 3, day % 2 == 0 ? RED : BLUE));
    }
    ProductLayout layout = layout(
        unit(ForecastModel.ECMWF_WRF, 1, "a", 0, 0),
        unit(ForecastModel.ECMWF_WRF, 2, "a", 10, 0),
        unit(ForecastModel.ECMWF_WRF, 3, "a", 0, 10),
        unit(ForecastModel.ECMWF_WRF, 4, "b", 0, 0),
        unit(ForecastModel.ECMWF_WRF, 5, "b", 10, 10));

    RunReport report = useCase(4).run(layout);

    assertEquals(List.of("ecmwf_wrf-d1", "ecmwf_wrf-d2", "ecmwf_wrf-d3", "ecmwf_wrf-d4", "ecmwf_wrf-d5"),
        report.units().stream().map(UnitResult::unitId).toList());
    assertEquals(4, report.count(UnitOutcome.COMPOSITED));
    assertEquals(UnitOutcome.FETCH_FAILED, report.unit("ecmwf_wrf-d5").orElseThrow().outcome());
    assertEquals(List.of(feed(ForecastModel.ECMWF_WRF)), issuance.calls());
    RasterImage a = canvases.saved().get("a-out.png");
    assertEquals(BLUE, a.get(5, 5));
    assertEquals(RED, a.get(15, 5));
    assertEquals(BLUE, a.get(5, 15));
    assertEquals(RED, canvases.saved().get("b-out.png").get(5, 5));
    assertEquals(5, metrics.observations("panel.fetch.latencyMillis"));
    assertEquals(4, metrics.observations("panel.composite.latencyMillis"));
  }

  @Test
  void rejectsNonPositiveWorkerCount() {
    assertThrows(IllegalArgumentException.class, () -> useCase(0));
  }

  private ForecastPanelUseCase useCase(int workers) {
    return new ForecastPanelUseCase(
        issuance, images, overlays, canvases, new RegionCompositor(), metrics, workers);
  }

  private static ProductLayout layout(UnitSpec... units) {
    return new ProductLayout("test",
        List.of(new CanvasSpec("a", "a.png", "a-out.png"), new CanvasSpec("b", "b.png", "b-out.png")),
        List.of(units));
  }

  private static UnitSpec unit(ForecastModel model, int day, String canvas, double x, double y) {
    return new UnitSpec(UnitSpec.defaultId(model, day), model, day, canvas,
        Placement.at(new PixelRect(x, y, 10, 10)), OptionalInt.empty());
  }

  private static String feed(ForecastModel model) {
    return model.feedUrl().orElseThrow();
  }

  private static String url(ForecastModel model, String step) {
    return model.imageUrl(new IssuanceTime(RUN), step);
  }
}
