package io.wxpanel.application.pipeline;

import io.wxpanel.application.port.CanvasStorePort;
import io.wxpanel.application.port.FetchFailedException;
import io.wxpanel.application.port.ImageFetchPort;
import io.wxpanel.application.port.IssuanceTimePort;
import io.wxpanel.application.port.MetricsPort;
import io.wxpanel.application.port.MissingBackgroundException;
import io.wxpanel.application.port.OverlaySourcePort;
import io.wxpanel.domain.composite.CompositeFailedException;
import io.wxpanel.domain.composite.RegionCompositor;
import io.wxpanel.domain.forecast.ForecastModel;
import io.wxpanel.domain.forecast.IssuanceTime;
import io.wxpanel.domain.layout.CanvasSpec;
import io.wxpanel.domain.layout.ProductLayout;
import io.wxpanel.domain.layout.UnitSpec;
import io.wxpanel.domain.raster.RasterImage;
import io.wxpanel.domain.raster.WhiteToTransparencyFilter;
import io.wxpanel.infrastructure.exec.ExecutorFactories;
import io.wxpanel.logging.Logs;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs one product: fetches every unit's chart, composites it onto its canvas, and
 * saves each canvas once.
 * <p><strong>Why:</strong> Charts come from independent servers that fail independently; one missing
 * chart must not cost the operator the rest of the infographic.</p>
 * <p><strong>Role:</strong> Application-layer use case wired by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load all backgrounds before any network call; a missing one aborts the run.</li>
 *   <li>Per unit: issuance time, forecast step, URL, download, white filter.</li>
 *   <li>Composite in configured order and save every canvas, even when units fail.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent {@link #run(ProductLayout)} calls.
 * With {@code fetchWorkers > 1} downloads run on a worker pool, while compositing stays on the calling
 * thread in unit order.</p>
 * <p><strong>Observability:</strong> Tags unit work with MDC key {@code unit}; emits
 * {@code panel.unit.*}, {@code panel.canvas.*}, {@code panel.fetch.latencyMillis}, and
 * {@code panel.composite.latencyMillis}.</p>
 *
 * @since 0.1.0
 */
public final class ForecastPanelUseCase {
  private static final Logger log = LoggerFactory.getLogger(ForecastPanelUseCase.class);
  private static final String MDC_UNIT = "unit";
  private static final Duration WORKER_GRACE = Duration.ofSeconds(5);

  private final IssuanceTimePort issuanceTimes;
  private final ImageFetchPort images;
  private final OverlaySourcePort overlays;
  private final CanvasStorePort canvasStore;
  private final RegionCompositor compositor;
  private final MetricsPort metrics;
  private final int fetchWorkers;

  /**
   * Creates the use case.
   *
   * @param issuanceTimes issuance feed client
   * @param images chart downloader
   * @param overlays local overlay source
   * @param canvasStore background loader and output writer
   * @param compositor region compositor
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   * @param fetchWorkers number of parallel fetch workers, at least 1
   */
  public ForecastPanelUseCase(
      IssuanceTimePort issuanceTimes,
      ImageFetchPort images,
      OverlaySourcePort overlays,
      CanvasStorePort canvasStore,
      RegionCompositor compositor,
      MetricsPort metrics,
      int fetchWorkers) {
    this.issuanceTimes = Objects.requireNonNull(issuanceTimes, "issuanceTimes");
    this.images = Objects.requireNonNull(images, "images");
    this.overlays = Objects.requireNonNull(overlays, "overlays");
    this.canvasStore = Objects.requireNonNull(canvasStore, "canvasStore");
    this.compositor = Objects.requireNonNull(compositor, "compositor");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    if (fetchWorkers < 1) {
      throw new IllegalArgumentException("fetchWorkers must be >= 1");
    }
    this.fetchWorkers = fetchWorkers;
  }

  /**
   * Executes a product run.
   *
   * @param layout canvases and units of the product
   * @return outcome of every unit and the canvases written
   * @throws MissingBackgroundException if a background cannot be loaded; nothing is fetched or written
   * @throws InterruptedException if interrupted while waiting on fetch workers
   */
  public RunReport run(ProductLayout layout) throws MissingBackgroundException, InterruptedException {
    Objects.requireNonNull(layout, "layout");
    CanvasRouter router = CanvasRouter.load(layout, canvasStore);
    router.warnOutOfBounds();
    log.info("Running {} with {} unit(s) across {} canvas(es)",
        layout.product(), layout.units().size(), layout.canvases().size());

    IssuanceTimeCache issuance = new IssuanceTimeCache(issuanceTimes);
    List<Prepared> prepared = fetchWorkers == 1 || layout.units().size() <= 1
        ? prepareSequentially(layout.units(), issuance)
        : prepareInParallel(layout.product(), layout.units(), issuance);

    List<UnitResult> results = new ArrayList<>(prepared.size());
    for (Prepared unit : prepared) {
      results.add(unit.chart() == null ? unit.result() : compositeUnit(router, unit));
    }

    List<Path> saved = new ArrayList<>();
    List<String> failedCanvases = new ArrayList<>();
    for (Map.Entry<CanvasSpec, RasterImage> entry : router.canvases().entrySet()) {
      CanvasSpec spec = entry.getKey();
      try {
        Path path = canvasStore.save(spec, entry.getValue());
        saved.add(path);
        metrics.increment("panel.canvas.saved");
        log.info("Saved canvas {} to {}", spec.id(), path);
      } catch (IOException ex) {
        failedCanvases.add(spec.id());
        metrics.increment("panel.canvas.saveFailed");
        log.error("Failed to save canvas {} as {}", spec.id(), spec.output(), ex);
      }
    }

    RunReport report = new RunReport(layout.product(), results, saved, failedCanvases);
    log.info("Run finished: {}", report.summary());
    return report;
  }

  private List<Prepared> prepareSequentially(List<UnitSpec> units, IssuanceTimePort issuance)
      throws InterruptedException {
    List<Prepared> prepared = new ArrayList<>(units.size());
    for (UnitSpec unit : units) {
      prepared.add(prepare(unit, issuance));
    }
    return prepared;
  }

  private List<Prepared> prepareInParallel(String product, List<UnitSpec> units, IssuanceTimePort issuance)
      throws InterruptedException {
    ExecutorService executor = ExecutorFactories.newFetchPool(fetchWorkers, units.size(), product);
    try {
      List<Future<Prepared>> futures = new ArrayList<>(units.size());
      for (UnitSpec unit : units) {
        futures.add(executor.submit(() -> prepare(unit, issuance)));
      }
      List<Prepared> prepared = new ArrayList<>(units.size());
      for (int i = 0; i < futures.size(); i++) {
        prepared.add(await(futures.get(i), units.get(i)));
      }
      return prepared;
    } catch (InterruptedException ex) {
      log.warn("Fetch workers interrupted; cancelling outstanding downloads");
      executor.shutdownNow();
      throw ex;
    } finally {
      ExecutorFactories.shutdownAndAwait(executor, WORKER_GRACE);
    }
  }

  private Prepared await(Future<Prepared> future, UnitSpec unit) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof InterruptedException interrupted) {
        throw interrupted;
      }
      log.warn("Unit {} failed unexpectedly", unit.id(), cause);
      metrics.increment("panel.unit.fetchFailed");
      return Prepared.failed(unit, UnitOutcome.FETCH_FAILED, String.valueOf(cause));
    }
  }

  private Prepared prepare(UnitSpec unit, IssuanceTimePort issuance) throws InterruptedException {
    String previousUnit = MDC.get(MDC_UNIT);
    MDC.put(MDC_UNIT, unit.id());
    try {
      return unit.model().isRemote() ? prepareRemote(unit, issuance) : prepareOverlay(unit);
    } catch (RuntimeException ex) {
      log.warn("Unit {} failed unexpectedly", unit.id(), ex);
      metrics.increment("panel.unit.fetchFailed");
      return Prepared.failed(unit, UnitOutcome.FETCH_FAILED, String.valueOf(ex));
    } finally {
      restoreMdc(previousUnit);
    }
  }

  private Prepared prepareRemote(UnitSpec unit, IssuanceTimePort issuance) throws InterruptedException {
    ForecastModel model = unit.model();
    String feed = model.feedUrl().orElseThrow();
    IssuanceTime time;
    try {
      time = issuance.latest(feed);
    } catch (FetchFailedException ex) {
      log.warn("Skipping {}: issuance time unavailable from {} ({})", unit.id(), ex.url(), ex.getMessage());
      metrics.increment("panel.unit.issuanceFailed");
      return Prepared.failed(unit, UnitOutcome.ISSUANCE_FAILED, ex.getMessage());
    }

    Optional<String> step = model.resolveStep(time, unit.dayOffset());
    if (step.isEmpty()) {
      log.info("Skipping {}: no chart for day {} from issuance {}", unit.id(), unit.dayOffset(), time);
      metrics.increment("panel.unit.skipped");
      return Prepared.failed(unit, UnitOutcome.SKIPPED_NO_STEP, "issuance " + time);
    }

    String url = model.imageUrl(time, step.get());
    log.debug("Fetching {} step {} from {}", unit.id(), step.get(), url);
    long started = System.nanoTime();
    RasterImage chart;
    try {
      chart = images.fetch(url);
    } catch (FetchFailedException ex) {
      log.warn("Skipping {}: {}", unit.id(), ex.getMessage());
      metrics.increment("panel.unit.fetchFailed");
      return Prepared.failed(unit, UnitOutcome.FETCH_FAILED, ex.getMessage());
    } finally {
      metrics.observe("panel.fetch.latencyMillis", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
    }

    applyFilter(unit, chart);
    return Prepared.ready(unit, chart, url);
  }

  private Prepared prepareOverlay(UnitSpec unit) {
    Optional<RasterImage> overlay;
    try {
      overlay = overlays.overlay(unit.dayOffset());
    } catch (IOException ex) {
      log.warn("Skipping {}: overlay for day {} unreadable", unit.id(), unit.dayOffset(), ex);
      metrics.increment("panel.unit.fetchFailed");
      return Prepared.failed(unit, UnitOutcome.FETCH_FAILED, ex.getMessage());
    }
    if (overlay.isEmpty()) {
      log.warn("Skipping {}: no overlay rendered for day {}", unit.id(), unit.dayOffset());
      metrics.increment("panel.unit.skipped");
      return Prepared.failed(unit, UnitOutcome.SKIPPED_NO_OVERLAY, "day " + unit.dayOffset());
    }
    RasterImage chart = overlay.get();
    applyFilter(unit, chart);
    return Prepared.ready(unit, chart, "overlay day " + unit.dayOffset());
  }

  private void applyFilter(UnitSpec unit, RasterImage chart) {
    if (unit.whiteThreshold().isEmpty()) {
      return;
    }
    int threshold = unit.whiteThreshold().getAsInt();
    int cleared = WhiteToTransparencyFilter.apply(chart, threshold);
    log.debug("White filter (>{}) cleared {} pixel(s) of {}", threshold, cleared, unit.id());
  }

  private UnitResult compositeUnit(CanvasRouter router, Prepared prepared) {
    UnitSpec unit = prepared.unit();
    String previousUnit = MDC.get(MDC_UNIT);
    MDC.put(MDC_UNIT, unit.id());
    long started = System.nanoTime();
    try {
      RasterImage canvas = router.canvasFor(unit);
      int touched = compositor.composite(canvas, prepared.chart(), unit.placement());
      metrics.increment("panel.unit.composited");
      log.info("Composited {} onto {} ({} visible px)", unit.id(), unit.canvasId(), touched);
      return new UnitResult(unit.id(), UnitOutcome.COMPOSITED, prepared.result().detail());
    } catch (CompositeFailedException | RuntimeException ex) {
      metrics.increment("panel.unit.compositeFailed");
      log.warn("Skipping {}: composite failed ({})", unit.id(), ex.getMessage(), ex);
      return new UnitResult(unit.id(), UnitOutcome.COMPOSITE_FAILED, Logs.truncate(String.valueOf(ex.getMessage()), 200));
    } finally {
      metrics.observe("panel.composite.latencyMillis", TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started));
      restoreMdc(previousUnit);
    }
  }

  private static void restoreMdc(String previousUnit) {
    if (previousUnit == null) {
      MDC.remove(MDC_UNIT);
    } else {
      MDC.put(MDC_UNIT, previousUnit);
    }
  }

  /** Unit after its fetch stage: either a ready chart or a terminal result. */
  private record Prepared(UnitSpec unit, RasterImage chart, UnitResult result) {
    static Prepared ready(UnitSpec unit, RasterImage chart, String source) {
      return new Prepared(unit, chart, new UnitResult(unit.id(), UnitOutcome.COMPOSITED, source));
    }

    static Prepared failed(UnitSpec unit, UnitOutcome outcome, String detail) {
      return new Prepared(unit, null, new UnitResult(unit.id(), outcome, detail));
    }
  }
}
