package io.wxpanel.config;

import io.wxpanel.application.pipeline.ForecastPanelUseCase;
import io.wxpanel.application.port.MetricsPort;
import io.wxpanel.domain.composite.RegionCompositor;
import io.wxpanel.domain.layout.ProductLayout;
import io.wxpanel.infrastructure.http.OkHttpImageFetcher;
import io.wxpanel.infrastructure.http.OkHttpIssuanceTimeClient;
import io.wxpanel.infrastructure.image.FileCanvasStore;
import io.wxpanel.infrastructure.image.FileOverlaySource;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a {@link ForecastPanelUseCase} and its layout from a validated
 * {@link PanelConfig}.
 * <p><strong>Role:</strong> Single place where configuration meets concrete adapters (OkHttp clients,
 * file canvas store, file overlay source, OpenTelemetry metrics).</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final PanelConfig config;
  private final MetricsPort metrics;

  /**
   * @param config validated run configuration
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   */
  public CompositionRoot(PanelConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Loads the product layout and applies the configured threshold override.
   *
   * @return layout ready to run
   * @throws IOException if the catalog cannot be read
   * @throws IllegalArgumentException if the catalog is invalid
   */
  public ProductLayout productLayout() throws IOException {
    ProductLayout layout = LayoutCatalogLoader.load(config.layoutCatalog(), config.product());
    if (config.whiteThresholdOverride().isEmpty()) {
      return layout;
    }
    int threshold = config.whiteThresholdOverride().getAsInt();
    boolean anyFiltered = layout.units().stream().anyMatch(u -> u.whiteThreshold().isPresent());
    if (!anyFiltered) {
      log.warn("whiteThreshold={} ignored: {} does not filter white pixels", threshold, config.product().cliName());
      return layout;
    }
    log.info("Using white threshold {} for {}", threshold, config.product().cliName());
    return layout.withWhiteThreshold(threshold);
  }

  /**
   * Builds the run use case with production adapters.
   *
   * @return configured use case
   */
  public ForecastPanelUseCase panelUseCase() {
    return new ForecastPanelUseCase(
        new OkHttpIssuanceTimeClient(config.issuanceTimeout()),
        new OkHttpImageFetcher(config.fetchTimeout()),
        new FileOverlaySource(config.overlayDirectory()),
        new FileCanvasStore(config.backgroundDirectory(), config.outputDirectory()),
        new RegionCompositor(),
        metrics,
        config.fetchWorkers());
  }

  public PanelConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }
}
