package io.wxpanel.api;

import io.wxpanel.application.pipeline.ForecastPanelUseCase;
import io.wxpanel.application.pipeline.RunReport;
import io.wxpanel.application.port.MetricsPort;
import io.wxpanel.application.port.MissingBackgroundException;
import io.wxpanel.config.CompositionRoot;
import io.wxpanel.config.ConfigMerger;
import io.wxpanel.config.DefaultsForMode;
import io.wxpanel.config.PanelConfig;
import io.wxpanel.config.Product;
import io.wxpanel.config.YamlConfigLoader;
import io.wxpanel.domain.layout.CanvasSpec;
import io.wxpanel.domain.layout.Placement;
import io.wxpanel.domain.layout.ProductLayout;
import io.wxpanel.domain.layout.UnitSpec;
import io.wxpanel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.wxpanel.logging.LoggingConfigurator;
import io.wxpanel.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one infographic product from the command line.
 *
 * <p>Settings merge embedded defaults, an optional YAML file ({@code config=PATH}), and
 * {@code key=value} arguments. {@code --dry-run} validates everything and prints the plan without
 * network access or file writes.</p>
 *
 * @since 0.1.0
 */
public final class PanelCli {
  private static final Logger log = LoggerFactory.getLogger(PanelCli.class);
  private static final String SUMMARY_USAGE =
      "usage: wxpanel <two-day|seven-day|aqi> [backgroundDir=PATH] [outDir=PATH] [overlayDir=PATH] "
          + "[whiteThreshold=0..255] [fetchTimeoutMillis=MS] [issuanceTimeoutMillis=MS] "
          + "[fetchWorkers=1..16] [layouts=PATH] [config=PATH] [--dry-run] [--verbose] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      wxpanel %s

      Usage:
        wxpanel %s [options]

      Options:
        backgroundDir=PATH         Directory holding background images (default .)
        outDir=PATH                Output directory, created when missing (default ./outputs/Output)
        overlayDir=PATH            Pre-rendered AQI overlays aqi_dayN.png (default ./outputs/aqi)
        whiteThreshold=0..255      Override the white-to-transparency threshold
        fetchTimeoutMillis=MS      Chart request timeout (default 15000)
        issuanceTimeoutMillis=MS   Issuance feed timeout (default 10000)
        fetchWorkers=1..16         Parallel chart downloads (default 1)
        layouts=PATH               Layout catalog YAML replacing the bundled one
        config=PATH                YAML settings file (common + per-product sections)
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --dry-run                  Validate configuration and print the plan
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private PanelCli() {}

  /**
   * Executes a product run.
   *
   * @param product product to build
   * @param args arguments following the product name
   * @return exit code capturing the outcome
   */
  static ExitCode run(Product product, String[] args) {
    Objects.requireNonNull(product, "product");
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.formatted(product.cliName(), product.cliName()));
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", product.cliName());
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    boolean dryRunSetting = ConfigCliUtils.removeBoolean(kv, "dryRun");
    boolean dryRun = input.dryRun() || dryRunSetting;

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, product);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    PanelConfig config;
    String metricsExporter;
    try {
      Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          product, yamlConfig, kv, DefaultsForMode.asFlatMap(product), log::warn));
      metricsExporter = TelemetryConfigurator.configureMetrics(effective);
      config = PanelConfig.fromMap(product, effective);
      Paths.validateWritableDir(config.outputDirectory(), false);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", product.cliName(), ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Paths.validateReadableDir(config.backgroundDirectory());
    } catch (IllegalArgumentException ex) {
      log.error("Background directory unusable: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    if (dryRun) {
      return dryRun(config, metricsExporter);
    }

    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    try {
      return execute(new CompositionRoot(config, metrics), metricsExporter);
    } finally {
      metrics.close();
    }
  }

  private static ExitCode execute(CompositionRoot root, String metricsExporter) {
    PanelConfig config = root.config();
    try {
      ProductLayout layout = root.productLayout();
      ForecastPanelUseCase useCase = root.panelUseCase();
      log.info(
          "Configured {}: backgrounds={}, output={}, fetchWorkers={}, metricsExporter={}",
          config.product().cliName(),
          config.backgroundDirectory(),
          config.outputDirectory(),
          config.fetchWorkers(),
          metricsExporter);
      RunReport report = useCase.run(layout);
      CliPrinter.println(report.summary());
      return report.hasSaveFailures() ? ExitCode.IO_ERROR : ExitCode.SUCCESS;
    } catch (MissingBackgroundException ex) {
      log.error("Missing background: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Layout configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to load layout catalog", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} run interrupted; shutting down", config.product().cliName(), ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {} run", config.product().cliName(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode dryRun(PanelConfig config, String metricsExporter) {
    ProductLayout layout;
    try {
      layout = new CompositionRoot(config, MetricsPort.NO_OP).productLayout();
    } catch (IllegalArgumentException ex) {
      log.error("Layout configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to load layout catalog", ex);
      return ExitCode.IO_ERROR;
    }

    List<String> lines = new ArrayList<>();
    lines.add(config.product().cliName() + " dry-run: nothing will be fetched or written.");
    lines.add(" Background dir    : " + config.backgroundDirectory());
    lines.add(" Output dir        : " + config.outputDirectory());
    lines.add(" Overlay dir       : " + config.overlayDirectory());
    lines.add(" Layout catalog    : " + config.layoutCatalog().map(Path::toString).orElse("<bundled>"));
    lines.add(" Fetch timeout     : " + config.fetchTimeout().toMillis() + " ms");
    lines.add(" Issuance timeout  : " + config.issuanceTimeout().toMillis() + " ms");
    lines.add(" Fetch workers     : " + config.fetchWorkers());
    lines.add(" Metrics exporter  : " + metricsExporter);
    for (CanvasSpec canvas : layout.canvases()) {
      Path background = config.backgroundDirectory().resolve(canvas.background());
      lines.add(" Canvas " + canvas.id() + " : " + background
          + (Files.isRegularFile(background) ? "" : " (MISSING)") + " -> " + canvas.output());
      for (UnitSpec unit : layout.unitsByCanvas().get(canvas.id())) {
        lines.add("   unit " + unit.id() + " day " + unit.dayOffset()
            + ", masks " + unit.placement().masks().size()
            + (unit.placement().keep().isPresent() ? ", keep-region" : "")
            + (unit.placement().paste() == Placement.Paste.DIRECT ? ", direct paste" : "")
            + ", white threshold "
            + (unit.whiteThreshold().isPresent() ? unit.whiteThreshold().getAsInt() : "off"));
      }
    }
    lines.add(" Re-run without --dry-run to build the panels.");
    CliPrinter.printLines(lines);
    return ExitCode.SUCCESS;
  }
}
