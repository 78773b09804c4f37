package io.wxpanel.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the meter used by one panel run.
 *
 * <p>Settings come from the {@code otel.metrics.exporter}, {@code otel.exporter.otlp.endpoint} and
 * {@code otel.resource.attributes} system properties, falling back to the matching {@code OTEL_*}
 * environment variables. Anything other than {@code otlp} yields a no-op meter. A run is short, so the
 * periodic reader mostly idles; {@link MeterHandle#close()} pushes the final numbers.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "io.wxpanel";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(60);
  private static final long SHUTDOWN_WAIT_SECONDS = 5;

  private OpenTelemetryBootstrap() {
    // Utility
  }

  static MeterHandle open() {
    String exporter = setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "none");
    if (!"otlp".equalsIgnoreCase(exporter)) {
      if (!"none".equalsIgnoreCase(exporter)) {
        log.warn("Unknown metrics exporter '{}'; metrics disabled", exporter);
      }
      return MeterHandle.noop();
    }
    String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
    Attributes extra = parseResourceAttributes(
        setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
    try {
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MeterHandle handle = open(PeriodicMetricReader.builder(otlp).setInterval(EXPORT_INTERVAL).build(), extra);
      log.info("Exporting panel metrics via OTLP to {}", endpoint);
      return handle;
    } catch (RuntimeException ex) {
      log.error("OTLP metrics exporter could not start; metrics disabled", ex);
      return MeterHandle.noop();
    }
  }

  static MeterHandle open(MetricReader reader, Attributes extraResource) {
    Objects.requireNonNull(reader, "reader");
    String version = serviceVersion();
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.of(
            AttributeKey.stringKey("service.name"), "wxpanel",
            AttributeKey.stringKey("service.version"), version)))
        .merge(Resource.create(extraResource == null ? Attributes.empty() : extraResource));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new MeterHandle(meter, provider);
  }

  /**
   * Parses {@code k1=v1,k2=v2}; entries without a key or value are skipped with a warning.
   */
  static Attributes parseResourceAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null || raw.isBlank()) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      String[] pair = entry.strip().split("=", 2);
      if (pair[0].isBlank()) {
        continue;
      }
      if (pair.length < 2 || pair[1].isBlank()) {
        log.warn("Ignoring resource attribute without value: {}", entry.strip());
        continue;
      }
      builder.put(AttributeKey.stringKey(pair[0].strip()), pair[1].strip());
    }
    return builder.build();
  }

  private static String setting(String property, String env, String fallback) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? fallback : value.strip();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    String version = pkg == null ? null : pkg.getImplementationVersion();
    return version == null || version.isBlank() ? "dev" : version;
  }

  /** Meter plus the provider that owns it; a {@code null} provider means metrics are off. */
  record MeterHandle(Meter meter, SdkMeterProvider provider) implements AutoCloseable {

    static MeterHandle noop() {
      return new MeterHandle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    boolean enabled() {
      return provider != null;
    }

    void flush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String action) {
      result.join(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("Metrics {} did not complete within {}s", action, SHUTDOWN_WAIT_SECONDS);
      }
    }
  }
}
