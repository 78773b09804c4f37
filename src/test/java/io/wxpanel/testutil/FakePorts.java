package io.wxpanel.testutil;

import io.wxpanel.application.port.CanvasStorePort;
import io.wxpanel.application.port.FetchFailedException;
import io.wxpanel.application.port.ImageFetchPort;
import io.wxpanel.application.port.IssuanceTimePort;
import io.wxpanel.application.port.MetricsPort;
import io.wxpanel.application.port.MissingBackgroundException;
import io.wxpanel.application.port.OverlaySourcePort;
import io.wxpanel.domain.forecast.IssuanceTime;
import io.wxpanel.domain.layout.CanvasSpec;
import io.wxpanel.domain.raster.RasterImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** In-memory port implementations for pipeline tests. */
public final class FakePorts {
  private FakePorts() {
    // Utility
  }

  /** Issuance feed answering from a map; unknown feeds fail. */
  public static final class Issuance implements IssuanceTimePort {
    private final Map<String, String> times = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public Issuance answer(String feedUrl, String time) {
      times.put(feedUrl, time);
      return this;
    }

    @Override
    public IssuanceTime latest(String feedUrl) throws FetchFailedException {
      calls.add(feedUrl);
      String time = times.get(feedUrl);
      if (time == null) {
        throw new FetchFailedException(feedUrl, "HTTP 503 from " + feedUrl);
      }
      return new IssuanceTime(time);
    }

    public List<String> calls() {
      return List.copyOf(calls);
    }
  }

  /** Image downloader serving copies of registered images; unknown URLs fail. */
  public static final class Images implements ImageFetchPort {
    private final Map<String, RasterImage> images = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public Images serve(String url, RasterImage image) {
      images.put(url, image);
      return this;
    }

    @Override
    public RasterImage fetch(String url) throws FetchFailedException {
      calls.add(url);
      RasterImage image = images.get(url);
      if (image == null) {
        throw new FetchFailedException(url, "HTTP 404 from " + url);
      }
      return image.copy();
    }

    public List<String> calls() {
      return List.copyOf(calls);
    }
  }

  /** Overlays keyed by day. */
  public static final class Overlays implements OverlaySourcePort {
    private final Map<Integer, RasterImage> overlays = new ConcurrentHashMap<>();

    public Overlays put(int day, RasterImage image) {
      overlays.put(day, image);
      return this;
    }

    @Override
    public Optional<RasterImage> overlay(int dayOffset) {
      return Optional.ofNullable(overlays.get(dayOffset)).map(RasterImage::copy);
    }
  }

  /** Canvas store holding backgrounds and saved outputs in memory. */
  public static final class Canvases implements CanvasStorePort {
    private final Map<String, RasterImage> backgrounds = new LinkedHashMap<>();
    private final Map<String, RasterImage> saved = new LinkedHashMap<>();
    private final Set<String> failingOutputs = new HashSet<>();

    public Canvases background(String fileName, RasterImage image) {
      backgrounds.put(fileName, image);
      return this;
    }

    public Canvases failSaving(String outputName) {
      failingOutputs.add(outputName);
      return this;
    }

    @Override
    public RasterImage load(CanvasSpec canvas) throws MissingBackgroundException {
      RasterImage image = backgrounds.get(canvas.background());
      if (image == null) {
        throw new MissingBackgroundException(Path.of(canvas.background()), "background missing", null);
      }
      return image.copy();
    }

    @Override
    public Path save(CanvasSpec canvas, RasterImage image) throws IOException {
      if (failingOutputs.contains(canvas.output())) {
        throw new IOException("disk full");
      }
      saved.put(canvas.output(), image.copy());
      return Path.of(canvas.output());
    }

    public Map<String, RasterImage> saved() {
      return saved;
    }
  }

  /** Metrics sink counting increments and observations by key. */
  public static final class Metrics implements MetricsPort {
    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> observations = new ConcurrentHashMap<>();

    @Override
    public void increment(String key) {
      counters.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void observe(String key, long value) {
      observations.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
    }

    public long count(String key) {
      AtomicLong value = counters.get(key);
      return value == null ? 0 : value.get();
    }

    public long observations(String key) {
      AtomicLong value = observations.get(key);
      return value == null ? 0 : value.get();
    }
  }
}
