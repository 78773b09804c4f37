package io.wxpanel.infrastructure.http;

import io.wxpanel.application.port.FetchFailedException;
import io.wxpanel.application.port.ImageFetchPort;
import io.wxpanel.domain.raster.RasterImage;
import io.wxpanel.infrastructure.image.ImageCodec;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ImageFetchPort} backed by OkHttp and ImageIO.
 * <p><strong>Behaviour:</strong> Issues a GET with a bounded timeout, accepts self-signed certificates,
 * treats any non-2xx status or empty body as a failure, and decodes PNG, GIF, or JPEG into RGBA.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; OkHttp clients are shareable.</p>
 *
 * @since 0.1.0
 */
public final class OkHttpImageFetcher implements ImageFetchPort {
  private static final Logger log = LoggerFactory.getLogger(OkHttpImageFetcher.class);

  private final OkHttpClient client;

  public OkHttpImageFetcher(Duration timeout) {
    this(InsecureOkHttp.client(timeout));
  }

  OkHttpImageFetcher(OkHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public RasterImage fetch(String url) throws FetchFailedException, InterruptedException {
    byte[] body = HttpCalls.get(client, url);
    try {
      RasterImage image = ImageCodec.decode(body);
      log.debug("Decoded {} byte(s) from {} into {}", body.length, url, image);
      return image;
    } catch (IOException ex) {
      throw new FetchFailedException(url, "undecodable image from " + url + ": " + ex.getMessage(), ex);
    }
  }
}
