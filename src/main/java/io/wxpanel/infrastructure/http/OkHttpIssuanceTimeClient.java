package io.wxpanel.infrastructure.http;

import io.wxpanel.application.port.FetchFailedException;
import io.wxpanel.application.port.IssuanceTimePort;
import io.wxpanel.domain.forecast.IssuanceTime;
import io.wxpanel.logging.Logs;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IssuanceTimePort} that reads the comma-separated feed body; the second field is the latest
 * issuance time.
 *
 * @since 0.1.0
 */
public final class OkHttpIssuanceTimeClient implements IssuanceTimePort {
  private static final Logger log = LoggerFactory.getLogger(OkHttpIssuanceTimeClient.class);

  private final OkHttpClient client;

  public OkHttpIssuanceTimeClient(Duration timeout) {
    this(InsecureOkHttp.client(timeout));
  }

  OkHttpIssuanceTimeClient(OkHttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public IssuanceTime latest(String feedUrl) throws FetchFailedException, InterruptedException {
    String payload = new String(HttpCalls.get(client, feedUrl), StandardCharsets.UTF_8);
    IssuanceTime time = IssuanceTime.fromFeedPayload(payload)
        .orElseThrow(() -> new FetchFailedException(feedUrl,
            "no issuance time in feed " + feedUrl + ": " + Logs.excerpt(payload)));
    log.info("Latest issuance from {} is {}", feedUrl, time);
    return time;
  }
}
