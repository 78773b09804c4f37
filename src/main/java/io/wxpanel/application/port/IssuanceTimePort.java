package io.wxpanel.application.port;

import io.wxpanel.domain.forecast.IssuanceTime;

/**
 * Queries the latest issuance time published by a feed.
 *
 * @since 0.1.0
 */
public interface IssuanceTimePort {
  /**
   * Fetches and parses the feed.
   *
   * @param feedUrl feed URL
   * @return latest issuance time
   * @throws FetchFailedException when the request fails or the body has no usable timestamp
   * @throws InterruptedException if interrupted while waiting
   */
  IssuanceTime latest(String feedUrl) throws FetchFailedException, InterruptedException;
}
