package io.wxpanel.application.pipeline;

import io.wxpanel.application.port.FetchFailedException;
import io.wxpanel.application.port.IssuanceTimePort;
import io.wxpanel.domain.forecast.IssuanceTime;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

/**
 * Run-scoped memo of issuance feed lookups.
 *
 * <p>Each feed URL is queried at most once per run; concurrent callers for the same feed wait for the
 * first lookup. Failures are remembered as well, so every unit sharing a broken feed reports the same
 * error without another request. An interrupted lookup is evicted.</p>
 *
 * @since 0.1.0
 */
final class IssuanceTimeCache implements IssuanceTimePort {
  private final IssuanceTimePort delegate;
  private final ConcurrentMap<String, FutureTask<IssuanceTime>> lookups = new ConcurrentHashMap<>();

  IssuanceTimeCache(IssuanceTimePort delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public IssuanceTime latest(String feedUrl) throws FetchFailedException, InterruptedException {
    Objects.requireNonNull(feedUrl, "feedUrl");
    FutureTask<IssuanceTime> created = new FutureTask<>(() -> delegate.latest(feedUrl));
    FutureTask<IssuanceTime> lookup = lookups.putIfAbsent(feedUrl, created);
    if (lookup == null) {
      lookup = created;
      created.run();
    }
    try {
      return lookup.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof FetchFailedException failed) {
        throw failed;
      }
      if (cause instanceof InterruptedException interrupted) {
        lookups.remove(feedUrl, lookup);
        throw interrupted;
      }
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("issuance lookup failed for " + feedUrl, cause);
    }
  }

  /** Number of distinct feeds looked up so far. */
  int size() {
    return lookups.size();
  }
}
