package io.wxpanel.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.wxpanel.application.port.FetchFailedException;
import io.wxpanel.application.port.IssuanceTimePort;
import io.wxpanel.domain.forecast.IssuanceTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class IssuanceTimeCacheTest {

  @Test
  void eachFeedIsQueriedOnce() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    IssuanceTimeCache cache = new IssuanceTimeCache(feed -> {
      calls.incrementAndGet();
      return new IssuanceTime(feed.endsWith("A") ? "2024061000" : "2024061012");
    });

    IssuanceTime first = cache.latest("feed-A");
    IssuanceTime second = cache.latest("feed-A");
    cache.latest("feed-B");

    assertSame(first, second);
    assertEquals(2, calls.get());
    assertEquals(2, cache.size());
  }

  @Test
  void failuresAreRememberedForTheRun() {
    AtomicInteger calls = new AtomicInteger();
    IssuanceTimeCache cache = new IssuanceTimeCache(feed -> {
      calls.incrementAndGet();
      throw new FetchFailedException(feed, "HTTP 500");
    });

    FetchFailedException first = assertThrows(FetchFailedException.class, () -> cache.latest("feed"));
    FetchFailedException second = assertThrows(FetchFailedException.class, () -> cache.latest("feed"));

    assertSame(first, second);
    assertEquals("feed", first.url());
    assertEquals(1, calls.get());
  }

  @Test
  void concurrentCallersShareOneLookup() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    CountDownLatch release = new CountDownLatch(1);
    IssuanceTimePort slow = feed -> {
      calls.incrementAndGet();
      release.await(5, TimeUnit.SECONDS);
      return new IssuanceTime("2024061009");
    };
    IssuanceTimeCache cache = new IssuanceTimeCache(slow);
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<IssuanceTime>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        futures.add(pool.submit(() -> cache.latest("feed")));
      }
      release.countDown();
      for (Future<IssuanceTime> future : futures) {
        assertEquals("2024061009", future.get(5, TimeUnit.SECONDS).full());
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, calls.get());
  }

  @Test
  void runtimeFailuresPropagateUnchanged() {
    IssuanceTimeCache cache = new IssuanceTimeCache(feed -> {
      throw new IllegalStateException("boom");
    });

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> cache.latest("feed"));
    assertEquals("boom", ex.getMessage());
  }
}
