package io.wxpanel.infrastructure.exec;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread pools for chart downloads.
 *
 * @since 0.1.0
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {
    // Utility
  }

  /**
   * Builds a fixed pool sized for one product run.
   *
   * <p>The queue holds exactly {@code units} tasks, so submitting more than one task per unit is
   * rejected. Worker threads are daemons named {@code wxpanel-<product>-fetch-N}; uncaught failures
   * are logged.</p>
   *
   * @param workers worker thread count; must be positive
   * @param units number of units the run will submit; must be positive
   * @param product product name used in thread names; blank falls back to {@code panel}
   * @return executor ready for {@code units} submissions
   */
  public static ExecutorService newFetchPool(int workers, int units, String product) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive (was " + workers + ")");
    }
    if (units <= 0) {
      throw new IllegalArgumentException("units must be positive (was " + units + ")");
    }
    String prefix = "wxpanel-" + (product == null || product.isBlank() ? "panel" : product.strip()) + "-fetch-";
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory = runnable -> {
      Thread thread = new Thread(runnable, prefix + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(
          (t, ex) -> log.error("Uncaught failure on fetch worker {}", t.getName(), ex));
      return thread;
    };
    int threads = Math.min(workers, units);
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(units),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Shuts a pool down and waits for in-flight downloads.
   *
   * @param executor pool to stop
   * @param grace maximum wait
   * @return {@code true} if every worker finished within {@code grace}
   * @throws InterruptedException if interrupted while waiting; the pool is then forced down
   */
  public static boolean shutdownAndAwait(ExecutorService executor, Duration grace)
      throws InterruptedException {
    executor.shutdown();
    try {
      if (executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
        return true;
      }
      log.warn("Fetch workers still running after {} ms; interrupting", grace.toMillis());
      executor.shutdownNow();
      return false;
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      throw ex;
    }
  }
}
