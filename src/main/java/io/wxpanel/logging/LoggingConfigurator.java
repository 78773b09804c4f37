package io.wxpanel.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runtime log-level switch behind {@code --verbose}.
 * <p><strong>Thread-safety:</strong> Call from the CLI thread before the run starts.</p>
 *
 * @implNote Only Logback levels can be changed; with another SLF4J binding the call logs a warning.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the root threshold to DEBUG so per-unit resolution and download details appear.
   *
   * @return {@code true} if the level was applied
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn("--verbose ignored: {} does not support level changes", factory.getClass().getName());
      return false;
    }
    context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
    return true;
  }
}
