package ca.gc.cra.netsim.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts simulator logging at runtime for CLI-driven lab runs.
 * <p><strong>Why:</strong> Per-packet forwarding decisions and timer firings are logged at DEBUG; {@code --verbose}
 * surfaces them without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings get a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String SIMULATOR_LOGGER = "ca.gc.cra.netsim";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger and the simulator's package logger to DEBUG.
   */
  public static void enableVerboseLogging() {
    setLevel(Level.DEBUG);
  }

  /**
   * Restores the simulator package logger to INFO, e.g. after a verbose test.
   */
  public static void resetLogging() {
    setLevel(Level.INFO);
  }

  private static void setLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      context.getLogger(SIMULATOR_LOGGER).setLevel(level);
      return;
    }
    log.warn("Logging level change to {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
