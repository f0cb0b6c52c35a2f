package ca.gc.cra.subconv.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the root log level for command-line runs.
 * <p><strong>Why:</strong> {@code --verbose} should surface per-link decode diagnostics without editing
 * {@code logback.xml}.</p>
 * <p><strong>Role:</strong> Adapter-side utility bridging CLI flags to Logback.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI bootstrap.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Raises the root logger level to DEBUG within the running JVM. */
  public static void enableVerboseLogging() {
    setRootLevel(Level.DEBUG);
  }

  private static void setRootLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!level.equals(root.getLevel())) {
        root.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
