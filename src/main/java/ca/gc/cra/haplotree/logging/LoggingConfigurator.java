package ca.gc.cra.haplotree.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts HAPLOTREE runtime logging for CLI-driven workflows.
 * <p><strong>Role:</strong> Adapter-side utility that bridges the {@code --verbose} flag to the logging
 * backend.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
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

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   *
   * @return {@code true} when the level was changed or already DEBUG
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }

  /**
   * Returns the current root logger level name.
   *
   * @return level name, or {@code "UNKNOWN"} for non-Logback backends
   */
  public static String rootLevel() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Level level = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();
      return level == null ? "UNKNOWN" : level.toString();
    }
    return "UNKNOWN";
  }

  /**
   * Sets the root logger level; used to restore state after {@link #enableVerboseLogging()}.
   *
   * @param levelName Logback level name such as {@code INFO}
   */
  public static void setRootLevel(String levelName) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(levelName, Level.INFO));
    }
  }
}
