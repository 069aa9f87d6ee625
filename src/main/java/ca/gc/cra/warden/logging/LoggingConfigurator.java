package ca.gc.cra.warden.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts the Logback root level from CLI flags and configuration.
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Only Logback supports dynamic changes; other SLF4J bindings keep their defaults and a warning is
 * logged.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the root logger to DEBUG ({@code --verbose}).
   */
  public static void enableVerboseLogging() {
    applyRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level by name.
   *
   * @param levelName one of TRACE, DEBUG, INFO, WARN, ERROR, OFF (case-insensitive)
   * @throws IllegalArgumentException when the name is blank or not a level
   */
  public static void applyRootLevel(String levelName) {
    Level level = parseLevel(levelName);
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

  static Level parseLevel(String levelName) {
    if (levelName == null || levelName.isBlank()) {
      throw new IllegalArgumentException("logLevel must not be blank");
    }
    String normalized = levelName.trim().toUpperCase(Locale.ROOT);
    // Level.toLevel silently falls back to DEBUG for unknown names
    Level level = Level.toLevel(normalized, null);
    if (level == null) {
      throw new IllegalArgumentException("logLevel must be TRACE, DEBUG, INFO, WARN, ERROR or OFF");
    }
    return level;
  }
}
