package com.gentoro.usagereporting.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger access for the library, plus the {@code logging.level} section of the YAML file.
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.usagereporting.transport: DEBUG
 * </pre>
 */
public final class LoggingService {
  public static final String LEVELS_PREFIX = "logging.level";

  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /** Applies every level under {@code logging.level}. Returns the levels that were set. */
  public static Map<String, Level> applyConfiguration(Configuration config) {
    Map<String, String> requested = new LinkedHashMap<>();
    if (config != null) {
      Configuration levels = config.subset(LEVELS_PREFIX);
      for (Iterator<String> keys = levels.getKeys(); keys.hasNext(); ) {
        String name = keys.next();
        requested.put(name, levels.getString(name, null));
      }
    }
    return applyLevels(requested);
  }

  /**
   * Sets logger levels by name; {@code root} addresses the root logger. Blank or unknown levels are
   * skipped with a warning. Without Logback as the SLF4J binding nothing is changed.
   */
  public static Map<String, Level> applyLevels(Map<String, String> levelsByLogger) {
    Map<String, Level> applied = new LinkedHashMap<>();
    if (levelsByLogger.isEmpty()) return applied;

    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.warn(
          "Logging levels are only applied with Logback; found {}", factory.getClass().getName());
      return applied;
    }

    levelsByLogger.forEach(
        (name, value) -> {
          Level level = value == null ? null : Level.toLevel(value.trim(), null);
          if (level == null) {
            log.warn("Ignoring level '{}' for logger {}", value, name);
            return;
          }
          String loggerName = "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
          context.getLogger(loggerName).setLevel(level);
          applied.put(loggerName, level);
        });
    log.debug("Applied logging levels {}", applied);
    return applied;
  }
}
