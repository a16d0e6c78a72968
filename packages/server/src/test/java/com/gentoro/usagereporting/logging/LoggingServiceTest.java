package com.gentoro.usagereporting.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {

  private static final String LOGGER = "com.gentoro.usagereporting.logging.sample";

  private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
  private final Level rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();

  @AfterEach
  void restore() {
    context.getLogger(LOGGER).setLevel(null);
    context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
  }

  @Test
  void appliesLevelsFromConfiguration() {
    Configuration config = new BaseConfiguration();
    config.setProperty("logging.level.root", "ERROR");
    config.setProperty("logging.level." + LOGGER, "trace");
    config.setProperty("usageReporting.apiKey", "unrelated");

    Map<String, Level> applied = LoggingService.applyConfiguration(config);

    assertEquals(Level.ERROR, applied.get(Logger.ROOT_LOGGER_NAME));
    assertEquals(Level.TRACE, applied.get(LOGGER));
    assertEquals(Level.TRACE, context.getLogger(LOGGER).getLevel());
    assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
  }

  @Test
  void skipsUnknownLevels() {
    Map<String, Level> applied = LoggingService.applyLevels(Map.of(LOGGER, "LOUD"));

    assertTrue(applied.isEmpty());
    assertNull(context.getLogger(LOGGER).getLevel());
  }

  @Test
  void nullConfigurationChangesNothing() {
    assertTrue(LoggingService.applyConfiguration(null).isEmpty());
  }
}
