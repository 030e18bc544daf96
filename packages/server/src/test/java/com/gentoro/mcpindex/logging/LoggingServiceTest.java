package com.gentoro.mcpindex.logging;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LoggingServiceTest {
  private static final String CACHE_LOGGER = "com.gentoro.mcpindex.cache";

  private final LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
  private final ch.qos.logback.classic.Logger root =
      ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
  private final List<Appender<ILoggingEvent>> savedAppenders = new ArrayList<>();
  private Level savedRootLevel;

  @BeforeEach
  void saveState() {
    root.iteratorForAppenders().forEachRemaining(savedAppenders::add);
    savedRootLevel = root.getLevel();
  }

  @AfterEach
  void restoreState() {
    Appender<ILoggingEvent> file = root.getAppender(LoggingService.FILE_APPENDER_NAME);
    if (file != null) {
      root.detachAppender(file);
      file.stop();
    }
    savedAppenders.forEach(
        app -> {
          if (root.getAppender(app.getName()) == null) {
            root.addAppender(app);
          }
        });
    root.setLevel(savedRootLevel);
    ctx.getLogger(CACHE_LOGGER).setLevel(null);
  }

  @Test
  @DisplayName("levels under logging.level are applied per logger, root included")
  void appliesConfiguredLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level.root", "WARN");
    cfg.addProperty("logging.level." + CACHE_LOGGER, "DEBUG");

    List<String> applied = LoggingService.applyLevels(cfg);

    assertTrue(applied.contains(org.slf4j.Logger.ROOT_LOGGER_NAME));
    assertTrue(applied.contains(CACHE_LOGGER));
    assertEquals(Level.WARN, root.getLevel());
    assertEquals(Level.DEBUG, ctx.getLogger(CACHE_LOGGER).getLevel());
  }

  @Test
  @DisplayName("unknown level names leave the logger untouched")
  void skipsUnknownLevels() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("logging.level." + CACHE_LOGGER, "LOUD");

    assertTrue(LoggingService.applyLevels(cfg).isEmpty());
    assertNull(ctx.getLogger(CACHE_LOGGER).getLevel());
    assertTrue(LoggingService.applyLevels(null).isEmpty());
  }

  @Test
  @DisplayName("file-only mode swaps console appenders for the rolling log file")
  void configureFileOnly(@TempDir Path dir) {
    Path logsDir = dir.resolve("logs");

    Path logFile = LoggingService.configureFileOnly(logsDir);
    LoggerFactory.getLogger(LoggingServiceTest.class).info("written to file");

    assertEquals(logsDir.resolve(LoggingService.LOG_FILE_NAME), logFile);
    assertTrue(Files.isDirectory(logsDir));
    assertNotNull(root.getAppender(LoggingService.FILE_APPENDER_NAME));
    List<Appender<ILoggingEvent>> remaining = new ArrayList<>();
    root.iteratorForAppenders().forEachRemaining(remaining::add);
    assertTrue(remaining.stream().noneMatch(app -> app instanceof ConsoleAppender));
    assertTrue(Files.exists(logFile));
  }
}
