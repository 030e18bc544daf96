package com.gentoro.mcpindex.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import com.gentoro.mcpindex.exception.IoException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger lookup plus the two runtime adjustments the server makes to Logback: per-logger levels
 * from {@code logging.level.*} and the switch to a rolling file in interactive mode.
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  public static final String FILE_APPENDER_NAME = "FILE";
  public static final String LOG_FILE_NAME = "mcp-index.log";
  static final String FILE_PATTERN =
      "%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n";
  static final int FILE_HISTORY_DAYS = 7;

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Set logger levels from the {@code logging.level} subtree, e.g. {@code logging.level.root: INFO}
   * or {@code logging.level.com.gentoro.mcpindex.cache: DEBUG}. Unknown level names are skipped.
   *
   * @return the names of the loggers whose level was changed
   */
  public static List<String> applyLevels(Configuration cfg) {
    List<String> applied = new ArrayList<>();
    if (cfg == null) {
      return applied;
    }
    LoggerContext ctx = loggerContext();
    Configuration levels = cfg.subset("logging.level");
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String key = it.next();
      Level level = Level.toLevel(levels.getString(key, "").trim(), null);
      if (level == null) {
        log.warn("Ignoring unknown log level '{}' for {}", levels.getString(key), key);
        continue;
      }
      String name = "root".equalsIgnoreCase(key) ? Logger.ROOT_LOGGER_NAME : key;
      ctx.getLogger(name).setLevel(level);
      applied.add(name);
    }
    log.debug("Applied configured log levels to {}", applied);
    return applied;
  }

  /**
   * Detach every console appender from the root logger and log to {@code logsDir/mcp-index.log}
   * instead, rolled daily and kept for a week.
   *
   * @return the active log file
   */
  public static Path configureFileOnly(Path logsDir) {
    try {
      Files.createDirectories(logsDir);
    } catch (IOException e) {
      throw new IoException("Cannot create log directory: " + logsDir, e);
    }
    LoggerContext ctx = loggerContext();
    ch.qos.logback.classic.Logger root = ctx.getLogger(Logger.ROOT_LOGGER_NAME);

    List<Appender<ILoggingEvent>> consoles = new ArrayList<>();
    root.iteratorForAppenders()
        .forEachRemaining(
            app -> {
              if (app instanceof ConsoleAppender) {
                consoles.add(app);
              }
            });
    consoles.forEach(root::detachAppender);

    Path logFile = logsDir.resolve(LOG_FILE_NAME);
    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(ctx);
    fileAppender.setName(FILE_APPENDER_NAME);
    fileAppender.setFile(logFile.toString());

    TimeBasedRollingPolicy<ILoggingEvent> policy = new TimeBasedRollingPolicy<>();
    policy.setContext(ctx);
    policy.setParent(fileAppender);
    policy.setFileNamePattern(logsDir.resolve("mcp-index.%d{yyyy-MM-dd}.log.gz").toString());
    policy.setMaxHistory(FILE_HISTORY_DAYS);
    policy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(ctx);
    encoder.setPattern(FILE_PATTERN);
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(policy);
    fileAppender.start();
    root.addAppender(fileAppender);

    log.info("Console logging disabled ({} appenders); logging to {}", consoles.size(), logFile);
    return logFile;
  }

  private static LoggerContext loggerContext() {
    return (LoggerContext) LoggerFactory.getILoggerFactory();
  }
}
