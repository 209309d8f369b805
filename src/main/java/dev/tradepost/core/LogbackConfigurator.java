/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.Layout;
import ch.qos.logback.core.encoder.Encoder;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/** Configures the {@code tradepost} logger on Logback backends. */
final class LogbackConfigurator {
  private static final org.slf4j.Logger LOG = LoggerFactory.getLogger("tradepost");
  static final String LOGGER_NAME = "tradepost";
  static final String APPENDER_NAME = "tradepost-console";

  private LogbackConfigurator() {}

  static boolean configure(Config.Log logCfg) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      configure(context, logCfg);
      return true;
    }
    LOG.debug(
        "(tradepost) skipping logback configuration; factory is {}", factory.getClass().getName());
    return false;
  }

  /**
   * Sets the level of the {@code tradepost} logger and attaches a dedicated console appender
   * (pattern or JSON lines). Records stop propagating to root so they are not printed twice.
   */
  static void configure(LoggerContext context, Config.Log logCfg) {
    Logger logger = context.getLogger(LOGGER_NAME);
    Level level = Level.toLevel(logCfg.level().trim().toUpperCase(Locale.ROOT), null);
    if (level == null) {
      level = Level.INFO;
      LOG.warn("(tradepost) invalid core.log.level {}; defaulting to INFO", logCfg.level());
    }
    logger.setLevel(level);

    if (logger.getAppender(APPENDER_NAME) != null) {
      logger.detachAppender(APPENDER_NAME);
    }
    ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
    console.setName(APPENDER_NAME);
    console.setContext(context);
    console.setEncoder(logCfg.json() ? jsonEncoder(context) : patternEncoder(context));
    console.start();
    logger.addAppender(console);
    logger.setAdditive(false);
  }

  private static Encoder<ILoggingEvent> patternEncoder(LoggerContext context) {
    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{ISO8601} %-5level [%thread] %logger{36} - %msg%n");
    encoder.start();
    return encoder;
  }

  private static Encoder<ILoggingEvent> jsonEncoder(LoggerContext context) {
    Layout<ILoggingEvent> layout = new TradepostJsonLayout();
    layout.setContext(context);
    layout.start();

    LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
    encoder.setContext(context);
    encoder.setLayout(layout);
    encoder.start();
    return encoder;
  }
}
