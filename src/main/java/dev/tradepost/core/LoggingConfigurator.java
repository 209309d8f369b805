/* Tradepost © 2025 Tradepost Devs — MIT */
package dev.tradepost.core;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code core.log} to the active logging backend. Logback is reached reflectively so a
 * host that binds SLF4J to another backend keeps its own configuration.
 */
final class LoggingConfigurator {
  private static final Logger LOG = LoggerFactory.getLogger("tradepost");
  private static final String LOGBACK_CLASS = "dev.tradepost.core.LogbackConfigurator";

  private LoggingConfigurator() {}

  /**
   * Configures logging.
   *
   * @param logCfg logging block
   * @return {@code true} when the Logback backend was configured
   */
  static boolean configure(Config.Log logCfg) {
    if (logCfg == null) {
      return false;
    }
    try {
      Class<?> configurator = Class.forName(LOGBACK_CLASS);
      Method configure = configurator.getDeclaredMethod("configure", Config.Log.class);
      configure.setAccessible(true);
      return Boolean.TRUE.equals(configure.invoke(null, logCfg));
    } catch (ClassNotFoundException | NoClassDefFoundError e) {
      LOG.debug("(tradepost) logback backend not detected; leaving logging at defaults");
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOG.warn("(tradepost) failed to configure logging: {}", cause.getMessage(), cause);
    } catch (ReflectiveOperationException e) {
      LOG.warn("(tradepost) failed to configure logging: {}", e.getMessage(), e);
    }
    return false;
  }
}
