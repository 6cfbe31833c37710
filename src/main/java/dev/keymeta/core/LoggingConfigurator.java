/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@code core.log} to the SLF4J backend.
 *
 * <p>Logback is optional at runtime; the call goes through reflection so that hosts binding
 * another SLF4J provider never load Logback classes.
 */
final class LoggingConfigurator {
  private static final Logger LOG = LoggerFactory.getLogger("keymeta");
  private static final String LOGBACK_CLASS = "dev.keymeta.core.LogbackConfigurator";

  private LoggingConfigurator() {}

  /**
   * Configures logging.
   *
   * @param logCfg logging block, ignored when {@code null}
   * @return {@code true} when the Logback configurator ran
   */
  static boolean configure(Config.Log logCfg) {
    if (logCfg == null) {
      return false;
    }
    try {
      Class<?> configurator = Class.forName(LOGBACK_CLASS);
      Method configure = configurator.getDeclaredMethod("configure", Config.Log.class);
      configure.setAccessible(true);
      configure.invoke(null, logCfg);
      return true;
    } catch (ClassNotFoundException | NoClassDefFoundError e) {
      LOG.debug("(keymeta) logback backend not detected; leaving logging at defaults");
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOG.warn("(keymeta) failed to configure logging: {}", cause.getMessage(), cause);
    } catch (ReflectiveOperationException e) {
      LOG.warn("(keymeta) failed to configure logging: {}", e.getMessage(), e);
    }
    return false;
  }
}
