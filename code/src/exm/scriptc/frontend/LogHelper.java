package exm.scriptc.frontend;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.scriptc.common.Logging;

/**
 * Helper functions to indent log messages by how deeply nested the
 * current scope is.
 *
 */
public class LogHelper {
  static final Logger logger = Logging.getLogger();

  public static void debug(Scope scope, String msg) {
    log(scope.getLevel(), Level.DEBUG, msg);
  }

  public static void trace(Scope scope, String msg) {
    log(scope.getLevel(), Level.TRACE, msg);
  }

  public static void log(int indent, Level level, String msg) {
    if (!logger.isEnabledFor(level)) {
      return;
    }
    logger.log(level, StringUtils.repeat(' ', indent * 2) + msg);
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }
}
