/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.scriptc.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.scriptc.common.exceptions.InvalidOptionException;

public class Logging {
  private static final String SCRIPTC_LOGGER_NAME = "exm.scriptc";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /**
   * Messages already emitted.
   */
  private static final Set<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  private static final String FILE_APPENDER_NAME = "scriptc-file";

  /** File the file appender currently writes to, or null */
  private static String attachedLogFile = null;

  public static Logger getLogger() {
    return Logger.getLogger(SCRIPTC_LOGGER_NAME);
  }

  /**
   * Configure logging from the scriptc.log.file and scriptc.log.trace
   * settings.
   * @return the logger to use
   * @throws InvalidOptionException if a setting is bad or the log file
   *                                can't be opened
   */
  public static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    try {
      return setupLogging(logfile, trace);
    } catch (IOException e) {
      throw new InvalidOptionException("Could not open log file " +
                                      logfile + ": " + e.getMessage());
    }
  }

  /**
   * Send analyzer log output to a file.
   * @param logfile file to write to. If empty or null, leave log4j
   *                configuration alone.
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the logger to use
   * @throws IOException if log file can't be opened
   */
  public static synchronized Logger setupLogging(String logfile,
                                  boolean trace) throws IOException {
    Logger logger = getLogger();
    if (logfile != null && logfile.length() > 0) {
      if (!logfile.equals(attachedLogFile)) {
        Layout layout = new PatternLayout(LOG_PATTERN);
        // Append=false so each run starts a fresh log
        FileAppender appender = new FileAppender(layout, logfile, false);
        appender.setName(FILE_APPENDER_NAME);
        Appender previous = logger.getAppender(FILE_APPENDER_NAME);
        if (previous != null) {
          logger.removeAppender(previous);
          previous.close();
        }
        logger.addAppender(appender);
        attachedLogFile = logfile;
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    // Even if logging is disabled, this must be valid:
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.of(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (addEmitted(Level.WARN, msg)) {
      getLogger().warn(msg);
    } else {
      getLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
