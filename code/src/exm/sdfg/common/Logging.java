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
package exm.sdfg.common;

import java.io.IOException;
import java.util.HashSet;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.common.util.Pair;

public class Logging {
  private static final String SDFG_LOGGER_NAME = "exm.sdfg";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted.
   */
  private static final HashSet<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getSDFGLogger() {
    return Logger.getLogger(SDFG_LOGGER_NAME);
  }

  /**
   * Attach a file appender to the SDFG logger.
   * @param logfile file to log to.  If null or empty, leave logging
   *                configuration alone
   * @param trace if true, log everything down to trace level
   * @return the SDFG logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger sdfgLogger = getSDFGLogger();
    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(LOG_PATTERN);
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        sdfgLogger.addAppender(appender);
      } catch (IOException e) {
        throw new SDFGRuntimeError("Could not open log file: " + logfile
                                  + ": " + e.getMessage());
      }
      sdfgLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    }
    // Even if logging is disabled, this must be valid:
    return sdfgLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getSDFGLogger().warn(msg);
    } else {
      Logging.getSDFGLogger().debug("Duplicate Warning: " + msg);
    }
  }
}
