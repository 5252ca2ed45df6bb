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

package exm.sdg.common;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.sdg.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String SDG_LOGGER_NAME = "exm.sdg";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted, keyed by level and text
   */
  static final Set<String> emitted = new HashSet<String>();

  public static Logger getSDGLogger()
  {
    return Logger.getLogger(SDG_LOGGER_NAME);
  }

  /**
   * Configure the SDG logger.
   * @param logfile file to append log output to, or empty to keep
   *                whatever log4j configuration is already present
   * @param trace log everything down to trace level
   * @return the SDG logger
   * @throws InvalidOptionException if the log file cannot be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
                                          throws InvalidOptionException
  {
    Logger sdgLogger = getSDGLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                new PatternLayout(LOG_PATTERN), logfile, false);
        sdgLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                         logfile + ": " + e.getMessage());
      }
      sdgLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else if (trace) {
      sdgLogger.setLevel(Level.TRACE);
    }
    // Even if logging is disabled, this must be valid:
    return sdgLogger;
  }

  /**
   * Configure logging from {@link Settings}
   */
  public static Logger setupLogging() throws InvalidOptionException {
    return setupLogging(Settings.get(Settings.LOG_FILE),
                        Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static boolean addEmitted(Level level, String msg)
  {
    synchronized (emitted) {
      return emitted.add(level + ":" + msg);
    }
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getSDGLogger().warn(msg);
    else
      getSDGLogger().debug("Duplicate Warning: " + msg);
  }
}
