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
package exm.dcw.common;

import java.io.IOException;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.dcw.common.exceptions.DCWRuntimeError;

public class Logging
{
  private static final String DCW_LOGGER_NAME = "exm.dcw";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  public static Logger getDCWLogger()
  {
    return Logger.getLogger(DCW_LOGGER_NAME);
  }

  /**
   * Configure the project logger.
   * @param logfile file to append log output to, or null or empty
   *                to leave appenders as configured
   * @param trace true to log everything, false for warnings only
   * @return the project logger
   */
  public static Logger setupLogging(String logfile, boolean trace)
  {
    Logger dcwLogger = getDCWLogger();
    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(LOG_PATTERN);
      try {
        FileAppender appender = new FileAppender(layout, logfile);
        dcwLogger.addAppender(appender);
      } catch (IOException e) {
        throw new DCWRuntimeError("Could not open log file: " + logfile +
                                  ": " + e.getMessage());
      }
    }
    dcwLogger.setLevel(trace ? Level.TRACE : Level.WARN);
    return dcwLogger;
  }
}
