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

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import com.google.common.collect.Ordering;

import exm.dcw.common.exceptions.InvalidOptionException;

/**
 * Writer and test settings, all held as strings.
 *
 * Every key has a default below.  A Java system property with the
 * same name replaces the default once {@link #initProperties()} runs.
 * */
public class Settings
{
  public static final String LOG_FILE = "dcw.log.file";
  public static final String LOG_TRACE = "dcw.log.trace";

  /** Location of fpc; empty to search PATH */
  public static final String FPC_EXECUTABLE = "dcw.fpc.executable";
  /** Location of dcc64; empty to search PATH */
  public static final String DCC64_EXECUTABLE = "dcw.dcc64.executable";

  public static final String TESTS_SKIP_FPC = "dcw.tests.skip-fpc";
  public static final String TESTS_SKIP_DCC64 = "dcw.tests.skip-dcc64";

  private static final List<String> BOOLEAN_KEYS = new ArrayList<String>();

  private static final Properties current;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(FPC_EXECUTABLE, "");
    defaults.setProperty(DCC64_EXECUTABLE, "");
    defaultBoolean(defaults, LOG_TRACE, false);
    // Compiler tests also skip themselves if the compiler is not found
    defaultBoolean(defaults, TESTS_SKIP_FPC, false);
    defaultBoolean(defaults, TESTS_SKIP_DCC64, false);
    current = new Properties(defaults);
  }

  private static void defaultBoolean(Properties defaults, String key,
                                     boolean value) {
    defaults.setProperty(key, Boolean.toString(value));
    BOOLEAN_KEYS.add(key);
  }

  /**
   * Take over system properties for all known keys
   * @throws InvalidOptionException if a system property has a bad value
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: current.stringPropertyNames()) {
      String override = System.getProperty(key);
      if (override != null) {
        current.setProperty(key, override);
      }
    }
    for (String key: BOOLEAN_KEYS) {
      getBoolean(key);
    }
  }

  public static void set(String key, String value) {
    current.setProperty(key, value);
  }

  /**
   * @return all known keys in alphabetical order
   */
  public static List<String> getKeys() {
    return Ordering.<String>natural().sortedCopy(
                                        current.stringPropertyNames());
  }

  /**
   * @return value, or null for an unknown key
   */
  public static String get(String key) {
    return current.getProperty(key);
  }

  public static boolean getBoolean(String key)
                                        throws InvalidOptionException {
    String value = current.getProperty(key);
    if (value == null) {
      throw new InvalidOptionException("no value for setting " + key);
    }
    if (value.equalsIgnoreCase("true")) {
      return true;
    }
    if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new InvalidOptionException("setting " + key +
              " must be true or false, but was '" + value + "'");
  }
}
