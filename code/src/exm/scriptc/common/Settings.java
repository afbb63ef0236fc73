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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.scriptc.common.exceptions.InvalidOptionException;

/**
 * General analyzer settings.
 *
 * Values are Java properties: defaults are set here and can be
 * overridden with -D on the command line of whatever program embeds
 * the analyzer.
 * */
public class Settings
{
  public static final String LOG_FILE = "scriptc.log.file";
  public static final String LOG_TRACE = "scriptc.log.trace";

  /** Log the analyzed program after a successful run */
  public static final String DUMP_TREE = "scriptc.sema.dump-tree";

  /** Base name for counter variables introduced by times loops */
  public static final String COUNTER_NAME = "scriptc.sema.counter-name";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(DUMP_TREE, "false");
    defaults.setProperty(COUNTER_NAME, "anonymous");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Go back to defaults
   */
  public static void reset() {
    properties.clear();
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(DUMP_TREE);
    checkIdentifier(COUNTER_NAME);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  /**
   * Synthetic names are built from this value, so it must not contain
   * the marker character or whitespace
   * @param key
   * @throws InvalidOptionException
   */
  private static void checkIdentifier(String key)
                                      throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null || val.isEmpty()) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    for (int i = 0; i < val.length(); i++) {
      char c = val.charAt(i);
      if (!Character.isLetterOrDigit(c) && c != '_') {
        throw new InvalidOptionException("option " + key + " must be an " +
            "identifier, but was '" + val + "'");
      }
    }
  }

  public static String getIdentifier(String key)
                                   throws InvalidOptionException {
    checkIdentifier(key);
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}
