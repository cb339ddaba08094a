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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.sdfg.common.exceptions.InvalidOptionException;

/**
 * General SDFG settings
 *
 * List of Java properties not processed here:
 * sdfg.log.file and sdfg.log.trace are read by whoever sets up logging
 * */
public class Settings
{
  public static final String OPT_INLINE_NESTED = "sdfg.opt.inline-nested";
  public static final String OPT_NEST_SDFG = "sdfg.opt.nest-sdfg";
  /* Promote transients outside any map scope to outputs when nesting */
  public static final String OPT_PROMOTE_GLOBAL_TRANSIENTS =
                            "sdfg.opt.promote-global-transients";
  public static final String OPT_MAX_ITERATIONS = "sdfg.opt.max-iterations";

  /** Run the validator after every applied transformation */
  public static final String VALIDATE = "sdfg.validate";

  /** Separator between nested SDFG name and array name for
   *  transients moved into parent */
  public static final String INLINE_TRANSIENT_SEPARATOR =
                            "sdfg.inline.transient-separator";

  public static final String LOG_FILE = "sdfg.log.file";
  public static final String LOG_TRACE = "sdfg.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(OPT_INLINE_NESTED, "true");
    defaults.setProperty(OPT_NEST_SDFG, "false");
    defaults.setProperty(OPT_PROMOTE_GLOBAL_TRANSIENTS, "false");
    defaults.setProperty(OPT_MAX_ITERATIONS, "100");
    defaults.setProperty(VALIDATE, "true");
    defaults.setProperty(INLINE_TRANSIENT_SEPARATOR, "_");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initSDFGProperties() throws InvalidOptionException {
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
   * Drop any value set since startup, reverting to the default
   */
  public static void reset(String key) {
    properties.remove(key);
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
    getBoolean(OPT_INLINE_NESTED);
    getBoolean(OPT_NEST_SDFG);
    getBoolean(OPT_PROMOTE_GLOBAL_TRANSIENTS);
    getBoolean(VALIDATE);
    getBoolean(LOG_TRACE);
    if (getLong(OPT_MAX_ITERATIONS) < 0) {
      throw new InvalidOptionException(OPT_MAX_ITERATIONS
                              + " must be non-negative");
    }
    if (get(INLINE_TRANSIENT_SEPARATOR).length() == 0) {
      throw new InvalidOptionException(INLINE_TRANSIENT_SEPARATOR
                              + " must not be empty");
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
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
