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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.sdg.common.exceptions.InvalidOptionException;
import exm.sdg.common.exceptions.SDGRuntimeError;

/**
 * General SDG settings
 *
 * Defaults can be overridden through Java system properties
 * with the same keys.
 * */
public class Settings
{
  /** Default width of rendered output, used for wrapping */
  public static final String OUTPUT_WIDTH = "sdg.output-width";
  /** Indentation unit for node types that do not declare one */
  public static final String INDENT_UNIT = "sdg.indent-unit";
  /** Character marking relative indentation at start of template line */
  public static final String INDENT_MARKER = "sdg.template.indent-marker";
  /** Fixed width reserved for decoration when wrapping attribute lists */
  public static final String WRAP_DECORATION = "sdg.render.wrap-decoration";

  public static final String LOG_FILE = "sdg.log.file";
  public static final String LOG_TRACE = "sdg.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(OUTPUT_WIDTH, "79");
    defaults.setProperty(INDENT_UNIT, "  ");
    defaults.setProperty(INDENT_MARKER, ">");
    defaults.setProperty(WRAP_DECORATION, "4");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
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

  public static String get(String key)
  {
    return properties.getProperty(key);
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
    if (getLong(OUTPUT_WIDTH) <= 0) {
      throw new InvalidOptionException("Output width must be positive: " +
                                       get(OUTPUT_WIDTH));
    }
    if (getLong(WRAP_DECORATION) < 0) {
      throw new InvalidOptionException("Wrap decoration must not be " +
                                       "negative: " + get(WRAP_DECORATION));
    }
    getBoolean(LOG_TRACE);
    checkSingleChar(INDENT_MARKER);
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String value = properties.getProperty(key);
    if (value == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    if (value.equalsIgnoreCase("true")) {
      return true;
    } else if (value.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for " + key +
                                       ": " + value);
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String value = properties.getProperty(key);
    if (value == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidOptionException("Invalid integer value for " + key +
                                       ": " + value);
    }
  }

  /**
   * Output width with settings errors treated as internal errors:
   * properties are validated by {@link #initProperties()}
   */
  public static int outputWidth() {
    try {
      return (int)getLong(OUTPUT_WIDTH);
    } catch (InvalidOptionException e) {
      throw new SDGRuntimeError(e.getMessage(), e);
    }
  }

  public static int wrapDecoration() {
    try {
      return (int)getLong(WRAP_DECORATION);
    } catch (InvalidOptionException e) {
      throw new SDGRuntimeError(e.getMessage(), e);
    }
  }

  public static String indentUnit() {
    return get(INDENT_UNIT);
  }

  public static char indentMarker() {
    String marker = get(INDENT_MARKER);
    if (marker == null || marker.length() != 1) {
      throw new SDGRuntimeError("Bad indent marker: '" + marker + "'");
    }
    return marker.charAt(0);
  }

  private static void checkSingleChar(String key)
                                        throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null || val.length() != 1) {
      throw new InvalidOptionException("Property " + key + " must be a " +
                                       "single character, was: '" + val + "'");
    }
  }
}
