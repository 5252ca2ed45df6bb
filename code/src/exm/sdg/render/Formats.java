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

package exm.sdg.render;

import java.util.HashMap;
import java.util.Map;

import exm.sdg.common.Logging;
import exm.sdg.node.Scope;

/**
 * Output formats and the pass (scope filter) each one renders
 */
public class Formats {
  public static final String C_FORMAT = "c_format";
  public static final String H_FORMAT = "h_format";
  public static final String XML_FORMAT = "xml_format";
  public static final String STR_FORMAT = "str_format";
  /** Debugging format showing the tree with type names */
  public static final String REPR_FORMAT = "repr_format";

  private static final Map<String, Scope> passes = new HashMap<String, Scope>();
  static {
    passes.put(C_FORMAT, Scope.BODY);
    passes.put(H_FORMAT, Scope.HEADER);
    passes.put(XML_FORMAT, Scope.BOTH);
    passes.put(STR_FORMAT, Scope.BOTH);
    passes.put(REPR_FORMAT, Scope.BOTH);
  }

  public static synchronized void registerPass(String format, Scope pass) {
    passes.put(format, pass);
  }

  /**
   * @return pass of format; formats not registered render everything
   */
  public static synchronized Scope passFor(String format) {
    Scope pass = passes.get(format);
    if (pass == null) {
      Logging.uniqueWarn("No pass registered for format " + format +
                         ", rendering all scopes");
      return Scope.BOTH;
    }
    return pass;
  }
}
