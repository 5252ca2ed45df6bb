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

package exm.sdg.template;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.sdg.common.Logging;
import exm.sdg.common.exceptions.TemplateAlreadyCompiledException;
import exm.sdg.node.NodeType;

/**
 * Compiled templates by (node type, format).  Filled when node types
 * are registered, then only read.
 */
public class TemplateCache {
  private static final Logger logger = Logging.getSDGLogger();

  private static final Map<NodeType, Map<String, CompiledTemplate>> cache =
      new IdentityHashMap<NodeType, Map<String, CompiledTemplate>>();

  /**
   * Compile template for (type, format).
   * @return the cached template if the same text was compiled before
   * @throws TemplateAlreadyCompiledException if a different text was
   *                compiled for the same pair
   */
  public static synchronized CompiledTemplate compile(NodeType type,
                                        String format, String text) {
    Map<String, CompiledTemplate> formats = cache.get(type);
    if (formats == null) {
      formats = new HashMap<String, CompiledTemplate>();
      cache.put(type, formats);
    }
    CompiledTemplate prev = formats.get(format);
    if (prev != null) {
      if (prev.getText().equals(text)) {
        return prev;
      }
      throw new TemplateAlreadyCompiledException(type.getName(), format);
    }
    CompiledTemplate compiled = new TemplateParser(type, format).parse(text);
    formats.put(format, compiled);
    if (logger.isDebugEnabled()) {
      logger.debug("Compiled " + type.getName() + "." + format + ": " +
                   compiled.getLines().size() + " lines");
    }
    return compiled;
  }

  /**
   * Get compiled template, compiling the type's declared template
   * on first use.
   * @return the template, or null if type declares none for format
   */
  public static synchronized CompiledTemplate lookup(NodeType type,
                                                     String format) {
    Map<String, CompiledTemplate> formats = cache.get(type);
    if (formats != null && formats.containsKey(format)) {
      return formats.get(format);
    }
    String text = type.getTemplate(format);
    if (text == null) {
      return null;
    }
    return compile(type, format, text);
  }
}
