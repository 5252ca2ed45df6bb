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

package exm.sdg.node;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.sdg.common.Logging;
import exm.sdg.common.exceptions.SDGRuntimeError;
import exm.sdg.template.TemplateCache;

/**
 * Registry of node types.  Registering a type compiles all of its
 * templates, so template errors surface at definition time.
 */
public class NodeTypes {
  private static final Logger logger = Logging.getSDGLogger();

  private static final Map<String, NodeType> registered =
      new LinkedHashMap<String, NodeType>();

  public static synchronized NodeType register(NodeType type) {
    NodeType prev = registered.get(type.getName());
    if (prev == type) {
      return type;
    } else if (prev != null) {
      throw new SDGRuntimeError("Node type " + type.getName() +
                                " already registered");
    }
    for (Map.Entry<String, String> e: type.getTemplates().entrySet()) {
      TemplateCache.compile(type, e.getKey(), e.getValue());
    }
    registered.put(type.getName(), type);
    if (logger.isDebugEnabled()) {
      logger.debug("Registered node type " + type.getName() + " formats: " +
                   type.getTemplates().keySet());
    }
    return type;
  }

  /**
   * @return registered type with name, or null
   */
  public static synchronized NodeType lookup(String name) {
    return registered.get(name);
  }

  public static synchronized boolean isRegistered(NodeType type) {
    return registered.get(type.getName()) == type;
  }
}
