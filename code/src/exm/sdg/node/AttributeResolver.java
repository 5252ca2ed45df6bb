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

import java.util.IdentityHashMap;
import java.util.Map;

import exm.sdg.common.exceptions.AttributeNotFoundException;

/**
 * Resolve attribute names and dotted paths against a node.
 *
 * A single name is looked up in this order:
 * <ol>
 * <li>values stored on the node</li>
 * <li>defaults declared by the node type</li>
 * <li>the prototype chain, applying the same rules to each prototype</li>
 * <li>built-ins derived from node state</li>
 * </ol>
 * A declared attribute therefore hides a built-in of the same name.
 * Each further path segment is looked up in the value found so far,
 * which must be a node or a map.
 */
public class AttributeResolver {

  public static final String ID = "id";
  public static final String TYPE = "type";
  public static final String TRAILER = "trailer";
  public static final String SCOPE = "scope";

  public static boolean isBuiltin(String name) {
    return ID.equals(name) || TYPE.equals(name) ||
           TRAILER.equals(name) || SCOPE.equals(name);
  }

  /**
   * A resolved value with its origin
   */
  public static class Resolution {
    public final Object value;
    public final AttributeSource source;

    Resolution(Object value, AttributeSource source) {
      this.value = value;
      this.source = source;
    }
  }

  /**
   * @param path attribute name or dotted path
   * @return resolved value, possibly null if null was stored
   * @throws AttributeNotFoundException if any segment has no value
   */
  public static Object resolve(Node node, String path) {
    String segments[] = path.split("\\.");
    Object current = node;
    for (String segment: segments) {
      if (current instanceof Node) {
        Resolution r = lookup((Node)current, segment);
        if (r == null) {
          throw notFound(node, path);
        }
        current = r.value;
      } else if (current instanceof Map) {
        Map<?, ?> map = (Map<?, ?>)current;
        if (!map.containsKey(segment)) {
          throw notFound(node, path);
        }
        current = map.get(segment);
      } else {
        throw notFound(node, path);
      }
    }
    return current;
  }

  /**
   * Look up a single attribute name
   * @return resolution, or null if no value anywhere
   */
  public static Resolution lookup(Node node, String name) {
    Resolution r = local(node, name);
    if (r != null) {
      return r;
    }
    Map<Node, Boolean> visited = new IdentityHashMap<Node, Boolean>();
    visited.put(node, Boolean.TRUE);
    for (Node p = node.getPrototype(); p != null && !visited.containsKey(p);
         p = p.getPrototype()) {
      visited.put(p, Boolean.TRUE);
      Resolution pr = local(p, name);
      if (pr != null) {
        return new Resolution(pr.value, AttributeSource.PROTOTYPE);
      }
    }
    return builtin(node, name);
  }

  private static Resolution builtin(Node node, String name) {
    if (ID.equals(name)) {
      return new Resolution(node.getId(), AttributeSource.BUILTIN);
    } else if (TYPE.equals(name)) {
      return new Resolution(node.getType().getName(),
                            AttributeSource.BUILTIN);
    } else if (TRAILER.equals(name)) {
      return new Resolution(node.getTrailer(), AttributeSource.BUILTIN);
    } else if (SCOPE.equals(name)) {
      return new Resolution(node.getScope().name(), AttributeSource.BUILTIN);
    }
    return null;
  }

  private static Resolution local(Node node, String name) {
    if (node.hasOwnAttribute(name)) {
      return new Resolution(node.getOwnAttribute(name), AttributeSource.OWN);
    }
    AttributeSpec spec = node.getType().getAttribute(name);
    if (spec != null && spec.hasDefault()) {
      return new Resolution(spec.getDefault(), AttributeSource.DEFAULT);
    }
    return null;
  }

  private static AttributeNotFoundException notFound(Node node, String path) {
    return new AttributeNotFoundException(path, node.getType().getName(),
                                          node.getId());
  }
}
