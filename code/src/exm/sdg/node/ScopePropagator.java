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

import org.apache.log4j.Logger;

import exm.sdg.common.Logging;

/**
 * Propagation of scope through a node tree.
 *
 * An explicit update always applies to the node it is called on.
 * Descendants follow unless they are pinned or their type manages
 * its own scope, in which case their whole subtree is left alone.
 * A parent whose type forces a child scope passes that scope instead
 * of its own. A type that does not pass scope keeps its children
 * out of both insertion and update.
 */
public class ScopePropagator {
  private static final Logger logger = Logging.getSDGLogger();

  public static void updateScope(Node node, Scope scope) {
    if (logger.isTraceEnabled()) {
      logger.trace("scope of " + node.getName() + ": " + node.getScope() +
                   " -> " + scope);
    }
    node.setScope(scope);
    if (node.getType().passesScope()) {
      for (Node child: node.allChildren()) {
        propagate(node, child);
      }
    }
  }

  /**
   * Update scope and shield the node from later ancestor updates
   */
  public static void pinScope(Node node, Scope scope) {
    node.setScopePinned(true);
    updateScope(node, scope);
  }

  /**
   * Called when child has just been inserted into parent
   */
  static void inherit(Node parent, Node child) {
    if (parent.getType().passesScope()) {
      propagate(parent, child);
    }
  }

  /**
   * @return scope parent hands down to its children
   */
  public static Scope scopeForChildren(Node parent) {
    Scope forced = parent.getType().getChildScope();
    return forced != null ? forced : parent.getScope();
  }

  public static boolean acceptsInherited(Node node) {
    return !node.isScopePinned() && node.getType().inheritsScope();
  }

  private static void propagate(Node parent, Node child) {
    if (acceptsInherited(child)) {
      updateScope(child, scopeForChildren(parent));
    }
  }
}
