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

package exm.sdg.common.exceptions;

import exm.sdg.node.Group;
import exm.sdg.node.Node;

/**
 * Insertion of a child violates the group constraints of its parent
 */
public class InvalidChildException extends DocumentException {

  private final Node parent;
  private final Node child;
  private final Group group;

  public InvalidChildException(Node parent, Node child, Group group,
                               String reason) {
    super("Invalid child " + describe(child) + " for group " + group +
          " of " + describe(parent) + ": " + reason);
    this.parent = parent;
    this.child = child;
    this.group = group;
  }

  private static String describe(Node node) {
    if (node == null) {
      return "<null>";
    }
    return node.getType().getName() + "#" + node.getId() +
           " '" + node.getName() + "'";
  }

  public Node getParent() {
    return parent;
  }

  public Node getChild() {
    return child;
  }

  /**
   * @return group the child was inserted into, null if no group
   *         could be determined
   */
  public Group getGroup() {
    return group;
  }

  private static final long serialVersionUID = 1L;
}
