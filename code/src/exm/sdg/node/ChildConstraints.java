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

import java.util.Arrays;
import java.util.List;

import exm.sdg.common.exceptions.InvalidChildException;

/**
 * Common child constraints
 */
public class ChildConstraints {

  public static final ChildConstraint ANY = new ChildConstraint() {
    @Override
    public void check(Node parent, Node child, Group group) {
      // Anything goes
    }
  };

  /**
   * Children inserted into group must be of one of the given types
   * (or subtypes).  Other groups are not restricted.
   */
  public static ChildConstraint accepting(final Group group,
                                          final NodeType... types) {
    final List<NodeType> accepted = Arrays.asList(types);
    return new ChildConstraint() {
      @Override
      public void check(Node parent, Node child, Group g)
          throws InvalidChildException {
        if (g != group) {
          return;
        }
        for (NodeType t: accepted) {
          if (child.getType().isSubtypeOf(t)) {
            return;
          }
        }
        throw new InvalidChildException(parent, child, g,
            "expected one of " + names(accepted));
      }
    };
  }

  /**
   * At most one child of the given type over all the listed groups
   */
  public static ChildConstraint atMostOne(final NodeType type,
                                          final Group... groups) {
    return new ChildConstraint() {
      @Override
      public void check(Node parent, Node child, Group g)
          throws InvalidChildException {
        if (!child.getType().isSubtypeOf(type)) {
          return;
        }
        for (Group other: groups) {
          for (Node existing: parent.getChildren(other)) {
            if (existing.getType().isSubtypeOf(type)) {
              throw new InvalidChildException(parent, child, g,
                  "already has a " + type.getName() + " child: " +
                  existing.getName());
            }
          }
        }
      }
    };
  }

  /**
   * Apply all constraints in order
   */
  public static ChildConstraint all(final ChildConstraint... constraints) {
    return new ChildConstraint() {
      @Override
      public void check(Node parent, Node child, Group g)
          throws InvalidChildException {
        for (ChildConstraint c: constraints) {
          c.check(parent, child, g);
        }
      }
    };
  }

  private static String names(List<NodeType> types) {
    StringBuilder sb = new StringBuilder();
    for (NodeType t: types) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(t.getName());
    }
    return sb.toString();
  }
}
