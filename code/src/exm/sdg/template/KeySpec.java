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

import exm.sdg.node.Group;

/**
 * One key of a group expansion: what to expand into items
 */
public class KeySpec {

  public static enum Kind {
    /** '*': child nodes of a group, or nodes held by an attribute */
    NODES('*'),
    /** '.': values of an attribute */
    VALUES('.'),
    /** '@': lines produced by a named line source */
    SOURCE('@');

    private final char prefix;

    private Kind(char prefix) {
      this.prefix = prefix;
    }

    public char prefix() {
      return prefix;
    }

    public static Kind forPrefix(char c) {
      for (Kind k: values()) {
        if (k.prefix == c) {
          return k;
        }
      }
      return null;
    }
  }

  /** Key naming every group of the node in declared order */
  public static final String ALL_CHILDREN = "children";

  private final Kind kind;
  private final String name;
  private final boolean anchored;
  private final String format;
  private final Group group;

  /**
   * @param name group name, attribute path or line source name
   * @param anchored continuation lines of each item are padded to
   *                 the column where the item starts
   * @param format format for rendering child nodes, null for the
   *               format being rendered
   * @param group resolved group for NODES keys naming a group, else null
   */
  public KeySpec(Kind kind, String name, boolean anchored, String format,
                 Group group) {
    this.kind = kind;
    this.name = name;
    this.anchored = anchored;
    this.format = format;
    this.group = group;
  }

  public Kind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public boolean isAnchored() {
    return anchored;
  }

  public String getFormat() {
    return format;
  }

  public Group getGroup() {
    return group;
  }

  public boolean isAllChildren() {
    return kind == Kind.NODES && ALL_CHILDREN.equals(name);
  }

  public String source() {
    return (anchored ? ">" : "") + kind.prefix() + name +
           (format != null ? "." + format : "");
  }

  @Override
  public String toString() {
    return source();
  }
}
