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

package exm.sdg.c;

import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.node.Scope;

/**
 * Braced block of declarations followed by statements
 */
public class Block extends CNode {

  /** Lines shared by all block-like statements */
  static final String BLOCK_LINES =
      "{\n" +
      ">%(::*decl:)\n" +
      ">%(::*body:)\n" +
      "}%(trailer)";

  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("Block", CNode.TYPE)
        .groups(Group.DECL, Group.BODY)
        .defaultGroup(Group.BODY)
        .preferredGroup(Group.BODY)
        .scope(Scope.BODY),
        BLOCK_LINES)
        .build());

  /**
   * @param children nodes, or code strings split into statements
   */
  public Block(Object... children) throws InvalidChildException {
    this(TYPE, new Object[0], children);
  }

  protected Block(NodeType type, Object[] positional, Object[] children)
      throws InvalidChildException {
    super(type, positional, null);
    addCode(children);
  }

  /**
   * Insert nodes, or statements parsed from code strings
   */
  public Block addCode(Object... children) throws InvalidChildException {
    for (Object c: children) {
      for (Node n: toNodes(c)) {
        insert(n);
      }
    }
    return this;
  }
}
