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
import exm.sdg.node.ChildConstraints;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.node.Scope;

public class Switch extends CNode {
  public static final String CONDITION = "condition";

  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("Switch", CNode.TYPE)
        .attribute(CONDITION, "", EXPRESSION)
        .frontArgs(CONDITION)
        .groups(Group.CASE, Group.DEFAULT)
        .preferredGroup(Group.BODY)
        .childConstraint(ChildConstraints.all(
            ChildConstraints.accepting(Group.CASE, Case.TYPE),
            ChildConstraints.accepting(Group.DEFAULT, DefaultCase.TYPE),
            ChildConstraints.atMostOne(DefaultCase.TYPE, Group.DEFAULT)))
        .scope(Scope.BODY),
        "switch (%(::*condition:))\n" +
        ">{\n" +
        ">>%(::*case:)\n" +
        ">>%(::*default:)\n" +
        ">}%(trailer)")
        .build());

  public Switch(Object condition, Node... cases)
      throws InvalidChildException {
    super(TYPE, new Object[] {condition}, null);
    add(cases);
  }
}
