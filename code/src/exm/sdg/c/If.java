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
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.node.Scope;
import exm.sdg.node.TrailerRule;

/**
 * Conditional statement.  Exactly one {@link Then} branch, any number
 * of {@link ElseIf} branches and at most one {@link Else}.  The last
 * branch closes the statement with a semicolon.
 */
public class If extends CNode {
  public static final String CONDITION = "condition";

  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("If", CNode.TYPE)
        .attribute(CONDITION, "", EXPRESSION)
        .frontArgs(CONDITION)
        .groups(Group.THEN, Group.ELSEIF, Group.ELSE)
        .preferredGroup(Group.BODY)
        .childConstraint(ChildConstraints.all(
            ChildConstraints.accepting(Group.THEN, Then.TYPE),
            ChildConstraints.accepting(Group.ELSEIF, ElseIf.TYPE),
            ChildConstraints.accepting(Group.ELSE, Else.TYPE),
            ChildConstraints.atMostOne(Then.TYPE, Group.THEN),
            ChildConstraints.atMostOne(Else.TYPE, Group.ELSE)))
        .trailerRule(new TrailerRule(";", Group.THEN, Group.ELSEIF,
                                     Group.ELSE))
        .scope(Scope.BODY),
        "if (%(::*condition:))\n" +
        "%(::*then:)\n" +
        "%(::*elseif:)\n" +
        "%(::*else:)")
        .build());

  /**
   * @param thenBody nodes or code of the then branch
   */
  public If(Object condition, Object... thenBody)
      throws InvalidChildException {
    super(TYPE, new Object[] {condition}, null);
    insert(new Then(thenBody));
  }

  public Then getThen() {
    return (Then)getChildren(Group.THEN).get(0);
  }
}
