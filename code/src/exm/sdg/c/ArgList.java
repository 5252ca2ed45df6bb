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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.ChildConstraints;
import exm.sdg.node.Group;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

/**
 * Formal arguments of a function, one per line when there are
 * several of them
 */
public class ArgList extends CNode {

  private static final Pattern ARG =
      Pattern.compile("^(.+)\\s+([_a-zA-Z][_a-zA-Z0-9]*)$");

  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("ArgList", CNode.TYPE)
        .groups(Group.DECL)
        .childConstraint(
            ChildConstraints.accepting(Group.DECL, Var.TYPE)),
        "%(:sep=%(indent)%(indent), :*decl:)")
        .build());

  /**
   * @param args declarations separated by commas, e.g.
   *             <code>"int x, char *y"</code>.  Empty or
   *             <code>"void"</code> for no arguments.
   */
  public ArgList(String args) throws InvalidChildException {
    super(TYPE, new Object[0], null);
    if (args == null) {
      return;
    }
    for (String arg: args.split(",")) {
      arg = arg.trim();
      if (arg.isEmpty() || arg.equals("void")) {
        continue;
      }
      Matcher m = ARG.matcher(arg);
      if (!m.matches()) {
        throw new InvalidChildException(this, null, Group.DECL,
                                        "malformed argument '" + arg + "'");
      }
      add(m.group(1).trim(), m.group(2));
    }
  }

  public ArgList add(String type, String name) throws InvalidChildException {
    Var v = new Var(type, name);
    v.setTrailer("");
    insert(v, Group.DECL);
    return this;
  }
}
