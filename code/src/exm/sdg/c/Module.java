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

import java.util.Map;

import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.render.Formats;

/**
 * A C module: rendered once as implementation file and once as
 * header file.  Children keep the scope they were created with.
 */
public class Module extends CNode {
  public static final String HEADER_COMMENT = "header_comment";

  private static final String CHILDREN =
      "%(::*decl:)\n" +
      "%(::*head:)\n" +
      "%(::*body:)\n" +
      "%(::*tail:)";

  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("Module", CNode.TYPE)
        .attribute(HEADER_COMMENT, null, COMMENT)
        .frontArgs(Node.NAME)
        .groups(Group.DECL, Group.HEAD, Group.BODY, Group.TAIL)
        .defaultGroup(Group.DECL)
        .passesScope(false)
        .template(Formats.C_FORMAT,
            "%(::*header_comment:)\n" +
            "%(::*description:)\n" +
            CHILDREN)
        .template(Formats.H_FORMAT,
            "#ifndef _%(name)_h_\n" +
            "#define _%(name)_h_\n" +
            "%(::*header_comment:)\n" +
            "%(::*description:)\n" +
            CHILDREN + "\n" +
            "#endif /* _%(name)_h_ */")
        .build());

  public Module(String name) {
    this(name, null);
  }

  /**
   * @param keywords further attributes: header_comment, description
   */
  public Module(String name, Map<String, ?> keywords) {
    super(TYPE, new Object[] {name}, keywords);
  }

  public Module addAll(Node... nodes) throws InvalidChildException {
    add(nodes);
    return this;
  }
}
