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

import exm.sdg.common.exceptions.InvalidAttributeException;
import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.AttributeConverter;
import exm.sdg.node.AttributeConverters;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.node.Scope;
import exm.sdg.render.Formats;

/**
 * Function definition.  The body pass renders the complete
 * definition, the header pass only the prototype.  Everything inside
 * the function belongs to the body.
 */
public class Function extends CNode {
  public static final String RETURN_TYPE = "return_type";
  public static final String ARGS = "args";
  public static final String STATIC = "static";
  public static final String EXTERN = "extern";

  private static final AttributeConverter ARG_LIST =
      new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null || value instanceof Node) {
        return value;
      }
      try {
        return new ArgList(value.toString());
      } catch (InvalidChildException e) {
        throw new InvalidAttributeException(node.getType().getName(), name,
                                            e.getMessage());
      }
    }
  };

  /** Signature; argument list on separate lines if there are several */
  private static final String SIGNATURE =
      "%(::.static:)%(::.extern:)%(::*return_type:) %(name)" +
      "%(:head=%(NL)%(indent)%(indent)( " +
      "¡rear=%(NL)%(indent)%(indent))" +
      "¡front0= (¡rear0=)¡empty= (void):*args:)";

  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("Function", CNode.TYPE)
        .attribute(RETURN_TYPE, "void", C_TYPE)
        .attribute(ARGS, null, ARG_LIST)
        .attribute(STATIC, null, AttributeConverters.flag("static "))
        .attribute(EXTERN, null, AttributeConverters.flag("extern "))
        .frontArgs(RETURN_TYPE, Node.NAME, ARGS)
        .groups(Group.DECL, Group.HEAD, Group.BODY, Group.TAIL)
        .defaultGroup(Group.BODY)
        .preferredGroup(Group.BODY)
        .childScope(Scope.BODY)
        .template(Formats.C_FORMAT,
            "%(::*description:)\n" +
            SIGNATURE + "\n" +
            "{\n" +
            ">%(::*decl:)\n" +
            ">%(::*head:)\n" +
            ">%(::*body:)\n" +
            ">%(::*tail:)\n" +
            "}\n" +
            ">")
        .template(Formats.H_FORMAT,
            "%(::*description:)\n" +
            SIGNATURE + ";\n" +
            ">")
        .build());

  public Function(String returnType, String name, String args)
      throws InvalidChildException {
    this(returnType, name, args, null);
  }

  /**
   * @param keywords further attributes: static, extern, description
   */
  public Function(String returnType, String name, String args,
                  Map<String, ?> keywords) throws InvalidChildException {
    super(TYPE, new Object[] {returnType, name, args}, keywords);
  }

  /**
   * Setting static pins this node to the body pass
   */
  @Override
  public void setAttribute(String attrName, Object value) {
    super.setAttribute(attrName, value);
    if (STATIC.equals(attrName) && getOwnAttribute(STATIC) != null) {
      pinScope(Scope.BODY);
    }
  }

  /**
   * Add statements or declarations to the body
   * @param code nodes, or code strings split into statements
   */
  public Function addCode(Object... code) throws InvalidChildException {
    for (Object c: code) {
      for (Node n: toNodes(c)) {
        insert(n);
      }
    }
    return this;
  }
}
