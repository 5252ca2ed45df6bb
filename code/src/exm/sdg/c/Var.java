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

import exm.sdg.node.AttributeConverter;
import exm.sdg.node.AttributeConverters;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.node.Scope;
import exm.sdg.render.Formats;

/**
 * Variable declaration.  The initializer is only emitted in the body
 * pass; static variables are private to the body.
 */
public class Var extends CNode {
  public static final String C_TYPE_ATTR = "type";
  public static final String INIT = "init";
  public static final String STATIC = "static";
  public static final String CONST = "const";
  public static final String EXTERN = "extern";

  private static final AttributeConverter INITIALIZER =
      new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null || "".equals(value)) {
        return null;
      }
      return EXPRESSION.convert(node, name, value);
    }
  };

  private static final String DECL_HEAD =
      "%(::.extern:)%(::.static:)%(::.const:)%(::*type:) %(name)";

  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("Var", CNode.TYPE)
        .attribute(C_TYPE_ATTR, "", C_TYPE)
        .attribute(INIT, null, INITIALIZER)
        .attribute(STATIC, null, AttributeConverters.flag("static "))
        .attribute(CONST, null, AttributeConverters.flag("const "))
        .attribute(EXTERN, null, AttributeConverters.flag("extern "))
        .frontArgs(C_TYPE_ATTR, Node.NAME)
        .preferredGroup(Group.DECL)
        .trailer(";")
        .template(Formats.C_FORMAT,
                  DECL_HEAD + "%(:head= = :*init:)%(trailer)")
        .template(Formats.H_FORMAT, DECL_HEAD + "%(trailer)")
        .build());

  public Var(String type, String name) {
    this(type, name, null);
  }

  /**
   * @param keywords further attributes: init, static, const, extern,
   *                 description
   */
  public Var(String type, String name, Map<String, ?> keywords) {
    super(TYPE, new Object[] {type, name}, keywords);
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
}
