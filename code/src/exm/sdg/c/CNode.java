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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import exm.sdg.node.AttributeConverter;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.render.Formats;

/**
 * Base of C code nodes.  C nodes render in two passes: c_format for
 * the implementation file and h_format for the header file.
 */
public class CNode extends Node {

  public static final String DESCRIPTION = "description";

  /** Wrap text into a Comment node */
  static final AttributeConverter COMMENT = new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null || value instanceof Node) {
        return value;
      } else if (value instanceof Collection) {
        return new Comment(((Collection<?>)value).toArray());
      }
      return new Comment(value);
    }
  };

  /** Wrap code text into an Expression node */
  static final AttributeConverter EXPRESSION = new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null || value instanceof Node) {
        return value;
      }
      return new Expression(value.toString());
    }
  };

  /** Wrap type name into a CType node */
  static final AttributeConverter C_TYPE = new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null || value instanceof Node) {
        return value;
      }
      return new CType(value.toString().trim());
    }
  };

  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("CNode", Node.TYPE)
        .attribute(DESCRIPTION, null, COMMENT)
        .groups()
        .indentUnit("  ")
        .build());

  protected CNode(NodeType type, Object[] positional,
                  Map<String, ?> keywords) {
    super(type, positional, keywords);
  }

  /**
   * Register type with the same template for c_format and h_format
   */
  static NodeType.Builder bothFormats(NodeType.Builder builder,
                                      String template) {
    return builder.template(Formats.C_FORMAT, template)
                  .template(Formats.H_FORMAT, template);
  }

  /**
   * Convert statement-like objects to nodes: nodes are kept, strings
   * are split into statements at semicolons, collections converted
   * element by element
   */
  static List<Node> toNodes(Object o) {
    List<Node> result = new ArrayList<Node>();
    if (o instanceof Node) {
      result.add((Node)o);
    } else if (o instanceof Collection) {
      for (Object elem: (Collection<?>)o) {
        result.addAll(toNodes(elem));
      }
    } else if (o != null) {
      result.addAll(Statement.parse(o.toString()));
    }
    return result;
  }
}
