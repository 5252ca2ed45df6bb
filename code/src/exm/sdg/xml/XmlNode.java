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

package exm.sdg.xml;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.AttributeConverter;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

/**
 * Base of XML document nodes
 */
public class XmlNode extends Node {
  public static final String DESCRIPTION = "description";

  static final Pattern XML_NAME = Pattern.compile("[A-Za-z_:][-_:.A-Za-z0-9]*");

  /** Markup characters, ampersands unless they start an entity reference */
  private static final Pattern SPECIAL_CHAR =
      Pattern.compile("[<>]|&(?!" + XML_NAME.pattern() + ";)");

  static final AttributeConverter COMMENT = new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null || value instanceof Node) {
        return value;
      }
      return new XmlComment(value.toString());
    }
  };

  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("XmlNode", Node.TYPE)
        .attribute(DESCRIPTION, null, COMMENT)
        .groups()
        .indentUnit("  ")
        .build());

  protected XmlNode(NodeType type, Object[] positional,
                    Map<String, ?> keywords) {
    super(type, positional, keywords);
  }

  /**
   * Insert children, turning strings into character data
   */
  public XmlNode addContent(Object... children) throws InvalidChildException {
    for (Object c: children) {
      if (c instanceof Node) {
        insert((Node)c);
      } else if (c != null) {
        insert(new CharData(c.toString()));
      }
    }
    return this;
  }

  /**
   * Replace markup characters by entity references.  Existing entity
   * references are kept.
   */
  public static String escape(String text) {
    Matcher m = SPECIAL_CHAR.matcher(text);
    StringBuffer sb = new StringBuffer();
    while (m.find()) {
      String c = m.group();
      String replacement = c.equals("<") ? "&lt;" :
                           c.equals(">") ? "&gt;" : "&amp;";
      m.appendReplacement(sb, replacement);
    }
    m.appendTail(sb);
    return sb.toString();
  }
}
