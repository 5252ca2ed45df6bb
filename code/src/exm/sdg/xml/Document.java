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

import exm.sdg.common.exceptions.InvalidAttributeException;
import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.AttributeConverter;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.render.Formats;

/**
 * XML document: declaration, optional doctype and one root element.
 * Children inserted into the document go to the root element.
 */
public class Document extends XmlNode {
  public static final String ROOT = "root";
  public static final String DOCTYPE = "doctype";
  public static final String ENCODING = "encoding";
  public static final String STANDALONE = "standalone";
  public static final String XML_VERSION = "xml_version";

  private static final AttributeConverter ROOT_ELEMENT =
      new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null || value instanceof Element) {
        return value;
      }
      try {
        return new Element(value.toString());
      } catch (InvalidChildException e) {
        throw new InvalidAttributeException(node.getType().getName(), name,
                                            e.getMessage());
      }
    }
  };

  private static final AttributeConverter DOCTYPE_DECL =
      new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null || value instanceof Doctype) {
        return value;
      }
      return new Doctype(value.toString());
    }
  };

  private static final AttributeConverter YES_NO = new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (Boolean.TRUE.equals(value) || "yes".equals(value)) {
        return "yes";
      } else if (Boolean.FALSE.equals(value) || "no".equals(value)) {
        return "no";
      }
      throw new InvalidAttributeException(node.getType().getName(), name,
                                          "expected yes or no: " + value);
    }
  };

  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("Document", XmlNode.TYPE)
        .attribute(ROOT, null, ROOT_ELEMENT)
        .attribute(DOCTYPE, null, DOCTYPE_DECL)
        .attribute(ENCODING, "utf-8")
        .attribute(STANDALONE, "yes", YES_NO)
        .attribute(XML_VERSION, "1.0")
        .frontArgs(ROOT)
        .template(Formats.XML_FORMAT,
            "<?xml version=\"%(xml_version)\" encoding=\"%(encoding)\"" +
              " standalone=\"%(standalone)\"?>\n" +
            "%(::*doctype:)\n" +
            "%(::*description:)\n" +
            "%(::*root:)")
        .build());

  /**
   * @param root root element, or its element type
   * @param content content of the root element
   */
  public Document(Object root, Object... content)
      throws InvalidChildException {
    this(root, null, content);
  }

  /**
   * @param keywords further attributes: doctype, encoding, standalone,
   *                 xml_version, description
   */
  public Document(Object root, Map<String, ?> keywords, Object... content)
      throws InvalidChildException {
    super(TYPE, new Object[] {root}, keywords);
    addContent(content);
  }

  public Element getRoot() {
    return (Element)getOwnAttribute(ROOT);
  }

  @Override
  public Node insert(Node child, Group group, int index)
      throws InvalidChildException {
    Element root = getRoot();
    if (root == null) {
      throw new InvalidChildException(this, child, group,
                                      "document has no root element");
    }
    root.insert(child, group, index);
    return this;
  }
}
