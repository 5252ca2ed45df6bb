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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import exm.sdg.common.exceptions.InvalidAttributeException;
import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.AttributeConverter;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.render.Formats;
import exm.sdg.render.LineSource;
import exm.sdg.render.RenderContext;
import exm.sdg.render.TokenWrapper;

/**
 * XML element.  Attributes are emitted sorted by name and wrapped to
 * the output width, continuation lines aligned with the first
 * attribute.
 */
public class Element extends XmlNode {
  public static final String ELEM_TYPE = "elem_type";
  public static final String X_ATTRS = "x_attrs";
  public static final String ATTR_VALUES = "attr_values";

  private static final AttributeConverter XML_NAME_CHECK =
      new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null || !XML_NAME.matcher(value.toString()).matches()) {
        throw new InvalidAttributeException(node.getType().getName(), name,
            "'" + value + "' does not match " + XML_NAME.pattern());
      }
      return value.toString();
    }
  };

  private static final AttributeConverter SORTED_MAP =
      new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null) {
        return null;
      } else if (!(value instanceof Map)) {
        throw new InvalidAttributeException(node.getType().getName(), name,
                                            "expected a map, got " + value);
      }
      Map<String, Object> result = new TreeMap<String, Object>();
      for (Map.Entry<?, ?> e: ((Map<?, ?>)value).entrySet()) {
        result.put(e.getKey().toString(), e.getValue());
      }
      return result;
    }
  };

  /**
   * <code>name="value"</code> pairs packed into lines
   */
  private static final LineSource WRAPPED_ATTRIBUTES = new LineSource() {
    @Override
    public Iterable<String> lines(Node node, RenderContext context) {
      return TokenWrapper.wrap(attributeTokens(node), context.wrapWidth());
    }
  };

  static final String START_TAG_ATTRS =
      "%(:lead= ¡rear0=¡rear=%(NL):>@attr_values:)";

  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("Element", XmlNode.TYPE)
        .attributeNoDefault(ELEM_TYPE, XML_NAME_CHECK)
        .attributeNoDefault(X_ATTRS, SORTED_MAP)
        .frontArgs(ELEM_TYPE)
        .groups(Group.BODY)
        .lineSource(ATTR_VALUES, WRAPPED_ATTRIBUTES)
        .template(Formats.XML_FORMAT,
            "%(::*description:)\n" +
            "<%(elem_type)" + START_TAG_ATTRS + ">\n" +
            ">%(::*body:)\n" +
            "</%(elem_type)>")
        .build());

  public Element(String elemType, Object... children)
      throws InvalidChildException {
    this(elemType, null, children);
  }

  /**
   * @param attrs XML attributes; null values are omitted
   */
  public Element(String elemType, Map<String, ?> attrs, Object... children)
      throws InvalidChildException {
    this(TYPE, elemType, attrs);
    addContent(children);
  }

  protected Element(NodeType type, String elemType, Map<String, ?> attrs) {
    super(type, new Object[] {elemType},
          attrs == null ? null : Collections.singletonMap(X_ATTRS, attrs));
  }

  /**
   * XML attributes of element, merged over its prototypes.
   * Attributes of closer prototypes win.
   */
  public Map<String, Object> getXmlAttributes() {
    List<Node> chain = new ArrayList<Node>();
    for (Node n = this; n != null && !chain.contains(n);
         n = n.getPrototype()) {
      chain.add(n);
    }
    Map<String, Object> result = new TreeMap<String, Object>();
    for (int i = chain.size() - 1; i >= 0; i--) {
      Object attrs = chain.get(i).getOwnAttribute(X_ATTRS);
      if (attrs instanceof Map) {
        for (Map.Entry<?, ?> e: ((Map<?, ?>)attrs).entrySet()) {
          result.put(e.getKey().toString(), e.getValue());
        }
      }
    }
    return result;
  }

  static List<String> attributeTokens(Node node) {
    List<String> tokens = new ArrayList<String>();
    if (!(node instanceof Element)) {
      return tokens;
    }
    for (Map.Entry<String, Object> e:
                  ((Element)node).getXmlAttributes().entrySet()) {
      if (e.getValue() != null) {
        tokens.add(e.getKey() + "=\"" +
                   e.getValue().toString().replace("\"", "&quot;") + "\"");
      }
    }
    return tokens;
  }
}
