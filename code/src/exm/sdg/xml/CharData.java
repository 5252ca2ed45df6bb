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
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import exm.sdg.common.util.StringUtil;
import exm.sdg.node.AttributeConverter;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.render.Formats;

/**
 * Character data of an element, escaped and split into lines
 */
public class CharData extends XmlNode {
  public static final String TEXT = "text";

  private static final AttributeConverter ESCAPED_LINES =
      new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      List<String> result = new ArrayList<String>();
      if (value instanceof Collection) {
        for (Object o: (Collection<?>)value) {
          if (o != null) {
            result.addAll(StringUtil.splitLines(escape(o.toString())));
          }
        }
      } else if (value != null) {
        result.addAll(StringUtil.splitLines(escape(value.toString())));
      }
      return result;
    }
  };

  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("CharData", XmlNode.TYPE)
        .attribute(TEXT, Collections.emptyList(), ESCAPED_LINES)
        .restArg(TEXT)
        .template(Formats.XML_FORMAT, "%(::.text:)")
        .build());

  public CharData(Object... text) {
    super(TYPE, text, null);
  }
}
