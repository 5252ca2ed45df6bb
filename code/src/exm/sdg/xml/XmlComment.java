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

import java.util.Collections;

import exm.sdg.common.util.StringUtil;
import exm.sdg.node.AttributeConverter;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.render.Formats;

/**
 * XML comment.  Double hyphens are not allowed inside comments and
 * are replaced.
 */
public class XmlComment extends XmlNode {
  public static final String TEXT = "text";

  private static final AttributeConverter COMMENT_LINES =
      new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null) {
        return null;
      }
      return StringUtil.splitLines(value.toString().replace("--", "···"));
    }
  };

  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("XmlComment", XmlNode.TYPE)
        .attribute(TEXT, Collections.emptyList(), COMMENT_LINES)
        .frontArgs(TEXT)
        .template(Formats.XML_FORMAT,
                  "<!-- %(:rear0= ¡rear=%(NL):>.text:)-->")
        .build());

  public XmlComment(String text) {
    super(TYPE, new Object[] {text}, null);
  }
}
