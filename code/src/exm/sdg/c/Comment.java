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
import java.util.Collections;
import java.util.List;

import exm.sdg.node.AttributeConverters;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.render.LineSource;
import exm.sdg.render.RenderContext;
import exm.sdg.render.TokenWrapper;

/**
 * C block comment.  Each paragraph of text is wrapped to the width
 * left at the comment's position; every output line is a complete
 * <code>/* ... *&#47;</code> comment.
 */
public class Comment extends CNode {

  public static final String TEXT = "text";

  private static final LineSource WRAPPED_TEXT = new LineSource() {
    @Override
    public Iterable<String> lines(Node node, RenderContext context) {
      List<String> result = new ArrayList<String>();
      for (Object paragraph: (List<?>)node.getAttribute(TEXT)) {
        result.addAll(TokenWrapper.wrapText(String.valueOf(paragraph),
                                            context.wrapWidth()));
      }
      return result;
    }
  };

  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("Comment", CNode.TYPE)
        .attribute(TEXT, Collections.emptyList(), AttributeConverters.LIST)
        .restArg(TEXT)
        .preferredGroup(Group.DECL)
        .lineSource(TEXT, WRAPPED_TEXT),
        "%(:lead=/* ¡tail= */:@text:)")
        .build());

  /**
   * @param text paragraphs of comment text
   */
  public Comment(Object... text) {
    super(TYPE, text, null);
  }
}
