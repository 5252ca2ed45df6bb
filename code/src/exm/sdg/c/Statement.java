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
import java.util.List;
import java.util.regex.Pattern;

import exm.sdg.node.AttributeConverter;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.node.Scope;

/**
 * Simple C statement.  Statements only appear in function bodies,
 * so they stay in body scope wherever they are inserted.
 */
public class Statement extends CNode {
  public static final String CODE = "code";

  private static final Pattern TRAILING_SEMICOLON = Pattern.compile("; *$");

  private static final AttributeConverter STRIP_SEMICOLON =
      new AttributeConverter() {
    @Override
    public Object convert(Node node, String name, Object value) {
      if (value == null) {
        return "";
      }
      return TRAILING_SEMICOLON.matcher(value.toString().trim())
                               .replaceFirst("");
    }
  };

  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("Statement", CNode.TYPE)
        .attribute(CODE, "", STRIP_SEMICOLON)
        .frontArgs(CODE)
        .preferredGroup(Group.BODY)
        .trailer(";")
        .scope(Scope.BODY)
        .inheritsScope(false),
        "%(code)%(trailer)")
        .build());

  public Statement(String code) {
    super(TYPE, new Object[] {code}, null);
  }

  /**
   * Split code at semicolons into statements
   */
  public static List<Statement> parse(String code) {
    List<Statement> result = new ArrayList<Statement>();
    for (String piece: code.split(";")) {
      if (!piece.trim().isEmpty()) {
        result.add(new Statement(piece.trim()));
      }
    }
    return result;
  }
}
