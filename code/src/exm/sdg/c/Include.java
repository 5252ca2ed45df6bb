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

import exm.sdg.node.Group;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

/**
 * Preprocessor include.  Names in angle brackets are kept as given,
 * anything else is quoted.
 */
public class Include extends CNode {
  public static final String FILE = "file";

  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("Include", CNode.TYPE)
        .attribute(FILE, "")
        .frontArgs(FILE)
        .preferredGroup(Group.HEAD),
        "#include %(file)")
        .build());

  public Include(String file) {
    super(TYPE, new Object[] {quoted(file)}, null);
  }

  private static String quoted(String file) {
    if (file.startsWith("<") || file.startsWith("\"")) {
      return file;
    }
    return "\"" + file + "\"";
  }
}
