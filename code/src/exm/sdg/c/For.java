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

import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

public class For extends Block {
  public static final String INIT = "init";
  public static final String CONDITION = "condition";
  public static final String INCREASE = "increase";

  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("For", Block.TYPE)
        .attribute(INIT, "", EXPRESSION)
        .attribute(CONDITION, "", EXPRESSION)
        .attribute(INCREASE, "", EXPRESSION)
        .frontArgs(INIT, CONDITION, INCREASE),
        "for (%(::*init:); %(::*condition:); %(::*increase:))\n" +
        BLOCK_LINES)
        .build());

  public For(Object init, Object condition, Object increase, Object... body)
      throws InvalidChildException {
    super(TYPE, new Object[] {init, condition, increase}, body);
  }
}
