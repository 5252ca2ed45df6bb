package exm.sdg.c;

import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

public class While extends Block {
  public static final String CONDITION = "condition";

  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("While", Block.TYPE)
        .attribute(CONDITION, "", EXPRESSION)
        .frontArgs(CONDITION),
        "while (%(::*condition:))\n" + BLOCK_LINES)
        .build());

  public While(Object condition, Object... body)
      throws InvalidChildException {
    super(TYPE, new Object[] {condition}, body);
  }
}
