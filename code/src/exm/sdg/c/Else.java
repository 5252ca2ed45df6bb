package exm.sdg.c;

import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.Group;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

public class Else extends Block {
  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("Else", Block.TYPE)
        .preferredGroup(Group.ELSE),
        "else\n" + BLOCK_LINES)
        .build());

  public Else(Object... children) throws InvalidChildException {
    super(TYPE, new Object[0], children);
  }
}
