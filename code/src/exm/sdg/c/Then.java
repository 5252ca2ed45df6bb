package exm.sdg.c;

import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.Group;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

/**
 * Branch taken if the condition of an {@link If} holds
 */
public class Then extends Block {
  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("Then", Block.TYPE)
        .preferredGroup(Group.THEN)
        .build());

  public Then(Object... children) throws InvalidChildException {
    super(TYPE, new Object[0], children);
  }
}
