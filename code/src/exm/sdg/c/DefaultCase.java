package exm.sdg.c;

import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.Group;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

public class DefaultCase extends Block {
  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("DefaultCase", Block.TYPE)
        .preferredGroup(Group.DEFAULT),
        "default :\n" +
        ">%(::*decl:)\n" +
        ">%(::*body:)")
        .build());

  public DefaultCase(Object... children) throws InvalidChildException {
    super(TYPE, new Object[0], children);
  }
}
