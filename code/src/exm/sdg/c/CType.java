package exm.sdg.c;

import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

/**
 * Reference to a C type by name
 */
public class CType extends CNode {
  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("Type", CNode.TYPE)
        .frontArgs(Node.NAME),
        "%(name)")
        .build());

  public CType(String name) {
    super(TYPE, new Object[] {name}, null);
  }
}
