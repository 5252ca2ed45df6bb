package exm.sdg.c;

import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

/**
 * C expression, rendered verbatim
 */
public class Expression extends CNode {
  public static final String CODE = "code";

  public static final NodeType TYPE = NodeTypes.register(
      bothFormats(new NodeType.Builder("Expression", CNode.TYPE)
        .attribute(CODE, "")
        .frontArgs(CODE),
        "%(code)")
        .build());

  public Expression(String code) {
    super(TYPE, new Object[] {code}, null);
  }
}
