package exm.sdg.xml;

import java.util.Map;

import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.render.Formats;

/**
 * Element without content, rendered as a single tag
 */
public class EmptyElement extends Element {
  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("EmptyElement", Element.TYPE)
        .groups()
        .template(Formats.XML_FORMAT,
            "%(::*description:)\n" +
            "<%(elem_type)" + START_TAG_ATTRS + "/>")
        .build());

  public EmptyElement(String elemType) {
    this(elemType, null);
  }

  public EmptyElement(String elemType, Map<String, ?> attrs) {
    super(TYPE, elemType, attrs);
  }
}
