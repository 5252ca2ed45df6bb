package exm.sdg.xml;

import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.render.Formats;

/**
 * Document type declaration with optional system DTD
 */
public class Doctype extends XmlNode {
  public static final String ROOT_ELEMENT = "root_element";
  public static final String DTD = "dtd";

  public static final NodeType TYPE = NodeTypes.register(
      new NodeType.Builder("Doctype", XmlNode.TYPE)
        .attribute(ROOT_ELEMENT, "")
        .attribute(DTD, null)
        .frontArgs(ROOT_ELEMENT, DTD)
        .template(Formats.XML_FORMAT,
            "<!DOCTYPE %(root_element) %(:head=SYSTEM \"¡rear=\":.dtd:)>")
        .build());

  public Doctype(String rootElement) {
    this(rootElement, null);
  }

  public Doctype(String rootElement, String dtd) {
    super(TYPE, new Object[] {rootElement, dtd}, null);
  }
}
