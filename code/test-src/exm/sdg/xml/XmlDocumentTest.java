package exm.sdg.xml;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdg.common.Logging;
import exm.sdg.common.exceptions.InvalidAttributeException;
import exm.sdg.node.Group;
import exm.sdg.node.Nodes;
import exm.sdg.render.DocumentWriter;
import exm.sdg.render.Formats;

public class XmlDocumentTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/XmlDocumentTest.sdg.log", true);
  }

  private static List<String> xml(XmlNode n) {
    return DocumentWriter.lines(n, Formats.XML_FORMAT);
  }

  @Test
  public void testWrappedStartTag() throws Exception {
    Map<String, Object> attrs = new HashMap<String, Object>();
    attrs.put("xmlns", "http://www.w3.org/2000/svg");
    attrs.put("viewBox", "10 60 450 260");
    attrs.put("width", "100%");
    attrs.put("height", "100%");
    Document d = new Document(new Element("svg", attrs),
        Nodes.kw("encoding", "UTF-8", "standalone", "no"), "...");
    assertEquals(Arrays.asList(
        "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"no\"?>",
        "<svg height=\"100%\" viewBox=\"10 60 450 260\" width=\"100%\"",
        "     xmlns=\"http://www.w3.org/2000/svg\"",
        ">",
        "  ...",
        "</svg>"), xml(d));
  }

  @Test
  public void testDocumentWithDoctypeAndComment() throws Exception {
    Document d = new Document("Memo",
        Nodes.kw("doctype", "memo", "description", "Just a test"),
        "First line of text",
        "& a second line of %text",
        "A third line of %text &entity; including");
    assertEquals(Arrays.asList(
        "<?xml version=\"1.0\" encoding=\"utf-8\" standalone=\"yes\"?>",
        "<!DOCTYPE memo >",
        "<!-- Just a test -->",
        "<Memo>",
        "  First line of text",
        "  &amp; a second line of %text",
        "  A third line of %text &entity; including",
        "</Memo>"), xml(d));
    assertEquals(3, d.getRoot().getChildren(Group.BODY).size());
  }

  @Test
  public void testNestedWrapping() throws Exception {
    Map<String, Object> ns = new HashMap<String, Object>();
    ns.put("xmlns", "http://foo/bar");
    Element fooProto = new Element("foo", ns);
    Element root = new Element("foo");
    root.setPrototype(fooProto);

    Map<String, Object> attrs = new LinkedHashMap<String, Object>();
    for (int i = 3; i >= 1; i--) {
      attrs.put("baz" + i, "This really is the value of baz" + i);
    }
    root.addContent(new Element("bar", attrs));

    assertEquals(Arrays.asList(
        "<?xml version=\"1.0\" encoding=\"utf-8\" standalone=\"yes\"?>",
        "<foo xmlns=\"http://foo/bar\">",
        "  <bar baz1=\"This really is the value of baz1\"",
        "       baz2=\"This really is the value of baz2\"",
        "       baz3=\"This really is the value of baz3\"",
        "  >",
        "  </bar>",
        "</foo>"), xml(new Document(root)));
  }

  @Test
  public void testPrototypeAttributes() throws Exception {
    Map<String, Object> base = new HashMap<String, Object>();
    base.put("a", "1");
    base.put("b", "2");
    Element proto = new Element("e", base);
    Map<String, Object> own = new HashMap<String, Object>();
    own.put("b", "3");
    own.put("c", null);
    Element e = new Element("e", own);
    e.setPrototype(proto);
    assertEquals(Arrays.asList("<e a=\"1\" b=\"3\">", "</e>"), xml(e));
  }

  @Test
  public void testAttributeQuoting() throws Exception {
    Map<String, Object> attrs = new HashMap<String, Object>();
    attrs.put("title", "say \"hi\"");
    assertEquals(Arrays.asList("<p title=\"say &quot;hi&quot;\"/>"),
                 xml(new EmptyElement("p", attrs)));
  }

  @Test
  public void testEmptyElement() throws Exception {
    assertEquals(Arrays.asList("<br/>"), xml(new EmptyElement("br")));
    Map<String, Object> attrs = new HashMap<String, Object>();
    attrs.put("src", "a.png");
    attrs.put("alt", "x");
    assertEquals(Arrays.asList("<img alt=\"x\" src=\"a.png\"/>"),
                 xml(new EmptyElement("img", attrs)));
  }

  @Test
  public void testComments() {
    assertEquals(Arrays.asList("<!-- A two line",
                               "     comment for a change",
                               "-->"),
                 xml(new XmlComment("A two line\ncomment for a change")));
    assertEquals(Arrays.asList("<!-- a ··· b -->"),
                 xml(new XmlComment("a -- b")));
  }

  @Test
  public void testEscape() {
    assertEquals("a &lt; b &amp; c &amp; d &gt;",
                 XmlNode.escape("a < b & c &amp; d >"));
  }

  @Test
  public void testDoctypeWithDtd() {
    assertEquals(Arrays.asList("<!DOCTYPE memo SYSTEM \"memo.dtd\">"),
                 xml(new Doctype("memo", "memo.dtd")));
  }

  @Test
  public void testContentGoesToRoot() throws Exception {
    Document d = new Document("r");
    CharData text = new CharData("x");
    d.addContent(text);
    assertSame(d.getRoot(), text.getParent());
  }

  @Test
  public void testBadElementType() throws Exception {
    exception.expect(InvalidAttributeException.class);
    exception.expectMessage("elem_type");
    new Element("1abc");
  }

  @Test
  public void testBadStandalone() throws Exception {
    exception.expect(InvalidAttributeException.class);
    new Document("r", Nodes.kw("standalone", "maybe"));
  }
}
