package exm.sdg.node;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.HashMap;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdg.common.Logging;
import exm.sdg.common.exceptions.AttributeNotFoundException;

public class AttributeResolverTest {

  private static final NodeType ITEM = NodeTypes.register(
      new NodeType.Builder("ART_Item", Node.TYPE)
        .attribute("colour", "red")
        .attribute("props", null)
        .attribute("link", null)
        .attributeNoDefault("size", null)
        .trailer(";")
        .build());

  private static final NodeType DECLARES_BUILTINS = NodeTypes.register(
      new NodeType.Builder("ART_DeclaresBuiltins", Node.TYPE)
        .attribute("id", "declared")
        .attributeNoDefault("type", null)
        .build());

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/AttributeResolverTest.sdg.log", true);
  }

  @Test
  public void testOwnBeatsDefault() {
    Node n = new Node(ITEM);
    assertEquals("red", n.getAttribute("colour"));
    assertEquals(AttributeSource.DEFAULT,
                 AttributeResolver.lookup(n, "colour").source);

    n.setAttribute("colour", "blue");
    assertEquals("blue", n.getAttribute("colour"));
    assertEquals(AttributeSource.OWN,
                 AttributeResolver.lookup(n, "colour").source);
  }

  @Test
  public void testPrototypeChain() {
    Node base = new Node(ITEM);
    base.setAttribute("size", 10);
    Node middle = new Node(ITEM);
    middle.setPrototype(base);
    Node n = new Node(ITEM);
    n.setPrototype(middle);

    assertEquals(10, n.getAttribute("size"));
    assertEquals(AttributeSource.PROTOTYPE,
                 AttributeResolver.lookup(n, "size").source);

    middle.setAttribute("size", 20);
    assertEquals(20, n.getAttribute("size"));
  }

  @Test
  public void testNoValueAnywhere() {
    Node n = new Node(ITEM);
    assertNull(AttributeResolver.lookup(n, "size"));
    exception.expect(AttributeNotFoundException.class);
    exception.expectMessage("size");
    n.getAttribute("size");
  }

  @Test
  public void testStoredNullIsAValue() {
    Node n = new Node(ITEM);
    n.setAttribute("size", null);
    assertNull(n.getAttribute("size"));
  }

  @Test
  public void testBuiltins() {
    Node n = new Node(ITEM);
    assertEquals(n.getId(), n.getAttribute("id"));
    assertEquals("ART_Item", n.getAttribute("type"));
    assertEquals(";", n.getAttribute("trailer"));
    assertEquals("BOTH", n.getAttribute("scope"));
    assertEquals(AttributeSource.BUILTIN,
                 AttributeResolver.lookup(n, "id").source);
  }

  @Test
  public void testDottedPath() {
    Node target = new Node(ITEM);
    target.setAttribute("colour", "green");
    Map<String, Object> props = new HashMap<String, Object>();
    props.put("width", 3);
    Node n = new Node(ITEM);
    n.setAttribute("link", target);
    n.setAttribute("props", props);

    assertEquals("green", n.getAttribute("link.colour"));
    assertEquals(3, n.getAttribute("props.width"));
  }

  @Test
  public void testDottedPathMissingKey() {
    Node n = new Node(ITEM);
    n.setAttribute("props", new HashMap<String, Object>());
    exception.expect(AttributeNotFoundException.class);
    n.getAttribute("props.height");
  }

  @Test
  public void testDottedPathThroughPlainValue() {
    Node n = new Node(ITEM);
    exception.expect(AttributeNotFoundException.class);
    n.getAttribute("colour.shade");
  }

  @Test
  public void testDeclaredAttributeHidesBuiltin() {
    Node n = new Node(DECLARES_BUILTINS);
    assertEquals("declared", n.getAttribute("id"));
    assertEquals(AttributeSource.DEFAULT,
                 AttributeResolver.lookup(n, "id").source);

    n.setAttribute("type", "int");
    assertEquals("int", n.getAttribute("type"));
    assertEquals(AttributeSource.OWN,
                 AttributeResolver.lookup(n, "type").source);
  }

  @Test
  public void testBuiltinAfterPrototypeMiss() {
    Node proto = new Node(DECLARES_BUILTINS);
    proto.setAttribute("type", "char");
    Node n = new Node(DECLARES_BUILTINS);
    n.setPrototype(proto);
    assertEquals("char", n.getAttribute("type"));
    assertEquals(AttributeSource.PROTOTYPE,
                 AttributeResolver.lookup(n, "type").source);

    // declared without default and not set anywhere
    Node bare = new Node(DECLARES_BUILTINS);
    assertEquals("ART_DeclaresBuiltins", bare.getAttribute("type"));
    assertEquals(AttributeSource.BUILTIN,
                 AttributeResolver.lookup(bare, "type").source);
  }
}
