package exm.sdg.render;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.Lists;

import exm.sdg.common.Logging;
import exm.sdg.common.exceptions.RenderException;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;
import exm.sdg.node.Nodes;
import exm.sdg.node.Scope;

public class RendererTest {

  private static final String FMT = "rt_format";
  private static final String ALT = "rt_alt_format";
  private static final String BODY_ONLY = "rt_body_format";

  static {
    Formats.registerPass(FMT, Scope.BOTH);
    Formats.registerPass(ALT, Scope.BOTH);
    Formats.registerPass(BODY_ONLY, Scope.BODY);
  }

  private static final NodeType LEAF = NodeTypes.register(
      new NodeType.Builder("RT_Leaf", Node.TYPE)
        .groups()
        .template(FMT, "%(name)")
        .template(ALT, "<%(name)>")
        .template(BODY_ONLY, "%(name)")
        .build());

  private static final NodeType LIST = NodeTypes.register(
      new NodeType.Builder("RT_List", Node.TYPE)
        .template(FMT, "%(:head=(¡rear=)¡sep=, ¡empty=<none>:*body:)")
        .build());

  private static final NodeType SINGLE = NodeTypes.register(
      new NodeType.Builder("RT_Single", Node.TYPE)
        .template(FMT, "%(:head=(¡rear=)¡front0=[¡rear0=]¡sep=, :*body:)")
        .build());

  private static final NodeType NEST = NodeTypes.register(
      new NodeType.Builder("RT_Nest", Node.TYPE)
        .template(FMT, "%(name)\n>%(::*body:)")
        .template(BODY_ONLY, "%(name)\n>%(::*body:)")
        .build());

  private static final NodeType ALT_CHILDREN = NodeTypes.register(
      new NodeType.Builder("RT_AltChildren", Node.TYPE)
        .template(FMT, "%(:sep= :*body.rt_alt_format:)")
        .build());

  private static final NodeType VALUES = NodeTypes.register(
      new NodeType.Builder("RT_Values", Node.TYPE)
        .attribute("args", null)
        .groups()
        .template(FMT, "f(%(:sep=,¡rear=):>.args:)")
        .template(ALT, "%(:lead=[¡tail=]¡sep_eol=;:.args:)")
        .template(BODY_ONLY, "%(args)\n>%(args)")
        .build());

  private static final NodeType LAZY = NodeTypes.register(
      new NodeType.Builder("RT_Lazy", Node.TYPE)
        .attributeNoDefault("missing", null)
        .groups()
        .template(FMT, "first\n%(missing)")
        .build());

  private static final NodeType BLANK = NodeTypes.register(
      new NodeType.Builder("RT_Blank", Node.TYPE)
        .template(FMT, "x\n>\n%(::*body:)\n100%% y")
        .build());

  private static final NodeType WORDS = NodeTypes.register(
      new NodeType.Builder("RT_Words", Node.TYPE)
        .attribute("text", "")
        .groups()
        .lineSource("words", new LineSource() {
          @Override
          public Iterable<String> lines(Node node, RenderContext ctx) {
            return TokenWrapper.wrapText((String)node.getAttribute("text"),
                                         ctx.wrapWidth());
          }
        })
        .template(FMT, "%(:lead=# :@words:)")
        .build());

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/RendererTest.sdg.log", true);
  }

  private static Node named(NodeType type, String name) {
    return Nodes.create(type, new Object[0], Nodes.kw("name", name));
  }

  private static Node values(Object args) {
    return Nodes.create(VALUES, new Object[0], Nodes.kw("args", args));
  }

  private static List<String> render(Node n, String format) {
    return Lists.newArrayList(Renderer.render(n, format, 79, "  "));
  }

  @Test
  public void testSeparatorBetweenItems() throws Exception {
    Node list = new Node(LIST);
    list.add(named(LEAF, "a"), named(LEAF, "b"), named(LEAF, "c"));
    List<String> lines = render(list, FMT);
    assertEquals(Arrays.asList("(a", ", b", ", c)"), lines);

    int separators = 0;
    for (String l: lines) {
      if (l.startsWith(", ")) {
        separators++;
      }
    }
    assertEquals(2, separators);
  }

  @Test
  public void testEmptyModifier() {
    assertEquals(Arrays.asList("<none>"), render(new Node(LIST), FMT));
  }

  @Test
  public void testSingleLineVariant() throws Exception {
    Node one = new Node(SINGLE);
    one.add(named(LEAF, "a"));
    assertEquals(Arrays.asList("[a]"), render(one, FMT));

    Node two = new Node(SINGLE);
    two.add(named(LEAF, "a"), named(LEAF, "b"));
    assertEquals(Arrays.asList("(a", ", b)"), render(two, FMT));
  }

  @Test
  public void testNestedIndentation() throws Exception {
    Node a = named(NEST, "a");
    Node b = named(NEST, "b");
    b.add(named(LEAF, "c"));
    a.add(b, named(LEAF, "d"));
    assertEquals(Arrays.asList("a", "  b", "    c", "  d"), render(a, FMT));
    assertEquals(Arrays.asList("a", "\tb", "\t\tc", "\td"),
                 Lists.newArrayList(Renderer.render(a, FMT, 79, "\t")));
  }

  @Test
  public void testRenderIsRepeatable() throws Exception {
    Node a = named(NEST, "a");
    a.add(named(LEAF, "b"));
    Iterable<String> rendering = Renderer.render(a, FMT, 79, "  ");
    List<String> first = Lists.newArrayList(rendering);
    List<String> second = Lists.newArrayList(rendering);
    assertEquals(Arrays.asList("a", "  b"), first);
    assertEquals(first, second);
  }

  @Test
  public void testChildFormatOverride() throws Exception {
    Node n = new Node(ALT_CHILDREN);
    n.add(named(LEAF, "a"), named(LEAF, "b"));
    assertEquals(Arrays.asList("<a>", " <b>"), render(n, FMT));
  }

  @Test
  public void testAnchoredValues() {
    assertEquals(Arrays.asList("f(x", "  ,y", "  ,z)"),
                 render(values(Arrays.asList("x", "y", "z")), FMT));
    assertEquals(Arrays.asList("f(x)"),
                 render(values(Arrays.asList("x")), FMT));
  }

  @Test
  public void testLeadTailSepEol() {
    assertEquals(Arrays.asList("[a];", "[b]"),
                 render(values(Arrays.asList("a", "b")), ALT));
  }

  @Test
  public void testNullValueGivesNoItems() {
    // A line that is empty because its expansion is empty is dropped
    assertEquals(Arrays.<String>asList(), render(values(null), ALT));
  }

  @Test
  public void testAttributeStringification() {
    assertEquals(Arrays.asList("a b", "  a b"),
                 render(values(Arrays.asList("a", "b")), BODY_ONLY));
    assertEquals(Arrays.asList("p", "", "q", "  p", "", "  q"),
                 render(values("p\n\nq"), BODY_ONLY));
  }

  @Test
  public void testBlankLinesAndEscapes() {
    assertEquals(Arrays.asList("x", "", "100% y"),
                 render(new Node(BLANK), FMT));
  }

  @Test
  public void testPassFiltersScopes() throws Exception {
    Node a = named(NEST, "a");
    Node hidden = named(LEAF, "h");
    a.add(named(LEAF, "b"), hidden);
    hidden.pinScope(Scope.HEADER);
    assertEquals(Arrays.asList("a", "  b"), render(a, BODY_ONLY));
    assertEquals(Arrays.asList("a", "  b", "  h"), render(a, FMT));

    a.updateScope(Scope.HEADER);
    assertEquals(Arrays.<String>asList(), render(a, BODY_ONLY));
  }

  @Test
  public void testWrapWidthFollowsColumn() throws Exception {
    String text = "aaa bbb ccc ddd eee";
    Node top = Nodes.create(WORDS, new Object[0], Nodes.kw("text", text));
    assertEquals(Arrays.asList("# aaa bbb ccc", "# ddd eee"),
                 Lists.newArrayList(Renderer.render(top, FMT, 18, "  ")));

    Node a = named(NEST, "a");
    a.add(Nodes.create(WORDS, new Object[0], Nodes.kw("text", text)));
    assertEquals(Arrays.asList("a", "  # aaa bbb", "  # ccc ddd", "  # eee"),
                 Lists.newArrayList(Renderer.render(a, FMT, 18, "  ")));
  }

  @Test
  public void testRenderingIsLazy() {
    Iterator<String> it = Renderer.render(new Node(LAZY), FMT, 79, "  ")
                                  .iterator();
    assertEquals("first", it.next());
    exception.expect(RenderException.class);
    exception.expectMessage("missing");
    it.next();
  }

  @Test
  public void testMissingTemplate() {
    exception.expect(RenderException.class);
    exception.expectMessage("RT_List");
    render(new Node(LIST), ALT);
  }
}
