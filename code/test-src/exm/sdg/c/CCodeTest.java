package exm.sdg.c;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import com.google.common.collect.Lists;

import exm.sdg.common.Logging;
import exm.sdg.common.exceptions.InvalidAttributeException;
import exm.sdg.common.exceptions.InvalidChildException;
import exm.sdg.node.Group;
import exm.sdg.node.Node;
import exm.sdg.node.Nodes;
import exm.sdg.node.Scope;
import exm.sdg.render.DocumentWriter;
import exm.sdg.render.Formats;
import exm.sdg.render.Renderer;

public class CCodeTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/CCodeTest.sdg.log", true);
  }

  private static List<String> c(Node n) {
    return DocumentWriter.lines(n, Formats.C_FORMAT);
  }

  private static List<String> h(Node n) {
    return DocumentWriter.lines(n, Formats.H_FORMAT);
  }

  @Test
  public void testIfWithoutElse() throws Exception {
    If i = new If("x > 0", "y = 1");
    assertEquals(Arrays.asList("if (x > 0)", "{", "  y = 1;", "};"), c(i));
  }

  @Test
  public void testIfElseIfElse() throws Exception {
    If i = new If("a", "x = 1");
    i.insert(new ElseIf("b", "x = 2"));
    i.insert(new Else("x = 3"));
    assertEquals(Arrays.asList(
        "if (a)", "{", "  x = 1;", "}",
        "else if (b)", "{", "  x = 2;", "}",
        "else", "{", "  x = 3;", "};"), c(i));
    assertEquals("", i.getThen().getTrailer());
  }

  @Test
  public void testIfSecondElse() throws Exception {
    If i = new If("a", "x = 1");
    i.insert(new Else("x = 3"));
    exception.expect(InvalidChildException.class);
    i.insert(new Else("x = 4"));
  }

  @Test
  public void testIfRejectsStatement() throws Exception {
    If i = new If("a");
    exception.expect(InvalidChildException.class);
    i.insert(new Statement("x = 1"));
  }

  @Test
  public void testStatementsFromCode() throws Exception {
    Block b = new Block(new Var("int", "i"), "i = 0; i++;");
    assertEquals(Arrays.asList("{", "  int i;", "  i = 0;", "  i++;", "}"),
                 c(b));
    assertEquals(1, b.getChildren(Group.DECL).size());
    assertEquals(2, b.getChildren(Group.BODY).size());
  }

  @Test
  public void testLoops() throws Exception {
    assertEquals(Arrays.asList("for (i = 0; i < n; i++)", "{",
                               "  s += i;", "}"),
                 c(new For("i = 0", "i < n", "i++", "s += i")));
    assertEquals(Arrays.asList("while (*p)", "{", "  p++;", "}"),
                 c(new While("*p", "p++")));
  }

  @Test
  public void testSwitch() throws Exception {
    Switch s = new Switch("c",
        new Case("1", "a = 0"),
        new Case("2", "a = 10; b = 20"),
        new DefaultCase("hugo ()"));
    assertEquals(Arrays.asList(
        "switch (c)",
        "  {",
        "    case 1 :",
        "      a = 0;",
        "      break;",
        "    case 2 :",
        "      a = 10;",
        "      b = 20;",
        "      break;",
        "    default :",
        "      hugo ();",
        "  }"), c(s));
  }

  @Test
  public void testSwitchSingleDefault() throws Exception {
    Switch s = new Switch("c", new DefaultCase("x ()"));
    exception.expect(InvalidChildException.class);
    s.insert(new DefaultCase("y ()"));
  }

  @Test
  public void testVar() {
    Var v = new Var("int", "x", Nodes.kw("init", "42", "const", true));
    assertEquals(Arrays.asList("const int x = 42;"), c(v));
    assertEquals(Arrays.asList("const int x;"), h(v));

    Var e = new Var("long", "y", Nodes.kw("extern", true, "init", ""));
    assertEquals(Arrays.asList("extern long y;"), c(e));
  }

  @Test
  public void testStaticVarOnlyInBody() {
    Var v = new Var("int", "n", Nodes.kw("static", true));
    assertEquals(Scope.BODY, v.getScope());
    assertEquals(Arrays.asList("static int n;"), c(v));
    assertTrue(h(v).isEmpty());
  }

  @Test
  public void testArgList() throws Exception {
    ArgList args = new ArgList("int x, char* s, void");
    assertEquals(2, args.getChildren(Group.DECL).size());
    assertEquals(Arrays.asList("int x", "    , char* s"), c(args));
    assertTrue(new ArgList("void").getChildren(Group.DECL).isEmpty());
  }

  @Test
  public void testMalformedArgument() throws Exception {
    exception.expect(InvalidChildException.class);
    exception.expectMessage("malformed argument");
    new ArgList("int");
  }

  @Test
  public void testMalformedFunctionArguments() throws Exception {
    exception.expect(InvalidAttributeException.class);
    new Function("int", "f", "int");
  }

  @Test
  public void testSignatureForms() throws Exception {
    assertEquals("int neg (int x)",
                 h(new Function("int", "neg", "int x")).get(0));
    assertEquals("int zero (void)",
                 h(new Function("int", "zero", "")).get(0));
    assertEquals(Arrays.asList("int add", "    ( int a", "    , int b",
                               "    );", ""),
                 h(new Function("int", "add", "int a, int b")));
  }

  @Test
  public void testModule() throws Exception {
    Module m = new Module("demo");
    Function pub = new Function("int", "add", "int a, int b");
    pub.addCode("return a + b");
    Function priv = new Function("void", "helper", null,
                                 Nodes.kw("static", true));
    priv.addCode("count++");
    m.add(new Include("<stdio.h>"), pub, priv);

    assertEquals(Arrays.asList(
        "#ifndef _demo_h_",
        "#define _demo_h_",
        "#include <stdio.h>",
        "int add",
        "    ( int a",
        "    , int b",
        "    );",
        "",
        "#endif /* _demo_h_ */"), h(m));

    assertEquals(Arrays.asList(
        "#include <stdio.h>",
        "int add",
        "    ( int a",
        "    , int b",
        "    )",
        "{",
        "  return a + b;",
        "}",
        "",
        "static void helper (void)",
        "{",
        "  count++;",
        "}",
        ""), c(m));
  }

  @Test
  public void testModuleDoesNotPassScope() throws Exception {
    Module m = new Module("demo");
    Var v = new Var("int", "counter");
    m.add(v);
    m.updateScope(Scope.HEADER);
    assertEquals(Scope.BOTH, v.getScope());
  }

  @Test
  public void testFunctionMadeStaticAfterConstruction() throws Exception {
    Module m = new Module("demo");
    Function f = new Function("void", "helper", null);
    f.addCode("count++");
    m.add(f);
    assertEquals(Scope.BOTH, f.getScope());

    f.setAttribute(Function.STATIC, true);
    assertEquals(Scope.BODY, f.getScope());
    assertTrue(f.isScopePinned());

    assertEquals(Arrays.asList(
        "#ifndef _demo_h_",
        "#define _demo_h_",
        "#endif /* _demo_h_ */"), h(m));
    assertEquals(Arrays.asList(
        "static void helper (void)",
        "{",
        "  count++;",
        "}",
        ""), c(m));
  }

  @Test
  public void testVarMadeStaticAfterConstruction() {
    Var v = new Var("int", "n");
    assertEquals(Arrays.asList("int n;"), h(v));
    v.setAttribute(Var.STATIC, true);
    assertEquals(Scope.BODY, v.getScope());
    assertTrue(h(v).isEmpty());
    assertEquals(Arrays.asList("static int n;"), c(v));
  }

  @Test
  public void testModuleUpdateKeepsChildScope() throws Exception {
    Module m = new Module("demo");
    Var v = new Var("int", "counter");
    m.add(v);
    m.updateScope(Scope.BODY);
    assertEquals(Scope.BOTH, v.getScope());
    assertEquals(Arrays.asList("int counter;"), c(m));
  }

  @Test
  public void testFunctionBodyScope() throws Exception {
    Function f = new Function("void", "g", null);
    Var local = new Var("int", "i");
    f.insert(local);
    assertEquals(Arrays.asList(local), f.getChildren(Group.DECL));
    assertEquals(Scope.BODY, local.getScope());
  }

  @Test
  public void testDescriptionComment() throws Exception {
    Function f = new Function("void", "g", null,
                              Nodes.kw("description", "Does nothing"));
    List<String> lines = c(f);
    assertEquals("/* Does nothing */", lines.get(0));
    assertEquals("void g (void)", lines.get(1));
  }

  @Test
  public void testCommentWrapping() {
    Comment cm = new Comment("the quick brown fox jumps over the lazy dog");
    assertEquals(Arrays.asList("/* the quick brown fox */",
                               "/* jumps over the lazy */",
                               "/* dog */"),
        Lists.newArrayList(Renderer.render(cm, Formats.C_FORMAT, 30, null)));
  }

  @Test
  public void testInclude() {
    assertEquals(Arrays.asList("#include \"sdg.h\""), c(new Include("sdg.h")));
  }
}
