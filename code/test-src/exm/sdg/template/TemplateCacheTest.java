package exm.sdg.template;

import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.sdg.common.Logging;
import exm.sdg.common.exceptions.TemplateAlreadyCompiledException;
import exm.sdg.common.exceptions.TemplateCompileException;
import exm.sdg.node.Node;
import exm.sdg.node.NodeType;
import exm.sdg.node.NodeTypes;

public class TemplateCacheTest {

  private static final String FMT = "test_format";

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/TemplateCacheTest.sdg.log", true);
  }

  @Test
  public void testCompiledOnRegistration() {
    NodeType t = NodeTypes.register(
        new NodeType.Builder("TCT_Registered", Node.TYPE)
          .template(FMT, "%(name)")
          .build());
    CompiledTemplate c = TemplateCache.lookup(t, FMT);
    assertNotNull(c);
    assertSame(c, TemplateCache.compile(t, FMT, "%(name)"));
    assertSame(c, TemplateCache.lookup(t, FMT));
  }

  @Test
  public void testLazyCompile() {
    NodeType t = new NodeType.Builder("TCT_Lazy", Node.TYPE)
          .template(FMT, "%(type)")
          .build();
    CompiledTemplate c = TemplateCache.lookup(t, FMT);
    assertNotNull(c);
    assertSame(c, TemplateCache.lookup(t, FMT));
  }

  @Test
  public void testNoTemplate() {
    NodeType t = new NodeType.Builder("TCT_None", Node.TYPE).build();
    assertNull(TemplateCache.lookup(t, FMT));
  }

  @Test
  public void testRecompileWithOtherText() {
    NodeType t = new NodeType.Builder("TCT_Twice", Node.TYPE).build();
    TemplateCache.compile(t, FMT, "a");
    exception.expect(TemplateAlreadyCompiledException.class);
    TemplateCache.compile(t, FMT, "b");
  }

  @Test
  public void testBadTemplateFailsRegistration() {
    exception.expect(TemplateCompileException.class);
    exception.expectMessage("TCT_Broken");
    NodeTypes.register(
        new NodeType.Builder("TCT_Broken", Node.TYPE)
          .template(FMT, "%(missing)")
          .build());
  }
}
