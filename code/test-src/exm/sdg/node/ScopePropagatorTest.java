package exm.sdg.node;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.sdg.common.Logging;

public class ScopePropagatorTest {

  private static final NodeType CONTAINER = NodeTypes.register(
      new NodeType.Builder("SPT_Container", Node.TYPE)
        .build());

  private static final NodeType SELF_MANAGED = NodeTypes.register(
      new NodeType.Builder("SPT_SelfManaged", Node.TYPE)
        .scope(Scope.BODY)
        .inheritsScope(false)
        .build());

  private static final NodeType FORCING = NodeTypes.register(
      new NodeType.Builder("SPT_Forcing", Node.TYPE)
        .childScope(Scope.BODY)
        .build());

  private static final NodeType BARRIER = NodeTypes.register(
      new NodeType.Builder("SPT_Barrier", Node.TYPE)
        .passesScope(false)
        .build());

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("target/ScopePropagatorTest.sdg.log", true);
  }

  @Test
  public void testVisibility() {
    assertTrue(Scope.BOTH.visibleIn(Scope.HEADER));
    assertTrue(Scope.HEADER.visibleIn(Scope.BOTH));
    assertTrue(Scope.BODY.visibleIn(Scope.BODY));
    assertFalse(Scope.BODY.visibleIn(Scope.HEADER));
    assertFalse(Scope.HEADER.visibleIn(Scope.BODY));
  }

  @Test
  public void testUpdateReachesDescendants() throws Exception {
    Node root = new Node(CONTAINER);
    Node mid = new Node(CONTAINER);
    Node leaf = new Node(CONTAINER);
    mid.insert(leaf);
    root.insert(mid);

    root.updateScope(Scope.HEADER);
    assertEquals(Scope.HEADER, root.getScope());
    assertEquals(Scope.HEADER, mid.getScope());
    assertEquals(Scope.HEADER, leaf.getScope());
  }

  @Test
  public void testInsertInheritsParentScope() throws Exception {
    Node root = new Node(CONTAINER);
    root.updateScope(Scope.BODY);
    Node child = new Node(CONTAINER);
    root.insert(child);
    assertEquals(Scope.BODY, child.getScope());
  }

  @Test
  public void testPinnedSubtreeShielded() throws Exception {
    Node root = new Node(CONTAINER);
    Node pinned = new Node(CONTAINER);
    Node below = new Node(CONTAINER);
    pinned.insert(below);
    pinned.pinScope(Scope.BODY);
    assertEquals(Scope.BODY, below.getScope());

    root.insert(pinned);
    root.updateScope(Scope.HEADER);
    assertEquals(Scope.HEADER, root.getScope());
    assertEquals(Scope.BODY, pinned.getScope());
    assertEquals(Scope.BODY, below.getScope());
    assertTrue(pinned.isScopePinned());
  }

  @Test
  public void testExplicitUpdateOnPinnedNode() {
    Node pinned = new Node(CONTAINER);
    pinned.pinScope(Scope.BODY);
    pinned.updateScope(Scope.HEADER);
    assertEquals(Scope.HEADER, pinned.getScope());
  }

  @Test
  public void testSelfManagedTypeKeepsScope() throws Exception {
    Node root = new Node(CONTAINER);
    Node self = new Node(SELF_MANAGED);
    root.insert(self);
    root.updateScope(Scope.HEADER);
    assertEquals(Scope.BODY, self.getScope());
  }

  @Test
  public void testForcedChildScope() throws Exception {
    Node forcing = new Node(FORCING);
    Node child = new Node(CONTAINER);
    forcing.insert(child);
    forcing.updateScope(Scope.HEADER);
    assertEquals(Scope.HEADER, forcing.getScope());
    assertEquals(Scope.BODY, child.getScope());
  }

  @Test
  public void testBarrierDoesNotPassOnInsert() throws Exception {
    Node barrier = new Node(BARRIER);
    barrier.updateScope(Scope.HEADER);
    Node child = new Node(CONTAINER);
    barrier.insert(child);
    assertEquals(Scope.BOTH, child.getScope());
  }

  @Test
  public void testBarrierDoesNotPassOnUpdate() throws Exception {
    Node barrier = new Node(BARRIER);
    Node child = new Node(CONTAINER);
    Node below = new Node(CONTAINER);
    child.insert(below);
    barrier.insert(child);

    barrier.updateScope(Scope.BODY);
    assertEquals(Scope.BODY, barrier.getScope());
    assertEquals(Scope.BOTH, child.getScope());
    assertEquals(Scope.BOTH, below.getScope());

    child.updateScope(Scope.HEADER);
    assertEquals(Scope.HEADER, below.getScope());
  }
}
