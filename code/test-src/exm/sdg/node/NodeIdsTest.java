package exm.sdg.node;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

public class NodeIdsTest {

  @Test
  public void testIncreasing() {
    Node a = new Node(Node.TYPE);
    Node b = new Node(Node.TYPE);
    assertTrue(b.getId() > a.getId());
  }

  @Test
  public void testUniqueAcrossThreads() throws Exception {
    final int threads = 4;
    final int perThread = 1000;
    final Set<Long> ids = Collections.synchronizedSet(new HashSet<Long>());
    List<Thread> workers = new ArrayList<Thread>();
    for (int t = 0; t < threads; t++) {
      Thread w = new Thread(new Runnable() {
        @Override
        public void run() {
          for (int i = 0; i < perThread; i++) {
            ids.add(NodeIds.next());
          }
        }
      });
      workers.add(w);
      w.start();
    }
    for (Thread w: workers) {
      w.join();
    }
    assertEquals(threads * perThread, ids.size());
  }
}
