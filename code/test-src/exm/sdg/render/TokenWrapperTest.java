package exm.sdg.render;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class TokenWrapperTest {

  @Test
  public void testBelowWidth() {
    assertEquals(Arrays.asList("aaaa bbbb"),
                 TokenWrapper.wrap(Arrays.asList("aaaa", "bbbb"), 10));
  }

  @Test
  public void testExactlyWidth() {
    // Joining space counts
    assertEquals(Arrays.asList("aaaa bbbbb"),
                 TokenWrapper.wrap(Arrays.asList("aaaa", "bbbbb"), 10));
  }

  @Test
  public void testAboveWidth() {
    assertEquals(Arrays.asList("aaaa", "bbbbbb"),
                 TokenWrapper.wrap(Arrays.asList("aaaa", "bbbbbb"), 10));
  }

  @Test
  public void testOversizedTokenAlone() {
    assertEquals(Arrays.asList("ab", "abcdefghijklmno", "cd"),
        TokenWrapper.wrap(Arrays.asList("ab", "abcdefghijklmno", "cd"), 5));
  }

  @Test
  public void testNoTokens() {
    assertTrue(TokenWrapper.wrap(Collections.<String>emptyList(), 10)
                           .isEmpty());
    assertTrue(TokenWrapper.wrapText("   ", 10).isEmpty());
  }

  @Test
  public void testWrapText() {
    assertEquals(Arrays.asList("the quick", "brown fox"),
                 TokenWrapper.wrapText("  the quick\nbrown   fox ", 10));
  }
}
