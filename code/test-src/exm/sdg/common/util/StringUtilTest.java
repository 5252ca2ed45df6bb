package exm.sdg.common.util;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

public class StringUtilTest {

  @Test
  public void testSplitLinesKeepsEmptyPieces() {
    assertEquals(Arrays.asList("a", "", "b", ""),
                 StringUtil.splitLines("a\n\nb\n"));
    assertEquals(Arrays.asList(""), StringUtil.splitLines(""));
  }

  @Test
  public void testLastLineLength() {
    assertEquals(3, StringUtil.lastLineLength("abc"));
    assertEquals(2, StringUtil.lastLineLength("abc\nde"));
    assertEquals(0, StringUtil.lastLineLength("abc\n"));
  }

  @Test
  public void testSpacesAndWords() {
    assertEquals("   ", StringUtil.spaces(3));
    assertEquals("", StringUtil.spaces(0));
    assertEquals(Arrays.asList("a", "b", "c"),
                 StringUtil.words(" a\tb\n c "));
  }
}
