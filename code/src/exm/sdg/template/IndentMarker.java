package exm.sdg.template;

import exm.sdg.common.Settings;

/**
 * Leading marker run: indentation level of the line
 */
public class IndentMarker extends Fragment {
  private final int level;

  public IndentMarker(int level) {
    super(1);
    this.level = level;
  }

  public int getLevel() {
    return level;
  }

  @Override
  public Kind kind() {
    return Kind.INDENT_MARKER;
  }

  @Override
  public String source() {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < level; i++) {
      sb.append(Settings.indentMarker());
    }
    return sb.toString();
  }
}
