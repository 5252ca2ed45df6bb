package exm.sdg.template;

/**
 * Reference to a single attribute value: <code>%(name.path)</code>
 */
public class AttributeRef extends Fragment {
  private final String path;

  public AttributeRef(int column, String path) {
    super(column);
    this.path = path;
  }

  /**
   * @return attribute name or dotted path
   */
  public String getPath() {
    return path;
  }

  @Override
  public Kind kind() {
    return Kind.ATTRIBUTE;
  }

  @Override
  public String source() {
    return "%(" + path + ")";
  }
}
