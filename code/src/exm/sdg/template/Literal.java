package exm.sdg.template;

public class Literal extends Fragment {
  private final String text;

  public Literal(int column, String text) {
    super(column);
    this.text = text;
  }

  public String getText() {
    return text;
  }

  @Override
  public Kind kind() {
    return Kind.LITERAL;
  }

  @Override
  public String source() {
    return text.replace("%", "%%").replace("\n", "\\n");
  }
}
