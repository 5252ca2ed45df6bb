package exm.sdg.common.exceptions;

/**
 * A different template was supplied for a (type, format) pair
 * that was already compiled
 */
public class TemplateAlreadyCompiledException
    extends TemplateCompileException {

  public TemplateAlreadyCompiledException(String typeName, String format) {
    super(typeName, format, 0, 0,
          "template already compiled with different text");
  }

  private static final long serialVersionUID = 1L;
}
