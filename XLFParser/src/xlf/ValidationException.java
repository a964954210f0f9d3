package xlf;

/** A well-formed tree that fails a catalogue check. */
public class ValidationException extends FormulaException {
  private static final long serialVersionUID = 1L;

  private final transient SyntaxNode node;

  public ValidationException(SyntaxNode node, String errorMsg) {
    super(node.span().start(), errorMsg);
    this.node = node;
  }

  public SyntaxNode node() {
    return node;
  }
}
