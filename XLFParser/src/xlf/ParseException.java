package xlf;

/** The token stream does not reduce to exactly one expression. */
public class ParseException extends FormulaException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    NO_GRAMMAR_RULE,
    UNEXPECTED_TOKEN,
    TOKEN_CANNOT_APPEAR_HERE,
    UNEXPECTED_TRAILING_TOKEN,
    EXPECTED_TOKEN_NOT_FOUND,
    NESTING_TOO_DEEP;
  }

  private final Kind kind;
  private final String tokenText;

  public ParseException(Kind kind, Tokenizer.Token token, String errorMsg) {
    super(token.span().start(), errorMsg);
    this.kind = kind;
    this.tokenText = token.text();
  }

  public Kind kind() {
    return kind;
  }

  /** The text of the offending token; empty for end of input. */
  public String tokenText() {
    return tokenText;
  }
}
