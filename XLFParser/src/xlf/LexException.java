package xlf;

/** No token pattern matches at some offset of the input. */
public class LexException extends FormulaException {
  private static final long serialVersionUID = 1L;

  private static final int CONTEXT_RADIUS = 3;

  private final char offendingChar;
  private final String context;

  LexException(String source, int offset) {
    this(source.charAt(offset), offset, contextAround(source, offset));
  }

  public LexException(char offendingChar, int offset, String context) {
    super(
        offset,
        String.format("Unrecognised input at %d: '%c' (…%s…)", offset, offendingChar, context));
    this.offendingChar = offendingChar;
    this.context = context;
  }

  static String contextAround(String source, int offset) {
    return source.substring(
        Math.max(offset - CONTEXT_RADIUS, 0), Math.min(offset + CONTEXT_RADIUS, source.length()));
  }

  public char offendingChar() {
    return offendingChar;
  }

  /** Up to three characters either side of the offending one. */
  public String context() {
    return context;
  }
}
