package xlf;

/** A failure located at a character offset of the cleaned formula. */
public class FormulaException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int offset;
  private final String errorMsg;

  public FormulaException(int offset, String errorMsg) {
    super(errorMsg);
    this.offset = offset;
    this.errorMsg = errorMsg;
  }

  public int offset() {
    return offset;
  }

  public String errorMsg() {
    return errorMsg;
  }

  public void print() {
    System.out.println(String.format("ERROR: @%d %s", offset, errorMsg));
  }
}
