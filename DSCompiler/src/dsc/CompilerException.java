package dsc;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Pos pos;
  private final String errorMsg;

  public CompilerException(Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public Pos pos() {
    return pos;
  }

  public void print() {
    System.out.println(String.format("ERROR: %s@%d %s", pos.file(), pos.lineNumber(), errorMsg));
  }
}
