package dsc;

/** A location in a script file. Line numbers are 1-based. */
public class Pos {
  private static final Pos INTERNAL = new Pos("<internal>", -1);

  public static Pos internal() {
    return INTERNAL;
  }

  private final String file;
  private final int lineNumber;

  public Pos(String file, int lineNumber) {
    this.file = file;
    this.lineNumber = lineNumber;
  }

  public String file() {
    return file;
  }

  public int lineNumber() {
    return lineNumber;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Pos)) {
      return false;
    }
    Pos that = (Pos) obj;
    return file.equals(that.file) && lineNumber == that.lineNumber;
  }

  @Override
  public int hashCode() {
    return 31 * file.hashCode() + lineNumber;
  }

  @Override
  public String toString() {
    return file + "@" + lineNumber;
  }
}
