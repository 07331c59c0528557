package dsc;

/** Reserved line prefixes controlling script structure. */
public enum Directive {
  IF_OPTION("*if option"),
  END_IF_OPTION("*end if option"),
  MERGE_OPTION("*merge option"),
  MERGE_IF("*merge if"),
  IF("*if"),
  ELSE("*else"),
  CHOICE("*choice"),
  END_CHOICE("*end choice");

  public static final char MARKER = '*';

  private final String prefix;

  Directive(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }

  public boolean matches(String line) {
    return line.startsWith(prefix);
  }

  public static boolean isPlainIf(String line) {
    return IF.matches(line) && !IF_OPTION.matches(line);
  }

  public static boolean isFirstIfOption(String line) {
    return line.startsWith(IF_OPTION.prefix + " 1");
  }

  /** True for {@code *if option N} lines that open the second or a later arm. */
  public static boolean isLaterIfOption(String line) {
    return IF_OPTION.matches(line) && !isFirstIfOption(line);
  }
}
