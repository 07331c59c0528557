package dsc;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;

/**
 * Re-indents emitted step code: cases at the left margin, bodies one level in plus one level per
 * open brace, and a blank line after each {@code break;}.
 */
public class BraceIndentFormatter implements OutputFormatter {
  private static final Splitter LINES = Splitter.on('\n').trimResults().omitEmptyStrings();

  private final String indent;

  public BraceIndentFormatter(int indentWidth) {
    this.indent = Strings.repeat(" ", indentWidth);
  }

  public BraceIndentFormatter() {
    this(4);
  }

  @Override
  public String format(String code) {
    StringBuilder out = new StringBuilder();
    int depth = 0;
    for (String line : LINES.split(code)) {
      if (line.startsWith("case ")) {
        depth = 0;
        out.append(line).append('\n');
        continue;
      }

      if (line.startsWith("}")) {
        depth = Math.max(0, depth - 1);
      }
      out.append(Strings.repeat(indent, depth + 1)).append(line).append('\n');
      if (line.endsWith("{")) {
        depth++;
      }
      if (line.equals("break;")) {
        out.append('\n');
      }
    }
    return out.toString();
  }
}
