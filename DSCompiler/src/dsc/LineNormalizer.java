package dsc;

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Cleans raw script lines: trims and drops blank lines, rewrites characters the target's string
 * literals cannot hold, fixes directive casing and closes branch arms the author left open.
 */
public class LineNormalizer {

  // Curly double quotes become a string concatenation around a single-quoted '"'.
  public static final String OPEN_QUOTE_ESCAPE = "\"+'\"";
  public static final String CLOSE_QUOTE_ESCAPE = "\"'+\"";

  public static final String SYNTHETIC_END_IF_OPTION = "*end if option*";

  private static final ImmutableMap<String, String> CHARACTER_REPLACEMENTS =
      ImmutableMap.of(
          "“", OPEN_QUOTE_ESCAPE,
          "”", CLOSE_QUOTE_ESCAPE,
          "’", "'",
          "‘", "'",
          "…", "...");

  // Applied in order; "*If" has to be fixed before "*if Option".
  private static final ImmutableMap<String, String> CASING_FIXES =
      ImmutableMap.of(
          "*If", "*if",
          "*Choice", "*choice",
          "*Option", "*option",
          "*if Option", "*if option");

  private final String file;

  public LineNormalizer(String file) {
    this.file = file;
  }

  public ImmutableList<ScriptLine> normalize(List<String> rawLines) {
    ImmutableList.Builder<ScriptLine> out = ImmutableList.builder();
    ScriptLine previous = null;
    for (int i = 0; i < rawLines.size(); i++) {
      String text = rawLines.get(i).trim();
      if (text.isEmpty()) {
        continue;
      }

      text = replaceAll(text, CHARACTER_REPLACEMENTS);
      text = replaceAll(text, CASING_FIXES);

      Pos pos = new Pos(file, i + 1);
      if (closesPreviousArm(text)
          && (previous == null || !Directive.END_IF_OPTION.matches(previous.text()))) {
        out.add(ScriptLine.create(SYNTHETIC_END_IF_OPTION, pos));
      }

      previous = ScriptLine.create(text, pos);
      out.add(previous);
    }
    return out.build();
  }

  public static String unescapeQuotes(String text) {
    return text.replace(OPEN_QUOTE_ESCAPE, "\"").replace(CLOSE_QUOTE_ESCAPE, "\"");
  }

  private static boolean closesPreviousArm(String line) {
    return Directive.isLaterIfOption(line) || Directive.MERGE_OPTION.matches(line);
  }

  private static String replaceAll(String text, ImmutableMap<String, String> replacements) {
    for (String from : replacements.keySet()) {
      text = text.replace(from, replacements.get(from));
    }
    return text;
  }
}
