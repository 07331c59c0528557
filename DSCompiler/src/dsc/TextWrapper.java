package dsc;

import com.google.common.collect.ImmutableList;

/** Greedy word wrapping for text that has to fit on screen. */
public final class TextWrapper {

  /**
   * Splits {@code text} into rows of at most {@code maxLength} characters, breaking at the last
   * space among the first {@code maxLength} characters.
   * Each break consumes exactly one space, so joining the rows with single spaces gives back the
   * input.
   *
   * @throws CompilerException if a single word is longer than {@code maxLength}
   */
  public static ImmutableList<String> wrap(Pos pos, String text, int maxLength)
      throws CompilerException {
    ImmutableList.Builder<String> rows = ImmutableList.builder();
    String rest = text;
    while (rest.length() > maxLength) {
      int space = rest.lastIndexOf(' ', maxLength - 1);
      if (space < 0) {
        int wordEnd = rest.indexOf(' ');
        String word = wordEnd < 0 ? rest : rest.substring(0, wordEnd);
        throw new CompilerException(
            pos,
            String.format("cannot wrap '%s': word is longer than %d characters", word, maxLength));
      }
      rows.add(rest.substring(0, space));
      rest = rest.substring(space + 1);
    }
    rows.add(rest);
    return rows.build();
  }

  private TextWrapper() {}
}
