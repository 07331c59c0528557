package dsc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

public class TextWrapperTest {

  private static final Pos POS = new Pos("/test/script.txt", 1);

  @Test
  public void shortTextIsOneRow() throws CompilerException {
    assertThat(TextWrapper.wrap(POS, "Hello there", 85)).containsExactly("Hello there");
  }

  @Test
  public void wrapsWithoutSplittingWords() throws CompilerException {
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 40; i++) {
      if (i > 0) {
        text.append(' ');
      }
      text.append("word").append(i % 7 == 0 ? "longer" : "").append(i);
    }

    ImmutableList<String> rows = TextWrapper.wrap(POS, text.toString(), 85);

    assertThat(rows.size()).isGreaterThan(1);
    for (String row : rows) {
      assertThat(row.length()).isAtMost(85);
      assertThat(row).doesNotMatch("^\\s.*|.*\\s$");
    }
    assertThat(String.join(" ", rows)).isEqualTo(text.toString());
  }

  @Test
  public void spaceAtColumnLimitIsNotABreakPoint() throws CompilerException {
    String first = Strings.repeat("a", 80);

    assertThat(TextWrapper.wrap(POS, first + " bbbb c", 85))
        .containsExactly(first, "bbbb c")
        .inOrder();
  }

  @Test
  public void fullRowFollowedBySpaceCannotBeWrapped() {
    String word = Strings.repeat("a", 85);

    assertThrows(CompilerException.class, () -> TextWrapper.wrap(POS, word + " b", 85));
  }

  @Test
  public void wrappingIsStableOnItsOwnRows() throws CompilerException {
    String text = Strings.repeat("lorem ipsum dolor ", 10).trim();

    for (String row : TextWrapper.wrap(POS, text, 85)) {
      assertThat(TextWrapper.wrap(POS, row, 85)).containsExactly(row);
    }
  }

  @Test
  public void overlongWord() {
    String word = Strings.repeat("x", 90);

    CompilerException ex =
        assertThrows(CompilerException.class, () -> TextWrapper.wrap(POS, "hi " + word, 85));
    assertThat(ex).hasMessageThat().contains("longer than 85");
  }
}
