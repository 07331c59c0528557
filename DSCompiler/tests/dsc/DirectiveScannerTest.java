package dsc;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

public class DirectiveScannerTest {

  private static ScriptLines lines(String... lines) {
    return new ScriptLines(new LineNormalizer("/test/script.txt").normalize(Arrays.asList(lines)));
  }

  @Test
  public void skipsNestedPairs() throws CompilerException {
    ScriptLines lines = lines("*if a", "x", "*else", "y", "*merge if", "*else", "z");

    assertThat(
            DirectiveScanner.findFirstUnmatched(
                lines, lines.all(), Directive.ELSE, Opener.PLAIN_IF))
        .isEqualTo(5);
  }

  @Test
  public void firstCloserAtDepthZeroWins() throws CompilerException {
    ScriptLines lines = lines("x", "*merge if", "y", "*merge if");

    assertThat(
            DirectiveScanner.findFirstUnmatched(
                lines, lines.all(), Directive.MERGE_IF, Opener.PLAIN_IF))
        .isEqualTo(1);
  }

  @Test
  public void ifOptionLinesAreNotPlainIfOpeners() throws CompilerException {
    ScriptLines lines =
        lines("*if option 1", "a", "*if option 2", "b", "*merge option", "*merge if");

    assertThat(
            DirectiveScanner.findFirstUnmatched(
                lines, lines.all(), Directive.MERGE_IF, Opener.PLAIN_IF))
        .isEqualTo(7);
  }

  @Test
  public void honorsRegionBounds() throws CompilerException {
    ScriptLines lines = lines("*choice", "*a", "*b", "*end choice", "*end choice");

    assertThat(
            DirectiveScanner.findFirstUnmatched(
                lines, Region.of(1, 5), Directive.END_CHOICE, Opener.CHOICE))
        .isEqualTo(3);
    assertThat(
            DirectiveScanner.findFirstUnmatched(
                lines, Region.of(0, 5), Directive.END_CHOICE, Opener.CHOICE))
        .isEqualTo(4);
  }

  @Test
  public void notFound() {
    ScriptLines lines = lines("*a", "*b", "*c");

    CompilerException ex =
        assertThrows(
            CompilerException.class,
            () ->
                DirectiveScanner.findFirstUnmatched(
                    lines, lines.all(), Directive.END_CHOICE, Opener.CHOICE));
    assertThat(ex).hasMessageThat().contains("'*end choice' not found");
    assertThat(ex).hasMessageThat().contains("*b");
    assertThat(ex.pos().lineNumber()).isEqualTo(1);
  }
}
