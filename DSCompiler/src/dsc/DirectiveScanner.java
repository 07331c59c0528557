package dsc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Locates the closing directive that ends the construct enclosing a region. */
public final class DirectiveScanner {
  private static final Logger logger = LoggerFactory.getLogger(DirectiveScanner.class);

  /**
   * Returns the index of the first {@code closing} line in {@code region} that is not matched by
   * an opener inside the region, i.e. the first closer that would take the nesting level below
   * zero.
   *
   * @throws CompilerException if the region holds no such line
   */
  public static int findFirstUnmatched(
      ScriptLines lines, Region region, Directive closing, Opener opener)
      throws CompilerException {
    int depth = 0;
    for (int i = region.start(); i < region.end(); i++) {
      String line = lines.get(i).text();
      if (opener.opens(line)) {
        depth++;
        logger.debug("depth {} after opener '{}'", depth, line);
      } else if (closing.matches(line)) {
        depth--;
        logger.debug("depth {} after closer '{}'", depth, line);
      }

      if (depth < 0) {
        return i;
      }
    }

    throw new CompilerException(
        lines.posOf(region),
        String.format(
            "'%s' not found! Text was:\n %s", closing.prefix(), lines.describe(region)));
  }

  private DirectiveScanner() {}
}
