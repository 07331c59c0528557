package dsc;

import java.util.stream.Collectors;

import com.google.common.collect.ImmutableList;

/** The immutable buffer of normalized lines the parser works on. */
public class ScriptLines {
  private final ImmutableList<ScriptLine> lines;

  public ScriptLines(Iterable<ScriptLine> lines) {
    this.lines = ImmutableList.copyOf(lines);
  }

  public ScriptLine get(int index) {
    return lines.get(index);
  }

  public Region all() {
    return Region.of(0, lines.size());
  }

  public ImmutableList<ScriptLine> slice(Region region) {
    return lines.subList(region.start(), region.end());
  }

  /** Position to blame for a problem in {@code region}. */
  public Pos posOf(Region region) {
    if (region.start() < lines.size()) {
      return lines.get(region.start()).pos();
    }
    return lines.isEmpty() ? Pos.internal() : lines.get(lines.size() - 1).pos();
  }

  public String describe(Region region) {
    return slice(region).stream().map(ScriptLine::text).collect(Collectors.joining("\n "));
  }
}
