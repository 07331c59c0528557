package dsc;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/**
 * A half-open range {@code [start, end)} of indices into a {@link ScriptLines} buffer.
 *
 * <p>All of the "skip the directive line" arithmetic of the parser lives here.
 */
@AutoValue
public abstract class Region {
  public abstract int start();

  public abstract int end();

  public static Region of(int start, int end) {
    Preconditions.checkArgument(0 <= start && start <= end, "bad region [%s, %s)", start, end);
    return new AutoValue_Region(start, end);
  }

  public boolean isEmpty() {
    return start() == end();
  }

  public boolean contains(int index) {
    return start() <= index && index < end();
  }

  /** The lines strictly after {@code index}, up to the end of this region. */
  public Region after(int index) {
    Preconditions.checkArgument(contains(index), "%s not in %s", index, this);
    return of(index + 1, end());
  }

  /** The lines strictly between two directive lines of this region. */
  public Region between(int open, int close) {
    Preconditions.checkArgument(contains(open) && contains(close) && open < close);
    return of(open + 1, close);
  }

  @Override
  public String toString() {
    return "[" + start() + ", " + end() + ")";
  }
}
