package dsc;

import com.google.auto.value.AutoValue;

/** One normalized input line, with the position it was read from. */
@AutoValue
public abstract class ScriptLine {
  public abstract String text();

  public abstract Pos pos();

  public static ScriptLine create(String text, Pos pos) {
    return new AutoValue_ScriptLine(text, pos);
  }

  @Override
  public String toString() {
    return text();
  }
}
