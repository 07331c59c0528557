package dsc;

import com.google.auto.value.AutoValue;

/**
 * The code run for one value of the step counter. Bodies combine by joining their text with a
 * newline; the empty body is the identity.
 */
@AutoValue
public abstract class StepBody {
  private static final StepBody EMPTY = new AutoValue_StepBody("");

  public abstract String text();

  public static StepBody of(String text) {
    return text.isEmpty() ? EMPTY : new AutoValue_StepBody(text);
  }

  public static StepBody empty() {
    return EMPTY;
  }

  public static StepBody concat(Iterable<StepBody> bodies) {
    StepBody result = EMPTY;
    for (StepBody body : bodies) {
      result = result.plus(body);
    }
    return result;
  }

  public boolean isEmpty() {
    return text().isEmpty();
  }

  public StepBody plus(StepBody other) {
    if (isEmpty()) {
      return other;
    } else if (other.isEmpty()) {
      return this;
    }
    return new AutoValue_StepBody(text() + "\n" + other.text());
  }
}
