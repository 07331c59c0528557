package dsc;

import java.util.List;

import com.google.common.base.Joiner;

/** Numbers step bodies into the cases of a {@code switch (step)} statement. */
public final class StepEmitter {
  private static final Joiner CASE_PARTS = Joiner.on("\n\t");

  public static String emit(List<StepBody> steps) {
    StringBuilder out = new StringBuilder();
    for (int i = 0; i < steps.size(); i++) {
      String header = "\ncase " + (i + 1) + ":";
      String body = steps.get(i).text();
      if (body.trim().isEmpty()) {
        out.append(CASE_PARTS.join(header, "break;"));
      } else {
        out.append(CASE_PARTS.join(header, body, "break;"));
      }
    }
    return out.toString();
  }

  private StepEmitter() {}
}
