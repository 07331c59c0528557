package dsc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/** Lowers {@link ScriptNode}s into the step bodies that execute them. */
public class StepLowering implements ScriptNode.Visitor<ImmutableList<StepBody>> {

  /** Advances to the next step and does nothing else. */
  public static final StepBody FILLER = StepBody.of("step += 1;");

  static final String BLANK_CASE = "//This case intentionally left blank;";
  static final String BLANK_CASE_2 = "//This case intentionally left blank 2;";

  private static final Joiner STATEMENTS = Joiner.on("\n\t");

  private final CompilerOptions options;

  public StepLowering(CompilerOptions options) {
    this.options = options;
  }

  public ImmutableList<StepBody> lower(List<ScriptNode> nodes) throws CompilerException {
    ImmutableList.Builder<StepBody> steps = ImmutableList.builder();
    for (ScriptNode node : nodes) {
      steps.addAll(node.accept(this));
    }
    return steps.build();
  }

  @Override
  public ImmutableList<StepBody> visit(ScriptNode.Comment comment) {
    return ImmutableList.of(StepBody.of("//" + comment.text() + ";\n step += 1;"));
  }

  @Override
  public ImmutableList<StepBody> visit(ScriptNode.Action action) {
    return ImmutableList.of(
        StepBody.of("//TODO: " + action.text() + ";\n"),
        StepBody.of(BLANK_CASE),
        StepBody.of(BLANK_CASE_2));
  }

  @Override
  public ImmutableList<StepBody> visit(ScriptNode.Screen screen) {
    List<String> statements = new ArrayList<>();
    if (screen.mode() == ScriptNode.Screen.Mode.SPEAKING) {
      Speaker speaker = screen.speaker();
      String announcer = speaker.isPlayer() ? options.playerLabel() : speaker.name();
      statements.add(String.format("announce(\"%s\");", announcer));
    }
    for (int i = 0; i < screen.lines().size(); i++) {
      statements.add(
          String.format(
              "draw_text(x, y + %d, \"%s\");", options.rowSpacing() * i, screen.lines().get(i)));
    }
    return ImmutableList.of(StepBody.of(STATEMENTS.join(statements)));
  }

  @Override
  public ImmutableList<StepBody> visit(ScriptNode.IfElse ifElse) throws CompilerException {
    ImmutableList<StepBody> thenSteps = lower(ifElse.thenBranch());
    ImmutableList<StepBody> elseSteps = lower(ifElse.elseBranch());
    int length = Math.max(thenSteps.size(), elseSteps.size());

    String header = ifElse.condition();
    List<StepBody> thenPadded = pad(thenSteps, length);
    List<StepBody> elsePadded = pad(elseSteps, length);

    ImmutableList.Builder<StepBody> steps = ImmutableList.builder();
    for (int i = 0; i < length; i++) {
      steps.add(wrap(header, thenPadded.get(i)).plus(wrap("else", elsePadded.get(i))));
    }
    return steps.build();
  }

  @Override
  public ImmutableList<StepBody> visit(ScriptNode.Choice choice) {
    ImmutableList.Builder<StepBody> steps = ImmutableList.builder();
    steps.add(setupStep(choice));
    steps.add(StepBody.of(STATEMENTS.join(drawOptions(choice))));
    for (ScriptNode.Option option : choice.options()) {
      steps.add(deactivateStep(choice, option));
    }
    return steps.build();
  }

  @Override
  public ImmutableList<StepBody> visit(ScriptNode.Branch branch) throws CompilerException {
    List<ImmutableList<StepBody>> armSteps = new ArrayList<>();
    int length = 0;
    for (ScriptNode.Arm arm : branch.arms()) {
      ImmutableList<StepBody> steps = lower(arm.nodes());
      armSteps.add(steps);
      length = Math.max(length, steps.size());
    }
    if (length == 0) {
      throw new CompilerException(branch.pos(), "*if option branch has no content in any arm");
    }

    List<List<StepBody>> wrapped = new ArrayList<>();
    for (int i = 0; i < armSteps.size(); i++) {
      String header = "if option == " + branch.arms().get(i).ordinal();
      wrapped.add(
          pad(armSteps.get(i), length).stream()
              .map(body -> wrap(header, body))
              .collect(Collectors.toList()));
    }

    // Transpose: step i of the branch holds step i of every arm.
    ImmutableList.Builder<StepBody> steps = ImmutableList.builder();
    for (int i = 0; i < length; i++) {
      int position = i;
      steps.add(StepBody.concat(Lists.transform(wrapped, arm -> arm.get(position))));
    }
    return steps.build();
  }

  private static List<StepBody> pad(List<StepBody> steps, int length) {
    List<StepBody> padded = new ArrayList<>(steps);
    padded.addAll(Collections.nCopies(length - steps.size(), FILLER));
    return padded;
  }

  private static StepBody wrap(String header, StepBody body) {
    return StepBody.of(String.join("\n", header, "{", body.text(), "}"));
  }

  private int spacing(ScriptNode.Choice choice) {
    return choice.optionCount() == ScriptNode.MAX_MEMBERS
        ? options.denseChoiceSpacing()
        : options.choiceSpacing();
  }

  private List<String> drawOptions(ScriptNode.Choice choice) {
    int spacing = spacing(choice);
    return choice.options().stream()
        .map(
            option ->
                String.format(
                    "draw_text(x, y + %d, \"Option %d: %s\");",
                    spacing * (option.ordinal() - 1),
                    option.ordinal(),
                    option.text()))
        .collect(Collectors.toList());
  }

  private StepBody setupStep(ScriptNode.Choice choice) {
    int spacing = spacing(choice);
    List<String> statements = new ArrayList<>(drawOptions(choice));
    statements.add(options.pointerObject() + ".visible = false;");
    for (ScriptNode.Option option : choice.options()) {
      int n = option.ordinal();
      if (n == 1) {
        statements.add(
            String.format(
                "option1 = instance_create(%d, %d, %s);",
                options.choiceAnchorX(), options.choiceAnchorY(), options.choiceObject()));
      } else {
        statements.add(
            String.format(
                "option%d = instance_create(option1.x, option1.y + %d, %s);",
                n, spacing * (n - 1), options.choiceObject()));
      }
      statements.add(String.format("option%d.amount = %d;", n, n));
    }
    statements.add("step += 1;");
    return StepBody.of(STATEMENTS.join(statements));
  }

  // Every option jumps to the step right after the last deactivate step.
  private StepBody deactivateStep(ScriptNode.Choice choice, ScriptNode.Option option) {
    return StepBody.of(
        String.join(
            "\n",
            String.format("instance_deactivate_object(%s);", options.choiceObject()),
            String.format("option = %d;", option.ordinal()),
            options.pointerObject() + ".visible = true;",
            String.format("step += %d;", jumpDistance(choice, option))));
  }

  static int jumpDistance(ScriptNode.Choice choice, ScriptNode.Option option) {
    return choice.optionCount() + 1 - option.ordinal();
  }
}
