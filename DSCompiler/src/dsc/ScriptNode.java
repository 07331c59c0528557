package dsc;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A parsed script construct. The set of node kinds is closed: every consumer implements {@link
 * Visitor}, so a new kind cannot be added without handling it everywhere.
 */
public abstract class ScriptNode {
  public enum Kind {
    COMMENT,
    ACTION,
    SCREEN,
    IF_ELSE,
    CHOICE,
    BRANCH;
  }

  public interface Visitor<V> {
    V visit(Comment comment) throws CompilerException;

    V visit(Action action) throws CompilerException;

    V visit(Screen screen) throws CompilerException;

    V visit(IfElse ifElse) throws CompilerException;

    V visit(Choice choice) throws CompilerException;

    V visit(Branch branch) throws CompilerException;
  }

  // Choices and branches both need two to four members.
  public static final int MIN_MEMBERS = 2;
  public static final int MAX_MEMBERS = 4;

  ScriptNode() {}

  /** Where the node starts in the script. */
  public abstract Pos pos();

  public abstract Kind kind();

  public abstract <V> V accept(Visitor<V> visitor) throws CompilerException;

  @SuppressWarnings("unchecked")
  public <T extends ScriptNode> T cast() {
    return (T) this;
  }

  private static void checkMemberCount(Pos pos, int count, String what) throws CompilerException {
    if (count < MIN_MEMBERS || count > MAX_MEMBERS) {
      throw new CompilerException(
          pos,
          String.format(
              "%s must have between %d and %d options, found %d",
              what, MIN_MEMBERS, MAX_MEMBERS, count));
    }
  }

  // (text)
  @AutoValue
  public abstract static class Comment extends ScriptNode {
    public abstract String text();

    public static Comment create(Pos pos, String text) {
      return new AutoValue_ScriptNode_Comment(pos, text);
    }

    @Override
    public Kind kind() {
      return Kind.COMMENT;
    }

    @Override
    public <V> V accept(Visitor<V> visitor) throws CompilerException {
      return visitor.visit(this);
    }
  }

  // {text}: something the script author codes by hand.
  @AutoValue
  public abstract static class Action extends ScriptNode {
    public abstract String text();

    public static Action create(Pos pos, String text) {
      return new AutoValue_ScriptNode_Action(pos, text);
    }

    @Override
    public Kind kind() {
      return Kind.ACTION;
    }

    @Override
    public <V> V accept(Visitor<V> visitor) throws CompilerException {
      return visitor.visit(this);
    }
  }

  /** One screenful of dialogue or player thought. */
  @AutoValue
  public abstract static class Screen extends ScriptNode {
    public enum Mode {
      SPEAKING,
      THINKING;
    }

    public abstract Speaker speaker();

    public abstract Mode mode();

    public abstract ImmutableList<String> lines();

    public static Screen create(
        Pos pos, Speaker speaker, Mode mode, List<String> lines, CompilerOptions options)
        throws CompilerException {
      if (lines.size() > options.maxRows()) {
        throw new CompilerException(
            pos,
            String.format(
                "text is over the limit of %d lines of %d characters: %s",
                options.maxRows(), options.maxRowLength(), lines));
      }
      for (String line : lines) {
        if (line.length() > options.maxRowLength()) {
          throw new CompilerException(
              pos,
              String.format("line is longer than %d characters: %s", options.maxRowLength(), line));
        }
      }
      return new AutoValue_ScriptNode_Screen(pos, speaker, mode, ImmutableList.copyOf(lines));
    }

    @Override
    public Kind kind() {
      return Kind.SCREEN;
    }

    @Override
    public <V> V accept(Visitor<V> visitor) throws CompilerException {
      return visitor.visit(this);
    }
  }

  @AutoValue
  public abstract static class IfElse extends ScriptNode {
    /** The full header of the generated conditional, {@code if} keyword included. */
    public abstract String condition();

    public abstract ImmutableList<ScriptNode> thenBranch();

    public abstract ImmutableList<ScriptNode> elseBranch();

    public static IfElse create(
        Pos pos, String condition, List<ScriptNode> thenBranch, List<ScriptNode> elseBranch) {
      return new AutoValue_ScriptNode_IfElse(
          pos, condition, ImmutableList.copyOf(thenBranch), ImmutableList.copyOf(elseBranch));
    }

    @Override
    public Kind kind() {
      return Kind.IF_ELSE;
    }

    @Override
    public <V> V accept(Visitor<V> visitor) throws CompilerException {
      return visitor.visit(this);
    }
  }

  @AutoValue
  public abstract static class Option {
    public abstract String text();

    // 1-based.
    public abstract int ordinal();

    public static Option create(String text, int ordinal) {
      return new AutoValue_ScriptNode_Option(text, ordinal);
    }
  }

  /** The player picks one of two to four options; the pick is stored for a later Branch. */
  @AutoValue
  public abstract static class Choice extends ScriptNode {
    public abstract ImmutableList<Option> options();

    public int optionCount() {
      return options().size();
    }

    public static Choice create(Pos pos, List<String> optionTexts) throws CompilerException {
      checkMemberCount(pos, optionTexts.size(), "*choice");

      ImmutableList.Builder<Option> options = ImmutableList.builder();
      for (int i = 0; i < optionTexts.size(); i++) {
        String text = optionTexts.get(i);
        if (text.isEmpty()) {
          throw new CompilerException(pos, String.format("option %d of *choice is empty", i + 1));
        }
        options.add(Option.create(text, i + 1));
      }
      return new AutoValue_ScriptNode_Choice(pos, options.build());
    }

    @Override
    public Kind kind() {
      return Kind.CHOICE;
    }

    @Override
    public <V> V accept(Visitor<V> visitor) throws CompilerException {
      return visitor.visit(this);
    }
  }

  @AutoValue
  public abstract static class Arm {
    public abstract int ordinal();

    public abstract ImmutableList<ScriptNode> nodes();

    public static Arm create(int ordinal, List<ScriptNode> nodes) {
      return new AutoValue_ScriptNode_Arm(ordinal, ImmutableList.copyOf(nodes));
    }
  }

  /** Content that depends on the option picked at the preceding Choice. */
  @AutoValue
  public abstract static class Branch extends ScriptNode {
    public abstract ImmutableList<Arm> arms();

    public static Branch create(Pos pos, List<? extends List<ScriptNode>> armNodes)
        throws CompilerException {
      checkMemberCount(pos, armNodes.size(), "*if option branch");

      ImmutableList.Builder<Arm> arms = ImmutableList.builder();
      for (int i = 0; i < armNodes.size(); i++) {
        arms.add(Arm.create(i + 1, armNodes.get(i)));
      }
      return new AutoValue_ScriptNode_Branch(pos, arms.build());
    }

    @Override
    public Kind kind() {
      return Kind.BRANCH;
    }

    @Override
    public <V> V accept(Visitor<V> visitor) throws CompilerException {
      return visitor.visit(this);
    }
  }
}
