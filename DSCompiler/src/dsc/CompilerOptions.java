package dsc;

import com.google.auto.value.AutoValue;

/** Constants baked into the generated step code, and parser switches. */
@AutoValue
public abstract class CompilerOptions {
  public abstract int maxRowLength();

  public abstract int maxRows();

  public abstract int rowSpacing();

  /** Vertical distance between option labels when a choice has all four options. */
  public abstract int denseChoiceSpacing();

  public abstract int choiceSpacing();

  public abstract int choiceAnchorX();

  public abstract int choiceAnchorY();

  public abstract String choiceObject();

  public abstract String pointerObject();

  /** The speaker name authors use for the player. */
  public abstract String playerAlias();

  /** The identity the player alias is canonicalized to. */
  public abstract String playerIdentity();

  public abstract String playerLabel();

  public abstract boolean strictDirectives();

  public abstract Builder toBuilder();

  public static CompilerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setMaxRowLength(85)
        .setMaxRows(4)
        .setRowSpacing(40)
        .setDenseChoiceSpacing(40)
        .setChoiceSpacing(60)
        .setChoiceAnchorX(650)
        .setChoiceAnchorY(620)
        .setChoiceObject("obj_choice")
        .setPointerObject("vicky_arrow_d")
        .setPlayerAlias("Player")
        .setPlayerIdentity("global.name")
        .setPlayerLabel("You")
        .setStrictDirectives(false);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setMaxRowLength(int maxRowLength);

    public abstract Builder setMaxRows(int maxRows);

    public abstract Builder setRowSpacing(int rowSpacing);

    public abstract Builder setDenseChoiceSpacing(int denseChoiceSpacing);

    public abstract Builder setChoiceSpacing(int choiceSpacing);

    public abstract Builder setChoiceAnchorX(int choiceAnchorX);

    public abstract Builder setChoiceAnchorY(int choiceAnchorY);

    public abstract Builder setChoiceObject(String choiceObject);

    public abstract Builder setPointerObject(String pointerObject);

    public abstract Builder setPlayerAlias(String playerAlias);

    public abstract Builder setPlayerIdentity(String playerIdentity);

    public abstract Builder setPlayerLabel(String playerLabel);

    public abstract Builder setStrictDirectives(boolean strictDirectives);

    public abstract CompilerOptions build();
  }
}
