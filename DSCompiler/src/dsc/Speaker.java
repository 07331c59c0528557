package dsc;

import com.google.auto.value.AutoValue;

/** Who a {@link ScriptNode.Screen} belongs to. */
@AutoValue
public abstract class Speaker {
  public abstract String name();

  public abstract boolean isPlayer();

  public static Speaker player(CompilerOptions options) {
    return new AutoValue_Speaker(options.playerIdentity(), true);
  }

  /** Canonicalizes the player alias to the player identity. */
  public static Speaker named(String name, CompilerOptions options) {
    if (name.equals(options.playerAlias()) || name.equals(options.playerIdentity())) {
      return player(options);
    }
    return new AutoValue_Speaker(name, false);
  }
}
