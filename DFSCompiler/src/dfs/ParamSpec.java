package dfs;

import com.google.auto.value.AutoValue;

/** One positional parameter of a catalogue action. */
@AutoValue
public abstract class ParamSpec {
  public abstract String name();

  public abstract ValueKind kind();

  public abstract boolean optional();

  // Takes one or more consecutive values.
  public abstract boolean plural();

  public static ParamSpec create(String name, ValueKind kind, boolean optional, boolean plural) {
    return new AutoValue_ParamSpec(name, kind, optional, plural);
  }
}
