package dfs;

import com.google.auto.value.AutoValue;

/** An encoded value placed in one slot of a block. */
@AutoValue
public abstract class Parameter {
  public abstract int slot();

  public abstract EncodedValue value();

  public static Parameter create(int slot, EncodedValue value) {
    return new AutoValue_Parameter(slot, value);
  }
}
