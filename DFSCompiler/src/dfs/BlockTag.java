package dfs;

import com.google.auto.value.AutoValue;

/** The chosen option of one block tag, encoded as a bl_tag item. */
@AutoValue
public abstract class BlockTag {
  public abstract String option();

  public abstract int slot();

  // The action and block the tag belongs to, repeated in every bl_tag item.
  public abstract String action();

  public abstract String block();

  public static BlockTag create(String option, int slot, String action, String block) {
    return new AutoValue_BlockTag(option, slot, action, block);
  }
}
