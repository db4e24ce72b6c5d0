package dfs;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** A named block option. Tags are always encoded, at a fixed slot, using the default if unset. */
@AutoValue
public abstract class TagSpec {
  // As written in source, e.g. alignmentMode
  public abstract String name();

  // As encoded, e.g. "Alignment Mode"
  public abstract String externalName();

  public abstract ImmutableList<String> options();

  public abstract String defaultOption();

  public abstract int slot();

  public boolean hasOption(String option) {
    return options().contains(option);
  }

  public static TagSpec create(
      String name, String externalName, Iterable<String> options, String defaultOption, int slot) {
    ImmutableList<String> optionList = ImmutableList.copyOf(options);
    Preconditions.checkArgument(
        optionList.contains(defaultOption),
        "default '%s' is not an option of tag %s",
        defaultOption,
        name);
    return new AutoValue_TagSpec(name, externalName, optionList, defaultOption, slot);
  }
}
