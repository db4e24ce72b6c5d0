package dfs;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/** Per-call settings for {@link Compiler}. */
@AutoValue
public abstract class CompilerOptions {
  public static final int DEFAULT_MAX_NESTING_DEPTH = 64;

  /** Name reported in diagnostic positions. */
  public abstract String fileName();

  /** Deepest allowed nesting of conditional and repeat bodies. */
  public abstract int maxNestingDepth();

  /**
   * Whether {@code game} and {@code save} declarations may also appear inside a unit body. When
   * false they are only accepted at file level.
   */
  public abstract boolean allowUnitGlobals();

  public static CompilerOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_CompilerOptions.Builder()
        .setFileName("<input>")
        .setMaxNestingDepth(DEFAULT_MAX_NESTING_DEPTH)
        .setAllowUnitGlobals(false);
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setFileName(String fileName);

    public abstract Builder setMaxNestingDepth(int maxNestingDepth);

    public abstract Builder setAllowUnitGlobals(boolean allowUnitGlobals);

    abstract CompilerOptions autoBuild();

    public CompilerOptions build() {
      CompilerOptions options = autoBuild();
      Preconditions.checkArgument(
          options.maxNestingDepth() > 0, "maxNestingDepth must be positive");
      return options;
    }
  }
}
