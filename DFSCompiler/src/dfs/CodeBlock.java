package dfs;

import java.util.Arrays;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

/** One record of a code line: either a block with its parameters and tags, or a bracket. */
@AutoValue
public abstract class CodeBlock {

  public enum Direction {
    OPEN("open"),
    CLOSE("close");

    private final String externalName;

    Direction(String externalName) {
      this.externalName = externalName;
    }

    public String externalName() {
      return externalName;
    }

    public static Optional<Direction> fromExternalName(String name) {
      return Arrays.stream(values()).filter(d -> d.externalName.equals(name)).findFirst();
    }
  }

  public enum BracketType {
    NORM("norm"),
    REPEAT("repeat");

    private final String externalName;

    BracketType(String externalName) {
      this.externalName = externalName;
    }

    public String externalName() {
      return externalName;
    }

    public static Optional<BracketType> fromExternalName(String name) {
      return Arrays.stream(values()).filter(t -> t.externalName.equals(name)).findFirst();
    }
  }

  public static final String ELSE = "else";

  abstract boolean bracket();

  public abstract Optional<String> block();

  public abstract Optional<String> action();

  // External selector name.
  public abstract Optional<String> target();

  public abstract Optional<String> data();

  // LS-CANCEL on events, NOT on negated conditionals.
  public abstract Optional<String> attribute();

  public abstract Optional<String> subAction();

  public abstract Optional<Direction> direction();

  public abstract Optional<BracketType> bracketType();

  public abstract ImmutableList<Parameter> params();

  // Keyed by external tag name.
  public abstract ImmutableSortedMap<String, BlockTag> tags();

  public boolean isBracket() {
    return bracket();
  }

  public boolean isOpen() {
    return direction().equals(Optional.of(Direction.OPEN));
  }

  public boolean isClose() {
    return direction().equals(Optional.of(Direction.CLOSE));
  }

  public boolean isBlock(String block) {
    return !isBracket() && block().equals(Optional.of(block));
  }

  public abstract Builder toBuilder();

  public static Builder block(String block) {
    return new AutoValue_CodeBlock.Builder()
        .setBracket(false)
        .setBlock(block)
        .setTags(ImmutableSortedMap.of());
  }

  public static CodeBlock bracket(Direction direction, BracketType type) {
    return new AutoValue_CodeBlock.Builder()
        .setBracket(true)
        .setDirection(direction)
        .setBracketType(type)
        .setTags(ImmutableSortedMap.of())
        .build();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setBracket(boolean bracket);

    abstract Builder setBlock(String block);

    public abstract Builder setAction(String action);

    public abstract Builder setTarget(String target);

    public abstract Builder setTarget(Optional<String> target);

    public abstract Builder setData(String data);

    public abstract Builder setAttribute(String attribute);

    public abstract Builder setSubAction(String subAction);

    abstract Builder setDirection(Direction direction);

    abstract Builder setBracketType(BracketType type);

    public abstract ImmutableList.Builder<Parameter> paramsBuilder();

    public abstract Builder setTags(ImmutableSortedMap<String, BlockTag> tags);

    public Builder addParam(int slot, EncodedValue value) {
      paramsBuilder().add(Parameter.create(slot, value));
      return this;
    }

    public abstract CodeBlock build();
  }
}
