package dfs;

import java.util.Arrays;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/** A parameter item as it appears in a block record, one subclass per item id. */
public abstract class EncodedValue {

  public enum Kind {
    NUMBER("num"),
    STRING("txt"),
    TEXT("comp"),
    LOCATION("loc"),
    VECTOR("vec"),
    SOUND("snd"),
    POTION("pot"),
    PARTICLE("part"),
    ITEM("item"),
    GAME_VALUE("g_val"),
    VARIABLE("var"),
    PARAMETER("pn_el"),
    HINT("hint");

    private final String id;

    Kind(String id) {
      this.id = id;
    }

    public String id() {
      return id;
    }

    public static Optional<Kind> fromId(String id) {
      return Arrays.stream(values()).filter(k -> k.id.equals(id)).findFirst();
    }
  }

  public abstract Kind kind();

  @SuppressWarnings("unchecked")
  public <T extends EncodedValue> T cast() {
    return (T) this;
  }

  /** num, txt and comp items, which carry a single name. */
  @AutoValue
  public abstract static class Simple extends EncodedValue {
    abstract Kind simpleKind();

    public abstract String name();

    @Override
    public Kind kind() {
      return simpleKind();
    }

    public static Simple number(double value) {
      return new AutoValue_EncodedValue_Simple(Kind.NUMBER, Numbers.format(value));
    }

    // A formula the runtime evaluates, e.g. %math(1+1)
    public static Simple number(String formula) {
      return new AutoValue_EncodedValue_Simple(Kind.NUMBER, formula);
    }

    public static Simple string(String text) {
      return new AutoValue_EncodedValue_Simple(Kind.STRING, text);
    }

    public static Simple text(String text) {
      return new AutoValue_EncodedValue_Simple(Kind.TEXT, text);
    }
  }

  @AutoValue
  public abstract static class Location extends EncodedValue {
    public abstract double x();

    public abstract double y();

    public abstract double z();

    public abstract double pitch();

    public abstract double yaw();

    @Override
    public Kind kind() {
      return Kind.LOCATION;
    }

    public static Location create(double x, double y, double z, double pitch, double yaw) {
      return new AutoValue_EncodedValue_Location(
          Numbers.normalize(x),
          Numbers.normalize(y),
          Numbers.normalize(z),
          Numbers.normalize(pitch),
          Numbers.normalize(yaw));
    }
  }

  @AutoValue
  public abstract static class Vector extends EncodedValue {
    public abstract double x();

    public abstract double y();

    public abstract double z();

    @Override
    public Kind kind() {
      return Kind.VECTOR;
    }

    public static Vector create(double x, double y, double z) {
      return new AutoValue_EncodedValue_Vector(
          Numbers.normalize(x), Numbers.normalize(y), Numbers.normalize(z));
    }
  }

  @AutoValue
  public abstract static class Sound extends EncodedValue {
    public abstract String sound();

    public abstract Optional<String> variant();

    public abstract double volume();

    public abstract double pitch();

    @Override
    public Kind kind() {
      return Kind.SOUND;
    }

    public static Sound create(
        String sound, Optional<String> variant, double volume, double pitch) {
      return new AutoValue_EncodedValue_Sound(
          sound, variant, Numbers.normalize(volume), Numbers.normalize(pitch));
    }
  }

  @AutoValue
  public abstract static class Potion extends EncodedValue {
    public abstract String potion();

    public abstract double amplifier();

    public abstract double duration();

    @Override
    public Kind kind() {
      return Kind.POTION;
    }

    public static Potion create(String potion, double amplifier, double duration) {
      return new AutoValue_EncodedValue_Potion(
          potion, Numbers.normalize(amplifier), Numbers.normalize(duration));
    }
  }

  /**
   * A particle. {@code data} is keyed by {@link ParticleField#key()}; values are {@link Double}
   * except for the material, which is a {@link String}.
   */
  @AutoValue
  public abstract static class Particle extends EncodedValue {
    public abstract String particle();

    public abstract int amount();

    public abstract double horizontal();

    public abstract double vertical();

    public abstract ImmutableMap<String, Object> data();

    @Override
    public Kind kind() {
      return Kind.PARTICLE;
    }

    public static Particle create(
        String particle,
        int amount,
        double horizontal,
        double vertical,
        ImmutableMap<String, Object> data) {
      return new AutoValue_EncodedValue_Particle(
          particle,
          amount,
          Numbers.normalize(horizontal),
          Numbers.normalize(vertical),
          ImmutableMap.copyOf(
              Maps.transformValues(
                  data,
                  v -> v instanceof Double ? (Object) Numbers.normalize((Double) v) : v)));
    }
  }

  @AutoValue
  public abstract static class Item extends EncodedValue {
    public abstract String item();

    @Override
    public Kind kind() {
      return Kind.ITEM;
    }

    public static Item create(String item) {
      return new AutoValue_EncodedValue_Item(item);
    }
  }

  @AutoValue
  public abstract static class GameValue extends EncodedValue {
    public abstract String type();

    // External selector name; "Default" when unqualified.
    public abstract String target();

    @Override
    public Kind kind() {
      return Kind.GAME_VALUE;
    }

    public static GameValue create(String type, String target) {
      return new AutoValue_EncodedValue_GameValue(type, target);
    }
  }

  @AutoValue
  public abstract static class Variable extends EncodedValue {
    public abstract String name();

    public abstract VariableScope scope();

    @Override
    public Kind kind() {
      return Kind.VARIABLE;
    }

    public static Variable create(String name, VariableScope scope) {
      return new AutoValue_EncodedValue_Variable(name, scope);
    }
  }

  /** A function parameter declared on the function header. */
  @AutoValue
  public abstract static class FunctionParam extends EncodedValue {
    public abstract Optional<EncodedValue> defaultValue();

    public abstract String name();

    public abstract boolean optional();

    public abstract boolean plural();

    // ValueKind#paramType()
    public abstract String type();

    @Override
    public Kind kind() {
      return Kind.PARAMETER;
    }

    public static FunctionParam create(
        Optional<EncodedValue> defaultValue,
        String name,
        boolean optional,
        boolean plural,
        String type) {
      return new AutoValue_EncodedValue_FunctionParam(defaultValue, name, optional, plural, type);
    }
  }

  @AutoValue
  public abstract static class Hint extends EncodedValue {
    public static final String FUNCTION = "function";

    public abstract String id();

    @Override
    public Kind kind() {
      return Kind.HINT;
    }

    public static Hint create(String id) {
      return new AutoValue_EncodedValue_Hint(id);
    }
  }
}
