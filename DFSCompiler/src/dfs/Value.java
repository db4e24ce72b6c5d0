package dfs;

import java.util.Optional;

import com.google.common.collect.ImmutableMap;

import dfs.processor.ASTNode;

/** Argument values: literals, composite literals, game values and variable references. */
public abstract class Value implements ASTNodeInterface {

  public enum Type {
    NUMBER,
    DYNAMIC_NUMBER,
    TEXT,
    STRING,
    LOCATION,
    VECTOR,
    SOUND,
    POTION,
    PARTICLE,
    ITEM,
    GAME_VALUE,
    VARIABLE;
  }

  private final Type type;
  private final Tokenizer.Pos pos;

  protected Value(Type type, Tokenizer.Pos pos) {
    this.type = type;
    this.pos = pos;
  }

  public Type type() {
    return type;
  }

  @Override
  public Tokenizer.Pos pos() {
    return pos;
  }

  @SuppressWarnings("unchecked")
  public <T extends Value> T cast() {
    return (T) this;
  }

  /** Whether the value is fixed at compile time, as opposed to read from the game. */
  public boolean isLiteral() {
    return type != Type.GAME_VALUE && type != Type.VARIABLE;
  }

  @ASTNode
  public static final class Number extends Value implements Value_Number_ASTNode {
    private final double value;

    private Number(double value, Tokenizer.Pos pos) {
      super(Type.NUMBER, pos);
      this.value = value;
    }

    public static Number create(double value, Tokenizer.Pos pos) {
      return new Number(value, pos);
    }

    public double value() {
      return value;
    }
  }

  /** A number computed by the runtime from a formula, e.g. {@code Number("%math(1+1)")}. */
  @ASTNode
  public static final class DynamicNumber extends Value implements Value_DynamicNumber_ASTNode {
    private final String formula;

    private DynamicNumber(String formula, Tokenizer.Pos pos) {
      super(Type.DYNAMIC_NUMBER, pos);
      this.formula = formula;
    }

    public static DynamicNumber create(String formula, Tokenizer.Pos pos) {
      return new DynamicNumber(formula, pos);
    }

    public String formula() {
      return formula;
    }
  }

  /** Styled text; inline markup is kept verbatim. */
  @ASTNode
  public static final class Text extends Value implements Value_Text_ASTNode {
    private final String text;

    private Text(String text, Tokenizer.Pos pos) {
      super(Type.TEXT, pos);
      this.text = text;
    }

    public static Text create(String text, Tokenizer.Pos pos) {
      return new Text(text, pos);
    }

    public String text() {
      return text;
    }
  }

  @ASTNode
  public static final class StringLiteral extends Value implements Value_StringLiteral_ASTNode {
    private final String text;

    private StringLiteral(String text, Tokenizer.Pos pos) {
      super(Type.STRING, pos);
      this.text = text;
    }

    public static StringLiteral create(String text, Tokenizer.Pos pos) {
      return new StringLiteral(text, pos);
    }

    public String text() {
      return text;
    }
  }

  @ASTNode
  public static final class Location extends Value implements Value_Location_ASTNode {
    private final double x;
    private final double y;
    private final double z;
    private final Optional<Double> pitch;
    private final Optional<Double> yaw;

    private Location(
        double x,
        double y,
        double z,
        Optional<Double> pitch,
        Optional<Double> yaw,
        Tokenizer.Pos pos) {
      super(Type.LOCATION, pos);
      this.x = x;
      this.y = y;
      this.z = z;
      this.pitch = pitch;
      this.yaw = yaw;
    }

    public static Location create(
        double x,
        double y,
        double z,
        Optional<Double> pitch,
        Optional<Double> yaw,
        Tokenizer.Pos pos) {
      return new Location(x, y, z, pitch, yaw, pos);
    }

    public double x() {
      return x;
    }

    public double y() {
      return y;
    }

    public double z() {
      return z;
    }

    public Optional<Double> pitch() {
      return pitch;
    }

    public Optional<Double> yaw() {
      return yaw;
    }
  }

  @ASTNode
  public static final class Vector extends Value implements Value_Vector_ASTNode {
    private final double x;
    private final double y;
    private final double z;

    private Vector(double x, double y, double z, Tokenizer.Pos pos) {
      super(Type.VECTOR, pos);
      this.x = x;
      this.y = y;
      this.z = z;
    }

    public static Vector create(double x, double y, double z, Tokenizer.Pos pos) {
      return new Vector(x, y, z, pos);
    }

    public double x() {
      return x;
    }

    public double y() {
      return y;
    }

    public double z() {
      return z;
    }
  }

  @ASTNode
  public static final class Sound extends Value implements Value_Sound_ASTNode {
    private final String name;
    private final double volume;
    private final double pitch;
    private final Optional<String> variant;

    private Sound(
        String name, double volume, double pitch, Optional<String> variant, Tokenizer.Pos pos) {
      super(Type.SOUND, pos);
      this.name = name;
      this.volume = volume;
      this.pitch = pitch;
      this.variant = variant;
    }

    public static Sound create(
        String name, double volume, double pitch, Optional<String> variant, Tokenizer.Pos pos) {
      return new Sound(name, volume, pitch, variant, pos);
    }

    public String name() {
      return name;
    }

    public double volume() {
      return volume;
    }

    public double pitch() {
      return pitch;
    }

    public Optional<String> variant() {
      return variant;
    }
  }

  @ASTNode
  public static final class Potion extends Value implements Value_Potion_ASTNode {
    private final String potion;
    private final double amplifier;
    private final double duration;

    private Potion(String potion, double amplifier, double duration, Tokenizer.Pos pos) {
      super(Type.POTION, pos);
      this.potion = potion;
      this.amplifier = amplifier;
      this.duration = duration;
    }

    public static Potion create(
        String potion, double amplifier, double duration, Tokenizer.Pos pos) {
      return new Potion(potion, amplifier, duration, pos);
    }

    public String potion() {
      return potion;
    }

    public double amplifier() {
      return amplifier;
    }

    public double duration() {
      return duration;
    }
  }

  /**
   * A particle effect. Optional data is given as named fields, e.g. {@code motion=Vector(0, 1, 0)}
   * or {@code rgb=16711680}; see {@link ParticleField} for the accepted names.
   */
  @ASTNode
  public static final class Particle extends Value implements Value_Particle_ASTNode {
    private final String particle;
    private final double amount;
    private final double horizontalSpread;
    private final double verticalSpread;
    private final ImmutableMap<String, Value> fields;

    private Particle(
        String particle,
        double amount,
        double horizontalSpread,
        double verticalSpread,
        ImmutableMap<String, Value> fields,
        Tokenizer.Pos pos) {
      super(Type.PARTICLE, pos);
      this.particle = particle;
      this.amount = amount;
      this.horizontalSpread = horizontalSpread;
      this.verticalSpread = verticalSpread;
      this.fields = fields;
    }

    public static Particle create(
        String particle,
        double amount,
        double horizontalSpread,
        double verticalSpread,
        ImmutableMap<String, Value> fields,
        Tokenizer.Pos pos) {
      return new Particle(particle, amount, horizontalSpread, verticalSpread, fields, pos);
    }

    public String particle() {
      return particle;
    }

    public double amount() {
      return amount;
    }

    public double horizontalSpread() {
      return horizontalSpread;
    }

    public double verticalSpread() {
      return verticalSpread;
    }

    public ImmutableMap<String, Value> fields() {
      return fields;
    }
  }

  /** Raw item data, passed through untouched. */
  @ASTNode
  public static final class Item extends Value implements Value_Item_ASTNode {
    private final String data;

    private Item(String data, Tokenizer.Pos pos) {
      super(Type.ITEM, pos);
      this.data = data;
    }

    public static Item create(String data, Tokenizer.Pos pos) {
      return new Item(data, pos);
    }

    public String data() {
      return data;
    }
  }

  @ASTNode
  public static final class GameValue extends Value implements Value_GameValue_ASTNode {
    private final String name;
    private final Optional<String> selector;

    private GameValue(String name, Optional<String> selector, Tokenizer.Pos pos) {
      super(Type.GAME_VALUE, pos);
      this.name = name;
      this.selector = selector;
    }

    public static GameValue create(String name, Optional<String> selector, Tokenizer.Pos pos) {
      return new GameValue(name, selector, pos);
    }

    // $selector:name
    public static GameValue parse(String token, Tokenizer.Pos pos) {
      int colon = token.indexOf(':');
      if (colon < 0) {
        return new GameValue(token, Optional.empty(), pos);
      }
      return new GameValue(
          token.substring(colon + 1), Optional.of(token.substring(0, colon)), pos);
    }

    public String name() {
      return name;
    }

    public Optional<String> selector() {
      return selector;
    }
  }

  /** A variable use. Its scope kind is resolved by {@link ScopeValidator}. */
  @ASTNode
  public static final class VariableRef extends Value implements Value_VariableRef_ASTNode {
    private final String name;

    private VariableRef(String name, Tokenizer.Pos pos) {
      super(Type.VARIABLE, pos);
      this.name = name;
    }

    public static VariableRef create(String name, Tokenizer.Pos pos) {
      return new VariableRef(name, pos);
    }

    public String name() {
      return name;
    }
  }
}
