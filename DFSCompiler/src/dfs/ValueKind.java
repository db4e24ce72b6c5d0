package dfs;

import java.util.Arrays;
import java.util.Optional;

/**
 * The kind of value a parameter expects, shared by catalogue schemas and function signatures.
 *
 * <p>Variables and game values are untyped at compile time and satisfy every kind; only literals
 * are checked.
 */
public enum ValueKind {
  ANY("any", "any"),
  NUMBER("number", "num"),
  STRING("string", "txt"),
  TEXT("text", "comp"),
  LOCATION("location", "loc"),
  VECTOR("vector", "vec"),
  SOUND("sound", "snd"),
  PARTICLE("particle", "par"),
  POTION("potion", "pot"),
  ITEM("item", "item"),
  VARIABLE("variable", "var"),
  LIST("list", "list"),
  DICT("dict", "dict");

  private final String sourceName;
  private final String paramType;

  ValueKind(String sourceName, String paramType) {
    this.sourceName = sourceName;
    this.paramType = paramType;
  }

  public String sourceName() {
    return sourceName;
  }

  /** The {@code type} field of an encoded function parameter. */
  public String paramType() {
    return paramType;
  }

  public boolean accepts(Value value) {
    switch (value.type()) {
      case VARIABLE:
        return true;
      case GAME_VALUE:
        return this != VARIABLE && this != LIST && this != DICT;
      default:
        break;
    }

    switch (this) {
      case ANY:
        return true;
      case NUMBER:
        return value.type() == Value.Type.NUMBER || value.type() == Value.Type.DYNAMIC_NUMBER;
      case STRING:
      case TEXT:
        return value.type() == Value.Type.STRING || value.type() == Value.Type.TEXT;
      case LOCATION:
        return value.type() == Value.Type.LOCATION;
      case VECTOR:
        return value.type() == Value.Type.VECTOR;
      case SOUND:
        return value.type() == Value.Type.SOUND;
      case PARTICLE:
        return value.type() == Value.Type.PARTICLE;
      case POTION:
        return value.type() == Value.Type.POTION;
      case ITEM:
        return value.type() == Value.Type.ITEM;
      default:
        return false;
    }
  }

  public static Optional<ValueKind> fromSourceName(String name) {
    return Arrays.stream(values()).filter(k -> k.sourceName.equals(name)).findFirst();
  }

  public static Optional<ValueKind> fromParamType(String type) {
    return Arrays.stream(values()).filter(k -> k.paramType.equals(type)).findFirst();
  }
}
