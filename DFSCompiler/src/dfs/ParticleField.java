package dfs;

import java.util.Arrays;
import java.util.Optional;

/** Named optional particle data, as written in source and as keyed in the encoded data object. */
public enum ParticleField {
  // Encoded as the "x", "y" and "z" keys.
  MOTION("motion", "x", Value.Type.VECTOR, false),
  MOTION_VARIATION("motionVariation", "motionVariation", Value.Type.NUMBER, true),
  RGB("rgb", "rgb", Value.Type.NUMBER, true),
  RGB_FADE("rgbFade", "rgb_fade", Value.Type.NUMBER, true),
  COLOR_VARIATION("colorVariation", "colorVariation", Value.Type.NUMBER, true),
  MATERIAL("material", "material", Value.Type.STRING, false),
  SIZE("size", "size", Value.Type.NUMBER, false),
  SIZE_VARIATION("sizeVariation", "sizeVariation", Value.Type.NUMBER, true),
  ROLL("roll", "roll", Value.Type.NUMBER, false);

  private final String sourceName;
  private final String key;
  private final Value.Type valueType;
  private final boolean integral;

  ParticleField(String sourceName, String key, Value.Type valueType, boolean integral) {
    this.sourceName = sourceName;
    this.key = key;
    this.valueType = valueType;
    this.integral = integral;
  }

  public String sourceName() {
    return sourceName;
  }

  public String key() {
    return key;
  }

  public Value.Type valueType() {
    return valueType;
  }

  public boolean isIntegral() {
    return integral;
  }

  /** Particle data is fixed when encoded, so only literals are accepted. */
  public boolean accepts(Value value) {
    if (valueType == Value.Type.STRING) {
      return value.type() == Value.Type.STRING || value.type() == Value.Type.TEXT;
    }
    return value.type() == valueType;
  }

  public static Optional<ParticleField> fromKey(String key) {
    return Arrays.stream(values()).filter(f -> f.key.equals(key)).findFirst();
  }

  public static Optional<ParticleField> fromSourceName(String name) {
    return Arrays.stream(values()).filter(f -> f.sourceName.equals(name)).findFirst();
  }
}
