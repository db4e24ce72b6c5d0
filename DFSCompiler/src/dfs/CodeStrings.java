package dfs;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.io.BaseEncoding;
import com.google.common.io.ByteStreams;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.stream.JsonWriter;

/**
 * Converts block graphs to and from codestrings: base64 of the gzipped UTF-8 JSON document
 * {@code {"blocks":[...]}}.
 *
 * <p>Serialization writes keys in a fixed order and omits absent fields, so {@link #serialize}
 * and {@link #deserialize} are exact inverses.
 */
public final class CodeStrings {
  static final String BLOCK_ID = "block";
  static final String BRACKET_ID = "bracket";
  static final String TAG_ID = "bl_tag";

  public static String serialize(BlockGraph graph) {
    byte[] json = toJson(graph).getBytes(StandardCharsets.UTF_8);
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (OutputStream gzip = new GZIPOutputStream(bytes)) {
      gzip.write(json);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return BaseEncoding.base64().encode(bytes.toByteArray());
  }

  public static BlockGraph deserialize(String codestring) throws CompilerException {
    byte[] compressed;
    try {
      compressed = BaseEncoding.base64().decode(codestring.trim());
    } catch (IllegalArgumentException ex) {
      throw error(Tokenizer.Pos.internal(), "codestring is not valid base64", ex);
    }

    byte[] json;
    try (InputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
      json = ByteStreams.toByteArray(gzip);
    } catch (IOException ex) {
      throw error(Tokenizer.Pos.internal(), "codestring is not gzip data", ex);
    }
    return fromJson(new String(json, StandardCharsets.UTF_8));
  }

  /** The JSON document inside a codestring. */
  static String toJson(BlockGraph graph) {
    StringWriter out = new StringWriter();
    try (JsonWriter writer = new JsonWriter(out)) {
      writer.beginObject().name("blocks").beginArray();
      for (CodeBlock block : graph.blocks()) {
        writeBlock(writer, block);
      }
      writer.endArray().endObject();
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
    return out.toString();
  }

  static BlockGraph fromJson(String json) throws CompilerException {
    JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException ex) {
      throw error(Tokenizer.Pos.internal(), "malformed JSON: " + ex.getMessage(), ex);
    }

    Tokenizer.Pos pos = Tokenizer.Pos.internal();
    JsonObject document = asObject(root, pos, "document");
    JsonArray array = asArray(required(document, "blocks", pos), pos, "blocks");

    ImmutableList.Builder<CodeBlock> blocks = ImmutableList.builder();
    for (int i = 0; i < array.size(); i++) {
      blocks.add(readBlock(asObject(array.get(i), Tokenizer.Pos.block(i), "block"), i));
    }

    BlockGraph graph = BlockGraph.create(blocks.build());
    int unbalanced = BlockGraph.findUnbalancedBracket(graph.blocks());
    if (unbalanced >= 0) {
      throw error(Tokenizer.Pos.block(unbalanced), "unbalanced bracket");
    }
    return graph;
  }

  private static void writeBlock(JsonWriter writer, CodeBlock block) throws IOException {
    writer.beginObject();
    if (block.isBracket()) {
      writer.name("id").value(BRACKET_ID);
      writer.name("direct").value(block.direction().get().externalName());
      writer.name("type").value(block.bracketType().get().externalName());
      writer.endObject();
      return;
    }

    writer.name("id").value(BLOCK_ID);
    writer.name("block").value(block.block().get());
    if (!block.isBlock(CodeBlock.ELSE)) {
      writer.name("args").beginObject().name("items").beginArray();
      for (Parameter param : block.params()) {
        writer.beginObject().name("item");
        writeItem(writer, param.value());
        writer.name("slot").value(param.slot());
        writer.endObject();
      }
      for (Map.Entry<String, BlockTag> tag : block.tags().entrySet()) {
        writer.beginObject().name("item");
        writeTag(writer, tag.getKey(), tag.getValue());
        writer.name("slot").value(tag.getValue().slot());
        writer.endObject();
      }
      writer.endArray().endObject();
    }
    writeOptional(writer, "action", block.action());
    writeOptional(writer, "target", block.target());
    writeOptional(writer, "data", block.data());
    writeOptional(writer, "attribute", block.attribute());
    writeOptional(writer, "subAction", block.subAction());
    writer.endObject();
  }

  private static void writeOptional(JsonWriter writer, String name, Optional<String> value)
      throws IOException {
    if (value.isPresent()) {
      writer.name(name).value(value.get());
    }
  }

  private static void writeTag(JsonWriter writer, String name, BlockTag tag) throws IOException {
    writer.beginObject().name("data").beginObject();
    writer.name("action").value(tag.action());
    writer.name("block").value(tag.block());
    writer.name("option").value(tag.option());
    writer.name("tag").value(name);
    writer.endObject().name("id").value(TAG_ID).endObject();
  }

  // {"data":{...},"id":"..."}
  private static void writeItem(JsonWriter writer, EncodedValue value) throws IOException {
    writer.beginObject().name("data").beginObject();
    switch (value.kind()) {
      case NUMBER:
      case STRING:
      case TEXT:
        writer.name("name").value(value.<EncodedValue.Simple>cast().name());
        break;
      case LOCATION:
        {
          EncodedValue.Location loc = value.cast();
          writer.name("isBlock").value(false);
          writer.name("loc").beginObject();
          writeNumber(writer.name("x"), loc.x());
          writeNumber(writer.name("y"), loc.y());
          writeNumber(writer.name("z"), loc.z());
          writeNumber(writer.name("pitch"), loc.pitch());
          writeNumber(writer.name("yaw"), loc.yaw());
          writer.endObject();
          break;
        }
      case VECTOR:
        {
          EncodedValue.Vector vec = value.cast();
          writeNumber(writer.name("x"), vec.x());
          writeNumber(writer.name("y"), vec.y());
          writeNumber(writer.name("z"), vec.z());
          break;
        }
      case SOUND:
        {
          EncodedValue.Sound sound = value.cast();
          writer.name("sound").value(sound.sound());
          writeOptional(writer, "variant", sound.variant());
          writeNumber(writer.name("vol"), sound.volume());
          writeNumber(writer.name("pitch"), sound.pitch());
          break;
        }
      case POTION:
        {
          EncodedValue.Potion potion = value.cast();
          writer.name("pot").value(potion.potion());
          writeNumber(writer.name("amp"), potion.amplifier());
          writeNumber(writer.name("dur"), potion.duration());
          break;
        }
      case PARTICLE:
        writeParticle(writer, value.cast());
        break;
      case ITEM:
        writer.name("item").value(value.<EncodedValue.Item>cast().item());
        break;
      case GAME_VALUE:
        {
          EncodedValue.GameValue gameValue = value.cast();
          writer.name("type").value(gameValue.type());
          writer.name("target").value(gameValue.target());
          break;
        }
      case VARIABLE:
        {
          EncodedValue.Variable variable = value.cast();
          writer.name("name").value(variable.name());
          writer.name("scope").value(variable.scope().externalName());
          break;
        }
      case PARAMETER:
        {
          EncodedValue.FunctionParam param = value.cast();
          if (param.defaultValue().isPresent()) {
            writer.name("default_value");
            writeItem(writer, param.defaultValue().get());
          }
          writer.name("name").value(param.name());
          writer.name("optional").value(param.optional());
          writer.name("plural").value(param.plural());
          writer.name("type").value(param.type());
          break;
        }
      case HINT:
        writer.name("id").value(value.<EncodedValue.Hint>cast().id());
        break;
    }
    writer.endObject().name("id").value(value.kind().id()).endObject();
  }

  private static void writeParticle(JsonWriter writer, EncodedValue.Particle particle)
      throws IOException {
    writer.name("particle").value(particle.particle());
    writer.name("cluster").beginObject();
    writer.name("amount").value(particle.amount());
    writeNumber(writer.name("horizontal"), particle.horizontal());
    writeNumber(writer.name("vertical"), particle.vertical());
    writer.endObject();

    writer.name("data").beginObject();
    for (Map.Entry<String, Object> field : particle.data().entrySet()) {
      writer.name(field.getKey());
      Object value = field.getValue();
      if (value instanceof String) {
        writer.value((String) value);
      } else {
        writeNumber(writer, ((Number) value).doubleValue());
      }
    }
    writer.endObject();
  }

  // Integral values are written without a fractional part.
  private static void writeNumber(JsonWriter writer, double value) throws IOException {
    if (value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
      writer.value((long) value);
    } else {
      writer.value(value);
    }
  }

  private static CodeBlock readBlock(JsonObject json, int index) throws CompilerException {
    Tokenizer.Pos pos = Tokenizer.Pos.block(index);
    String id = string(json, "id", pos);
    if (id.equals(BRACKET_ID)) {
      String direct = string(json, "direct", pos);
      String type = string(json, "type", pos);
      Optional<CodeBlock.Direction> direction = CodeBlock.Direction.fromExternalName(direct);
      Optional<CodeBlock.BracketType> bracketType = CodeBlock.BracketType.fromExternalName(type);
      if (!direction.isPresent()) {
        throw error(pos, String.format("unknown bracket direction '%s'", direct));
      }
      if (!bracketType.isPresent()) {
        throw error(pos, String.format("unknown bracket type '%s'", type));
      }
      return CodeBlock.bracket(direction.get(), bracketType.get());
    } else if (!id.equals(BLOCK_ID)) {
      throw error(pos, String.format("unknown record id '%s'", id));
    }

    CodeBlock.Builder block = CodeBlock.block(string(json, "block", pos));
    optionalString(json, "action", pos).ifPresent(block::setAction);
    block.setTarget(optionalString(json, "target", pos));
    optionalString(json, "data", pos).ifPresent(block::setData);
    optionalString(json, "attribute", pos).ifPresent(block::setAttribute);
    optionalString(json, "subAction", pos).ifPresent(block::setSubAction);

    ImmutableSortedMap.Builder<String, BlockTag> tags = ImmutableSortedMap.naturalOrder();
    if (json.has("args")) {
      JsonObject args = asObject(json.get("args"), pos, "args");
      JsonArray items = asArray(required(args, "items", pos), pos, "items");
      for (JsonElement element : items) {
        JsonObject entry = asObject(element, pos, "item entry");
        int slot = integer(entry, "slot", pos);
        JsonObject item = asObject(required(entry, "item", pos), pos, "item");
        if (string(item, "id", pos).equals(TAG_ID)) {
          JsonObject data = asObject(required(item, "data", pos), pos, "tag data");
          tags.put(
              string(data, "tag", pos),
              BlockTag.create(
                  string(data, "option", pos),
                  slot,
                  string(data, "action", pos),
                  string(data, "block", pos)));
        } else {
          block.addParam(slot, readItem(item, pos));
        }
      }
    }

    try {
      return block.setTags(tags.buildOrThrow()).build();
    } catch (IllegalArgumentException ex) {
      throw error(pos, "duplicate tag: " + ex.getMessage(), ex);
    }
  }

  private static EncodedValue readItem(JsonObject item, Tokenizer.Pos pos)
      throws CompilerException {
    String id = string(item, "id", pos);
    Optional<EncodedValue.Kind> kind = EncodedValue.Kind.fromId(id);
    if (!kind.isPresent()) {
      throw error(pos, String.format("unknown item id '%s'", id));
    }

    JsonObject data = asObject(required(item, "data", pos), pos, id + " data");
    switch (kind.get()) {
      case NUMBER:
        return EncodedValue.Simple.number(string(data, "name", pos));
      case STRING:
        return EncodedValue.Simple.string(string(data, "name", pos));
      case TEXT:
        return EncodedValue.Simple.text(string(data, "name", pos));
      case LOCATION:
        {
          JsonObject loc = asObject(required(data, "loc", pos), pos, "loc");
          return EncodedValue.Location.create(
              number(loc, "x", pos),
              number(loc, "y", pos),
              number(loc, "z", pos),
              number(loc, "pitch", pos),
              number(loc, "yaw", pos));
        }
      case VECTOR:
        return EncodedValue.Vector.create(
            number(data, "x", pos), number(data, "y", pos), number(data, "z", pos));
      case SOUND:
        return EncodedValue.Sound.create(
            string(data, "sound", pos),
            optionalString(data, "variant", pos),
            number(data, "vol", pos),
            number(data, "pitch", pos));
      case POTION:
        return EncodedValue.Potion.create(
            string(data, "pot", pos), number(data, "amp", pos), number(data, "dur", pos));
      case PARTICLE:
        return readParticle(data, pos);
      case ITEM:
        return EncodedValue.Item.create(string(data, "item", pos));
      case GAME_VALUE:
        return EncodedValue.GameValue.create(
            string(data, "type", pos), string(data, "target", pos));
      case VARIABLE:
        {
          String scope = string(data, "scope", pos);
          Optional<VariableScope> variableScope = VariableScope.fromExternalName(scope);
          if (!variableScope.isPresent()) {
            throw error(pos, String.format("unknown variable scope '%s'", scope));
          }
          return EncodedValue.Variable.create(string(data, "name", pos), variableScope.get());
        }
      case PARAMETER:
        {
          Optional<EncodedValue> defaultValue = Optional.empty();
          if (data.has("default_value")) {
            defaultValue =
                Optional.of(
                    readItem(asObject(data.get("default_value"), pos, "default_value"), pos));
          }
          return EncodedValue.FunctionParam.create(
              defaultValue,
              string(data, "name", pos),
              bool(data, "optional", pos),
              bool(data, "plural", pos),
              string(data, "type", pos));
        }
      case HINT:
        return EncodedValue.Hint.create(string(data, "id", pos));
    }
    throw error(pos, String.format("unsupported item id '%s'", id));
  }

  private static EncodedValue.Particle readParticle(JsonObject data, Tokenizer.Pos pos)
      throws CompilerException {
    JsonObject cluster = asObject(required(data, "cluster", pos), pos, "cluster");
    ImmutableMap.Builder<String, Object> fields = ImmutableMap.builder();
    if (data.has("data")) {
      for (Map.Entry<String, JsonElement> field :
          asObject(data.get("data"), pos, "particle data").entrySet()) {
        JsonPrimitive value = asPrimitive(field.getValue(), pos, field.getKey());
        if (value.isString()) {
          fields.put(field.getKey(), value.getAsString());
        } else if (value.isNumber()) {
          fields.put(field.getKey(), finite(value.getAsDouble(), field.getKey(), pos));
        } else {
          throw error(pos, String.format("invalid particle field '%s'", field.getKey()));
        }
      }
    }
    return EncodedValue.Particle.create(
        string(data, "particle", pos),
        integer(cluster, "amount", pos),
        number(cluster, "horizontal", pos),
        number(cluster, "vertical", pos),
        fields.buildOrThrow());
  }

  private static JsonElement required(JsonObject json, String key, Tokenizer.Pos pos)
      throws CompilerException {
    JsonElement element = json.get(key);
    if (element == null || element.isJsonNull()) {
      throw error(pos, String.format("missing field '%s'", key));
    }
    return element;
  }

  private static JsonObject asObject(JsonElement element, Tokenizer.Pos pos, String what)
      throws CompilerException {
    if (!element.isJsonObject()) {
      throw error(pos, String.format("%s must be an object", what));
    }
    return element.getAsJsonObject();
  }

  private static JsonArray asArray(JsonElement element, Tokenizer.Pos pos, String what)
      throws CompilerException {
    if (!element.isJsonArray()) {
      throw error(pos, String.format("%s must be an array", what));
    }
    return element.getAsJsonArray();
  }

  private static JsonPrimitive asPrimitive(JsonElement element, Tokenizer.Pos pos, String what)
      throws CompilerException {
    if (!element.isJsonPrimitive()) {
      throw error(pos, String.format("'%s' must be a string, number or boolean", what));
    }
    return element.getAsJsonPrimitive();
  }

  private static String string(JsonObject json, String key, Tokenizer.Pos pos)
      throws CompilerException {
    JsonPrimitive value = asPrimitive(required(json, key, pos), pos, key);
    if (!value.isString()) {
      throw error(pos, String.format("field '%s' must be a string", key));
    }
    return value.getAsString();
  }

  private static Optional<String> optionalString(JsonObject json, String key, Tokenizer.Pos pos)
      throws CompilerException {
    return json.has(key) ? Optional.of(string(json, key, pos)) : Optional.empty();
  }

  private static double number(JsonObject json, String key, Tokenizer.Pos pos)
      throws CompilerException {
    JsonPrimitive value = asPrimitive(required(json, key, pos), pos, key);
    if (!value.isNumber()) {
      throw error(pos, String.format("field '%s' must be a number", key));
    }
    return finite(value.getAsDouble(), key, pos);
  }

  private static double finite(double value, String key, Tokenizer.Pos pos)
      throws CompilerException {
    if (!Double.isFinite(value)) {
      throw error(pos, String.format("field '%s' must be a finite number", key));
    }
    return value;
  }

  private static int integer(JsonObject json, String key, Tokenizer.Pos pos)
      throws CompilerException {
    double value = number(json, key, pos);
    if (value != Math.rint(value) || value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw error(pos, String.format("field '%s' must be an integer", key));
    }
    return (int) value;
  }

  private static boolean bool(JsonObject json, String key, Tokenizer.Pos pos)
      throws CompilerException {
    JsonPrimitive value = asPrimitive(required(json, key, pos), pos, key);
    if (!value.isBoolean()) {
      throw error(pos, String.format("field '%s' must be a boolean", key));
    }
    return value.getAsBoolean();
  }

  private static CompilerException error(Tokenizer.Pos pos, String message) {
    return new CompilerException(CompilerException.Kind.SERIALIZATION, pos, message);
  }

  private static CompilerException error(Tokenizer.Pos pos, String message, Throwable cause) {
    return new CompilerException(CompilerException.Kind.SERIALIZATION, pos, message, cause);
  }

  private CodeStrings() {}
}
