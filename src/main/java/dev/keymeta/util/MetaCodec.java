/* Keymeta © 2025 — MIT */
package dev.keymeta.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import dev.keymeta.api.MetaValue;
import dev.keymeta.api.MetaValue.BoolValue;
import dev.keymeta.api.MetaValue.FloatValue;
import dev.keymeta.api.MetaValue.IntValue;
import dev.keymeta.api.MetaValue.ListValue;
import dev.keymeta.api.MetaValue.MapValue;
import dev.keymeta.api.MetaValue.StringValue;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * JSON codec for {@link MetaValue}s, backed by Gson.
 *
 * <p>Integers encode without a fraction and floats always with one ({@code 15.0}), so the tag
 * survives a round trip. JSON {@code null} decodes to "absent" at the top level and to the empty
 * string inside containers.
 */
public final class MetaCodec {
  private static final Gson GSON =
      new GsonBuilder().disableHtmlEscaping().serializeSpecialFloatingPointValues().create();

  private MetaCodec() {}

  /**
   * Encodes a value as compact JSON, keeping map insertion order.
   *
   * @param value value to encode
   * @return JSON text
   */
  public static String encode(MetaValue value) {
    return GSON.toJson(toJson(value, false));
  }

  /**
   * Encodes a value with map keys sorted at every level, so structurally equal values always
   * produce the same text.
   *
   * @param value value to encode
   * @return canonical JSON text
   */
  public static String canonical(MetaValue value) {
    return GSON.toJson(toJson(value, true));
  }

  /**
   * Serialized size used for size introspection.
   *
   * @param value value to measure
   * @return UTF-8 byte length of {@link #encode(MetaValue)}
   */
  public static int byteSize(MetaValue value) {
    return encode(value).getBytes(StandardCharsets.UTF_8).length;
  }

  /**
   * Decodes JSON text.
   *
   * @param json JSON text
   * @return decoded value, {@code null} for JSON {@code null}
   * @throws IllegalArgumentException when the text is not valid JSON
   */
  public static MetaValue decode(String json) {
    if (json == null) {
      throw new IllegalArgumentException("json must not be null");
    }
    try {
      return fromJson(JsonParser.parseString(json));
    } catch (JsonParseException e) {
      throw new IllegalArgumentException("invalid JSON value", e);
    }
  }

  /**
   * Decodes JSON text, swallowing syntax errors.
   *
   * @param json JSON text, may be {@code null}
   * @return decoded value, or empty when the text is malformed, blank or {@code null}
   */
  public static Optional<MetaValue> tryDecode(String json) {
    if (json == null || json.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.ofNullable(fromJson(JsonParser.parseString(json)));
    } catch (JsonParseException e) {
      return Optional.empty();
    }
  }

  static JsonElement toJson(MetaValue value, boolean sortKeys) {
    if (value instanceof IntValue i) {
      return new JsonPrimitive(i.value());
    }
    if (value instanceof FloatValue f) {
      return new JsonPrimitive(f.value());
    }
    if (value instanceof BoolValue b) {
      return new JsonPrimitive(b.value());
    }
    if (value instanceof StringValue s) {
      return new JsonPrimitive(s.value());
    }
    if (value instanceof ListValue l) {
      JsonArray array = new JsonArray(l.size());
      for (MetaValue item : l.items()) {
        array.add(toJson(item, sortKeys));
      }
      return array;
    }
    MapValue m = (MapValue) value;
    Map<String, MetaValue> entries = sortKeys ? new TreeMap<>(m.entries()) : m.entries();
    JsonObject object = new JsonObject();
    for (Map.Entry<String, MetaValue> e : entries.entrySet()) {
      object.add(e.getKey(), toJson(e.getValue(), sortKeys));
    }
    return object;
  }

  static MetaValue fromJson(JsonElement element) {
    if (element == null || element.isJsonNull()) {
      return null;
    }
    if (element.isJsonArray()) {
      List<MetaValue> items = new ArrayList<>();
      for (JsonElement item : element.getAsJsonArray()) {
        items.add(orAbsent(fromJson(item)));
      }
      return MetaValue.list(items);
    }
    if (element.isJsonObject()) {
      Map<String, MetaValue> entries = new LinkedHashMap<>();
      for (Map.Entry<String, JsonElement> e : element.getAsJsonObject().entrySet()) {
        entries.put(e.getKey(), orAbsent(fromJson(e.getValue())));
      }
      return MetaValue.map(entries);
    }
    JsonPrimitive primitive = element.getAsJsonPrimitive();
    if (primitive.isBoolean()) {
      return MetaValue.of(primitive.getAsBoolean());
    }
    if (primitive.isNumber()) {
      return number(primitive.getAsString());
    }
    return MetaValue.of(primitive.getAsString());
  }

  private static MetaValue number(String literal) {
    boolean integral =
        literal.indexOf('.') < 0 && literal.indexOf('e') < 0 && literal.indexOf('E') < 0;
    if (integral) {
      try {
        return MetaValue.of(Long.parseLong(literal));
      } catch (NumberFormatException overflow) {
        // falls through to double
      }
    }
    return MetaValue.of(Double.parseDouble(literal));
  }

  private static MetaValue orAbsent(MetaValue value) {
    return value == null ? MetaValue.ABSENT : value;
  }
}
