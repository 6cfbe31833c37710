/* Keymeta © 2025 — MIT */
package dev.keymeta.api;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dynamically typed attribute value.
 *
 * <p>Every value is one of six tagged shapes: four scalars and two containers. Containers are
 * immutable and may nest arbitrarily. Equality is strict and structural: {@code 1}, {@code 1.0}
 * and {@code "1"} are three different values, while two maps holding equal entries are equal.
 *
 * <p>The empty string is the store's absence sentinel; see {@link #isAbsent(MetaValue)}.
 */
public interface MetaValue {

  /** Runtime tag of a value. */
  enum Kind {
    INT("integer"),
    FLOAT("double"),
    BOOL("boolean"),
    STRING("string"),
    LIST("array"),
    MAP("array");

    private final String typeName;

    Kind(String typeName) {
      this.typeName = typeName;
    }

    /**
     * Loose type name shared by both container kinds.
     *
     * @return type name reported by {@code getType}
     */
    public String typeName() {
      return typeName;
    }
  }

  /** Shared empty string, used when an absent source is copied. */
  StringValue ABSENT = new StringValue("");

  /**
   * Runtime tag.
   *
   * @return kind of this value
   */
  Kind kind();

  /**
   * Loose type name of this value ({@code integer}, {@code double}, {@code boolean}, {@code
   * string} or {@code array}).
   *
   * @return type name
   */
  default String typeName() {
    return kind().typeName();
  }

  /**
   * Whether this value is a list or a map.
   *
   * @return {@code true} for containers
   */
  default boolean isContainer() {
    return kind() == Kind.LIST || kind() == Kind.MAP;
  }

  /**
   * Treats {@code null} and the empty string as "no value stored".
   *
   * @param value value read from a store, may be {@code null}
   * @return {@code true} when the value counts as absent
   */
  static boolean isAbsent(MetaValue value) {
    return value == null || (value instanceof StringValue s && s.value().isEmpty());
  }

  static IntValue of(long value) {
    return new IntValue(value);
  }

  static FloatValue of(double value) {
    return new FloatValue(value);
  }

  static BoolValue of(boolean value) {
    return value ? BoolValue.TRUE : BoolValue.FALSE;
  }

  static StringValue of(String value) {
    return new StringValue(value);
  }

  static ListValue list(MetaValue... items) {
    return new ListValue(Arrays.asList(items));
  }

  static ListValue list(List<? extends MetaValue> items) {
    return new ListValue(List.<MetaValue>copyOf(items));
  }

  static MapValue map(Map<String, ? extends MetaValue> entries) {
    return new MapValue(new LinkedHashMap<String, MetaValue>(entries));
  }

  /** Empty map. */
  static MapValue emptyMap() {
    return MapValue.EMPTY;
  }

  /** Signed 64-bit integer. */
  record IntValue(long value) implements MetaValue {
    @Override
    public Kind kind() {
      return Kind.INT;
    }
  }

  /** Double precision float. */
  record FloatValue(double value) implements MetaValue {
    @Override
    public Kind kind() {
      return Kind.FLOAT;
    }
  }

  /** Boolean. */
  record BoolValue(boolean value) implements MetaValue {
    static final BoolValue TRUE = new BoolValue(true);
    static final BoolValue FALSE = new BoolValue(false);

    @Override
    public Kind kind() {
      return Kind.BOOL;
    }
  }

  /** UTF-16 string; never {@code null}. */
  record StringValue(String value) implements MetaValue {
    public StringValue {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public Kind kind() {
      return Kind.STRING;
    }
  }

  /** Ordered sequence. Elements are never {@code null}. */
  record ListValue(List<MetaValue> items) implements MetaValue {
    public static final ListValue EMPTY = new ListValue(List.of());

    public ListValue {
      items = List.copyOf(items);
    }

    @Override
    public Kind kind() {
      return Kind.LIST;
    }

    public int size() {
      return items.size();
    }
  }

  /** String-keyed mapping, iteration follows insertion order. Values are never {@code null}. */
  record MapValue(Map<String, MetaValue> entries) implements MetaValue {
    public static final MapValue EMPTY = new MapValue(Map.of());

    public MapValue {
      Map<String, MetaValue> copy = new LinkedHashMap<>();
      for (Map.Entry<String, MetaValue> e : entries.entrySet()) {
        copy.put(
            Objects.requireNonNull(e.getKey(), "key"),
            Objects.requireNonNull(e.getValue(), "value"));
      }
      entries = Collections.unmodifiableMap(copy);
    }

    @Override
    public Kind kind() {
      return Kind.MAP;
    }

    public MetaValue get(String key) {
      return entries.get(key);
    }

    public boolean containsKey(String key) {
      return entries.containsKey(key);
    }

    public int size() {
      return entries.size();
    }
  }
}
