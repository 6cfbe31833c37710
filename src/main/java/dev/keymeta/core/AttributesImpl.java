/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import dev.keymeta.api.Attributes;
import dev.keymeta.api.CastKind;
import dev.keymeta.api.MetaValue;
import dev.keymeta.api.MetaValue.ListValue;
import dev.keymeta.api.MetaValue.StringValue;
import dev.keymeta.api.storage.AttributeStore;
import dev.keymeta.util.DotPath;
import dev.keymeta.util.MetaCasts;
import dev.keymeta.util.MetaCodec;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Attributes} implementation over an {@link AttributeStore}.
 *
 * <p>Holds no state besides the store handle. Every call reads the first stored row of the key;
 * mutations rewrite the whole value with {@link AttributeStore#set}.
 */
public final class AttributesImpl implements Attributes {
  private static final Logger LOG = LoggerFactory.getLogger("keymeta");

  private final AttributeStore store;
  private final long largeValueBytes;

  public AttributesImpl(AttributeStore store) {
    this(store, DEFAULT_LARGE_BYTES);
  }

  /**
   * Creates a new instance.
   *
   * @param store backing store
   * @param largeValueBytes threshold of {@link #isLarge(String, long, String)}
   */
  public AttributesImpl(AttributeStore store, long largeValueBytes) {
    this.store = Objects.requireNonNull(store, "store");
    this.largeValueBytes = largeValueBytes;
  }

  @Override
  public boolean exists(String entityType, long entityId, String key) {
    return !MetaValue.isAbsent(raw(entityType, entityId, key));
  }

  @Override
  public MetaValue get(String entityType, long entityId, String key) {
    MetaValue value = raw(entityType, entityId, key);
    return MetaValue.isAbsent(value) ? null : value;
  }

  @Override
  public List<MetaValue> getValues(String entityType, long entityId, String key) {
    requireKey(entityType, key);
    List<MetaValue> values = store.values(entityType, entityId, key);
    return values.isEmpty() ? null : values;
  }

  @Override
  public MetaValue getOrDefault(
      String entityType, long entityId, String key, MetaValue defaultValue) {
    MetaValue value = get(entityType, entityId, key);
    return value != null ? value : defaultValue;
  }

  @Override
  public MetaValue getCast(
      String entityType, long entityId, String key, CastKind kind, MetaValue defaultValue) {
    Objects.requireNonNull(kind, "kind");
    return MetaCasts.cast(getOrDefault(entityType, entityId, key, defaultValue), kind);
  }

  @Override
  public long getInt(String entityType, long entityId, String key, long defaultValue) {
    return MetaCasts.toLong(getOrDefault(entityType, entityId, key, MetaValue.of(defaultValue)));
  }

  @Override
  public double getFloat(String entityType, long entityId, String key, double defaultValue) {
    return MetaCasts.toDouble(getOrDefault(entityType, entityId, key, MetaValue.of(defaultValue)));
  }

  @Override
  public boolean getBool(String entityType, long entityId, String key, boolean defaultValue) {
    return MetaCasts.toBool(getOrDefault(entityType, entityId, key, MetaValue.of(defaultValue)));
  }

  @Override
  public String getString(String entityType, long entityId, String key, String defaultValue) {
    MetaValue value = get(entityType, entityId, key);
    return value != null ? MetaCasts.toText(value) : defaultValue;
  }

  @Override
  public boolean update(String entityType, long entityId, String key, MetaValue value) {
    requireKey(entityType, key);
    Objects.requireNonNull(value, "value");
    boolean ok = store.set(entityType, entityId, key, value);
    if (!ok) {
      LOG.debug("(keymeta) write rejected type={} id={} key={}", entityType, entityId, key);
    }
    return ok;
  }

  @Override
  public boolean updateIfChanged(String entityType, long entityId, String key, MetaValue value) {
    Objects.requireNonNull(value, "value");
    MetaValue current = raw(entityType, entityId, key);
    if (value.equals(current == null ? MetaValue.ABSENT : current)) {
      return false;
    }
    return update(entityType, entityId, key, value);
  }

  @Override
  public boolean delete(String entityType, long entityId, String key) {
    requireKey(entityType, key);
    if (entityId <= 0) {
      return false;
    }
    return store.delete(entityType, entityId, key);
  }

  @Override
  public OptionalLong increment(String entityType, long entityId, String key, long amount) {
    return adjust(entityType, entityId, key, amount, "increment");
  }

  @Override
  public OptionalLong decrement(String entityType, long entityId, String key, long amount) {
    if (amount == Long.MIN_VALUE) {
      LOG.warn("(keymeta) op={} message={} key={}", "decrement", "amount overflow", key);
      return OptionalLong.empty();
    }
    return adjust(entityType, entityId, key, -Math.abs(amount), "decrement");
  }

  private OptionalLong adjust(
      String entityType, long entityId, String key, long delta, String op) {
    long current = MetaCasts.toLong(raw(entityType, entityId, key));
    long next;
    try {
      next = Math.addExact(current, delta);
    } catch (ArithmeticException e) {
      LOG.warn(
          "(keymeta) op={} message={} type={} id={} key={}",
          op,
          "integer overflow",
          entityType,
          entityId,
          key);
      return OptionalLong.empty();
    }
    return update(entityType, entityId, key, MetaValue.of(next))
        ? OptionalLong.of(next)
        : OptionalLong.empty();
  }

  @Override
  public boolean arrayContains(String entityType, long entityId, String key, MetaValue element) {
    return raw(entityType, entityId, key) instanceof ListValue list
        && list.items().contains(element);
  }

  @Override
  public boolean arrayAppend(String entityType, long entityId, String key, MetaValue element) {
    Objects.requireNonNull(element, "element");
    List<MetaValue> items = new ArrayList<>();
    if (raw(entityType, entityId, key) instanceof ListValue list) {
      items.addAll(list.items());
    }
    items.add(element);
    return update(entityType, entityId, key, MetaValue.list(items));
  }

  @Override
  public boolean arrayRemove(String entityType, long entityId, String key, MetaValue element) {
    if (!(raw(entityType, entityId, key) instanceof ListValue list)) {
      return false;
    }
    int index = list.items().indexOf(element);
    if (index < 0) {
      return false;
    }
    List<MetaValue> items = new ArrayList<>(list.items());
    items.remove(index);
    return update(entityType, entityId, key, MetaValue.list(items));
  }

  @Override
  public boolean arrayRemoveAll(
      String entityType, long entityId, String key, MetaValue element) {
    if (!(raw(entityType, entityId, key) instanceof ListValue list)) {
      return false;
    }
    List<MetaValue> items = new ArrayList<>(list.items());
    if (!items.removeIf(item -> item.equals(element))) {
      return false;
    }
    return update(entityType, entityId, key, MetaValue.list(items));
  }

  @Override
  public boolean arrayUnique(String entityType, long entityId, String key) {
    if (!(raw(entityType, entityId, key) instanceof ListValue list)) {
      return false;
    }
    List<MetaValue> unique = new ArrayList<>(new LinkedHashSet<>(list.items()));
    if (unique.size() == list.size()) {
      return false;
    }
    return update(entityType, entityId, key, MetaValue.list(unique));
  }

  @Override
  public int arrayCount(String entityType, long entityId, String key) {
    return raw(entityType, entityId, key) instanceof ListValue list ? list.size() : 0;
  }

  @Override
  public MetaValue getNested(
      String entityType, long entityId, String key, String path, MetaValue defaultValue) {
    MetaValue root = get(entityType, entityId, key);
    if (root == null || !root.isContainer()) {
      return defaultValue;
    }
    return DotPath.get(root, path).orElse(defaultValue);
  }

  @Override
  public boolean setNested(
      String entityType, long entityId, String key, String path, MetaValue value) {
    MetaValue root = get(entityType, entityId, key);
    return update(entityType, entityId, key, DotPath.set(root, path, value));
  }

  @Override
  public boolean removeNested(String entityType, long entityId, String key, String path) {
    Optional<MetaValue> rebuilt = DotPath.remove(get(entityType, entityId, key), path);
    return rebuilt.isPresent() && update(entityType, entityId, key, rebuilt.get());
  }

  @Override
  public MetaValue getJson(
      String entityType, long entityId, String key, MetaValue defaultValue) {
    MetaValue value = get(entityType, entityId, key);
    if (value == null) {
      return defaultValue;
    }
    if (value.isContainer()) {
      return value;
    }
    if (value instanceof StringValue s) {
      return MetaCodec.tryDecode(s.value())
          .filter(MetaValue::isContainer)
          .orElse(defaultValue);
    }
    return defaultValue;
  }

  @Override
  public boolean setJson(String entityType, long entityId, String key, MetaValue value) {
    Objects.requireNonNull(value, "value");
    if (!value.isContainer()) {
      throw new IllegalArgumentException("setJson expects a list or map, got " + value.kind());
    }
    return update(entityType, entityId, key, value);
  }

  @Override
  public boolean isTruthy(String entityType, long entityId, String key, boolean defaultValue) {
    MetaValue value = get(entityType, entityId, key);
    return value != null ? MetaCasts.toBool(value) : defaultValue;
  }

  @Override
  public Optional<Boolean> toggle(String entityType, long entityId, String key) {
    boolean next = !isTruthy(entityType, entityId, key, false);
    return update(entityType, entityId, key, MetaValue.of(next))
        ? Optional.of(next)
        : Optional.empty();
  }

  @Override
  public String getType(String entityType, long entityId, String key) {
    MetaValue value = get(entityType, entityId, key);
    return value != null ? value.typeName() : null;
  }

  @Override
  public int getSize(String entityType, long entityId, String key) {
    MetaValue value = get(entityType, entityId, key);
    return value != null ? store.byteSize(value) : 0;
  }

  @Override
  public boolean isType(String entityType, long entityId, String key, String typeName) {
    Objects.requireNonNull(typeName, "typeName");
    MetaValue value = get(entityType, entityId, key);
    if (value == null) {
      return false;
    }
    String wanted = typeName.trim().toLowerCase(Locale.ROOT);
    return wanted.equals(value.typeName())
        || wanted.equals(value.kind().name().toLowerCase(Locale.ROOT));
  }

  @Override
  public boolean isLarge(String entityType, long entityId, String key, long sizeLimit) {
    return getSize(entityType, entityId, key) > sizeLimit;
  }

  @Override
  public boolean isLarge(String entityType, long entityId, String key) {
    return isLarge(entityType, entityId, key, largeValueBytes);
  }

  @Override
  public boolean migrateKey(
      String entityType, long entityId, String oldKey, String newKey, boolean deleteOld) {
    requireKey(entityType, newKey);
    MetaValue value = raw(entityType, entityId, oldKey);
    boolean copied = update(entityType, entityId, newKey, value == null ? MetaValue.ABSENT : value);
    if (copied && deleteOld) {
      return delete(entityType, entityId, oldKey);
    }
    return copied;
  }

  /** First stored row, including the empty-string sentinel; {@code null} when no row exists. */
  private MetaValue raw(String entityType, long entityId, String key) {
    requireKey(entityType, key);
    List<MetaValue> values = store.values(entityType, entityId, key);
    return values.isEmpty() ? null : values.get(0);
  }

  static void requireKey(String entityType, String key) {
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(key, "key");
    if (key.isEmpty()) {
      throw new IllegalArgumentException("attribute key must not be empty");
    }
  }
}
