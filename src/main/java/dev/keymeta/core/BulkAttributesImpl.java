/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import dev.keymeta.api.Attributes;
import dev.keymeta.api.BulkAttributes;
import dev.keymeta.api.Comparison;
import dev.keymeta.api.MetaValue;
import dev.keymeta.api.NumericStats;
import dev.keymeta.api.SyncDirection;
import dev.keymeta.api.ValueComparison;
import dev.keymeta.api.storage.AttributeStore;
import dev.keymeta.util.MetaCasts;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BulkAttributes} composed from {@link Attributes} calls.
 *
 * <p>Only {@link #getAll}, the prefix operations and {@link #findObjectsByValue} reach the store
 * directly, since they need its scan and query capabilities. Everything else loops over single
 * attribute calls in input order.
 */
public final class BulkAttributesImpl implements BulkAttributes {
  private static final Logger LOG = LoggerFactory.getLogger("keymeta");

  private final Attributes attributes;
  private final AttributeStore store;
  private final Metrics metrics;
  private final long largeValueBytes;

  public BulkAttributesImpl(Attributes attributes, AttributeStore store, Metrics metrics) {
    this(attributes, store, metrics, Attributes.DEFAULT_LARGE_BYTES);
  }

  /**
   * Creates a new instance.
   *
   * @param attributes single attribute accessor
   * @param store backing store shared with {@code attributes}
   * @param metrics metrics registry, may be {@code null}
   * @param largeValueBytes threshold of {@link #findLarge(String, long)}
   */
  public BulkAttributesImpl(
      Attributes attributes, AttributeStore store, Metrics metrics, long largeValueBytes) {
    this.attributes = Objects.requireNonNull(attributes, "attributes");
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = metrics;
    this.largeValueBytes = largeValueBytes;
  }

  @Override
  public Map<String, MetaValue> getMany(
      String entityType, long entityId, Collection<String> keys) {
    Map<String, MetaValue> out = new LinkedHashMap<>();
    for (String key : keys) {
      MetaValue value = attributes.get(entityType, entityId, key);
      if (value != null) {
        out.put(key, value);
      }
    }
    return out;
  }

  @Override
  public Map<String, List<MetaValue>> getManyValues(
      String entityType, long entityId, Collection<String> keys) {
    Map<String, List<MetaValue>> out = new LinkedHashMap<>();
    for (String key : keys) {
      List<MetaValue> values = attributes.getValues(entityType, entityId, key);
      if (values != null) {
        out.put(key, values);
      }
    }
    return out;
  }

  @Override
  public Map<String, List<MetaValue>> getAll(String entityType, long entityId) {
    Objects.requireNonNull(entityType, "entityType");
    return store.all(entityType, entityId);
  }

  @Override
  public List<String> updateMany(
      String entityType, long entityId, Map<String, MetaValue> values, boolean skipUnchanged) {
    List<String> written = new ArrayList<>();
    int failed = 0;
    for (Map.Entry<String, MetaValue> e : values.entrySet()) {
      if (skipUnchanged && unchanged(entityType, entityId, e.getKey(), e.getValue())) {
        continue;
      }
      if (attributes.update(entityType, entityId, e.getKey(), e.getValue())) {
        written.add(e.getKey());
      } else {
        failed++;
        LOG.debug(
            "(keymeta) op={} failed type={} id={} key={}",
            "bulk.updateMany",
            entityType,
            entityId,
            e.getKey());
      }
    }
    recordBulk(values.size(), failed);
    return written;
  }

  /** Same test as {@link Attributes#updateIfChanged}, kept separate so failed writes count. */
  private boolean unchanged(String entityType, long entityId, String key, MetaValue value) {
    List<MetaValue> rows = attributes.getValues(entityType, entityId, key);
    return value.equals(rows == null ? MetaValue.ABSENT : rows.get(0));
  }

  @Override
  public int deleteMany(String entityType, long entityId, Collection<String> keys) {
    int deleted = 0;
    for (String key : keys) {
      if (attributes.delete(entityType, entityId, key)) {
        deleted++;
      }
    }
    return deleted;
  }

  @Override
  public Map<String, MetaValue> backup(String entityType, long entityId, Collection<String> keys) {
    return getMany(entityType, entityId, keys);
  }

  @Override
  public List<String> restore(String entityType, long entityId, Map<String, MetaValue> backup) {
    return updateMany(entityType, entityId, backup, false);
  }

  @Override
  public Map<String, MetaValue> getByPrefix(String entityType, long entityId, String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    Map<String, MetaValue> out = new LinkedHashMap<>();
    for (Map.Entry<String, List<MetaValue>> e : getAll(entityType, entityId).entrySet()) {
      if (e.getKey().startsWith(prefix) && !e.getValue().isEmpty()) {
        out.put(e.getKey(), e.getValue().get(0));
      }
    }
    return out;
  }

  @Override
  public List<String> keysByPrefix(String entityType, long entityId, String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    List<String> keys = new ArrayList<>();
    for (String key : getAll(entityType, entityId).keySet()) {
      if (key.startsWith(prefix)) {
        keys.add(key);
      }
    }
    return keys;
  }

  @Override
  public int deleteByPrefix(String entityType, String prefix) {
    Objects.requireNonNull(entityType, "entityType");
    Objects.requireNonNull(prefix, "prefix");
    if (prefix.isEmpty()) {
      throw new IllegalArgumentException("prefix must not be empty");
    }
    if (!store.supports(entityType)) {
      return 0;
    }
    int removed = 0;
    List<String> keys = store.distinctKeysByPrefix(entityType, prefix);
    for (String key : keys) {
      removed += store.deleteRowsByKey(entityType, key);
    }
    if (metrics != null) {
      metrics.recordPrefixDeletion(removed);
    }
    LOG.info(
        "(keymeta) op={} type={} prefix={} keys={} rows={}",
        "bulk.deleteByPrefix",
        entityType,
        prefix,
        keys.size(),
        removed);
    return removed;
  }

  @Override
  public Map<Long, MetaValue> bulkGet(
      String entityType, Collection<Long> entityIds, String key) {
    Map<Long, MetaValue> out = new LinkedHashMap<>();
    for (Long id : entityIds) {
      MetaValue value = attributes.get(entityType, id, key);
      if (value != null) {
        out.put(id, value);
      }
    }
    return out;
  }

  @Override
  public Map<Long, Boolean> bulkUpdate(
      String entityType, Collection<Long> entityIds, String key, MetaValue value) {
    Map<Long, Boolean> out = new LinkedHashMap<>();
    int failed = 0;
    for (Long id : entityIds) {
      boolean ok = attributes.update(entityType, id, key, value);
      if (!ok) {
        failed++;
        LOG.debug(
            "(keymeta) op={} failed type={} id={} key={}", "bulk.update", entityType, id, key);
      }
      out.put(id, ok);
    }
    recordBulk(entityIds.size(), failed);
    return out;
  }

  @Override
  public Map<Long, Boolean> bulkDelete(
      String entityType, Collection<Long> entityIds, String key) {
    Map<Long, Boolean> out = new LinkedHashMap<>();
    for (Long id : entityIds) {
      out.put(id, attributes.delete(entityType, id, key));
    }
    recordBulk(entityIds.size(), 0);
    return out;
  }

  @Override
  public List<Long> findObjectsByValue(
      String entityType, String key, MetaValue value, Comparison comparison) {
    AttributesImpl.requireKey(entityType, key);
    return store.findIds(
        entityType,
        key,
        value != null ? value : MetaValue.ABSENT,
        comparison != null ? comparison : Comparison.EQ);
  }

  @Override
  public ValueComparison compareValues(
      String entityType, Collection<Long> entityIds, String key) {
    if (entityIds.isEmpty()) {
      return ValueComparison.EMPTY;
    }
    Map<MetaValue, Integer> counts = new LinkedHashMap<>();
    Map<Long, MetaValue> values = new LinkedHashMap<>();
    int with = 0;
    int without = 0;
    for (Long id : entityIds) {
      MetaValue value = attributes.get(entityType, id, key);
      if (value == null) {
        without++;
        continue;
      }
      with++;
      values.put(id, value);
      counts.merge(value, 1, Integer::sum);
    }
    return new ValueComparison(counts, with, without, values, List.copyOf(counts.keySet()));
  }

  @Override
  public NumericStats getStats(String entityType, Collection<Long> entityIds, String key) {
    int numeric = 0;
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    double sum = 0;
    for (Long id : entityIds) {
      OptionalDouble n = MetaCasts.numeric(attributes.get(entityType, id, key));
      if (n.isEmpty()) {
        continue;
      }
      double d = n.getAsDouble();
      numeric++;
      min = Math.min(min, d);
      max = Math.max(max, d);
      sum += d;
    }
    if (numeric == 0) {
      return NumericStats.empty(entityIds.size());
    }
    return new NumericStats(entityIds.size(), numeric, min, max, sum / numeric, sum);
  }

  @Override
  public Map<String, Integer> findLarge(String entityType, long entityId) {
    return findLarge(entityType, entityId, largeValueBytes);
  }

  @Override
  public Map<String, Integer> findLarge(String entityType, long entityId, long sizeLimit) {
    Map<String, Integer> out = new LinkedHashMap<>();
    for (Map.Entry<String, List<MetaValue>> e : getAll(entityType, entityId).entrySet()) {
      List<MetaValue> rows = e.getValue();
      int size =
          rows.size() == 1
              ? store.byteSize(rows.get(0))
              : store.byteSize(MetaValue.list(rows));
      if (size > sizeLimit) {
        out.put(e.getKey(), size);
      }
    }
    return out;
  }

  @Override
  public boolean sync(
      String entityType,
      long entityId,
      Map<String, MetaValue> properties,
      Map<String, String> fieldMap,
      SyncDirection direction) {
    Objects.requireNonNull(properties, "properties");
    Objects.requireNonNull(direction, "direction");
    if (entityId <= 0 || fieldMap == null || fieldMap.isEmpty()) {
      return false;
    }
    boolean success = true;
    for (Map.Entry<String, String> field : fieldMap.entrySet()) {
      String property = field.getKey();
      String key = field.getValue();
      if (direction != SyncDirection.FROM_STORE) {
        MetaValue current = properties.get(property);
        if (current != null && !attributes.update(entityType, entityId, key, current)) {
          success = false;
        }
      }
      if (direction != SyncDirection.TO_STORE) {
        MetaValue stored = attributes.get(entityType, entityId, key);
        if (stored != null) {
          properties.put(property, stored);
        }
      }
    }
    return success;
  }

  private void recordBulk(int items, int failed) {
    if (metrics != null && items > 0) {
      metrics.recordBulk(failed);
    }
  }
}
