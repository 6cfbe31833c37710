/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import dev.keymeta.api.Comparison;
import dev.keymeta.api.ErrorCode;
import dev.keymeta.api.MetaValue;
import dev.keymeta.api.storage.AttributeStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heap-backed {@link AttributeStore}.
 *
 * <p>Entities are kept in concurrent maps; mutation of a single entity is serialized on that
 * entity's key map. Only the entity types given at construction are accepted; writes to other
 * types are counted as {@link ErrorCode#UNKNOWN_ENTITY_TYPE} failures.
 */
public final class InMemoryAttributeStore implements AttributeStore {
  private static final Logger LOG = LoggerFactory.getLogger("keymeta");

  private final Map<String, Map<Long, Map<String, List<MetaValue>>>> types =
      new ConcurrentHashMap<>();
  private final Metrics metrics;

  public InMemoryAttributeStore(Collection<String> entityTypes) {
    this(entityTypes, null);
  }

  /**
   * Creates a store accepting {@code entityTypes}.
   *
   * @param entityTypes known entity types
   * @param metrics read/write counters, may be {@code null}
   */
  public InMemoryAttributeStore(Collection<String> entityTypes, Metrics metrics) {
    this.metrics = metrics;
    for (String type : entityTypes) {
      types.put(Objects.requireNonNull(type, "entityType"), new ConcurrentHashMap<>());
    }
  }

  /**
   * Adds a row without replacing existing ones, the way a multi-valued key is stored.
   *
   * @return {@code false} when the entity type is unknown
   */
  public boolean add(String entityType, long entityId, String key, MetaValue value) {
    Objects.requireNonNull(value, "value");
    Map<String, List<MetaValue>> entity = entityForWrite(entityType, entityId, "add");
    if (entity == null) {
      return false;
    }
    synchronized (entity) {
      entity.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }
    writeDone(true);
    return true;
  }

  @Override
  public boolean supports(String entityType) {
    return types.containsKey(entityType);
  }

  @Override
  public List<MetaValue> values(String entityType, long entityId, String key) {
    readDone();
    Map<String, List<MetaValue>> entity = entity(entityType, entityId);
    if (entity == null) {
      return List.of();
    }
    synchronized (entity) {
      List<MetaValue> rows = entity.get(key);
      return rows == null ? List.of() : List.copyOf(rows);
    }
  }

  @Override
  public Map<String, List<MetaValue>> all(String entityType, long entityId) {
    readDone();
    Map<String, List<MetaValue>> entity = entity(entityType, entityId);
    Map<String, List<MetaValue>> out = new LinkedHashMap<>();
    if (entity == null) {
      return out;
    }
    synchronized (entity) {
      for (Map.Entry<String, List<MetaValue>> e : entity.entrySet()) {
        out.put(e.getKey(), List.copyOf(e.getValue()));
      }
    }
    return out;
  }

  @Override
  public boolean set(String entityType, long entityId, String key, MetaValue value) {
    Objects.requireNonNull(value, "value");
    Map<String, List<MetaValue>> entity = entityForWrite(entityType, entityId, "set");
    if (entity == null) {
      return false;
    }
    synchronized (entity) {
      List<MetaValue> rows = new ArrayList<>(1);
      rows.add(value);
      entity.put(key, rows);
    }
    writeDone(true);
    return true;
  }

  @Override
  public boolean delete(String entityType, long entityId, String key) {
    if (!known(entityType, "delete")) {
      return false;
    }
    writeDone(true);
    Map<String, List<MetaValue>> entity = entity(entityType, entityId);
    if (entity == null) {
      return false;
    }
    synchronized (entity) {
      return entity.remove(key) != null;
    }
  }

  @Override
  public List<String> distinctKeysByPrefix(String entityType, String prefix) {
    Map<Long, Map<String, List<MetaValue>>> entities = types.get(entityType);
    if (entities == null) {
      return List.of();
    }
    Set<String> keys = new TreeSet<>();
    for (Map<String, List<MetaValue>> entity : entities.values()) {
      synchronized (entity) {
        for (String key : entity.keySet()) {
          if (key.startsWith(prefix)) {
            keys.add(key);
          }
        }
      }
    }
    return new ArrayList<>(keys);
  }

  @Override
  public int deleteRowsByKey(String entityType, String key) {
    if (!known(entityType, "deleteRowsByKey")) {
      return 0;
    }
    writeDone(true);
    Map<Long, Map<String, List<MetaValue>>> entities = types.get(entityType);
    int removed = 0;
    for (Map<String, List<MetaValue>> entity : entities.values()) {
      synchronized (entity) {
        List<MetaValue> rows = entity.remove(key);
        if (rows != null) {
          removed += rows.size();
        }
      }
    }
    return removed;
  }

  @Override
  public List<Long> findIds(
      String entityType, String key, MetaValue operand, Comparison comparison) {
    Objects.requireNonNull(operand, "operand");
    Objects.requireNonNull(comparison, "comparison");
    Map<Long, Map<String, List<MetaValue>>> entities = types.get(entityType);
    if (entities == null) {
      return List.of();
    }
    Set<Long> ids = new TreeSet<>();
    for (Map.Entry<Long, Map<String, List<MetaValue>>> e : entities.entrySet()) {
      Map<String, List<MetaValue>> entity = e.getValue();
      synchronized (entity) {
        List<MetaValue> rows = entity.get(key);
        if (rows == null) {
          continue;
        }
        for (MetaValue row : rows) {
          if (comparison.matches(row, operand)) {
            ids.add(e.getKey());
            break;
          }
        }
      }
    }
    return new ArrayList<>(ids);
  }

  private Map<String, List<MetaValue>> entity(String entityType, long entityId) {
    Map<Long, Map<String, List<MetaValue>>> entities = types.get(entityType);
    return entities == null ? null : entities.get(entityId);
  }

  private Map<String, List<MetaValue>> entityForWrite(
      String entityType, long entityId, String op) {
    if (!known(entityType, op)) {
      return null;
    }
    return types.get(entityType).computeIfAbsent(entityId, id -> new LinkedHashMap<>());
  }

  private boolean known(String entityType, String op) {
    if (types.containsKey(entityType)) {
      return true;
    }
    LOG.debug(
        "(keymeta) code={} op={} type={}",
        ErrorCode.UNKNOWN_ENTITY_TYPE,
        "memory." + op,
        entityType);
    writeDone(false);
    return false;
  }

  private void readDone() {
    if (metrics != null) {
      metrics.recordRead(true, null);
    }
  }

  private void writeDone(boolean ok) {
    if (metrics != null) {
      metrics.recordWrite(ok, ok ? null : ErrorCode.UNKNOWN_ENTITY_TYPE);
    }
  }
}
