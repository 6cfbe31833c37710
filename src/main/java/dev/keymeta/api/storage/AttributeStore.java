/* Keymeta © 2025 — MIT */
package dev.keymeta.api.storage;

import dev.keymeta.api.Comparison;
import dev.keymeta.api.MetaValue;
import dev.keymeta.util.MetaCodec;
import java.util.List;
import java.util.Map;

/**
 * Backing store for entity attributes.
 *
 * <p>Rows are addressed by {@code (entityType, entityId, key)}. A key may hold several rows; the
 * accessor layer reads the first and {@link #set} collapses them to one. Implementations report
 * failures through return values ({@code false}, empty collections, {@code 0}) and never throw for
 * store-side problems. Unknown entity types behave like empty namespaces that reject writes.
 */
public interface AttributeStore {

  /**
   * Whether the store has a namespace for {@code entityType}.
   *
   * @param entityType entity type name
   * @return {@code true} when reads and writes can reach a backing collection
   */
  boolean supports(String entityType);

  /**
   * Every stored value of a key, in insertion order.
   *
   * @param entityType entity type name
   * @param entityId entity id
   * @param key attribute key
   * @return values, empty when none are stored or the read failed
   */
  List<MetaValue> values(String entityType, long entityId, String key);

  /**
   * Every attribute of an entity.
   *
   * @param entityType entity type name
   * @param entityId entity id
   * @return key to stored values, in first-insertion order
   */
  Map<String, List<MetaValue>> all(String entityType, long entityId);

  /**
   * Replaces all rows of a key with a single value.
   *
   * @param entityType entity type name
   * @param entityId entity id
   * @param key attribute key
   * @param value value to store
   * @return {@code true} when the store accepted the write
   */
  boolean set(String entityType, long entityId, String key, MetaValue value);

  /**
   * Deletes every row of a key.
   *
   * @param entityType entity type name
   * @param entityId entity id
   * @param key attribute key
   * @return {@code true} when at least one row was removed
   */
  boolean delete(String entityType, long entityId, String key);

  /**
   * Distinct keys starting with {@code prefix} across all entities of a type.
   *
   * @param entityType entity type name
   * @param prefix literal key prefix
   * @return matching keys
   */
  List<String> distinctKeysByPrefix(String entityType, String prefix);

  /**
   * Deletes every row of {@code key} across all entities of a type.
   *
   * @param entityType entity type name
   * @param key attribute key
   * @return number of rows removed
   */
  int deleteRowsByKey(String entityType, String key);

  /**
   * Distinct ids of entities holding a row for {@code key} that satisfies {@code comparison}.
   *
   * @param entityType entity type name
   * @param key attribute key
   * @param operand right-hand side of the comparison
   * @param comparison comparator
   * @return matching entity ids, ascending
   */
  List<Long> findIds(String entityType, String key, MetaValue operand, Comparison comparison);

  /**
   * Serialized size of a value as this store would persist it.
   *
   * @param value value to measure
   * @return size in bytes
   */
  default int byteSize(MetaValue value) {
    return MetaCodec.byteSize(value);
  }
}
