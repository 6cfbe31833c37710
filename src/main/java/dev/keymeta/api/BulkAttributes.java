/* Keymeta © 2025 — MIT */
package dev.keymeta.api;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Multi-key and multi-entity operations composed from {@link Attributes} calls.
 *
 * <p>Empty key or id collections short-circuit to empty results. A failure on one key or entity
 * does not stop the remaining ones; results report each item separately. Result maps iterate in
 * input order.
 */
public interface BulkAttributes {

  /** Present values for {@code keys}; absent keys are omitted. */
  Map<String, MetaValue> getMany(String entityType, long entityId, Collection<String> keys);

  /** All stored rows for {@code keys}; keys without rows are omitted. */
  Map<String, List<MetaValue>> getManyValues(
      String entityType, long entityId, Collection<String> keys);

  /** Every attribute of an entity as stored, rows per key. */
  Map<String, List<MetaValue>> getAll(String entityType, long entityId);

  /**
   * Writes each entry of {@code values}.
   *
   * @param skipUnchanged skip keys whose stored value already equals the new one, as {@link
   *     Attributes#updateIfChanged} does
   * @return keys that were written
   */
  List<String> updateMany(
      String entityType, long entityId, Map<String, MetaValue> values, boolean skipUnchanged);

  default List<String> updateMany(
      String entityType, long entityId, Map<String, MetaValue> values) {
    return updateMany(entityType, entityId, values, true);
  }

  /** Deletes {@code keys}, returning how many deletions succeeded. */
  int deleteMany(String entityType, long entityId, Collection<String> keys);

  /** Snapshot of the present values of {@code keys}. */
  Map<String, MetaValue> backup(String entityType, long entityId, Collection<String> keys);

  /** Unconditionally writes a snapshot back, returning the keys written. */
  List<String> restore(String entityType, long entityId, Map<String, MetaValue> backup);

  /** Attributes of an entity whose key starts with {@code prefix}, first row per key. */
  Map<String, MetaValue> getByPrefix(String entityType, long entityId, String prefix);

  /** Keys of an entity starting with {@code prefix}. */
  List<String> keysByPrefix(String entityType, long entityId, String prefix);

  /**
   * Deletes every row of every key starting with {@code prefix}, across <em>all</em> entities of
   * {@code entityType}. Irreversible.
   *
   * @return rows removed
   */
  int deleteByPrefix(String entityType, String prefix);

  /** Value of {@code key} per entity; entities without a value are omitted. */
  Map<Long, MetaValue> bulkGet(String entityType, Collection<Long> entityIds, String key);

  /** Writes {@code value} to every entity, reporting success per id. */
  Map<Long, Boolean> bulkUpdate(
      String entityType, Collection<Long> entityIds, String key, MetaValue value);

  /** Deletes {@code key} from every entity, reporting success per id. */
  Map<Long, Boolean> bulkDelete(String entityType, Collection<Long> entityIds, String key);

  /**
   * Distinct ids of entities whose {@code key} satisfies the comparison.
   *
   * @param value operand
   * @param comparison comparator
   * @return matching ids
   */
  List<Long> findObjectsByValue(
      String entityType, String key, MetaValue value, Comparison comparison);

  /** Distribution of {@code key} across a cohort. */
  ValueComparison compareValues(String entityType, Collection<Long> entityIds, String key);

  /** Numeric aggregates of {@code key} across a cohort. */
  NumericStats getStats(String entityType, Collection<Long> entityIds, String key);

  /**
   * Attributes of an entity whose serialized size exceeds {@code sizeLimit}.
   *
   * @return key to size in bytes
   */
  Map<String, Integer> findLarge(String entityType, long entityId, long sizeLimit);

  /** {@link #findLarge(String, long, long)} with the configured large-value threshold. */
  default Map<String, Integer> findLarge(String entityType, long entityId) {
    return findLarge(entityType, entityId, Attributes.DEFAULT_LARGE_BYTES);
  }

  /**
   * Synchronizes a caller-owned property map with attributes.
   *
   * @param properties mutable property map, updated in place when reading from the store
   * @param fieldMap property name to attribute key
   * @param direction what to copy
   * @return {@code false} for an invalid id, an empty field map, or when any write failed
   */
  boolean sync(
      String entityType,
      long entityId,
      Map<String, MetaValue> properties,
      Map<String, String> fieldMap,
      SyncDirection direction);
}
