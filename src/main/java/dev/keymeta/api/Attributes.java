/* Keymeta © 2025 — MIT */
package dev.keymeta.api;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Single-attribute operations on one {@code (entityType, entityId, key)}.
 *
 * <p>Entity types are opaque namespace names ({@code "post"}, {@code "user"}, ...) that the
 * backing store maps to a collection. A stored empty string counts as absent; absence is reported
 * as {@code null} (or the caller's default), never as an exception. Store failures surface as
 * {@code false} or an empty optional.
 *
 * <p>Each call reads and writes the store directly. Read-modify-write operations (increments,
 * array and nested edits, {@link #updateIfChanged}) are not atomic against other writers.
 */
public interface Attributes {

  /** Default threshold for {@link #isLarge(String, long, String)}: 1 MiB. */
  long DEFAULT_LARGE_BYTES = 1_048_576L;

  /**
   * Returns whether a non-absent value is stored.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @return {@code true} when present
   */
  boolean exists(String entityType, long entityId, String key);

  /**
   * Returns the stored value.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @return value, or {@code null} when absent
   */
  MetaValue get(String entityType, long entityId, String key);

  /**
   * Returns every stored row of a key.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @return values, or {@code null} when no row exists
   */
  List<MetaValue> getValues(String entityType, long entityId, String key);

  /**
   * Returns the stored value or {@code defaultValue} when absent.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @param defaultValue fallback, may be {@code null}
   * @return value or fallback
   */
  MetaValue getOrDefault(String entityType, long entityId, String key, MetaValue defaultValue);

  /**
   * Reads a value, substitutes {@code defaultValue} when absent, then coerces it to {@code kind}.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @param kind cast target
   * @param defaultValue fallback applied before the cast, may be {@code null}
   * @return coerced value, never {@code null}
   */
  MetaValue getCast(
      String entityType, long entityId, String key, CastKind kind, MetaValue defaultValue);

  /** Integer reading of {@link #getCast}. */
  long getInt(String entityType, long entityId, String key, long defaultValue);

  /** Float reading of {@link #getCast}. */
  double getFloat(String entityType, long entityId, String key, double defaultValue);

  /** Boolean reading of {@link #getCast}. */
  boolean getBool(String entityType, long entityId, String key, boolean defaultValue);

  /** String reading of {@link #getCast}. */
  String getString(String entityType, long entityId, String key, String defaultValue);

  /**
   * Unconditional upsert.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @param value new value
   * @return {@code true} when the store accepted the write
   */
  boolean update(String entityType, long entityId, String key, MetaValue value);

  /**
   * Writes only when {@code value} differs from the stored value. {@code "1"} and {@code 1}
   * differ; equal containers do not.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @param value new value
   * @return {@code true} only when a write happened and succeeded
   */
  boolean updateIfChanged(String entityType, long entityId, String key, MetaValue value);

  /**
   * Deletes a key. Ids below 1 are ignored.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @return {@code true} when rows were removed
   */
  boolean delete(String entityType, long entityId, String key);

  /**
   * Adds {@code amount} to the integer reading of the stored value (absent reads as 0).
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @param amount signed delta
   * @return new value, or empty when the write failed
   */
  OptionalLong increment(String entityType, long entityId, String key, long amount);

  default OptionalLong increment(String entityType, long entityId, String key) {
    return increment(entityType, entityId, key, 1L);
  }

  /**
   * Subtracts {@code |amount|} from the integer reading of the stored value.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @param amount delta; its sign is ignored
   * @return new value, or empty when the write failed
   */
  OptionalLong decrement(String entityType, long entityId, String key, long amount);

  default OptionalLong decrement(String entityType, long entityId, String key) {
    return decrement(entityType, entityId, key, 1L);
  }

  /**
   * Membership test on a stored list using strict structural equality.
   *
   * @return {@code false} when the value is absent or not a list
   */
  boolean arrayContains(String entityType, long entityId, String key, MetaValue element);

  /**
   * Appends to a stored list; an absent or non-list value is replaced by a new list.
   *
   * @return {@code true} when the store accepted the write
   */
  boolean arrayAppend(String entityType, long entityId, String key, MetaValue element);

  /**
   * Removes the first element equal to {@code element}.
   *
   * @return {@code false} when not a list, not found, or the write failed
   */
  boolean arrayRemove(String entityType, long entityId, String key, MetaValue element);

  /**
   * Removes every element equal to {@code element}.
   *
   * @return {@code false} when not a list, nothing matched, or the write failed
   */
  boolean arrayRemoveAll(String entityType, long entityId, String key, MetaValue element);

  /**
   * Removes duplicates, keeping the first occurrence of each element.
   *
   * @return {@code false} when not a list, no duplicates existed, or the write failed
   */
  boolean arrayUnique(String entityType, long entityId, String key);

  /**
   * Number of elements in a stored list.
   *
   * @return size, or 0 when absent or not a list
   */
  int arrayCount(String entityType, long entityId, String key);

  /**
   * Reads a nested entry of a map value.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @param path dot path such as {@code "settings.theme"}
   * @param defaultValue returned when the path does not resolve
   * @return nested value or default
   */
  MetaValue getNested(
      String entityType, long entityId, String key, String path, MetaValue defaultValue);

  /**
   * Writes a nested entry, creating intermediate maps. Non-map intermediates are overwritten.
   *
   * @return {@code true} when the store accepted the rewritten value
   */
  boolean setNested(String entityType, long entityId, String key, String path, MetaValue value);

  /**
   * Removes a nested entry.
   *
   * @return {@code false} when the path does not resolve or the write failed
   */
  boolean removeNested(String entityType, long entityId, String key, String path);

  /**
   * Reads a container value. A stored string is parsed as JSON.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param key attribute key
   * @param defaultValue returned when absent, malformed, or not a container
   * @return container or default
   */
  MetaValue getJson(String entityType, long entityId, String key, MetaValue defaultValue);

  /**
   * Stores a container value.
   *
   * @throws IllegalArgumentException when {@code value} is not a list or map
   */
  boolean setJson(String entityType, long entityId, String key, MetaValue value);

  /**
   * Boolean reading of the stored value.
   *
   * @param defaultValue returned when absent
   * @return truthiness
   */
  boolean isTruthy(String entityType, long entityId, String key, boolean defaultValue);

  /**
   * Stores the negation of the boolean reading (absent reads as {@code false}).
   *
   * @return new value, or empty when the write failed
   */
  Optional<Boolean> toggle(String entityType, long entityId, String key);

  /**
   * Type name of the stored value.
   *
   * @return {@link MetaValue#typeName()}, or {@code null} when absent
   */
  String getType(String entityType, long entityId, String key);

  /**
   * Serialized size of the stored value.
   *
   * @return bytes, or 0 when absent
   */
  int getSize(String entityType, long entityId, String key);

  /**
   * Compares the stored type against {@code typeName}. Both the loose names of
   * {@link MetaValue#typeName()} and {@link MetaValue.Kind} names are accepted.
   */
  boolean isType(String entityType, long entityId, String key, String typeName);

  /** Whether the serialized size exceeds {@code sizeLimit} bytes. */
  boolean isLarge(String entityType, long entityId, String key, long sizeLimit);

  /** {@link #isLarge(String, long, String, long)} with the configured large-value threshold. */
  default boolean isLarge(String entityType, long entityId, String key) {
    return isLarge(entityType, entityId, key, DEFAULT_LARGE_BYTES);
  }

  /**
   * Copies {@code oldKey} to {@code newKey} and optionally deletes {@code oldKey}.
   *
   * <p>An absent source is copied as the empty string, which reads back as absent. Check {@link
   * #exists} first when a missing source must leave the destination untouched.
   *
   * @param entityType entity type
   * @param entityId entity id
   * @param oldKey source key
   * @param newKey destination key
   * @param deleteOld whether to delete the source after a successful copy
   * @return {@code true} when the copy (and the delete, if requested) succeeded
   */
  boolean migrateKey(
      String entityType, long entityId, String oldKey, String newKey, boolean deleteOld);

  default boolean migrateKey(String entityType, long entityId, String oldKey, String newKey) {
    return migrateKey(entityType, entityId, oldKey, newKey, true);
  }
}
