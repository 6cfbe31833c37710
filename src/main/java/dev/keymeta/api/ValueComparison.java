/* Keymeta © 2025 — MIT */
package dev.keymeta.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Distribution of one attribute across a cohort.
 *
 * <p>{@code valueCounts} is keyed by the values themselves; because {@link MetaValue} equality is
 * structural, equal containers share one bucket. Maps iterate in first-seen order; all
 * collections are unmodifiable.
 *
 * @param valueCounts occurrences per distinct value
 * @param objectsWithMeta entities holding a value
 * @param objectsWithoutMeta entities without a value
 * @param values value per entity id, for entities holding one
 * @param uniqueValues distinct values in first-seen order
 */
public record ValueComparison(
    Map<MetaValue, Integer> valueCounts,
    int objectsWithMeta,
    int objectsWithoutMeta,
    Map<Long, MetaValue> values,
    List<MetaValue> uniqueValues) {

  public ValueComparison {
    valueCounts = Collections.unmodifiableMap(new LinkedHashMap<>(valueCounts));
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    uniqueValues = List.copyOf(uniqueValues);
  }

  /** Report for an empty cohort. */
  public static final ValueComparison EMPTY =
      new ValueComparison(Map.of(), 0, 0, Map.of(), List.of());
}
