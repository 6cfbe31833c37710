/* Keymeta © 2025 — MIT */
package dev.keymeta.api;

/**
 * Aggregates over the numeric subset of a cohort.
 *
 * @param count size of the whole cohort
 * @param numericValues number of entities whose value was numeric
 * @param min smallest numeric value, {@code null} when there were none
 * @param max largest numeric value, {@code null} when there were none
 * @param average arithmetic mean, {@code null} when there were none
 * @param sum total, {@code null} when there were none
 */
public record NumericStats(
    int count, int numericValues, Double min, Double max, Double average, Double sum) {

  /**
   * Stats for a cohort with no numeric values.
   *
   * @param count cohort size
   * @return stats with null aggregates
   */
  public static NumericStats empty(int count) {
    return new NumericStats(count, 0, null, null, null, null);
  }

  /**
   * Whether any numeric value contributed.
   *
   * @return {@code true} when aggregates are present
   */
  public boolean hasValues() {
    return numericValues > 0;
  }
}
