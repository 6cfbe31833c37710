/* Keymeta © 2025 — MIT */
package dev.keymeta.api;

/** Direction of a property-map/attribute synchronization. */
public enum SyncDirection {
  /** Write properties into attributes. */
  TO_STORE,
  /** Copy stored attributes into properties. */
  FROM_STORE,
  /** Write first, then read back. */
  BOTH
}
