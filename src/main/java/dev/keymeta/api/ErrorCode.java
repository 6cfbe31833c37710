/* Keymeta © 2025 — MIT */
package dev.keymeta.api;

/**
 * Canonical failure codes produced by Keymeta stores.
 *
 * <p>Operations report failures as {@code false} or empty results; these codes end up in the
 * structured warning logs and the metrics MBean so operators can tell failures apart.
 */
public enum ErrorCode {
  /** Database connection pool lost connectivity to the server. */
  CONNECTION_LOST,

  /** Statement hit a deadlock or lock wait timeout. */
  DEADLOCK_RETRY_EXHAUSTED,

  /** Unique constraint violated. */
  DUPLICATE_KEY,

  /** Store entered degraded mode and refuses mutations until recovery. */
  DEGRADED_MODE,

  /** Entity type has no configured backing table. */
  UNKNOWN_ENTITY_TYPE,

  /** Stored payload could not be decoded. */
  INVALID_VALUE,

  /** Serialized value exceeds the configured maximum size. */
  VALUE_TOO_LARGE;
}
