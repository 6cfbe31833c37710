/* Keymeta © 2025 — MIT */
package dev.keymeta.api;

import java.util.Locale;

/** Target type for read-time coercion. See {@code MetaCasts} for the rules applied per kind. */
public enum CastKind {
  INT,
  FLOAT,
  BOOL,
  LIST,
  STRING;

  /**
   * Parses a cast kind name, accepting the common aliases ({@code integer}, {@code double},
   * {@code boolean}, {@code array}, {@code sequence}).
   *
   * @param raw cast kind name, case-insensitive
   * @return parsed kind
   * @throws IllegalArgumentException when the name is not a known kind
   */
  public static CastKind from(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("cast kind must not be null");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "int", "integer", "long" -> INT;
      case "float", "double" -> FLOAT;
      case "bool", "boolean" -> BOOL;
      case "array", "list", "sequence" -> LIST;
      case "string" -> STRING;
      default -> throw new IllegalArgumentException("unknown cast kind: " + raw);
    };
  }
}
