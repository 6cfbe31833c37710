/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import dev.keymeta.api.ErrorCode;
import java.sql.SQLException;
import java.util.Locale;

/** Maps JDBC {@link SQLException}s to Keymeta {@link ErrorCode}s. */
public final class SqlErrorCodes {

  private SqlErrorCodes() {}

  /**
   * Classifies a SQL exception.
   *
   * @param e SQL exception thrown by MariaDB/MySQL
   * @return mapped code, defaulting to {@link ErrorCode#CONNECTION_LOST}
   */
  public static ErrorCode classify(SQLException e) {
    if (e == null) {
      return ErrorCode.CONNECTION_LOST;
    }
    String state = e.getSQLState();
    if (state != null && state.length() >= 2) {
      switch (state.substring(0, 2)) {
        case "40":
        case "41":
          return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
        case "23":
          return ErrorCode.DUPLICATE_KEY;
        case "42":
          if (e.getErrorCode() == 1146) {
            return ErrorCode.UNKNOWN_ENTITY_TYPE;
          }
          break;
        case "22":
          return ErrorCode.INVALID_VALUE;
        default:
          break;
      }
    }

    int vendor = e.getErrorCode();
    if (vendor == 1213 || vendor == 1205) {
      return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
    }
    if (vendor == 1062 || vendor == 1586) {
      return ErrorCode.DUPLICATE_KEY;
    }
    if (vendor == 1146) {
      return ErrorCode.UNKNOWN_ENTITY_TYPE;
    }
    if (vendor == 1153 || vendor == 1406) {
      return ErrorCode.VALUE_TOO_LARGE;
    }

    String message = e.getMessage();
    if (message != null) {
      String lower = message.toLowerCase(Locale.ROOT);
      if (lower.contains("deadlock") || lower.contains("lock wait timeout")) {
        return ErrorCode.DEADLOCK_RETRY_EXHAUSTED;
      }
      if (lower.contains("duplicate") || lower.contains("unique constraint")) {
        return ErrorCode.DUPLICATE_KEY;
      }
      if (lower.contains("max_allowed_packet") || lower.contains("data too long")) {
        return ErrorCode.VALUE_TOO_LARGE;
      }
    }
    return ErrorCode.CONNECTION_LOST;
  }
}
