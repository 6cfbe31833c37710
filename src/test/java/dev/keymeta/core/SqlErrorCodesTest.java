/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import dev.keymeta.api.ErrorCode;
import java.sql.SQLException;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link SqlErrorCodes}. */
final class SqlErrorCodesTest {

  @Test
  void duplicateSqlStateMapsToDuplicateKey() {
    SQLException sql = new SQLException("Duplicate entry 'x' for key 'PRIMARY'", "23000", 1062);
    assertEquals(ErrorCode.DUPLICATE_KEY, SqlErrorCodes.classify(sql));
  }

  @Test
  void deadlockVendorCodeMapsWithoutSqlState() {
    SQLException sql = new SQLException("Deadlock found when trying to get lock", null, 1213);
    assertEquals(ErrorCode.DEADLOCK_RETRY_EXHAUSTED, SqlErrorCodes.classify(sql));
  }

  @Test
  void missingTableMapsToUnknownEntityType() {
    SQLException sql = new SQLException("Table 'keymeta.widgetmeta' doesn't exist", "42S02", 1146);
    assertEquals(ErrorCode.UNKNOWN_ENTITY_TYPE, SqlErrorCodes.classify(sql));
  }

  @Test
  void oversizedPayloadMapsToValueTooLarge() {
    assertEquals(
        ErrorCode.VALUE_TOO_LARGE,
        SqlErrorCodes.classify(new SQLException("Got a packet bigger than 'max_allowed_packet'")));
    assertEquals(
        ErrorCode.VALUE_TOO_LARGE,
        SqlErrorCodes.classify(new SQLException("Data too long", "HY000", 1406)));
  }

  @Test
  void messageFallbackMapsWhenStateAndVendorMissing() {
    SQLException sql = new SQLException("Unique constraint violated on postmeta.meta_id");
    assertEquals(ErrorCode.DUPLICATE_KEY, SqlErrorCodes.classify(sql));
  }

  @Test
  void unknownFailuresDefaultToConnectionLost() {
    assertEquals(
        ErrorCode.CONNECTION_LOST,
        SqlErrorCodes.classify(new SQLException("Connection refused", "08S01", 0)));
    assertEquals(ErrorCode.CONNECTION_LOST, SqlErrorCodes.classify(null));
  }
}
