/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Idempotent schema migrations: one attribute table per entity type plus version bookkeeping. */
public final class Migrations {
  private static final Logger LOG = LoggerFactory.getLogger("keymeta");
  private static final int CURRENT_VERSION = 1;

  private Migrations() {}

  /**
   * DDL for one attribute table. {@code meta_key} and {@code meta_value} use a binary collation so
   * key lookups, prefix scans and text comparisons are case- and accent-sensitive.
   */
  static String attributeTableDdl(String table) {
    return """
        CREATE TABLE IF NOT EXISTS %s (
          meta_id     BIGINT UNSIGNED NOT NULL AUTO_INCREMENT,
          entity_id   BIGINT          NOT NULL,
          meta_key    VARCHAR(255)    CHARACTER SET utf8mb4 COLLATE utf8mb4_bin NOT NULL,
          meta_value  LONGTEXT        CHARACTER SET utf8mb4 COLLATE utf8mb4_bin NOT NULL,
          value_json  LONGTEXT        NULL,
          PRIMARY KEY (meta_id),
          KEY idx_%s_entity_key (entity_id, meta_key),
          KEY idx_%s_key (meta_key)
        ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
        """
        .formatted(table, table, table);
  }

  /**
   * Applies idempotent DDL. Each statement is executed independently; failures are logged and the
   * migrator proceeds with remaining statements.
   *
   * @param ds database to migrate
   * @param entityTables entity type to table name, already validated
   * @return {@code true} when every statement succeeded and the version was recorded
   */
  public static boolean apply(DataSource ds, Map<String, String> entityTables) {
    List<String> ddl = new ArrayList<>();
    ddl.add(
        """
        CREATE TABLE IF NOT EXISTS keymeta_schema_version (
          version       INT              NOT NULL,
          applied_at_s  BIGINT UNSIGNED  NOT NULL,
          PRIMARY KEY (version)
        ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4 ROW_FORMAT=DYNAMIC
        """);
    for (String table : JdbcAttributeStore.validateTables(entityTables).values()) {
      ddl.add(attributeTableDdl(table));
    }

    boolean allSucceeded = true;
    try (Connection c = ds.getConnection();
        Statement st = c.createStatement()) {
      for (String sql : ddl) {
        try {
          st.execute(sql);
        } catch (SQLException e) {
          allSucceeded = false;
          LOG.warn(
              "(keymeta) migration statement failed; continuing. cause={} sql=\n{}",
              e.getMessage(),
              sql);
        }
      }
    } catch (SQLException e) {
      throw new IllegalStateException("Migration failed", e);
    }

    if (!allSucceeded) {
      LOG.warn("(keymeta) migrations completed with errors; schema version unchanged");
      return false;
    }
    recordSchemaVersion(ds);
    return true;
  }

  /** Current schema version number. */
  public static int currentVersion() {
    return CURRENT_VERSION;
  }

  private static void recordSchemaVersion(DataSource ds) {
    try (Connection c = ds.getConnection();
        PreparedStatement ps =
            c.prepareStatement(
                "INSERT INTO keymeta_schema_version(version, applied_at_s) VALUES(?, ?) "
                    + "ON DUPLICATE KEY UPDATE applied_at_s=VALUES(applied_at_s)")) {
      ps.setInt(1, CURRENT_VERSION);
      ps.setLong(2, Instant.now().getEpochSecond());
      ps.executeUpdate();
      LOG.info("(keymeta) schema version recorded: {}", CURRENT_VERSION);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to record schema version", e);
    }
  }
}
