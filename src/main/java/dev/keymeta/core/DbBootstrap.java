/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Best-effort DB bootstrap: create the database if it is missing. */
final class DbBootstrap {
  private static final Logger LOG = LoggerFactory.getLogger("keymeta");
  private static final String PREFIX = "jdbc:mariadb://";

  private DbBootstrap() {}

  /**
   * @return true if the vendor error code signals "Unknown database" (1049 for MariaDB/MySQL).
   */
  static boolean isUnknownDatabase(SQLException e) {
    if (e == null) return false;
    if (e.getErrorCode() == 1049) return true;
    String m = String.valueOf(e.getMessage()).toLowerCase(Locale.ROOT);
    return m.contains("unknown database");
  }

  /**
   * Creates the database named in {@code jdbcUrl} if it does not exist.
   *
   * @param jdbcUrl like jdbc:mariadb://host:port/dbname?opts
   * @param user db user
   * @param pass db password
   */
  static void ensureDatabaseExists(String jdbcUrl, String user, String pass) throws SQLException {
    Parsed p = Parsed.from(jdbcUrl);
    String rootUrl = buildBootstrapUrl(jdbcUrl);
    LOG.warn("(keymeta) database '{}' missing; attempting to create via {}", p.db, p.hostPort);
    try (Connection c = DriverManager.getConnection(rootUrl, user, pass);
        Statement st = c.createStatement()) {
      st.executeUpdate(
          "CREATE DATABASE IF NOT EXISTS `"
              + p.db
              + "` CHARACTER SET utf8mb4 COLLATE utf8mb4_unicode_ci");
    }
    LOG.info("(keymeta) database '{}' created (or already existed)", p.db);
  }

  /** Same URL without the database name; query parameters (TLS settings) are kept. */
  static String buildBootstrapUrl(String jdbcUrl) {
    Parsed p = Parsed.from(jdbcUrl);
    return PREFIX + p.hostPort + "/" + p.query;
  }

  /** Minimal JDBC URL parser for jdbc:mariadb://host[:port]/db[?opt=...] */
  private static final class Parsed {
    final String hostPort;
    final String db;
    final String query;

    private Parsed(String hostPort, String db, String query) {
      this.hostPort = hostPort;
      this.db = db;
      this.query = query;
    }

    static Parsed from(String url) {
      String s = url;
      if (s.startsWith(PREFIX)) s = s.substring(PREFIX.length());
      int slash = s.indexOf('/');
      if (slash < 0) throw new IllegalArgumentException("No / in JDBC url: " + url);
      String hostPort = s.substring(0, slash);
      String rest = s.substring(slash + 1);
      int q = rest.indexOf('?');
      String db = (q >= 0) ? rest.substring(0, q) : rest;
      String query = (q >= 0) ? rest.substring(q) : "";
      if (db.isEmpty()) throw new IllegalArgumentException("No database name in JDBC url: " + url);
      if (!db.matches("[A-Za-z0-9_$]+")) {
        throw new IllegalArgumentException("Unsupported database name in JDBC url: " + db);
      }
      return new Parsed(hostPort, db, query);
    }
  }
}
