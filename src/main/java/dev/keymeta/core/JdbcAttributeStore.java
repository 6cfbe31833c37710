/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import dev.keymeta.api.Comparison;
import dev.keymeta.api.ErrorCode;
import dev.keymeta.api.MetaValue;
import dev.keymeta.api.storage.AttributeStore;
import dev.keymeta.util.MetaCasts;
import dev.keymeta.util.MetaCodec;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MariaDB-backed {@link AttributeStore}.
 *
 * <p>Each entity type maps to its own table (see {@link Migrations}). A row keeps the value twice:
 * {@code meta_value} holds the text form that comparisons run against, {@code value_json} the
 * typed JSON that reads decode. Rows without {@code value_json} read back as strings.
 */
public final class JdbcAttributeStore implements AttributeStore {
  private static final Logger LOG = LoggerFactory.getLogger("keymeta");
  private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z0-9_]+");

  /** Matches the same strings as {@link MetaCasts#isNumeric} for string values. */
  static final String NUMERIC_REGEX =
      "^[[:space:]]*[+-]?([0-9]+([.][0-9]*)?|[.][0-9]+)([eE][+-]?[0-9]+)?[[:space:]]*$";

  private final DataSource ds;
  private final Map<String, String> tables;
  private final DbHealth dbHealth;
  private final Metrics metrics;
  private final int maxValueBytes;

  /**
   * Creates a new instance.
   *
   * @param ds shared datasource
   * @param entityTables entity type to table name
   * @param dbHealth health monitor for degraded mode handling
   * @param metrics metrics registry, may be {@code null}
   * @param maxValueBytes largest serialized value accepted by {@link #set}
   */
  JdbcAttributeStore(
      DataSource ds,
      Map<String, String> entityTables,
      DbHealth dbHealth,
      Metrics metrics,
      int maxValueBytes) {
    this.ds = Objects.requireNonNull(ds, "ds");
    this.tables = validateTables(entityTables);
    this.dbHealth = Objects.requireNonNull(dbHealth, "dbHealth");
    this.metrics = metrics;
    this.maxValueBytes = maxValueBytes;
  }

  static Map<String, String> validateTables(Map<String, String> entityTables) {
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : entityTables.entrySet()) {
      String table = e.getValue();
      if (table == null || !TABLE_NAME.matcher(table).matches()) {
        throw new IllegalStateException(
            "entityTypes." + e.getKey() + " must be a plain table name, got " + table);
      }
      out.put(e.getKey(), table);
    }
    return Map.copyOf(out);
  }

  @Override
  public boolean supports(String entityType) {
    return tables.containsKey(entityType);
  }

  @Override
  public List<MetaValue> values(String entityType, long entityId, String key) {
    String table = tables.get(entityType);
    if (table == null) {
      return List.of();
    }
    String sql =
        "SELECT value_json, meta_value FROM "
            + table
            + " WHERE entity_id=? AND meta_key=? ORDER BY meta_id";
    List<MetaValue> out = new ArrayList<>();
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setLong(1, entityId);
      ps.setString(2, key);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          decodeRow(rs.getString(1), rs.getString(2), key).ifPresent(out::add);
        }
      }
      readSucceeded();
    } catch (SQLException e) {
      failed("store.values", e, false);
      return List.of();
    }
    return out;
  }

  @Override
  public Map<String, List<MetaValue>> all(String entityType, long entityId) {
    Map<String, List<MetaValue>> out = new LinkedHashMap<>();
    String table = tables.get(entityType);
    if (table == null) {
      return out;
    }
    String sql =
        "SELECT meta_key, value_json, meta_value FROM "
            + table
            + " WHERE entity_id=? ORDER BY meta_id";
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setLong(1, entityId);
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          String key = rs.getString(1);
          Optional<MetaValue> value = decodeRow(rs.getString(2), rs.getString(3), key);
          if (value.isPresent()) {
            out.computeIfAbsent(key, k -> new ArrayList<>()).add(value.get());
          }
        }
      }
      readSucceeded();
    } catch (SQLException e) {
      failed("store.all", e, false);
      return new LinkedHashMap<>();
    }
    return out;
  }

  @Override
  public boolean set(String entityType, long entityId, String key, MetaValue value) {
    Objects.requireNonNull(value, "value");
    String table = writableTable(entityType, "store.set");
    if (table == null) {
      return false;
    }
    String json = MetaCodec.encode(value);
    int size = MetaCodec.byteSize(value);
    if (size > maxValueBytes) {
      recordWrite(false, ErrorCode.VALUE_TOO_LARGE);
      LOG.warn(
          "(keymeta) code={} op={} message={} key={} bytes={}",
          ErrorCode.VALUE_TOO_LARGE,
          "store.set",
          "value exceeds limits.maxValueBytes",
          key,
          size);
      return false;
    }
    try (Connection c = ds.getConnection()) {
      c.setAutoCommit(false);
      try (PreparedStatement del =
              c.prepareStatement("DELETE FROM " + table + " WHERE entity_id=? AND meta_key=?");
          PreparedStatement ins =
              c.prepareStatement(
                  "INSERT INTO "
                      + table
                      + "(entity_id, meta_key, meta_value, value_json) VALUES(?,?,?,?)")) {
        del.setLong(1, entityId);
        del.setString(2, key);
        del.executeUpdate();
        ins.setLong(1, entityId);
        ins.setString(2, key);
        ins.setString(3, MetaCasts.toText(value));
        ins.setString(4, json);
        ins.executeUpdate();
        c.commit();
      } catch (SQLException e) {
        c.rollback();
        throw e;
      }
      writeSucceeded();
      return true;
    } catch (SQLException e) {
      failed("store.set", e, true);
      return false;
    }
  }

  @Override
  public boolean delete(String entityType, long entityId, String key) {
    String table = writableTable(entityType, "store.delete");
    if (table == null) {
      return false;
    }
    try (Connection c = ds.getConnection();
        PreparedStatement ps =
            c.prepareStatement("DELETE FROM " + table + " WHERE entity_id=? AND meta_key=?")) {
      ps.setLong(1, entityId);
      ps.setString(2, key);
      int removed = ps.executeUpdate();
      writeSucceeded();
      return removed > 0;
    } catch (SQLException e) {
      failed("store.delete", e, true);
      return false;
    }
  }

  @Override
  public List<String> distinctKeysByPrefix(String entityType, String prefix) {
    String table = tables.get(entityType);
    if (table == null) {
      return List.of();
    }
    String sql =
        "SELECT DISTINCT meta_key FROM "
            + table
            + " WHERE meta_key LIKE ? ESCAPE '!' ORDER BY meta_key";
    List<String> keys = new ArrayList<>();
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, escapeLike(prefix) + "%");
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          keys.add(rs.getString(1));
        }
      }
      readSucceeded();
    } catch (SQLException e) {
      failed("store.distinctKeysByPrefix", e, false);
      return List.of();
    }
    return keys;
  }

  @Override
  public int deleteRowsByKey(String entityType, String key) {
    String table = writableTable(entityType, "store.deleteRowsByKey");
    if (table == null) {
      return 0;
    }
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE meta_key=?")) {
      ps.setString(1, key);
      int removed = ps.executeUpdate();
      writeSucceeded();
      return removed;
    } catch (SQLException e) {
      failed("store.deleteRowsByKey", e, true);
      return 0;
    }
  }

  @Override
  public List<Long> findIds(
      String entityType, String key, MetaValue operand, Comparison comparison) {
    Objects.requireNonNull(operand, "operand");
    Objects.requireNonNull(comparison, "comparison");
    String table = tables.get(entityType);
    if (table == null) {
      return List.of();
    }
    OptionalDouble number =
        comparison.isOrdering() ? MetaCasts.numeric(operand) : OptionalDouble.empty();
    String sql =
        "SELECT DISTINCT entity_id FROM "
            + table
            + " WHERE meta_key=? AND "
            + predicate(comparison, number.isPresent())
            + " ORDER BY entity_id";
    List<Long> ids = new ArrayList<>();
    try (Connection c = ds.getConnection();
        PreparedStatement ps = c.prepareStatement(sql)) {
      ps.setString(1, key);
      String text = MetaCasts.toText(operand);
      if (comparison == Comparison.LIKE) {
        ps.setString(2, "%" + escapeLike(text) + "%");
      } else if (number.isPresent()) {
        ps.setString(2, NUMERIC_REGEX);
        ps.setDouble(3, number.getAsDouble());
      } else {
        ps.setString(2, text);
      }
      try (ResultSet rs = ps.executeQuery()) {
        while (rs.next()) {
          ids.add(rs.getLong(1));
        }
      }
      readSucceeded();
    } catch (SQLException e) {
      failed("store.findIds", e, false);
      return List.of();
    }
    return ids;
  }

  /** SQL predicate over {@code meta_value}; the operand is always bound, never inlined. */
  static String predicate(Comparison comparison, boolean numeric) {
    if (comparison == Comparison.LIKE) {
      return "meta_value LIKE ? ESCAPE '!'";
    }
    String op = comparison == Comparison.NE ? "<>" : comparison.symbol();
    if (numeric) {
      return "meta_value REGEXP ? AND (meta_value + 0e0) " + op + " ?";
    }
    return "meta_value " + op + " ?";
  }

  /** Escapes {@code %}, {@code _} and the escape character itself for {@code ESCAPE '!'}. */
  static String escapeLike(String raw) {
    StringBuilder sb = new StringBuilder(raw.length() + 8);
    for (int i = 0; i < raw.length(); i++) {
      char ch = raw.charAt(i);
      if (ch == '!' || ch == '%' || ch == '_') {
        sb.append('!');
      }
      sb.append(ch);
    }
    return sb.toString();
  }

  private Optional<MetaValue> decodeRow(String json, String text, String key) {
    if (json == null) {
      return Optional.of(MetaValue.of(text == null ? "" : text));
    }
    Optional<MetaValue> value = MetaCodec.tryDecode(json);
    if (value.isEmpty()) {
      LOG.warn(
          "(keymeta) code={} op={} message={} key={}",
          ErrorCode.INVALID_VALUE,
          "store.decode",
          "stored value_json is not valid JSON; row skipped",
          key);
    }
    return value;
  }

  private String writableTable(String entityType, String op) {
    String table = tables.get(entityType);
    if (table == null) {
      recordWrite(false, ErrorCode.UNKNOWN_ENTITY_TYPE);
      LOG.debug(
          "(keymeta) code={} op={} type={}", ErrorCode.UNKNOWN_ENTITY_TYPE, op, entityType);
      return null;
    }
    if (!dbHealth.allowWrite(op)) {
      recordWrite(false, ErrorCode.DEGRADED_MODE);
      return null;
    }
    return table;
  }

  private void readSucceeded() {
    dbHealth.markSuccess();
    if (metrics != null) {
      metrics.recordRead(true, null);
    }
  }

  private void writeSucceeded() {
    dbHealth.markSuccess();
    recordWrite(true, null);
  }

  private void recordWrite(boolean ok, ErrorCode code) {
    if (metrics != null) {
      metrics.recordWrite(ok, code);
    }
  }

  private void failed(String op, SQLException e, boolean write) {
    ErrorCode code = SqlErrorCodes.classify(e);
    dbHealth.markFailure(op, code, e);
    if (metrics != null) {
      if (write) {
        metrics.recordWrite(false, code);
      } else {
        metrics.recordRead(false, code);
      }
    }
    LOG.warn(
        "(keymeta) code={} op={} message={} sqlState={} vendor={}",
        code,
        op,
        e.getMessage(),
        e.getSQLState(),
        e.getErrorCode(),
        e);
  }
}
