/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Runtime configuration loaded from {@code keymeta.json5}.
 *
 * <ul>
 *   <li>Writes a commented template on first run.
 *   <li>Emits a {@code keymeta.json5.example} snapshot next to it.
 *   <li>Supports environment overrides for the DB connection ({@code KEYMETA_DB_*}).
 *   <li>Parses the store, entity type, limits and core (db, runtime, log) blocks.
 * </ul>
 */
public final class Config {

  static final String TEMPLATE =
      """
      // Keymeta v1.0.0 configuration (JSON5 with comments)
      // Environment overrides: KEYMETA_DB_HOST|PORT|DATABASE|USER|PASSWORD.
      {
        store: {
          // "memory" keeps attributes on the heap; "jdbc" uses MariaDB/MySQL (core.db)
          kind: "memory"
        },
        // entity type -> attribute table
        entityTypes: {
          post: "postmeta",
          user: "usermeta",
          term: "termmeta",
          comment: "commentmeta"
        },
        limits: {
          largeValueBytes: 1048576,
          maxValueBytes: 4194304
        },
        core: {
          db: {
            host: "127.0.0.1",
            port: 3306,
            database: "keymeta",
            user: "keymeta",
            password: "change-me",
            tls: { enabled: false },
            pool: {
              maxPoolSize: 10,
              minimumIdle: 2,
              connectionTimeoutMs: 10000,
              idleTimeoutMs: 600000,
              maxLifetimeMs: 1700000,
              startupAttempts: 3
            }
          },
          runtime: { reconnectEveryS: 10 },
          log: {
            json: false,
            slowQueryMs: 250,
            level: "INFO"
          }
        }
      }
      """;

  private static final Map<String, String> DEFAULT_ENTITY_TYPES =
      Map.of("post", "postmeta", "user", "usermeta", "term", "termmeta", "comment", "commentmeta");

  private final StoreKind storeKind;
  private final Map<String, String> entityTypes;
  private final Limits limits;
  private final Db db;
  private final Runtime runtime;
  private final Log log;

  Config(
      StoreKind storeKind,
      Map<String, String> entityTypes,
      Limits limits,
      Db db,
      Runtime runtime,
      Log log) {
    this.storeKind = storeKind;
    this.entityTypes = Map.copyOf(entityTypes);
    this.limits = limits;
    this.db = db;
    this.runtime = runtime;
    this.log = log;
  }

  /** Which backing store to build. */
  public StoreKind storeKind() {
    return storeKind;
  }

  /**
   * Entity types and the table backing each.
   *
   * @return entity type to table name
   */
  public Map<String, String> entityTypes() {
    return entityTypes;
  }

  /** Size limits. */
  public Limits limits() {
    return limits;
  }

  /**
   * Database connection block.
   *
   * @return database settings
   */
  public Db db() {
    return db;
  }

  /**
   * Runtime behavior (reconnect cadence).
   *
   * @return runtime configuration values
   */
  public Runtime runtime() {
    return runtime;
  }

  /**
   * Logging configuration.
   *
   * @return logging configuration block
   */
  public Log log() {
    return log;
  }

  /**
   * Defaults of the bundled template, for embedding without a config file.
   *
   * @return parsed template
   */
  public static Config defaults() {
    return parse(TEMPLATE, name -> null);
  }

  /**
   * Loads configuration, writing a default file if it does not exist and always refreshing the
   * commented example alongside it.
   *
   * @param path config path
   * @return parsed config
   */
  public static Config loadOrWriteDefault(Path path) {
    return loadOrWriteDefault(path, System::getenv);
  }

  static Config loadOrWriteDefault(Path path, Function<String, String> env) {
    try {
      Path configDir = path.getParent();
      Path exampleDir = configDir != null ? configDir : Path.of(".");
      ConfigTemplateWriter.writeExample(exampleDir.resolve("keymeta.json5.example"), TEMPLATE);

      if (!Files.exists(path)) {
        if (configDir != null) {
          Files.createDirectories(configDir);
        }
        Files.writeString(path, TEMPLATE, StandardCharsets.UTF_8);
      }
      return parse(Files.readString(path, StandardCharsets.UTF_8), env);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read config: " + path, e);
    }
  }

  static Config parse(String raw, Function<String, String> env) {
    JsonObject root;
    try {
      root = JsonParser.parseString(stripJson5(raw)).getAsJsonObject();
    } catch (JsonParseException | IllegalStateException e) {
      throw new IllegalStateException("config is not a valid JSON5 object", e);
    }
    JsonObject core = optObject(root, "core");
    if (core == null) {
      throw new IllegalStateException("config missing core{} block");
    }

    JsonObject store = optObject(root, "store");
    StoreKind kind = StoreKind.from(optString(store, "kind", "memory"));
    Map<String, String> entityTypes = parseEntityTypes(optObject(root, "entityTypes"));
    Limits limits = parseLimits(optObject(root, "limits"));
    Db db = parseDb(optObject(core, "db"), env);
    Runtime runtime = parseRuntime(optObject(core, "runtime"));
    Log log = parseLog(optObject(core, "log"));

    Config config = new Config(kind, entityTypes, limits, db, runtime, log);
    validate(config);
    return config;
  }

  /** Drops comments and trailing commas; both are left alone inside string literals. */
  static String stripJson5(String raw) {
    StringBuilder out = new StringBuilder(raw.length());
    int n = raw.length();
    int i = 0;
    while (i < n) {
      char ch = raw.charAt(i);
      if (ch == '"' || ch == '\'') {
        int end = skipString(raw, i);
        out.append(raw, i, end);
        i = end;
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '/') {
        while (i < n && raw.charAt(i) != '\n') i++;
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '*') {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? n : close + 2;
      } else if (ch == ',' && closesNext(raw, i + 1)) {
        i++;
      } else {
        out.append(ch);
        i++;
      }
    }
    return out.toString();
  }

  private static int skipString(String raw, int start) {
    char quote = raw.charAt(start);
    int i = start + 1;
    while (i < raw.length()) {
      char ch = raw.charAt(i);
      if (ch == '\\') {
        i += 2;
        continue;
      }
      i++;
      if (ch == quote) {
        break;
      }
    }
    return Math.min(i, raw.length());
  }

  /** Whether only whitespace and comments separate {@code from} from a closing bracket. */
  private static boolean closesNext(String raw, int from) {
    int i = from;
    int n = raw.length();
    while (i < n) {
      char ch = raw.charAt(i);
      if (Character.isWhitespace(ch)) {
        i++;
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '/') {
        while (i < n && raw.charAt(i) != '\n') i++;
      } else if (ch == '/' && i + 1 < n && raw.charAt(i + 1) == '*') {
        int close = raw.indexOf("*/", i + 2);
        i = close < 0 ? n : close + 2;
      } else {
        return ch == '}' || ch == ']';
      }
    }
    return false;
  }

  private static Map<String, String> parseEntityTypes(JsonObject types) {
    if (types == null) {
      return DEFAULT_ENTITY_TYPES;
    }
    Map<String, String> out = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> e : types.entrySet()) {
      out.put(e.getKey(), e.getValue().getAsString());
    }
    return out;
  }

  private static Limits parseLimits(JsonObject limits) {
    long large = optLong(limits, "largeValueBytes", 1_048_576L);
    int max = optInt(limits, "maxValueBytes", 4_194_304);
    return new Limits(large, max);
  }

  private static Db parseDb(JsonObject db, Function<String, String> env) {
    if (db == null) {
      throw new IllegalStateException("config missing core.db{}");
    }
    String envHost = env.apply("KEYMETA_DB_HOST");
    String envPort = env.apply("KEYMETA_DB_PORT");
    String envDatabase = env.apply("KEYMETA_DB_DATABASE");
    String envUser = env.apply("KEYMETA_DB_USER");
    String envPassword = env.apply("KEYMETA_DB_PASSWORD");

    String host = envHost != null ? envHost : optString(db, "host", null);
    int port;
    try {
      port = envPort != null ? Integer.parseInt(envPort.trim()) : optInt(db, "port", 3306);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("KEYMETA_DB_PORT must be a number", e);
    }
    String database = envDatabase != null ? envDatabase : optString(db, "database", null);
    String user = envUser != null ? envUser : optString(db, "user", null);
    String password = envPassword != null ? envPassword : optString(db, "password", null);

    JsonObject tlsObj = optObject(db, "tls");
    boolean tls = tlsObj != null && optBoolean(tlsObj, "enabled", false);

    JsonObject poolObj = optObject(db, "pool");
    int maxPool = optInt(poolObj, "maxPoolSize", 10);
    int minIdle = optInt(poolObj, "minimumIdle", 2);
    long connTimeout = optLong(poolObj, "connectionTimeoutMs", 10_000L);
    long idleTimeout = optLong(poolObj, "idleTimeoutMs", 600_000L);
    long maxLifetime = optLong(poolObj, "maxLifetimeMs", 1_700_000L);
    int startupAttempts = optInt(poolObj, "startupAttempts", 3);

    return new Db(
        host,
        port,
        database,
        user,
        password,
        tls,
        new Pool(maxPool, minIdle, connTimeout, idleTimeout, maxLifetime, startupAttempts));
  }

  private static Runtime parseRuntime(JsonObject runtime) {
    return new Runtime(optInt(runtime, "reconnectEveryS", 10));
  }

  private static Log parseLog(JsonObject log) {
    if (log == null) {
      return new Log(false, 250L, "INFO");
    }
    boolean json = optBoolean(log, "json", false);
    long slow = optLong(log, "slowQueryMs", 250L);
    String level = optString(log, "level", "INFO");
    return new Log(json, slow, level);
  }

  private static JsonObject optObject(JsonObject parent, String key) {
    return parent != null && parent.has(key) && parent.get(key).isJsonObject()
        ? parent.getAsJsonObject(key)
        : null;
  }

  private static boolean optBoolean(JsonObject obj, String key, boolean def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsBoolean() : def;
  }

  private static int optInt(JsonObject obj, String key, int def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsInt() : def;
  }

  private static long optLong(JsonObject obj, String key, long def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsLong() : def;
  }

  private static String optString(JsonObject obj, String key, String def) {
    return obj != null && obj.has(key) ? obj.get(key).getAsString() : def;
  }

  private static void validate(Config cfg) {
    validateEntityTypes(cfg.entityTypes());
    validateLimits(cfg.limits());
    if (cfg.storeKind() == StoreKind.JDBC) {
      validateDb(cfg.db());
    }
    validateRuntime(cfg.runtime());
    validateLog(cfg.log());
  }

  private static void validateEntityTypes(Map<String, String> types) {
    if (types.isEmpty()) {
      throw new IllegalStateException("entityTypes must include at least one entry");
    }
    for (Map.Entry<String, String> e : types.entrySet()) {
      requireNonBlank(e.getKey(), "entityTypes key");
      String table = e.getValue();
      if (table == null || !table.matches("[A-Za-z0-9_]+")) {
        throw new IllegalStateException(
            "entityTypes." + e.getKey() + " must match [A-Za-z0-9_]+");
      }
    }
  }

  private static void validateLimits(Limits limits) {
    if (limits.largeValueBytes() < 1) {
      throw new IllegalStateException("limits.largeValueBytes must be >= 1");
    }
    if (limits.maxValueBytes() < 1) {
      throw new IllegalStateException("limits.maxValueBytes must be >= 1");
    }
  }

  private static void validateDb(Db db) {
    requireNonBlank(db.host(), "core.db.host");
    requireNonBlank(db.database(), "core.db.database");
    requireNonBlank(db.user(), "core.db.user");
    requireNonBlank(db.password(), "core.db.password");
    if (db.port() <= 0 || db.port() > 65535) {
      throw new IllegalStateException("core.db.port must be between 1 and 65535");
    }
    if (db.host().contains(" ")) {
      throw new IllegalStateException("core.db.host must not contain spaces");
    }
    if (!db.database().matches("[A-Za-z0-9_]+")) {
      throw new IllegalStateException("core.db.database must match [A-Za-z0-9_]+");
    }
    int maxPool = db.pool().maxPoolSize();
    if (maxPool < 1 || maxPool > 50) {
      throw new IllegalStateException("core.db.pool.maxPoolSize must be between 1 and 50");
    }
    int minIdle = db.pool().minimumIdle();
    if (minIdle < 0 || minIdle > maxPool) {
      throw new IllegalStateException("core.db.pool.minimumIdle must be between 0 and maxPoolSize");
    }
    long connectionTimeout = db.pool().connectionTimeoutMs();
    if (connectionTimeout < 1_000 || connectionTimeout > 120_000) {
      throw new IllegalStateException(
          "core.db.pool.connectionTimeoutMs must be between 1000 and 120000");
    }
    long idleTimeout = db.pool().idleTimeoutMs();
    long maxLifetime = db.pool().maxLifetimeMs();
    if (maxLifetime < 30_000L || maxLifetime > 3_600_000L) {
      throw new IllegalStateException(
          "core.db.pool.maxLifetimeMs must be between 30000 and 3600000");
    }
    if (idleTimeout >= maxLifetime) {
      throw new IllegalStateException("core.db.pool.idleTimeoutMs must be less than maxLifetimeMs");
    }
    int attempts = db.pool().startupAttempts();
    if (attempts < 1 || attempts > 10) {
      throw new IllegalStateException("core.db.pool.startupAttempts must be between 1 and 10");
    }
  }

  private static void validateRuntime(Runtime runtime) {
    int reconnect = runtime.reconnectEveryS();
    if (reconnect < 5 || reconnect > 300) {
      throw new IllegalStateException(
          "core.runtime.reconnectEveryS must be between 5 and 300 seconds");
    }
  }

  private static void validateLog(Log log) {
    if (log.slowQueryMs() < 0) {
      throw new IllegalStateException("core.log.slowQueryMs must be >= 0");
    }
    requireNonBlank(log.level(), "core.log.level");
    String normalized = log.level().toUpperCase(Locale.ROOT);
    if (!List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR").contains(normalized)) {
      throw new IllegalStateException("core.log.level must be TRACE, DEBUG, INFO, WARN, or ERROR");
    }
  }

  private static void requireNonBlank(String value, String field) {
    if (value == null || value.trim().isEmpty()) {
      throw new IllegalStateException(field + " must be provided");
    }
  }

  /** Backing store selection ({@code store.kind}). */
  public enum StoreKind {
    /** {@link InMemoryAttributeStore}. */
    MEMORY,
    /** {@link JdbcAttributeStore} over {@code core.db}. */
    JDBC;

    static StoreKind from(String raw) {
      return switch (raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT)) {
        case "memory" -> MEMORY;
        case "jdbc", "mariadb", "mysql" -> JDBC;
        default -> throw new IllegalStateException(
            "store.kind must be memory or jdbc, got " + raw);
      };
    }
  }

  /**
   * Size limits.
   *
   * @param largeValueBytes default threshold for large-value reports
   * @param maxValueBytes largest serialized value the JDBC store accepts
   */
  public record Limits(long largeValueBytes, int maxValueBytes) {}

  /**
   * Database settings parsed from {@code core.db}.
   *
   * @param host hostname or IP for the MariaDB/MySQL server
   * @param port TCP port for the database service
   * @param database schema name to use when connecting
   * @param user database user
   * @param password password for the configured {@code user}
   * @param tlsEnabled whether to request TLS/SSL when connecting
   * @param pool pool tuning overrides applied to HikariCP
   */
  public record Db(
      String host,
      int port,
      String database,
      String user,
      String password,
      boolean tlsEnabled,
      Pool pool) {

    /**
     * Fully formed JDBC URL (MariaDB tuned for UTF-8).
     *
     * @return JDBC URL string for MariaDB connections
     */
    public String jdbcUrl() {
      StringBuilder url =
          new StringBuilder("jdbc:mariadb://")
              .append(host)
              .append(':')
              .append(port)
              .append('/')
              .append(database)
              .append("?useUnicode=true&characterEncoding=utf8mb4");
      if (tlsEnabled) {
        url.append("&useSsl=true&sslMode=VERIFY_IDENTITY&trustServerCertificate=false");
      } else {
        url.append("&useSsl=false");
      }
      return url.toString();
    }
  }

  /**
   * Connection pool tuning.
   *
   * @param maxPoolSize maximum number of pooled connections
   * @param minimumIdle minimum number of idle connections to retain
   * @param connectionTimeoutMs wait time when borrowing a connection
   * @param idleTimeoutMs idle connection eviction threshold
   * @param maxLifetimeMs maximum lifetime of each connection
   * @param startupAttempts retry count when initializing the pool
   */
  public record Pool(
      int maxPoolSize,
      int minimumIdle,
      long connectionTimeoutMs,
      long idleTimeoutMs,
      long maxLifetimeMs,
      int startupAttempts) {}

  /**
   * Runtime reconnect cadence.
   *
   * @param reconnectEveryS number of seconds between degraded-mode reconnect attempts
   */
  public record Runtime(int reconnectEveryS) {}

  /**
   * Logging block.
   *
   * @param json whether to emit structured JSON logs
   * @param slowQueryMs threshold for slow-query warnings
   * @param level textual log level for the console logger
   */
  public record Log(boolean json, long slowQueryMs, String level) {}
}
