/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import dev.keymeta.api.Attributes;
import dev.keymeta.api.BulkAttributes;
import dev.keymeta.api.storage.AttributeStore;
import java.io.Closeable;
import java.io.IOException;
import java.sql.SQLException;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wires store, accessor and coordinator and manages shared resources (Hikari pool, scheduler). */
public final class CoreServices implements Services, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger("keymeta");

  private final HikariDataSource pool;
  private final ScheduledExecutorService scheduler;
  private final AttributeStore store;
  private final Attributes attributes;
  private final BulkAttributes bulk;
  private final Metrics metrics;

  private CoreServices(
      HikariDataSource pool,
      ScheduledExecutorService scheduler,
      AttributeStore store,
      Metrics metrics,
      long largeValueBytes) {
    this.pool = pool;
    this.scheduler = scheduler;
    this.store = store;
    this.metrics = metrics;
    this.attributes = new AttributesImpl(store, largeValueBytes);
    this.bulk = new BulkAttributesImpl(attributes, store, metrics, largeValueBytes);
  }

  /**
   * Heap-backed engine with the default entity types and no metrics registration.
   *
   * @return service container
   */
  public static Services inMemory() {
    Config cfg = Config.defaults();
    return new CoreServices(
        null,
        null,
        new InMemoryAttributeStore(cfg.entityTypes().keySet()),
        null,
        cfg.limits().largeValueBytes());
  }

  /**
   * Starts the engine described by {@code cfg}: configures logging, then builds either the heap
   * store or the pooled MariaDB store with migrations applied.
   *
   * @param cfg runtime configuration
   * @return service container
   */
  public static Services start(Config cfg) {
    LoggingConfigurator.configure(cfg.log());
    Metrics metrics = new Metrics();
    if (cfg.storeKind() == Config.StoreKind.MEMORY) {
      LOG.info("(keymeta) starting in-memory store types={}", cfg.entityTypes().keySet());
      return new CoreServices(
          null,
          null,
          new InMemoryAttributeStore(cfg.entityTypes().keySet(), metrics),
          metrics,
          cfg.limits().largeValueBytes());
    }

    HikariDataSource ds = openPool(cfg);
    ScheduledExecutorService scheduler =
        Executors.newScheduledThreadPool(
            1,
            r -> {
              Thread t = new Thread(r, "keymeta-scheduler");
              t.setDaemon(true);
              return t;
            });

    DataSource timed = SlowQueryDataSource.wrap(ds, cfg.log().slowQueryMs(), metrics);
    migrate(timed, cfg.entityTypes(), scheduler::shutdownNow, ds, metrics);
    DbHealth dbHealth = new DbHealth(timed, scheduler, cfg.runtime().reconnectEveryS(), metrics);
    AttributeStore store =
        new JdbcAttributeStore(
            timed, cfg.entityTypes(), dbHealth, metrics, cfg.limits().maxValueBytes());
    LOG.info("(keymeta) started jdbc store types={}", cfg.entityTypes().keySet());
    return new CoreServices(ds, scheduler, store, metrics, cfg.limits().largeValueBytes());
  }

  /**
   * Applies migrations; when they fail, closes {@code resources} in order and rethrows.
   *
   * @param ds migrated database
   * @param tables entity type to table name
   * @param resources opened so far
   */
  static void migrate(DataSource ds, Map<String, String> tables, AutoCloseable... resources) {
    try {
      Migrations.apply(ds, tables);
    } catch (RuntimeException e) {
      for (AutoCloseable resource : resources) {
        try {
          resource.close();
        } catch (Exception closeError) {
          e.addSuppressed(closeError);
        }
      }
      throw e;
    }
  }

  private static HikariDataSource openPool(Config cfg) {
    Config.Db db = cfg.db();
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.jdbcUrl());
    hc.setUsername(db.user());
    hc.setPassword(db.password());
    hc.setMaximumPoolSize(db.pool().maxPoolSize());
    hc.setMinimumIdle(Math.min(db.pool().minimumIdle(), db.pool().maxPoolSize()));
    hc.setConnectionTimeout(db.pool().connectionTimeoutMs());
    hc.setIdleTimeout(db.pool().idleTimeoutMs());
    hc.setMaxLifetime(db.pool().maxLifetimeMs());
    hc.setAutoCommit(true);
    hc.setPoolName("keymeta-hikari");

    if (!db.tlsEnabled() && !isLocalHost(db.host())) {
      LOG.warn(
          "(keymeta) code={} op={} message={}",
          "DB_TLS_DISABLED",
          "config",
          "TLS is disabled for a non-local database host; enable core.db.tls.enabled");
    }
    if ("change-me".equals(db.password())) {
      LOG.warn(
          "(keymeta) code={} op={} message={}",
          "DB_PASSWORD_DEFAULT",
          "config",
          "database password is still the default 'change-me'");
    }

    RuntimeException last = null;
    boolean bootstrapped = false;
    int attempts = Math.max(1, db.pool().startupAttempts());
    for (int attempt = 1; attempt <= attempts; attempt++) {
      try {
        return new HikariDataSource(hc);
      } catch (RuntimeException ex) {
        last = ex;
        SQLException sql = findSqlException(ex);
        if (!bootstrapped && DbBootstrap.isUnknownDatabase(sql)) {
          try {
            DbBootstrap.ensureDatabaseExists(db.jdbcUrl(), db.user(), db.password());
            bootstrapped = true;
            continue;
          } catch (SQLException bootstrapEx) {
            LOG.warn("(keymeta) database bootstrap failed: {}", bootstrapEx.getMessage());
          }
        }
        LOG.warn(
            "(keymeta) failed to start Hikari (attempt {}/{}): {}",
            attempt,
            attempts,
            ex.getMessage());
        if (attempt < attempts && !backoff(attempt)) {
          break;
        }
      }
    }
    throw new IllegalStateException("Unable to start datasource", last);
  }

  private static boolean backoff(int attempt) {
    try {
      Thread.sleep(250L * attempt);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @Override
  public Attributes attributes() {
    return attributes;
  }

  @Override
  public BulkAttributes bulk() {
    return bulk;
  }

  @Override
  public AttributeStore store() {
    return store;
  }

  @Override
  public Metrics metrics() {
    return metrics;
  }

  /** Closes background resources and the connection pool. */
  @Override
  public void shutdown() throws IOException {
    if (metrics != null) {
      metrics.close();
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
    if (pool != null) {
      pool.close();
    }
  }

  /** Alias for {@link #shutdown()}. */
  @Override
  public void close() throws IOException {
    shutdown();
  }

  static boolean isLocalHost(String host) {
    if (host == null) {
      return false;
    }
    String normalized = host.trim();
    return normalized.equalsIgnoreCase("localhost")
        || normalized.equals("127.0.0.1")
        || normalized.equals("::1")
        || normalized.equalsIgnoreCase("[::1]");
  }

  private static SQLException findSqlException(Throwable error) {
    Throwable cursor = error;
    while (cursor != null) {
      if (cursor instanceof SQLException sql) {
        return sql;
      }
      cursor = cursor.getCause();
    }
    return null;
  }
}
