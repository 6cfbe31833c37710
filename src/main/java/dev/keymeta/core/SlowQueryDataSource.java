/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import java.io.PrintWriter;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DataSource} decorator timing every {@code execute*} call of the statements it hands out.
 *
 * <p>Calls at or above {@code core.log.slowQueryMs} log a {@code DB_SLOW_QUERY} warning naming
 * the attribute table and the shortened SQL, and bump {@link Metrics} when one is attached.
 */
final class SlowQueryDataSource implements DataSource {
  static final String CODE = "DB_SLOW_QUERY";
  private static final int MAX_SQL_CHARS = 160;
  private static final Pattern TABLE =
      Pattern.compile("\\b(?:FROM|INTO|UPDATE|TABLE(?: IF NOT EXISTS)?)\\s+`?(\\w+)`?");

  private final DataSource delegate;
  private final long thresholdMs;
  private final Logger logger;
  private final Metrics metrics;

  private SlowQueryDataSource(
      DataSource delegate, long thresholdMs, Logger logger, Metrics metrics) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.thresholdMs = thresholdMs;
    this.logger = Objects.requireNonNull(logger, "logger");
    this.metrics = metrics;
  }

  static DataSource wrap(DataSource delegate, long thresholdMs, Metrics metrics) {
    return wrap(delegate, thresholdMs, LoggerFactory.getLogger("keymeta"), metrics);
  }

  /** Returns {@code delegate} itself when timing is disabled or it is already timed. */
  static DataSource wrap(DataSource delegate, long thresholdMs, Logger logger, Metrics metrics) {
    if (delegate == null || thresholdMs <= 0 || delegate instanceof SlowQueryDataSource) {
      return delegate;
    }
    return new SlowQueryDataSource(delegate, thresholdMs, logger, metrics);
  }

  @Override
  public Connection getConnection() throws SQLException {
    return timed(delegate.getConnection());
  }

  @Override
  public Connection getConnection(String username, String password) throws SQLException {
    return timed(delegate.getConnection(username, password));
  }

  private Connection timed(Connection connection) {
    return connection == null
        ? null
        : (Connection) proxy(Connection.class, new Handler(connection, null, null));
  }

  private static Object proxy(Class<?> iface, InvocationHandler handler) {
    return Proxy.newProxyInstance(
        SlowQueryDataSource.class.getClassLoader(), new Class<?>[] {iface}, handler);
  }

  /**
   * Forwards to a connection or statement. Statements created through a connection proxy are
   * proxied in turn and remember their SQL.
   */
  private final class Handler implements InvocationHandler {
    private final Object target;
    private final Connection owner;
    private final String sql;

    Handler(Object target, Connection owner, String sql) {
      this.target = target;
      this.owner = owner;
      this.sql = sql;
    }

    @Override
    public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
      String name = method.getName();
      String argSql = args != null && args.length > 0 && args[0] instanceof String s ? s : null;
      switch (name) {
        case "equals":
          return proxy == args[0];
        case "hashCode":
          return System.identityHashCode(proxy);
        case "getConnection":
          if (owner != null) {
            return owner;
          }
          break;
        default:
          break;
      }
      if (owner == null || !name.startsWith("execute")) {
        Object result = call(method, args);
        Class<?> type = method.getReturnType();
        if (owner == null && result != null && Statement.class.isAssignableFrom(type)) {
          return proxy(type, new Handler(result, (Connection) proxy, argSql));
        }
        return result;
      }
      long startNs = System.nanoTime();
      try {
        return call(method, args);
      } finally {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        if (elapsedMs >= thresholdMs) {
          slow(name, elapsedMs, argSql != null ? argSql : sql);
        }
      }
    }

    private Object call(Method method, Object[] args) throws Throwable {
      try {
        return method.invoke(target, args);
      } catch (InvocationTargetException e) {
        throw e.getCause();
      }
    }
  }

  private void slow(String op, long elapsedMs, String sql) {
    logger.warn(
        "(keymeta) code={} op={} table={} elapsedMs={} thresholdMs={} sql={}",
        CODE,
        op,
        tableOf(sql),
        elapsedMs,
        thresholdMs,
        abbreviate(sql));
    if (metrics != null) {
      metrics.recordSlowQuery();
    }
  }

  /** First table named after FROM, INTO, UPDATE or TABLE; {@code -} when none is found. */
  static String tableOf(String sql) {
    if (sql == null) {
      return "-";
    }
    Matcher m = TABLE.matcher(sql.toUpperCase(Locale.ROOT));
    return m.find() ? m.group(1).toLowerCase(Locale.ROOT) : "-";
  }

  static String abbreviate(String sql) {
    if (sql == null) {
      return "<unknown>";
    }
    String normalized = sql.replaceAll("\\s+", " ").trim();
    return normalized.length() <= MAX_SQL_CHARS
        ? normalized
        : normalized.substring(0, MAX_SQL_CHARS - 3) + "...";
  }

  @Override
  public <T> T unwrap(Class<T> iface) throws SQLException {
    return iface.isInstance(this) ? iface.cast(this) : delegate.unwrap(iface);
  }

  @Override
  public boolean isWrapperFor(Class<?> iface) throws SQLException {
    return iface.isInstance(this) || delegate.isWrapperFor(iface);
  }

  @Override
  public PrintWriter getLogWriter() throws SQLException {
    return delegate.getLogWriter();
  }

  @Override
  public void setLogWriter(PrintWriter out) throws SQLException {
    delegate.setLogWriter(out);
  }

  @Override
  public void setLoginTimeout(int seconds) throws SQLException {
    delegate.setLoginTimeout(seconds);
  }

  @Override
  public int getLoginTimeout() throws SQLException {
    return delegate.getLoginTimeout();
  }

  @Override
  public java.util.logging.Logger getParentLogger() throws SQLFeatureNotSupportedException {
    return delegate.getParentLogger();
  }
}
