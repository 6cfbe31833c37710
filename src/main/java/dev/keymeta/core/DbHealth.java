/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import dev.keymeta.api.ErrorCode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Degraded-mode switch of the JDBC store.
 *
 * <p>A failed store operation degrades the store and remembers which operation failed and how.
 * While degraded, writes are refused; reads still go through and any successful statement, or
 * the scheduled {@code SELECT 1} ping, restores normal mode.
 */
final class DbHealth {
  private static final Logger LOG = LoggerFactory.getLogger("keymeta");
  private static final long REFUSAL_LOG_INTERVAL_NS = TimeUnit.SECONDS.toNanos(5);

  /**
   * What put the store into degraded mode.
   *
   * @param op store operation that failed, e.g. {@code store.set}
   * @param code classified failure
   * @param sinceMillis wall clock time of the failure
   */
  record Degradation(String op, ErrorCode code, long sinceMillis) {
    @Override
    public String toString() {
      return op + ":" + code;
    }
  }

  private final DataSource ds;
  private final Metrics metrics;
  private final AtomicReference<Degradation> degradation = new AtomicReference<>();
  private final AtomicLong lastRefusalLogNs = new AtomicLong();

  /**
   * Creates the switch and schedules its ping.
   *
   * @param ds datasource pinged while degraded
   * @param scheduler ping scheduler, or {@code null} to ping only through {@link #ping()}
   * @param reconnectEveryS ping interval in seconds
   * @param metrics registry told about transitions, may be {@code null}
   */
  DbHealth(
      DataSource ds, ScheduledExecutorService scheduler, int reconnectEveryS, Metrics metrics) {
    this.ds = ds;
    this.metrics = metrics;
    if (scheduler != null) {
      long every = Math.max(1, reconnectEveryS);
      scheduler.scheduleWithFixedDelay(this::ping, every, every, TimeUnit.SECONDS);
    }
  }

  /** Whether {@code op} may write; refusals are logged at most every five seconds. */
  boolean allowWrite(String op) {
    Degradation current = degradation.get();
    if (current == null) {
      return true;
    }
    long now = System.nanoTime();
    long prev = lastRefusalLogNs.get();
    if (now - prev > REFUSAL_LOG_INTERVAL_NS && lastRefusalLogNs.compareAndSet(prev, now)) {
      LOG.warn(
          "(keymeta) code={} op={} message={} cause={}",
          ErrorCode.DEGRADED_MODE,
          op,
          "write refused while degraded",
          current);
    }
    return false;
  }

  /**
   * Enters degraded mode. A store already degraded keeps its first cause.
   *
   * @param op failed store operation
   * @param code classified failure
   * @param error underlying exception, may be {@code null}
   */
  void markFailure(String op, ErrorCode code, Throwable error) {
    Degradation next = new Degradation(op, code, System.currentTimeMillis());
    if (degradation.compareAndSet(null, next)) {
      LOG.warn(
          "(keymeta) code={} op={} message={}",
          code,
          op,
          "entering degraded mode: " + (error != null ? error.getMessage() : "unknown"));
      if (metrics != null) {
        metrics.recordDegraded(next.toString());
      }
    }
  }

  void markSuccess() {
    Degradation previous = degradation.getAndSet(null);
    if (previous != null) {
      LOG.info(
          "(keymeta) op={} message={} after={}ms cause={}",
          "db.health",
          "leaving degraded mode",
          System.currentTimeMillis() - previous.sinceMillis(),
          previous);
      if (metrics != null) {
        metrics.recordDegraded(null);
      }
    }
  }

  boolean isDegraded() {
    return degradation.get() != null;
  }

  Optional<Degradation> degradation() {
    return Optional.ofNullable(degradation.get());
  }

  /** Runs {@code SELECT 1} while degraded and leaves degraded mode when it answers. */
  void ping() {
    if (degradation.get() == null) {
      return;
    }
    try (Connection c = ds.getConnection();
        PreparedStatement select = c.prepareStatement("SELECT 1");
        ResultSet rs = select.executeQuery()) {
      if (rs.next()) {
        markSuccess();
      }
    } catch (SQLException e) {
      LOG.debug("(keymeta) op={} message={}", "db.ping", e.getMessage());
    }
  }
}
