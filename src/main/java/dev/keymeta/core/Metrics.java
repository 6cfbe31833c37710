/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import dev.keymeta.api.ErrorCode;
import java.lang.management.ManagementFactory;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import javax.management.InstanceAlreadyExistsException;
import javax.management.MBeanRegistrationException;
import javax.management.MBeanServer;
import javax.management.MalformedObjectNameException;
import javax.management.NotCompliantMBeanException;
import javax.management.ObjectName;
import javax.management.StandardMBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counters for store reads and writes, bulk operations and prefix deletions, exposed via JMX.
 *
 * <p>Failures also record the last observed {@link ErrorCode} for quick diagnostics.
 */
public final class Metrics implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("keymeta");
  private static final String MBEAN_NAME = "dev.keymeta:type=KeymetaMetrics";

  private final AtomicLong readSuccess = new AtomicLong();
  private final AtomicLong readFailure = new AtomicLong();
  private final AtomicLong writeSuccess = new AtomicLong();
  private final AtomicLong writeFailure = new AtomicLong();
  private final AtomicLong bulkOperations = new AtomicLong();
  private final AtomicLong bulkItemFailures = new AtomicLong();
  private final AtomicLong prefixRowsDeleted = new AtomicLong();
  private final AtomicLong slowQueries = new AtomicLong();
  private final AtomicReference<String> lastErrorCode = new AtomicReference<>("NONE");
  private final AtomicReference<String> degradedCause = new AtomicReference<>("NONE");

  private final MBeanServer server;
  private final ObjectName objectName;

  /** Creates and registers the metrics MBean. */
  public Metrics() {
    this.server = ManagementFactory.getPlatformMBeanServer();
    this.objectName = createObjectName();
    registerMBean();
  }

  /** Records a store read outcome. */
  public void recordRead(boolean ok, ErrorCode code) {
    (ok ? readSuccess : readFailure).incrementAndGet();
    remember(ok, code);
  }

  /** Records a store write (set/delete) outcome. */
  public void recordWrite(boolean ok, ErrorCode code) {
    (ok ? writeSuccess : writeFailure).incrementAndGet();
    remember(ok, code);
  }

  /**
   * Records a completed bulk operation.
   *
   * @param failedItems number of items inside the operation that failed
   */
  public void recordBulk(int failedItems) {
    bulkOperations.incrementAndGet();
    if (failedItems > 0) {
      bulkItemFailures.addAndGet(failedItems);
    }
  }

  /** Records rows removed by a prefix deletion. */
  public void recordPrefixDeletion(int rows) {
    if (rows > 0) {
      prefixRowsDeleted.addAndGet(rows);
    }
  }

  /** Records a statement slower than {@code core.log.slowQueryMs}. */
  public void recordSlowQuery() {
    slowQueries.incrementAndGet();
  }

  /**
   * Records a degraded-mode transition.
   *
   * @param cause {@code op:code} that degraded the store, or {@code null} once it recovered
   */
  public void recordDegraded(String cause) {
    degradedCause.set(cause != null ? cause : "NONE");
  }

  long readFailures() {
    return readFailure.get();
  }

  long writeFailures() {
    return writeFailure.get();
  }

  String lastErrorCode() {
    return lastErrorCode.get();
  }

  String degradedCause() {
    return degradedCause.get();
  }

  private void remember(boolean ok, ErrorCode code) {
    if (!ok && code != null) {
      lastErrorCode.set(code.name());
    }
  }

  private ObjectName createObjectName() {
    try {
      return new ObjectName(MBEAN_NAME);
    } catch (MalformedObjectNameException e) {
      throw new IllegalStateException("Invalid metrics object name", e);
    }
  }

  private void registerMBean() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
      server.registerMBean(new StandardMBean(new Bean(), KeymetaMetricsMBean.class), objectName);
    } catch (InstanceAlreadyExistsException
        | MBeanRegistrationException
        | NotCompliantMBeanException e) {
      LOG.warn("(keymeta) metrics registration failed", e);
    } catch (Exception e) {
      LOG.warn("(keymeta) metrics registration unexpected failure", e);
    }
  }

  @Override
  public void close() {
    try {
      if (server.isRegistered(objectName)) {
        server.unregisterMBean(objectName);
      }
    } catch (Exception e) {
      LOG.debug("(keymeta) metrics unregister failed", e);
    }
  }

  private final class Bean implements KeymetaMetricsMBean {
    @Override
    public long getReadSuccess() {
      return readSuccess.get();
    }

    @Override
    public long getReadFailure() {
      return readFailure.get();
    }

    @Override
    public long getWriteSuccess() {
      return writeSuccess.get();
    }

    @Override
    public long getWriteFailure() {
      return writeFailure.get();
    }

    @Override
    public long getBulkOperations() {
      return bulkOperations.get();
    }

    @Override
    public long getBulkItemFailures() {
      return bulkItemFailures.get();
    }

    @Override
    public long getPrefixRowsDeleted() {
      return prefixRowsDeleted.get();
    }

    @Override
    public String getLastErrorCode() {
      return lastErrorCode.get();
    }

    @Override
    public long getSlowQueries() {
      return slowQueries.get();
    }

    @Override
    public String getDegradedCause() {
      return degradedCause.get();
    }
  }

  /** JMX view of the metrics registry. */
  public interface KeymetaMetricsMBean {
    /** Store read successes. */
    long getReadSuccess();

    /** Store read failures. */
    long getReadFailure();

    /** Store write successes. */
    long getWriteSuccess();

    /** Store write failures. */
    long getWriteFailure();

    /** Completed bulk operations. */
    long getBulkOperations();

    /** Items that failed inside bulk operations. */
    long getBulkItemFailures();

    /** Rows removed by prefix deletions. */
    long getPrefixRowsDeleted();

    /** Last observed error code. */
    String getLastErrorCode();

    /** Statements slower than the configured threshold. */
    long getSlowQueries();

    /** Operation and error code that degraded the JDBC store, {@code NONE} when healthy. */
    String getDegradedCause();
  }
}
