/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.keymeta.api.ErrorCode;
import java.lang.management.ManagementFactory;
import javax.management.MBeanServer;
import javax.management.ObjectName;
import org.junit.jupiter.api.Test;

class MetricsTest {

  @Test
  void exposesCountersThroughJmx() throws Exception {
    MBeanServer server = ManagementFactory.getPlatformMBeanServer();
    ObjectName name = new ObjectName("dev.keymeta:type=KeymetaMetrics");

    try (Metrics metrics = new Metrics()) {
      metrics.recordWrite(true, null);
      metrics.recordWrite(false, ErrorCode.DEADLOCK_RETRY_EXHAUSTED);
      metrics.recordRead(false, ErrorCode.CONNECTION_LOST);
      metrics.recordBulk(2);
      metrics.recordBulk(0);
      metrics.recordPrefixDeletion(5);
      metrics.recordSlowQuery();

      assertTrue(server.isRegistered(name));
      assertEquals(1L, server.getAttribute(name, "WriteSuccess"));
      assertEquals(1L, server.getAttribute(name, "WriteFailure"));
      assertEquals(1L, server.getAttribute(name, "ReadFailure"));
      assertEquals(2L, server.getAttribute(name, "BulkOperations"));
      assertEquals(2L, server.getAttribute(name, "BulkItemFailures"));
      assertEquals(5L, server.getAttribute(name, "PrefixRowsDeleted"));
      assertEquals(1L, server.getAttribute(name, "SlowQueries"));
      assertEquals("CONNECTION_LOST", server.getAttribute(name, "LastErrorCode"));
      assertEquals("NONE", server.getAttribute(name, "DegradedCause"));

      metrics.recordDegraded("store.set:CONNECTION_LOST");
      assertEquals("store.set:CONNECTION_LOST", server.getAttribute(name, "DegradedCause"));
      metrics.recordDegraded(null);
      assertEquals("NONE", metrics.degradedCause());
    }

    assertFalse(server.isRegistered(name));
  }

  @Test
  void successesDoNotOverwriteLastError() {
    try (Metrics metrics = new Metrics()) {
      assertEquals("NONE", metrics.lastErrorCode());

      metrics.recordWrite(false, ErrorCode.DEGRADED_MODE);
      metrics.recordRead(true, null);

      assertEquals("DEGRADED_MODE", metrics.lastErrorCode());
      assertEquals(1L, metrics.writeFailures());
      assertEquals(0L, metrics.readFailures());
    }
  }
}
