/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import dev.keymeta.api.MetaValue;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import javax.management.ObjectName;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class CoreServicesTest {

  @Test
  void inMemoryServicesShareOneStore() throws Exception {
    Services services = CoreServices.inMemory();
    try {
      assertInstanceOf(InMemoryAttributeStore.class, services.store());
      assertNull(services.metrics());

      services.attributes().update("post", 1, "views", MetaValue.of(1L));
      assertEquals(OptionalLong.of(2L), services.attributes().increment("post", 1, "views"));
      assertEquals(
          List.of(1L),
          services.bulk().findObjectsByValue("post", "views", MetaValue.of(2L), null));
    } finally {
      services.shutdown();
    }
  }

  @Test
  void startWithDefaultsRegistersMetricsUntilShutdown() throws Exception {
    LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    Level previous = root.getLevel();
    ObjectName name = new ObjectName("dev.keymeta:type=KeymetaMetrics");
    Services services = CoreServices.start(Config.defaults());
    try {
      assertNotNull(services.metrics());
      assertTrue(ManagementFactory.getPlatformMBeanServer().isRegistered(name));
      assertTrue(services.store().supports("comment"));
      assertTrue(services.attributes().update("comment", 3, "spam", MetaValue.of(false)));
      assertEquals(MetaValue.of(false), services.attributes().get("comment", 3, "spam"));
      assertEquals(
          1L, ManagementFactory.getPlatformMBeanServer().getAttribute(name, "WriteSuccess"));
      assertEquals(
          1L, ManagementFactory.getPlatformMBeanServer().getAttribute(name, "ReadSuccess"));
    } finally {
      services.shutdown();
      root.detachAppender(LogbackConfigurator.CONSOLE_APPENDER);
      root.setLevel(previous);
    }
    assertFalse(ManagementFactory.getPlatformMBeanServer().isRegistered(name));
  }

  @Test
  void failedMigrationReleasesOpenedResources() throws Exception {
    DataSource unreachable = mock(DataSource.class);
    when(unreachable.getConnection()).thenThrow(new SQLException("refused", "08S01"));
    AutoCloseable scheduler = mock(AutoCloseable.class);
    AutoCloseable pool = mock(AutoCloseable.class);
    doThrow(new IOException("already closed")).when(pool).close();

    IllegalStateException error =
        assertThrows(
            IllegalStateException.class,
            () -> CoreServices.migrate(unreachable, Map.of("post", "postmeta"), scheduler, pool));

    verify(scheduler).close();
    verify(pool).close();
    assertEquals(1, error.getSuppressed().length);
  }

  @Test
  void recognizesLocalHosts() {
    assertTrue(CoreServices.isLocalHost("localhost"));
    assertTrue(CoreServices.isLocalHost(" 127.0.0.1 "));
    assertTrue(CoreServices.isLocalHost("[::1]"));
    assertFalse(CoreServices.isLocalHost("db.example.com"));
    assertFalse(CoreServices.isLocalHost(null));
  }
}
