/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import javax.sql.DataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SlowQueryDataSourceTest {
  @Mock private DataSource delegate;
  @Mock private Connection connection;
  @Mock private PreparedStatement prepared;
  @Mock private Statement plain;
  @Mock private Metrics metrics;

  private final LoggerContext context = new LoggerContext();
  private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
  private Logger logger;

  @BeforeEach
  void attachAppender() {
    context.start();
    logger = context.getLogger("keymeta");
    appender.start();
    logger.addAppender(appender);
  }

  @AfterEach
  void detachAppender() {
    logger.detachAppender(appender);
    appender.stop();
    context.stop();
  }

  @Test
  void slowPreparedStatementIsLoggedWithItsTable() throws Exception {
    when(delegate.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(prepared);
    when(prepared.executeQuery())
        .thenAnswer(
            invocation -> {
              Thread.sleep(15L);
              return null;
            });
    DataSource timed = SlowQueryDataSource.wrap(delegate, 5L, logger, metrics);

    try (Connection c = timed.getConnection();
        PreparedStatement ps =
            c.prepareStatement("SELECT value_json FROM postmeta WHERE entity_id=?")) {
      ps.executeQuery();
    }

    assertEquals(1, appender.list.size());
    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertTrue(event.getFormattedMessage().contains("code=" + SlowQueryDataSource.CODE));
    assertTrue(event.getFormattedMessage().contains("table=postmeta"));
    assertTrue(event.getFormattedMessage().contains("op=executeQuery"));
    verify(metrics).recordSlowQuery();
  }

  @Test
  void plainStatementTakesSqlFromExecuteCall() throws Exception {
    when(delegate.getConnection()).thenReturn(connection);
    when(connection.createStatement()).thenReturn(plain);
    when(plain.execute(anyString()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(15L);
              return false;
            });
    DataSource timed = SlowQueryDataSource.wrap(delegate, 5L, logger, null);

    try (Connection c = timed.getConnection();
        Statement st = c.createStatement()) {
      st.execute("CREATE TABLE IF NOT EXISTS usermeta (meta_id BIGINT)");
    }

    assertTrue(appender.list.get(0).getFormattedMessage().contains("table=usermeta"));
  }

  @Test
  void fastStatementsStayQuiet() throws Exception {
    when(delegate.getConnection()).thenReturn(connection);
    when(connection.prepareStatement(anyString())).thenReturn(prepared);
    when(prepared.executeUpdate()).thenReturn(2);
    DataSource timed = SlowQueryDataSource.wrap(delegate, 60_000L, logger, metrics);

    try (Connection c = timed.getConnection();
        PreparedStatement ps = c.prepareStatement("DELETE FROM postmeta WHERE meta_key=?")) {
      assertEquals(2, ps.executeUpdate());
      assertSame(c, ps.getConnection());
    }

    assertTrue(appender.list.isEmpty());
    verify(metrics, never()).recordSlowQuery();
  }

  @Test
  void disabledOrRepeatedWrapKeepsDataSource() {
    assertSame(delegate, SlowQueryDataSource.wrap(delegate, 0L, logger, null));
    DataSource timed = SlowQueryDataSource.wrap(delegate, 5L, logger, null);
    assertSame(timed, SlowQueryDataSource.wrap(timed, 5L, logger, null));
  }

  @Test
  void findsTableNames() {
    assertEquals("termmeta", SlowQueryDataSource.tableOf("insert into termmeta(a) values(?)"));
    assertEquals("postmeta", SlowQueryDataSource.tableOf("UPDATE `postmeta` SET x=1"));
    assertEquals("-", SlowQueryDataSource.tableOf("SELECT 1"));
    assertEquals("-", SlowQueryDataSource.tableOf(null));
  }

  @Test
  void abbreviatesLongStatements() {
    String sql = "SELECT   *\nFROM postmeta WHERE " + "meta_key = 'x' AND ".repeat(20) + "1=1";

    String shortened = SlowQueryDataSource.abbreviate(sql);

    assertEquals(160, shortened.length());
    assertTrue(shortened.startsWith("SELECT * FROM postmeta"));
    assertTrue(shortened.endsWith("..."));
    assertFalse(shortened.contains("\n"));
    assertEquals("<unknown>", SlowQueryDataSource.abbreviate(null));
  }
}
