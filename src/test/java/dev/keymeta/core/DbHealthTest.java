/* Keymeta © 2025 — MIT */
package dev.keymeta.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.keymeta.api.ErrorCode;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DbHealthTest {

  @Mock private DataSource dataSource;
  @Mock private Connection connection;
  @Mock private PreparedStatement statement;
  @Mock private ResultSet resultSet;
  @Mock private Metrics metrics;

  @Test
  void failureEntersDegradedModeUntilSuccess() {
    DbHealth health = new DbHealth(dataSource, null, 10, null);
    assertTrue(health.allowWrite("store.set"));

    health.markFailure(
        "store.set", ErrorCode.CONNECTION_LOST, new SQLException("refused", "08S01", 0));
    assertTrue(health.isDegraded());
    assertFalse(health.allowWrite("store.set"));
    assertFalse(health.allowWrite("store.delete"));

    health.markSuccess();
    assertFalse(health.isDegraded());
    assertTrue(health.allowWrite("store.set"));
  }

  @Test
  void firstFailureIsKeptAsCauseAndPublished() {
    DbHealth health = new DbHealth(dataSource, null, 10, metrics);

    health.markFailure("store.values", ErrorCode.CONNECTION_LOST, null);
    health.markFailure("store.set", ErrorCode.DEADLOCK_RETRY_EXHAUSTED, null);

    DbHealth.Degradation cause = health.degradation().orElseThrow();
    assertEquals("store.values", cause.op());
    assertEquals(ErrorCode.CONNECTION_LOST, cause.code());
    verify(metrics).recordDegraded("store.values:CONNECTION_LOST");

    health.markSuccess();
    assertTrue(health.degradation().isEmpty());
    verify(metrics).recordDegraded(null);
  }

  @Test
  void pingSkipsHealthyDatabase() {
    DbHealth health = new DbHealth(dataSource, null, 10, null);

    health.ping();

    verifyNoInteractions(dataSource);
  }

  @Test
  void pingLeavesDegradedModeWhenDatabaseAnswers() throws Exception {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.prepareStatement("SELECT 1")).thenReturn(statement);
    when(statement.executeQuery()).thenReturn(resultSet);
    when(resultSet.next()).thenReturn(true);
    DbHealth health = new DbHealth(dataSource, null, 10, null);
    health.markFailure("store.all", ErrorCode.CONNECTION_LOST, new SQLException("gone"));

    health.ping();

    assertFalse(health.isDegraded());
  }

  @Test
  void failedPingKeepsDegradedMode() throws Exception {
    when(dataSource.getConnection()).thenThrow(new SQLException("still down"));
    DbHealth health = new DbHealth(dataSource, null, 10, null);
    health.markFailure("store.all", ErrorCode.CONNECTION_LOST, new SQLException("gone"));

    health.ping();

    assertTrue(health.isDegraded());
  }
}
