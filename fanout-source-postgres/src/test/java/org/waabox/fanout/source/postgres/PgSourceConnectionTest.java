package org.waabox.fanout.source.postgres;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.waabox.fanout.NotifierConnectionException;
import org.waabox.fanout.source.SourceNotification;

/** Tests for {@link PgSourceConnection}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PgSourceConnectionTest {

  @Test
  void whenListening_givenChannel_shouldIssueQuotedListen() throws Exception {
    final Connection connection = createMock(Connection.class);
    final PGConnection pgConnection = createMock(PGConnection.class);
    final Statement statement = createMock(Statement.class);

    expect(connection.createStatement()).andReturn(statement);
    expect(statement.execute("LISTEN \"matchdata_change\"")).andReturn(false);
    statement.close();
    replay(connection, pgConnection, statement);

    new PgSourceConnection(connection, pgConnection)
        .listen("matchdata_change");

    verify(connection, pgConnection, statement);
  }

  @Test
  void whenUnlistening_givenFailure_shouldThrowConnectionException()
      throws Exception {
    final Connection connection = createMock(Connection.class);
    final PGConnection pgConnection = createMock(PGConnection.class);
    final Statement statement = createMock(Statement.class);

    expect(connection.createStatement()).andReturn(statement);
    expect(statement.execute("UNLISTEN \"a\"")).andThrow(
        new SQLException("connection closed"));
    statement.close();
    replay(connection, pgConnection, statement);

    assertThrows(NotifierConnectionException.class,
        () -> new PgSourceConnection(connection, pgConnection).unlisten("a"));

    verify(connection, pgConnection, statement);
  }

  @Test
  void whenPolling_givenNotifications_shouldMapChannelAndPayload()
      throws Exception {
    final Connection connection = createMock(Connection.class);
    final PGConnection pgConnection = createMock(PGConnection.class);
    final PGNotification notification = createMock(PGNotification.class);

    expect(notification.getName()).andReturn("match_change");
    expect(notification.getParameter()).andReturn("{\"id\":1}");
    expect(pgConnection.getNotifications(500)).andReturn(
        new PGNotification[] {notification});
    replay(connection, pgConnection, notification);

    final List<SourceNotification> result = new PgSourceConnection(
        connection, pgConnection).poll(Duration.ofMillis(500));

    assertEquals(List.of(new SourceNotification("match_change",
        "{\"id\":1}")), result);
    verify(connection, pgConnection, notification);
  }

  @Test
  void whenPolling_givenNothingOrZeroTimeout_shouldReturnEmptyWithoutBlocking()
      throws Exception {
    final Connection connection = createMock(Connection.class);
    final PGConnection pgConnection = createMock(PGConnection.class);

    expect(pgConnection.getNotifications(1)).andReturn(null);
    replay(connection, pgConnection);

    assertTrue(new PgSourceConnection(connection, pgConnection)
        .poll(Duration.ZERO).isEmpty());
    verify(connection, pgConnection);
  }

  @Test
  void whenPolling_givenBrokenConnection_shouldThrowConnectionException()
      throws Exception {
    final Connection connection = createMock(Connection.class);
    final PGConnection pgConnection = createMock(PGConnection.class);

    expect(pgConnection.getNotifications(500)).andThrow(
        new SQLException("An I/O error occurred"));
    replay(connection, pgConnection);

    assertThrows(NotifierConnectionException.class,
        () -> new PgSourceConnection(connection, pgConnection)
            .poll(Duration.ofMillis(500)));
  }

  @Test
  void whenCheckingValidity_givenDriverError_shouldReturnFalse()
      throws Exception {
    final Connection connection = createMock(Connection.class);
    final PGConnection pgConnection = createMock(PGConnection.class);

    expect(connection.isValid(2)).andThrow(new SQLException("closed"));
    replay(connection, pgConnection);

    assertFalse(new PgSourceConnection(connection, pgConnection).isValid());
  }

  @Test
  void whenClosing_givenDriverError_shouldNotThrow() throws Exception {
    final Connection connection = createMock(Connection.class);
    final PGConnection pgConnection = createMock(PGConnection.class);

    connection.close();
    expectLastCall().andThrow(new SQLException("already closed"));
    replay(connection, pgConnection);

    new PgSourceConnection(connection, pgConnection).close();

    verify(connection, pgConnection);
  }

  @Test
  void whenQuoting_givenEmbeddedQuote_shouldDoubleIt() {
    assertEquals("\"we\"\"ird\"", PgSourceConnection.quoteIdentifier(
        "we\"ird"));
  }
}
