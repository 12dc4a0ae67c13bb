package org.waabox.fanout.source.postgres;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.fanout.NotifierConnectionException;
import org.waabox.fanout.source.SourceConnection;
import org.waabox.fanout.source.SourceNotification;

/** A {@link SourceConnection} over a PostgreSQL session using
 * LISTEN/NOTIFY.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class PgSourceConnection implements SourceConnection {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PgSourceConnection.class);

  /** Seconds given to the server to answer a validity check. */
  private static final int VALIDATION_TIMEOUT_SECONDS = 2;

  /** The JDBC connection, never null. */
  private final Connection connection;

  /** The driver view of the connection, never null. */
  private final PGConnection pgConnection;

  /** Creates a new source connection.
   *
   * @param theConnection the JDBC connection, never null
   * @param thePgConnection the same connection unwrapped, never null
   */
  PgSourceConnection(final Connection theConnection,
      final PGConnection thePgConnection) {
    connection = Objects.requireNonNull(theConnection,
        "connection must not be null");
    pgConnection = Objects.requireNonNull(thePgConnection,
        "pgConnection must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public void listen(final String channel) {
    execute("LISTEN " + quoteIdentifier(channel));
  }

  /** {@inheritDoc} */
  @Override
  public void unlisten(final String channel) {
    execute("UNLISTEN " + quoteIdentifier(channel));
  }

  /** {@inheritDoc} */
  @Override
  public List<SourceNotification> poll(final Duration timeout) {
    // A zero timeout blocks forever in the driver.
    final int millis = (int) Math.max(1, Math.min(Integer.MAX_VALUE,
        timeout.toMillis()));
    final PGNotification[] notifications;
    try {
      notifications = pgConnection.getNotifications(millis);
    } catch (final SQLException e) {
      throw new NotifierConnectionException(
          "Source connection failed: " + e.getMessage(), e);
    }
    if (notifications == null || notifications.length == 0) {
      return List.of();
    }
    final List<SourceNotification> result =
        new ArrayList<>(notifications.length);
    for (final PGNotification notification : notifications) {
      result.add(new SourceNotification(notification.getName(),
          notification.getParameter()));
    }
    return result;
  }

  /** {@inheritDoc} */
  @Override
  public boolean isValid() {
    try {
      return connection.isValid(VALIDATION_TIMEOUT_SECONDS);
    } catch (final SQLException e) {
      return false;
    }
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    try {
      connection.close();
    } catch (final SQLException e) {
      log.warn("Error closing source connection: {}", e.getMessage());
    }
  }

  /** Quotes a channel name as a SQL identifier, keeping its case.
   *
   * <p>Package-private for testability.
   *
   * @param channel the channel name, never null
   * @return the quoted identifier, never null
   */
  static String quoteIdentifier(final String channel) {
    Objects.requireNonNull(channel, "channel must not be null");
    return "\"" + channel.replace("\"", "\"\"") + "\"";
  }

  private void execute(final String sql) {
    try (Statement statement = connection.createStatement()) {
      statement.execute(sql);
    } catch (final SQLException e) {
      throw new NotifierConnectionException(
          "Failed to execute '" + sql + "': " + e.getMessage(), e);
    }
  }
}
