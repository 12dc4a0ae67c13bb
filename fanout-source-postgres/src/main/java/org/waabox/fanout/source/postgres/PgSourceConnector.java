package org.waabox.fanout.source.postgres;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;

import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.fanout.NotifierConnectionException;
import org.waabox.fanout.source.SourceConnection;
import org.waabox.fanout.source.SourceConnector;

/** Opens dedicated PostgreSQL connections for LISTEN/NOTIFY.
 *
 * <p>Listening needs a session of its own, so connections are opened
 * straight from the driver instead of being borrowed from a pool.
 *
 * <p>Credentials may also be given as URL parameters
 * ({@code ?user=app&password=secret}); the configured ones win.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PgSourceConnector implements SourceConnector {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PgSourceConnector.class);

  /** The connection settings, never null. */
  private final PgSourceConfig config;

  /** Creates a new connector.
   *
   * @param theConfig the connection settings, never null
   */
  public PgSourceConnector(final PgSourceConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public SourceConnection connect() {
    Connection connection = null;
    try {
      connection = DriverManager.getConnection(config.jdbcUrl(),
          connectionProperties());
      connection.setAutoCommit(true);
      final PGConnection pgConnection = connection.unwrap(
          PGConnection.class);
      log.debug("Opened source connection to {}", config.jdbcUrl());
      return new PgSourceConnection(connection, pgConnection);
    } catch (final SQLException e) {
      closeQuietly(connection);
      throw new NotifierConnectionException("Failed to connect to "
          + config.jdbcUrl() + ": " + e.getMessage(), e);
    }
  }

  /** Builds the driver properties.
   *
   * <p>Package-private for testability.
   *
   * @return the properties, never null
   */
  Properties connectionProperties() {
    final Properties props = new Properties();
    if (config.user() != null) {
      PGProperty.USER.set(props, config.user());
    }
    if (config.password() != null) {
      PGProperty.PASSWORD.set(props, config.password());
    }
    final int timeoutSeconds = (int) Math.max(1,
        config.connectTimeout().toSeconds());
    PGProperty.CONNECT_TIMEOUT.set(props, timeoutSeconds);
    PGProperty.LOGIN_TIMEOUT.set(props, timeoutSeconds);
    PGProperty.APPLICATION_NAME.set(props, "fanout-listener");
    return props;
  }

  private static void closeQuietly(final Connection connection) {
    if (connection != null) {
      try {
        connection.close();
      } catch (final SQLException e) {
        log.warn("Error closing source connection: {}", e.getMessage());
      }
    }
  }
}
