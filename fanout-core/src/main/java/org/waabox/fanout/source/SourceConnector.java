package org.waabox.fanout.source;

import org.waabox.fanout.NotifierConnectionException;

/**
 * Opens connections to the source store's change channels.
 *
 * <p>Implementations define how a channel subscription is held against a
 * concrete store (e.g. PostgreSQL {@code LISTEN/NOTIFY}). Each call returns
 * a new, exclusively owned connection.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface SourceConnector {

  /**
   * Opens a new connection to the source store.
   *
   * @return the open connection, never null
   *
   * @throws NotifierConnectionException if the store is unreachable
   */
  SourceConnection connect();
}
