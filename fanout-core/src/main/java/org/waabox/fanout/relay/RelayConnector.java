package org.waabox.fanout.relay;

import org.waabox.fanout.NotifierConnectionException;

/**
 * Opens connections to the shared pub/sub relay.
 *
 * <p>Implementations define the broker (e.g. Kafka). Every connection
 * returned must receive every message published on a topic it subscribes
 * to, regardless of how many other processes subscribe to the same topic.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface RelayConnector {

  /**
   * Opens a new connection to the relay.
   *
   * @return the open connection, never null
   *
   * @throws NotifierConnectionException if the relay is unreachable
   */
  RelayConnection connect();
}
