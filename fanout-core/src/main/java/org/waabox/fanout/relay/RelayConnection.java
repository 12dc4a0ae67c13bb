package org.waabox.fanout.relay;

import java.time.Duration;
import java.util.List;

import org.waabox.fanout.NotifierConnectionException;

/**
 * An open connection to the relay.
 *
 * <p>{@link #publish(String, String)} and {@link #wakeup()} may be called
 * from any thread. The subscription methods and {@link #receive(Duration)}
 * are used by one thread at a time.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface RelayConnection extends AutoCloseable {

  /**
   * Publishes a message on a topic.
   *
   * @param topic the topic, never null
   * @param message the message text, never null
   *
   * @throws NotifierConnectionException if the relay rejects or cannot
   *         accept the message
   */
  void publish(String topic, String message);

  /**
   * Subscribes to a topic.
   *
   * @param topic the topic, never null
   *
   * @throws NotifierConnectionException if the subscription fails
   */
  void subscribe(String topic);

  /** Drops the current subscription, if any. */
  void unsubscribe();

  /**
   * Returns the messages received on the subscription, waiting up to the
   * given timeout for at least one to arrive.
   *
   * @param timeout the maximum time to wait, never null
   * @return the received messages, empty if none arrived or the wait was
   *         woken up, never null
   *
   * @throws NotifierConnectionException if the connection is broken
   */
  List<RelayMessage> receive(Duration timeout);

  /**
   * Makes a pending or the next {@link #receive(Duration)} return early.
   * Safe to call from any thread.
   */
  default void wakeup() {
  }

  /** Closes the connection. Never throws. */
  @Override
  void close();
}
