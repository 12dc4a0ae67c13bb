package org.waabox.fanout.source;

import java.time.Duration;
import java.util.List;

import org.waabox.fanout.NotifierConnectionException;

/**
 * An open connection to the source store that can register interest in
 * change channels and receive their notifications.
 *
 * <p>A connection is used by one thread at a time: the owner registers
 * channels, then a single receive thread polls it, and finally the owner
 * unregisters and closes it once that thread has stopped.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SourceConnection extends AutoCloseable {

  /**
   * Registers interest in a channel.
   *
   * @param channel the channel name, never null
   *
   * @throws NotifierConnectionException if the registration fails
   */
  void listen(String channel);

  /**
   * Removes interest in a channel.
   *
   * @param channel the channel name, never null
   *
   * @throws NotifierConnectionException if the call fails
   */
  void unlisten(String channel);

  /**
   * Returns the notifications received so far, waiting up to the given
   * timeout for at least one to arrive.
   *
   * @param timeout the maximum time to wait, never null
   * @return the received notifications, empty if none arrived, never null
   *
   * @throws NotifierConnectionException if the connection is broken
   */
  List<SourceNotification> poll(Duration timeout);

  /**
   * Whether the connection is still usable.
   *
   * @return true if the connection is open and healthy
   */
  boolean isValid();

  /** Closes the connection. Never throws. */
  @Override
  void close();
}
