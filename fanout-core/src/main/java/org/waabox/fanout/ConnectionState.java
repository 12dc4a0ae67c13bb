package org.waabox.fanout;

/**
 * The connection state of a {@link ConnectionManager}.
 *
 * <p>Exactly one of these values is held by a manager at any time. The
 * manager starts in {@link #DISCONNECTED} and always returns to it on
 * shutdown.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ConnectionState {

  /** Not started, or shut down. */
  DISCONNECTED,

  /** Change events are consumed from the relay. */
  RELAY_CONNECTED,

  /** Change events are consumed directly from the source store. */
  FALLBACK_CONNECTED,

  /** No live notification path is active; reconnection is retried. */
  DEGRADED;

  /**
   * Whether this state has a live notification path.
   *
   * @return true for {@link #RELAY_CONNECTED} and
   *         {@link #FALLBACK_CONNECTED}
   */
  public boolean isConnected() {
    return this == RELAY_CONNECTED || this == FALLBACK_CONNECTED;
  }
}
