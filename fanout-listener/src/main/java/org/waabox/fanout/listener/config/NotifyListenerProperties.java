package org.waabox.fanout.listener.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Configuration properties for the notification listener, bound from the
 * {@code fanout.listener} prefix.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "fanout.listener")
public class NotifyListenerProperties {

  /** The wait between a lost session and the next attempt, defaults to
   * 5 seconds. */
  private Duration reconnectDelay = Duration.ofSeconds(5);

  /** Returns the wait between a lost session and the next attempt.
   *
   * @return the reconnect delay, never null
   */
  public Duration getReconnectDelay() {
    return reconnectDelay;
  }

  /** Sets the wait between a lost session and the next attempt.
   *
   * @param theReconnectDelay the reconnect delay, never null
   */
  public void setReconnectDelay(final Duration theReconnectDelay) {
    reconnectDelay = theReconnectDelay;
  }
}
