package org.waabox.fanout;

import java.util.List;
import java.util.Objects;

/** Configuration holder for a {@link ConnectionManager}.
 *
 * <p>Carries the transport preference, the fixed set of channels the
 * manager listens to in either mode, and the retry policy of the
 * maintenance loop.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConnectionManagerConfig {

  /** Whether the relay is the preferred transport. */
  private final boolean preferRelay;

  /** The channels to consume, never null or empty. */
  private final List<String> channels;

  /** The reconnection policy, never null. */
  private final RetryPolicy retryPolicy;

  /** Creates a new ConnectionManagerConfig.
   *
   * @param thePreferRelay whether the relay is preferred
   * @param theChannels the channels, never null
   * @param theRetryPolicy the retry policy, never null
   */
  private ConnectionManagerConfig(final boolean thePreferRelay,
      final List<String> theChannels, final RetryPolicy theRetryPolicy) {
    preferRelay = thePreferRelay;
    channels = theChannels;
    retryPolicy = theRetryPolicy;
  }

  /** Creates a configuration for the default channels and retry policy.
   *
   * @param preferRelay true to consume through the relay when it is
   *        reachable, false to always subscribe to the source directly
   *
   * @return a new configuration, never null
   */
  public static ConnectionManagerConfig create(final boolean preferRelay) {
    return create(preferRelay, ChangeChannels.DEFAULT,
        RetryPolicy.defaultPolicy());
  }

  /** Creates a configuration with custom channels and retry policy.
   *
   * @param preferRelay true to consume through the relay when it is
   *        reachable, false to always subscribe to the source directly
   * @param channels the channels to consume, never null or empty
   * @param retryPolicy the reconnection policy, never null
   *
   * @return a new configuration, never null
   *
   * @throws IllegalArgumentException if channels is empty or contains a
   *         blank name
   */
  public static ConnectionManagerConfig create(final boolean preferRelay,
      final List<String> channels, final RetryPolicy retryPolicy) {
    Objects.requireNonNull(channels, "channels must not be null");
    Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
    if (channels.isEmpty()) {
      throw new IllegalArgumentException("channels must not be empty");
    }
    for (final String channel : channels) {
      if (channel == null || channel.isBlank()) {
        throw new IllegalArgumentException(
            "channels must not contain blank names: " + channels);
      }
    }
    return new ConnectionManagerConfig(preferRelay, List.copyOf(channels),
        retryPolicy);
  }

  /** Whether the relay is the preferred transport.
   *
   * @return true if relay mode is preferred
   */
  public boolean preferRelay() {
    return preferRelay;
  }

  /** Returns the channels consumed in either mode.
   *
   * @return an unmodifiable list of channel names, never null
   */
  public List<String> channels() {
    return channels;
  }

  /** Returns the reconnection policy.
   *
   * @return the retry policy, never null
   */
  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }
}
