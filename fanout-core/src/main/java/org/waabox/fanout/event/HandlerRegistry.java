package org.waabox.fanout.event;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps each channel to the single handler that receives its changes.
 *
 * <p>Registering a handler for a channel that already has one replaces it
 * (last registration wins). Lookups are always served from the current
 * mapping, so changes take effect on the next delivered message.
 *
 * <p>Thread safety: this class is thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HandlerRegistry {

  /** The handlers, keyed by channel. */
  private final Map<String, ChangeHandler> handlers =
      new ConcurrentHashMap<>();

  /**
   * Creates a registry pre-populated with the given handlers.
   *
   * @param handlers the handlers keyed by channel, never null
   * @return a new registry, never null
   */
  public static HandlerRegistry of(final Map<String, ChangeHandler> handlers) {
    Objects.requireNonNull(handlers, "handlers must not be null");
    final HandlerRegistry registry = new HandlerRegistry();
    handlers.forEach(registry::register);
    return registry;
  }

  /**
   * Registers the handler for a channel, replacing any previous one.
   *
   * @param channel the channel name, never null
   * @param handler the handler, never null
   */
  public void register(final String channel, final ChangeHandler handler) {
    Objects.requireNonNull(channel, "channel must not be null");
    Objects.requireNonNull(handler, "handler must not be null");
    handlers.put(channel, handler);
  }

  /**
   * Removes the handler of a channel. Does nothing if there is none.
   *
   * @param channel the channel name, never null
   */
  public void unregister(final String channel) {
    Objects.requireNonNull(channel, "channel must not be null");
    handlers.remove(channel);
  }

  /**
   * Returns the handler currently registered for a channel.
   *
   * @param channel the channel name, may be null
   * @return the handler, or empty if none is registered
   */
  public Optional<ChangeHandler> lookup(final String channel) {
    if (channel == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(handlers.get(channel));
  }

  /**
   * Returns the channels that currently have a handler.
   *
   * @return an immutable snapshot of the channel names, never null
   */
  public Set<String> channels() {
    return Set.copyOf(handlers.keySet());
  }
}
