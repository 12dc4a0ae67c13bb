package org.waabox.fanout.spring;

import org.waabox.fanout.event.HandlerRegistry;

/**
 * A callback interface for registering per-channel change handlers with the
 * {@link org.waabox.fanout.ConnectionManager} created by the
 * auto-configuration.
 *
 * <p>Implement this interface as a Spring bean to register one or more
 * handlers. All discovered {@code ChannelHandlerRegistrar} beans are invoked
 * while the manager bean is created, before its lifecycle starts.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Bean
 * ChannelHandlerRegistrar scoreboardHandlers(final Broadcaster broadcaster) {
 *     return handlers -> {
 *         handlers.register(ChangeChannels.SCOREBOARD,
 *             broadcaster::scoreboardChanged);
 *         handlers.register(ChangeChannels.PLAYCLOCK,
 *             broadcaster::playClockChanged);
 *     };
 * }
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface ChannelHandlerRegistrar {

  /**
   * Registers handlers for one or more channels.
   *
   * @param handlers the registry to add handlers to, never null
   */
  void register(HandlerRegistry handlers);
}
