package org.waabox.fanout.listener.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.fanout.listener.NotifyListenerService;
import org.waabox.fanout.relay.RelayNotifier;
import org.waabox.fanout.source.SourceConnector;
import org.waabox.fanout.spring.FanoutProperties;

/** Wires the listener service over the transports created by the fanout
 * starter from {@code fanout.source.*} and {@code fanout.relay.kafka.*}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@Configuration
@EnableConfigurationProperties(NotifyListenerProperties.class)
public class NotifyListenerConfig {

  /** Creates the listener service.
   *
   * @param relayNotifier the relay to publish to, never null
   * @param sourceConnector the database to listen on, never null
   * @param fanoutProperties the channel settings, never null
   * @param listenerProperties the reconnect settings, never null
   *
   * @return the listener service, never null
   */
  @Bean
  public NotifyListenerService notifyListenerService(
      final RelayNotifier relayNotifier,
      final SourceConnector sourceConnector,
      final FanoutProperties fanoutProperties,
      final NotifyListenerProperties listenerProperties) {
    return new NotifyListenerService(relayNotifier, sourceConnector,
        fanoutProperties.getChannels(),
        listenerProperties.getReconnectDelay());
  }
}
