package org.waabox.fanout.listener;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.waabox.fanout.ConnectionManager;
import org.waabox.fanout.listener.config.NotifyListenerConfig;
import org.waabox.fanout.listener.config.NotifyListenerProperties;
import org.waabox.fanout.spring.FanoutAutoConfiguration;

/** Tests the listener wiring over the fanout auto-configuration.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class NotifyListenerPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(
          AutoConfigurations.of(FanoutAutoConfiguration.class))
      .withUserConfiguration(NotifyListenerConfig.class)
      .withPropertyValues("fanout.manager.enabled=false",
          "fanout.source.url=postgresql://127.0.0.1:1/none",
          "fanout.relay.kafka.bootstrap-servers=127.0.0.1:1");

  @Test
  void whenBinding_givenNoValue_shouldDefaultToFiveSeconds() {
    assertEquals(Duration.ofSeconds(5),
        new NotifyListenerProperties().getReconnectDelay());
  }

  @Test
  void whenContextLoads_givenTransports_shouldWireServiceWithoutManager() {
    runner.withPropertyValues("fanout.listener.reconnect-delay=250ms")
        .run(context -> {
          final NotifyListenerService service =
              context.getBean(NotifyListenerService.class);
          assertEquals(Duration.ofMillis(250), context.getBean(
              NotifyListenerProperties.class).getReconnectDelay());
          assertEquals(0, context.getBeansOfType(ConnectionManager.class)
              .size());
          service.stop();
        });
  }
}
