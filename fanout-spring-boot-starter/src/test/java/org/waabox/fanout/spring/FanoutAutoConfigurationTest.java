package org.waabox.fanout.spring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.fanout.ConnectionManager;
import org.waabox.fanout.ConnectionState;
import org.waabox.fanout.RetryPolicy;
import org.waabox.fanout.relay.RelayNotifier;
import org.waabox.fanout.relay.kafka.KafkaRelayConnector;
import org.waabox.fanout.source.postgres.PgSourceConnector;

/**
 * Tests for {@link FanoutAutoConfiguration}.
 *
 * <p>Uses {@link ApplicationContextRunner} for fast, isolated testing
 * of the auto-configuration without bootstrapping a full Spring Boot
 * application.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FanoutAutoConfigurationTest {

  /** The application context runner configured with the auto-configuration. */
  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(
          AutoConfigurations.of(FanoutAutoConfiguration.class));

  @Test
  void whenContextLoads_givenNoSourceConnector_shouldFail() {
    runner.run(context -> assertNotNull(context.getStartupFailure()));
  }

  @Test
  void whenContextLoads_givenManagerDisabled_shouldNotCreateManager() {
    runner.withPropertyValues("fanout.manager.enabled=false")
        .run(context -> {
          assertFalse(context.containsBean("connectionManager"));
          assertNotNull(context.getBean(RetryPolicy.class));
        });
  }

  @Test
  void whenContextLoads_givenSourceOnly_shouldStartInDirectMode() {
    runner.withUserConfiguration(StubSourceConfig.class)
        .withPropertyValues("fanout.channels=match_change,scoreboard_change")
        .run(context -> {
          final ConnectionManager manager =
              context.getBean(ConnectionManager.class);

          assertFalse(manager.config().preferRelay());
          assertEquals(List.of("match_change", "scoreboard_change"),
              manager.config().channels());
          assertEquals(ConnectionState.FALLBACK_CONNECTED, manager.state());
        });
  }

  @Test
  void whenReceiving_givenHandlerRegistrar_shouldDeliverChanges() {
    runner.withUserConfiguration(StubSourceConfig.class,
        HandlerConfig.class)
        .run(context -> {
          final StubSourceConnector source =
              context.getBean(StubSourceConnector.class);
          final CountDownLatch latch = context.getBean(CountDownLatch.class);

          source.notify("match_change", "{\"match_id\":1}");

          assertTrue(latch.await(5, TimeUnit.SECONDS));
        });
  }

  @Test
  void whenContextCloses_givenRunningManager_shouldShutItDown() {
    final ConnectionManager[] holder = new ConnectionManager[1];
    runner.withUserConfiguration(StubSourceConfig.class)
        .run(context -> holder[0] = context.getBean(ConnectionManager.class));

    assertEquals(ConnectionState.DISCONNECTED, holder[0].state());
    assertFalse(holder[0].isMaintaining());
  }

  @Test
  void whenContextLoads_givenTransportProperties_shouldCreateConnectors() {
    runner.withPropertyValues("fanout.manager.enabled=false",
        "fanout.source.url=postgres://db/scores",
        "fanout.relay.kafka.bootstrap-servers=localhost:9092",
        "fanout.relay.kafka.topic=custom.events",
        "fanout.retry.initial-backoff=1s",
        "fanout.retry.max-backoff=8s")
        .run(context -> {
          assertNotNull(context.getBean(PgSourceConnector.class));
          assertNotNull(context.getBean(KafkaRelayConnector.class));
          assertEquals("custom.events",
              context.getBean(RelayNotifier.class).topic());
          assertEquals(Duration.ofSeconds(8),
              context.getBean(RetryPolicy.class).maxBackoff());
        });
  }

  @Test
  void whenContextLoads_givenNoRelayProperties_shouldNotCreateNotifier() {
    runner.withUserConfiguration(StubSourceConfig.class)
        .withPropertyValues("fanout.manager.enabled=false")
        .run(context -> {
          assertTrue(context.getBeansOfType(RelayNotifier.class).isEmpty());
          assertTrue(context.getBeansOfType(PgSourceConnector.class)
              .isEmpty());
        });
  }

  /** Provides a stub source connector. */
  @Configuration(proxyBeanMethods = false)
  static class StubSourceConfig {

    @Bean
    StubSourceConnector stubSourceConnector() {
      return new StubSourceConnector();
    }
  }

  /** Registers a handler that counts down a latch. */
  @Configuration(proxyBeanMethods = false)
  static class HandlerConfig {

    @Bean
    CountDownLatch deliveries() {
      return new CountDownLatch(1);
    }

    @Bean
    ChannelHandlerRegistrar matchHandlers(final CountDownLatch deliveries) {
      return handlers -> handlers.register("match_change",
          (channel, payload) -> {
            if (payload.get("match_id").asInt() == 1) {
              deliveries.countDown();
            }
          });
    }
  }
}
