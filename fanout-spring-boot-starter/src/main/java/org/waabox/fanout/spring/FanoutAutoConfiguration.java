package org.waabox.fanout.spring;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.waabox.fanout.ConnectionManager;
import org.waabox.fanout.ConnectionManagerConfig;
import org.waabox.fanout.RetryPolicy;
import org.waabox.fanout.event.HandlerRegistry;
import org.waabox.fanout.relay.RelayConnector;
import org.waabox.fanout.relay.RelayNotifier;
import org.waabox.fanout.relay.kafka.KafkaRelayConfig;
import org.waabox.fanout.relay.kafka.KafkaRelayConnector;
import org.waabox.fanout.source.SourceConnector;
import org.waabox.fanout.source.postgres.PgSourceConfig;
import org.waabox.fanout.source.postgres.PgSourceConnector;

/**
 * Spring Boot auto-configuration for change-notification fan-out.
 *
 * <p>Creates the transports from {@link FanoutProperties}: a PostgreSQL
 * {@link SourceConnector} when {@code fanout.source.url} is set, and a Kafka
 * {@link RelayConnector} plus its {@link RelayNotifier} when
 * {@code fanout.relay.kafka.bootstrap-servers} is set. Applications may
 * replace any of them with their own bean.
 *
 * <p>Unless {@code fanout.manager.enabled} is false, a singleton
 * {@link ConnectionManager} is created with the handlers of every
 * {@link ChannelHandlerRegistrar} bean, and its startup/shutdown is managed
 * through Spring's {@link SmartLifecycle}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(FanoutProperties.class)
public class FanoutAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FanoutAutoConfiguration.class);

  /**
   * Creates the reconnection retry policy.
   *
   * @param properties the configuration properties, never null
   *
   * @return the retry policy, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy fanoutRetryPolicy(final FanoutProperties properties) {
    return RetryPolicy.of(properties.getRetry().getInitialBackoff(),
        properties.getRetry().getMaxBackoff());
  }

  /**
   * Creates the PostgreSQL source connector.
   *
   * @param properties the configuration properties, never null
   *
   * @return the source connector, never null
   */
  @Bean
  @ConditionalOnProperty(prefix = "fanout.source", name = "url")
  @ConditionalOnMissingBean(SourceConnector.class)
  public PgSourceConnector pgSourceConnector(
      final FanoutProperties properties) {
    final FanoutProperties.Source source = properties.getSource();
    final PgSourceConfig config = PgSourceConfig.create(source.getUrl(),
        source.getUser(), source.getPassword());
    log.info("Fanout source store: {}", config.jdbcUrl());
    return new PgSourceConnector(config);
  }

  /**
   * Creates the Kafka relay connector.
   *
   * @param properties the configuration properties, never null
   *
   * @return the relay connector, never null
   */
  @Bean
  @ConditionalOnProperty(prefix = "fanout.relay.kafka",
      name = "bootstrap-servers")
  @ConditionalOnMissingBean(RelayConnector.class)
  public KafkaRelayConnector kafkaRelayConnector(
      final FanoutProperties properties) {
    final FanoutProperties.Kafka kafka = properties.getRelay().getKafka();
    log.info("Fanout Kafka relay on '{}'", kafka.getBootstrapServers());
    return new KafkaRelayConnector(KafkaRelayConfig.create(
        kafka.getBootstrapServers(), kafka.getConsumerGroupPrefix(),
        kafka.getRequestTimeout(), kafka.getHealthCheckInterval()));
  }

  /**
   * Creates the relay notifier over the relay connector.
   *
   * @param properties the configuration properties, never null
   * @param connector the relay connector, never null
   *
   * @return the relay notifier, never null
   */
  @Bean
  @ConditionalOnBean(RelayConnector.class)
  @ConditionalOnMissingBean
  public RelayNotifier relayNotifier(final FanoutProperties properties,
      final RelayConnector connector) {
    return new RelayNotifier(connector,
        properties.getRelay().getKafka().getTopic());
  }

  /** The connection manager and its lifecycle. */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnProperty(prefix = "fanout.manager", name = "enabled",
      havingValue = "true", matchIfMissing = true)
  static class ConnectionManagerConfiguration {

    /**
     * Creates the singleton {@link ConnectionManager} bean.
     *
     * <p>Without a relay notifier the manager runs in direct mode only.
     *
     * @param properties the configuration properties, never null
     * @param retryPolicy the reconnection retry policy, never null
     * @param relayNotifierProvider provider for an optional RelayNotifier
     * @param sourceConnectorProvider provider for the SourceConnector
     * @param registrars the handler registrars, may be empty
     *
     * @return the configured manager, never null
     *
     * @throws IllegalStateException if no source connector is available
     */
    @Bean
    @ConditionalOnMissingBean
    public ConnectionManager connectionManager(
        final FanoutProperties properties,
        final RetryPolicy retryPolicy,
        final ObjectProvider<RelayNotifier> relayNotifierProvider,
        final ObjectProvider<SourceConnector> sourceConnectorProvider,
        final List<ChannelHandlerRegistrar> registrars) {

      requireAtMostOne(relayNotifierProvider, RelayNotifier.class);
      requireAtMostOne(sourceConnectorProvider, SourceConnector.class);

      final SourceConnector sourceConnector =
          sourceConnectorProvider.getIfAvailable();
      if (sourceConnector == null) {
        throw new IllegalStateException("Fanout requires a SourceConnector "
            + "bean; set fanout.source.url or define one");
      }

      final RelayNotifier relayNotifier =
          relayNotifierProvider.getIfAvailable();
      boolean preferRelay = properties.isPreferRelay();
      if (preferRelay && relayNotifier == null) {
        log.warn("fanout.prefer-relay is set but no relay is configured, "
            + "running in direct mode only");
        preferRelay = false;
      }

      final HandlerRegistry handlers = new HandlerRegistry();
      for (final ChannelHandlerRegistrar registrar : registrars) {
        registrar.register(handlers);
        log.debug("Invoked ChannelHandlerRegistrar: {}",
            registrar.getClass().getSimpleName());
      }

      final ConnectionManager.Builder builder = ConnectionManager.builder()
          .config(ConnectionManagerConfig.create(preferRelay,
              properties.getChannels(), retryPolicy))
          .sourceConnector(sourceConnector);
      if (relayNotifier != null) {
        builder.relayNotifier(relayNotifier);
      }
      for (final String channel : handlers.channels()) {
        handlers.lookup(channel).ifPresent(
            handler -> builder.handler(channel, handler));
      }

      log.info("ConnectionManager created with {} handler(s) over {} "
          + "channel(s)", handlers.channels().size(),
          properties.getChannels().size());

      return builder.build();
    }

    /**
     * Creates a {@link SmartLifecycle} bean that starts the connection
     * manager once the context is refreshed and shuts it down on close.
     *
     * @param manager the connection manager to manage, never null
     *
     * @return the lifecycle bean, never null
     */
    @Bean
    public SmartLifecycle connectionManagerLifecycle(
        final ConnectionManager manager) {
      return new SmartLifecycle() {

        /** Whether the lifecycle is currently running. */
        private volatile boolean running = false;

        @Override
        public void start() {
          log.info("Starting fanout connection manager...");
          manager.startup();
          running = true;
          log.info("Fanout connection manager started in state {}",
              manager.state());
        }

        @Override
        public void stop() {
          log.info("Stopping fanout connection manager...");
          manager.shutdown();
          running = false;
          log.info("Fanout connection manager stopped.");
        }

        @Override
        public boolean isRunning() {
          return running;
        }

        @Override
        public int getPhase() {
          return Integer.MAX_VALUE - 1;
        }
      };
    }
  }

  /**
   * Validates that at most one bean of the given type is present in the
   * application context.
   *
   * @param provider the object provider to validate, never null
   * @param type     the bean type for error reporting, never null
   * @param <T>      the bean type
   *
   * @throws IllegalStateException if more than one bean of the given type
   *                               is present
   */
  private static <T> void requireAtMostOne(final ObjectProvider<T> provider,
      final Class<T> type) {

    final List<String> beanNames = provider.orderedStream()
        .map(bean -> bean.getClass().getSimpleName())
        .collect(Collectors.toList());

    if (beanNames.size() > 1) {
      throw new IllegalStateException(
          "Fanout requires at most one " + type.getSimpleName()
              + " bean, but found " + beanNames.size() + ": "
              + String.join(", ", beanNames));
    }
  }
}
