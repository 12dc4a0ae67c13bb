package org.waabox.fanout.relay.kafka;

import java.time.Duration;
import java.util.Objects;

/** Configuration holder for the Kafka relay.
 *
 * <p>Every connection gets its own consumer group (formed by
 * {@code consumerGroupPrefix + UUID}), so every process receives every
 * message published on the relay topic. The topic itself belongs to the
 * {@link org.waabox.fanout.relay.RelayNotifier}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaRelayConfig {

  /** Default consumer group prefix. */
  private static final String DEFAULT_CONSUMER_GROUP_PREFIX = "fanout-";

  /** Default bound on broker calls made to verify the connection. */
  private static final Duration DEFAULT_REQUEST_TIMEOUT =
      Duration.ofSeconds(5);

  /** Default interval between broker health checks while idle. */
  private static final Duration DEFAULT_HEALTH_CHECK_INTERVAL =
      Duration.ofSeconds(10);

  /** The Kafka bootstrap servers connection string, never null. */
  private final String bootstrapServers;

  /** The prefix for generating unique consumer groups, never null. */
  private final String consumerGroupPrefix;

  /** Bound on connection checks and publish acknowledgements, never
   * null. */
  private final Duration requestTimeout;

  /** How often an idle connection checks the broker, never null. */
  private final Duration healthCheckInterval;

  /** Creates a new KafkaRelayConfig.
   *
   * @param theBootstrapServers the Kafka bootstrap servers, never null
   * @param theConsumerGroupPrefix the consumer group prefix, never null
   * @param theRequestTimeout the broker request bound, never null
   * @param theHealthCheckInterval the idle health check interval, never
   *        null
   */
  private KafkaRelayConfig(final String theBootstrapServers,
      final String theConsumerGroupPrefix, final Duration theRequestTimeout,
      final Duration theHealthCheckInterval) {
    bootstrapServers = Objects.requireNonNull(theBootstrapServers,
        "bootstrapServers must not be null");
    consumerGroupPrefix = Objects.requireNonNull(theConsumerGroupPrefix,
        "consumerGroupPrefix must not be null");
    requestTimeout = Objects.requireNonNull(theRequestTimeout,
        "requestTimeout must not be null");
    healthCheckInterval = Objects.requireNonNull(theHealthCheckInterval,
        "healthCheckInterval must not be null");
    if (bootstrapServers.isBlank()) {
      throw new IllegalArgumentException("bootstrapServers must not be blank");
    }
  }

  /** Creates a configuration with the given bootstrap servers and default
   * values for everything else.
   *
   * @param bootstrapServers the Kafka bootstrap servers (e.g.
   *        "localhost:9092"), never null
   *
   * @return a new KafkaRelayConfig with default values, never null
   */
  public static KafkaRelayConfig create(final String bootstrapServers) {
    return new KafkaRelayConfig(bootstrapServers,
        DEFAULT_CONSUMER_GROUP_PREFIX, DEFAULT_REQUEST_TIMEOUT,
        DEFAULT_HEALTH_CHECK_INTERVAL);
  }

  /** Creates a configuration with a custom consumer group prefix.
   *
   * @param bootstrapServers the Kafka bootstrap servers, never null
   * @param consumerGroupPrefix the prefix for generating unique consumer
   *        groups, never null
   *
   * @return a new KafkaRelayConfig, never null
   */
  public static KafkaRelayConfig create(final String bootstrapServers,
      final String consumerGroupPrefix) {
    return new KafkaRelayConfig(bootstrapServers, consumerGroupPrefix,
        DEFAULT_REQUEST_TIMEOUT, DEFAULT_HEALTH_CHECK_INTERVAL);
  }

  /** Creates a fully custom configuration.
   *
   * @param bootstrapServers the Kafka bootstrap servers, never null
   * @param consumerGroupPrefix the consumer group prefix, never null
   * @param requestTimeout the bound on broker checks and publish
   *        acknowledgements, never null
   * @param healthCheckInterval how often an idle connection checks the
   *        broker, never null
   *
   * @return a new KafkaRelayConfig, never null
   */
  public static KafkaRelayConfig create(final String bootstrapServers,
      final String consumerGroupPrefix, final Duration requestTimeout,
      final Duration healthCheckInterval) {
    return new KafkaRelayConfig(bootstrapServers, consumerGroupPrefix,
        requestTimeout, healthCheckInterval);
  }

  /** Returns the Kafka bootstrap servers connection string.
   *
   * @return the bootstrap servers, never null
   */
  public String bootstrapServers() {
    return bootstrapServers;
  }

  /** Returns the prefix used to generate unique consumer group IDs.
   *
   * @return the consumer group prefix, never null
   */
  public String consumerGroupPrefix() {
    return consumerGroupPrefix;
  }

  /** Returns the bound on connection checks and publish acknowledgements.
   *
   * @return the request timeout, never null
   */
  public Duration requestTimeout() {
    return requestTimeout;
  }

  /** Returns how often an idle connection checks that the broker is still
   * reachable.
   *
   * @return the health check interval, never null
   */
  public Duration healthCheckInterval() {
    return healthCheckInterval;
  }
}
