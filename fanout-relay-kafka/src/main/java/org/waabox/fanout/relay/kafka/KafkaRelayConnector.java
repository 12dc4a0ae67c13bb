package org.waabox.fanout.relay.kafka;

import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.function.Supplier;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.fanout.NotifierConnectionException;
import org.waabox.fanout.relay.RelayConnection;
import org.waabox.fanout.relay.RelayConnector;

/** Opens {@link KafkaRelayConnection}s.
 *
 * <p>Each connection owns one producer and one consumer. The consumer joins
 * a fresh consumer group, so the connection sees every message published
 * after it subscribes, the same way every other process does. A connection
 * is only handed out after the broker answered a metadata request.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaRelayConnector implements RelayConnector {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      KafkaRelayConnector.class);

  /** The Kafka configuration, never null. */
  private final KafkaRelayConfig config;

  /** Creates new consumers, never null. */
  private final Supplier<Consumer<String, String>> consumerFactory;

  /** Creates new producers, never null. */
  private final Supplier<Producer<String, String>> producerFactory;

  /** Creates a connector talking to the configured brokers.
   *
   * @param theConfig the Kafka relay configuration, never null
   */
  public KafkaRelayConnector(final KafkaRelayConfig theConfig) {
    this(theConfig,
        () -> new KafkaConsumer<>(consumerProperties(theConfig)),
        () -> new KafkaProducer<>(producerProperties(theConfig)));
  }

  /** Creates a connector with custom client factories.
   *
   * <p>Package-private for testability.
   *
   * @param theConfig the Kafka relay configuration, never null
   * @param theConsumerFactory creates consumers, never null
   * @param theProducerFactory creates producers, never null
   */
  KafkaRelayConnector(final KafkaRelayConfig theConfig,
      final Supplier<Consumer<String, String>> theConsumerFactory,
      final Supplier<Producer<String, String>> theProducerFactory) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    consumerFactory = Objects.requireNonNull(theConsumerFactory,
        "consumerFactory must not be null");
    producerFactory = Objects.requireNonNull(theProducerFactory,
        "producerFactory must not be null");
  }

  /** {@inheritDoc} */
  @Override
  public RelayConnection connect() {
    Consumer<String, String> consumer = null;
    Producer<String, String> producer = null;
    try {
      consumer = consumerFactory.get();
      producer = producerFactory.get();
      consumer.listTopics(config.requestTimeout());
    } catch (final KafkaException e) {
      KafkaRelayConnection.closeQuietly(producer, "producer");
      KafkaRelayConnection.closeQuietly(consumer, "consumer");
      throw new NotifierConnectionException("Kafka brokers '"
          + config.bootstrapServers() + "' unreachable: " + e.getMessage(),
          e);
    }
    log.debug("Opened Kafka relay connection to '{}'",
        config.bootstrapServers());
    return new KafkaRelayConnection(consumer, producer, config);
  }

  /** Builds the producer properties.
   *
   * <p>Blocking in send is bounded by the request timeout, so publishing
   * to a dead broker fails instead of hanging.
   *
   * @param config the relay configuration, never null
   * @return the producer properties, never null
   */
  static Properties producerProperties(final KafkaRelayConfig config) {
    final Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "1");
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG,
        String.valueOf(config.requestTimeout().toMillis()));
    return props;
  }

  /** Builds the consumer properties with a unique consumer group for
   * broadcast semantics.
   *
   * @param config the relay configuration, never null
   * @return the consumer properties, never null
   */
  static Properties consumerProperties(final KafkaRelayConfig config) {
    final Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,
        config.bootstrapServers());
    props.put(ConsumerConfig.GROUP_ID_CONFIG,
        config.consumerGroupPrefix() + UUID.randomUUID());
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    return props;
  }
}
