package org.waabox.fanout.relay.kafka;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.fanout.NotifierConnectionException;
import org.waabox.fanout.relay.RelayConnection;
import org.waabox.fanout.relay.RelayMessage;

/** A {@link RelayConnection} backed by a Kafka producer and consumer.
 *
 * <p>Records with a value are data messages; tombstones (null values) are
 * control messages. A Kafka consumer keeps polling quietly when the brokers
 * disappear, so while no records arrive the connection asks the brokers for
 * metadata every {@link KafkaRelayConfig#healthCheckInterval()} and reports
 * the connection as broken when they do not answer.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class KafkaRelayConnection implements RelayConnection {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      KafkaRelayConnection.class);

  /** The consumer, never null. */
  private final Consumer<String, String> consumer;

  /** The producer, never null. */
  private final Producer<String, String> producer;

  /** The Kafka configuration, never null. */
  private final KafkaRelayConfig config;

  /** When the brokers were last known to be reachable, in millis. */
  private volatile long lastHealthy;

  /** Creates a new connection over already verified clients.
   *
   * @param theConsumer the consumer, never null
   * @param theProducer the producer, never null
   * @param theConfig the relay configuration, never null
   */
  KafkaRelayConnection(final Consumer<String, String> theConsumer,
      final Producer<String, String> theProducer,
      final KafkaRelayConfig theConfig) {
    consumer = Objects.requireNonNull(theConsumer,
        "consumer must not be null");
    producer = Objects.requireNonNull(theProducer,
        "producer must not be null");
    config = Objects.requireNonNull(theConfig, "config must not be null");
    lastHealthy = System.currentTimeMillis();
  }

  /** {@inheritDoc}
   *
   * <p>Waits for the broker acknowledgement, up to the request timeout.
   */
  @Override
  public void publish(final String topic, final String message) {
    Objects.requireNonNull(topic, "topic must not be null");
    Objects.requireNonNull(message, "message must not be null");
    try {
      final RecordMetadata metadata = producer.send(
          new ProducerRecord<>(topic, message))
          .get(config.requestTimeout().toMillis(), TimeUnit.MILLISECONDS);
      log.debug("Published to '{}' partition {} offset {}", topic,
          metadata.partition(), metadata.offset());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NotifierConnectionException(
          "Interrupted while publishing to '" + topic + "'", e);
    } catch (final ExecutionException e) {
      throw new NotifierConnectionException("Failed to publish to '"
          + topic + "': " + e.getCause().getMessage(), e.getCause());
    } catch (final TimeoutException e) {
      throw new NotifierConnectionException(
          "Timed out publishing to '" + topic + "'", e);
    } catch (final KafkaException e) {
      throw new NotifierConnectionException("Failed to publish to '"
          + topic + "': " + e.getMessage(), e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void subscribe(final String topic) {
    try {
      consumer.subscribe(Collections.singletonList(topic));
    } catch (final KafkaException e) {
      throw new NotifierConnectionException(
          "Failed to subscribe to '" + topic + "'", e);
    }
    lastHealthy = System.currentTimeMillis();
  }

  /** {@inheritDoc} */
  @Override
  public void unsubscribe() {
    try {
      consumer.unsubscribe();
    } catch (final KafkaException e) {
      log.warn("Error unsubscribing Kafka consumer: {}", e.getMessage());
    }
  }

  /** {@inheritDoc} */
  @Override
  public List<RelayMessage> receive(final Duration timeout) {
    final ConsumerRecords<String, String> records;
    try {
      records = consumer.poll(timeout);
      if (records.isEmpty()) {
        checkBrokers();
        return List.of();
      }
    } catch (final WakeupException e) {
      return List.of();
    } catch (final InterruptException e) {
      // The client already restored the interrupt flag.
      return List.of();
    } catch (final KafkaException e) {
      throw new NotifierConnectionException(
          "Kafka relay connection failed: " + e.getMessage(), e);
    }

    lastHealthy = System.currentTimeMillis();
    final List<RelayMessage> messages = new ArrayList<>(records.count());
    for (final ConsumerRecord<String, String> record : records) {
      if (record.value() == null) {
        messages.add(RelayMessage.control("tombstone at partition "
            + record.partition() + " offset " + record.offset()));
      } else {
        messages.add(RelayMessage.data(record.value()));
      }
    }
    return messages;
  }

  /** {@inheritDoc} */
  @Override
  public void wakeup() {
    consumer.wakeup();
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    closeQuietly(producer, "producer");
    closeQuietly(consumer, "consumer");
  }

  /** Asks the brokers for metadata when the last sign of life is older
   * than the health check interval.
   *
   * @throws KafkaException if the brokers do not answer
   */
  private void checkBrokers() {
    final long now = System.currentTimeMillis();
    if (now - lastHealthy < config.healthCheckInterval().toMillis()) {
      return;
    }
    consumer.listTopics(config.requestTimeout());
    lastHealthy = now;
  }

  /** Closes an AutoCloseable resource quietly, logging any errors.
   *
   * @param closeable the resource to close, may be null
   * @param name the name for logging purposes, never null
   */
  static void closeQuietly(final AutoCloseable closeable,
      final String name) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (final Exception e) {
        log.warn("Error closing {}: {}", name, e.getMessage(), e);
      }
    }
  }
}
