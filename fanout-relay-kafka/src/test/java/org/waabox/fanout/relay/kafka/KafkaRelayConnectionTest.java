package org.waabox.fanout.relay.kafka;

import static org.easymock.EasyMock.anyObject;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;
import org.waabox.fanout.NotifierConnectionException;
import org.waabox.fanout.relay.RelayMessage;

/** Tests for {@link KafkaRelayConnection}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class KafkaRelayConnectionTest {

  private static final String TOPIC = "pg_notify.events";

  private static final TopicPartition PARTITION =
      new TopicPartition(TOPIC, 0);

  private final KafkaRelayConfig config = KafkaRelayConfig.create(
      "localhost:9092");

  private final MockConsumer<String, String> consumer =
      new MockConsumer<>(OffsetResetStrategy.EARLIEST);

  private final MockProducer<String, String> producer = new MockProducer<>(
      true, new StringSerializer(), new StringSerializer());

  @Test
  void whenPublishing_givenAcknowledgedSend_shouldWriteToTopic() {
    final KafkaRelayConnection connection = new KafkaRelayConnection(
        consumer, producer, config);

    connection.publish(TOPIC, "{\"channel\":\"a\",\"payload\":1}");

    assertEquals(1, producer.history().size());
    assertEquals(TOPIC, producer.history().get(0).topic());
    assertNull(producer.history().get(0).key());
    assertEquals("{\"channel\":\"a\",\"payload\":1}",
        producer.history().get(0).value());
  }

  @Test
  @SuppressWarnings("unchecked")
  void whenPublishing_givenFailedSend_shouldThrowConnectionException() {
    final Producer<String, String> failing = createMock(Producer.class);
    expect(failing.send(anyObject())).andReturn(
        CompletableFuture.failedFuture(new TimeoutException("no broker")));
    replay(failing);

    final KafkaRelayConnection connection = new KafkaRelayConnection(
        consumer, failing, config);

    assertThrows(NotifierConnectionException.class,
        () -> connection.publish(TOPIC, "{}"));
    verify(failing);
  }

  @Test
  void whenReceiving_givenRecords_shouldMapValuesAndTombstones() {
    final KafkaRelayConnection connection = subscribed();
    consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, null, "{\"a\":1}"));
    consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, "k", null));

    final List<RelayMessage> messages = connection.receive(
        Duration.ofMillis(10));

    assertEquals(2, messages.size());
    assertTrue(messages.get(0).isData());
    assertEquals("{\"a\":1}", messages.get(0).body());
    assertFalse(messages.get(1).isData());
  }

  @Test
  void whenReceiving_givenWakeup_shouldReturnEmpty() {
    final KafkaRelayConnection connection = subscribed();

    connection.wakeup();

    assertTrue(connection.receive(Duration.ofMillis(10)).isEmpty());
  }

  @Test
  void whenReceiving_givenPollFailure_shouldThrowConnectionException() {
    final KafkaRelayConnection connection = subscribed();
    consumer.setPollException(new KafkaException("broker gone"));

    assertThrows(NotifierConnectionException.class,
        () -> connection.receive(Duration.ofMillis(10)));
  }

  @Test
  void whenReceiving_givenIdleAndBrokersSilent_shouldThrowConnectionException() {
    final MockConsumer<String, String> silent =
        new MockConsumer<>(OffsetResetStrategy.EARLIEST) {
          @Override
          public synchronized Map<String, List<PartitionInfo>> listTopics(
              final Duration timeout) {
            throw new TimeoutException("metadata timeout");
          }
        };
    final KafkaRelayConnection connection = new KafkaRelayConnection(silent,
        producer, KafkaRelayConfig.create("localhost:9092", "fanout-",
            Duration.ofMillis(100), Duration.ZERO));
    connection.subscribe(TOPIC);
    silent.rebalance(List.of(PARTITION));
    silent.updateBeginningOffsets(Map.of(PARTITION, 0L));

    assertThrows(NotifierConnectionException.class,
        () -> connection.receive(Duration.ofMillis(10)));
  }

  @Test
  void whenReceiving_givenIdleAndBrokersHealthy_shouldReturnEmpty() {
    final KafkaRelayConnection connection = new KafkaRelayConnection(
        consumer, producer, KafkaRelayConfig.create("localhost:9092",
            "fanout-", Duration.ofMillis(100), Duration.ZERO));
    connection.subscribe(TOPIC);
    consumer.rebalance(List.of(PARTITION));
    consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));

    assertTrue(connection.receive(Duration.ofMillis(10)).isEmpty());
  }

  @Test
  void whenUnsubscribing_givenSubscription_shouldDropIt() {
    final KafkaRelayConnection connection = subscribed();

    connection.unsubscribe();

    assertTrue(consumer.subscription().isEmpty());
  }

  @Test
  void whenClosing_givenOpenClients_shouldCloseBoth() {
    final KafkaRelayConnection connection = subscribed();

    connection.close();

    assertTrue(consumer.closed());
    assertTrue(producer.closed());
  }

  private KafkaRelayConnection subscribed() {
    final KafkaRelayConnection connection = new KafkaRelayConnection(
        consumer, producer, config);
    connection.subscribe(TOPIC);
    consumer.rebalance(List.of(PARTITION));
    consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
    return connection;
  }
}
