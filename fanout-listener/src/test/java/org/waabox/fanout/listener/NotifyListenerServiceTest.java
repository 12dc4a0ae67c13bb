package org.waabox.fanout.listener;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.waabox.fanout.NotifierConnectionException;
import org.waabox.fanout.relay.RelayConnection;
import org.waabox.fanout.relay.RelayConnector;
import org.waabox.fanout.relay.RelayMessage;
import org.waabox.fanout.relay.RelayNotifier;
import org.waabox.fanout.source.SourceConnection;
import org.waabox.fanout.source.SourceConnector;
import org.waabox.fanout.source.SourceNotification;

/** Tests for {@link NotifyListenerService}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class NotifyListenerServiceTest {

  private static final List<String> CHANNELS = List.of("match_change",
      "scoreboard_change");

  private final FakeRelay relay = new FakeRelay();

  private final FakeSource source = new FakeSource();

  private NotifyListenerService service;

  @AfterEach
  void tearDown() {
    if (service != null) {
      service.stop();
    }
  }

  @Test
  void whenNotified_givenRunningService_shouldPublishEnvelopeToRelay()
      throws Exception {
    service = new NotifyListenerService(new RelayNotifier(relay), source,
        CHANNELS, Duration.ofMillis(50));
    service.start();
    awaitConnects(source.connects, 1);

    source.queue.offer(new SourceNotification("match_change",
        "{\"match_id\":7}"));

    final String published = relay.published.poll(5, TimeUnit.SECONDS);
    assertEquals("{\"channel\":\"match_change\",\"payload\":{\"match_id\":7}}",
        published);
    assertEquals(RelayNotifier.DEFAULT_TOPIC, relay.topics.get(0));
  }

  @Test
  void whenSourceConnectionIsLost_givenRunningService_shouldReconnect()
      throws Exception {
    service = new NotifyListenerService(new RelayNotifier(relay), source,
        CHANNELS, Duration.ofMillis(50));
    service.start();
    awaitConnects(source.connects, 1);

    source.failNextPoll = true;

    awaitConnects(source.connects, 2);
    awaitConnects(relay.connects, 2);
    assertTrue(service.isRunning());
  }

  @Test
  void whenPublishFails_givenRunningService_shouldEndSessionAndReconnect()
      throws Exception {
    relay.failPublish = true;
    service = new NotifyListenerService(new RelayNotifier(relay), source,
        CHANNELS, Duration.ofMillis(50));
    service.start();
    awaitConnects(source.connects, 1);

    source.queue.offer(new SourceNotification("match_change", "1"));

    awaitConnects(relay.connects, 2);
    assertTrue(relay.closed.get() >= 1);
  }

  @Test
  void whenSourceIsDown_givenStartup_shouldKeepRetrying() throws Exception {
    source.available = false;
    service = new NotifyListenerService(new RelayNotifier(relay), source,
        CHANNELS, Duration.ofMillis(20));
    service.start();

    awaitConnects(relay.connects, 3);
    source.available = true;
    awaitConnects(source.connects, 1);
  }

  @Test
  void whenRunningSession_givenRelayDown_shouldFailWithoutTouchingSource() {
    final RelayConnector connector = createMock(RelayConnector.class);
    final SourceConnector sourceConnector = createMock(SourceConnector.class);
    expect(connector.connect()).andThrow(
        new NotifierConnectionException("relay unavailable"));
    replay(connector, sourceConnector);

    final NotifyListenerService idle = new NotifyListenerService(
        new RelayNotifier(connector), sourceConnector, CHANNELS,
        Duration.ofSeconds(5));

    assertThrows(NotifierConnectionException.class, idle::runSession);
    verify(connector, sourceConnector);
  }

  @Test
  void whenStopping_givenRunningService_shouldCloseEverything()
      throws Exception {
    service = new NotifyListenerService(new RelayNotifier(relay), source,
        CHANNELS, Duration.ofMillis(50));
    service.start();
    awaitConnects(source.connects, 1);

    service.stop();

    assertFalse(service.isRunning());
    assertEquals(relay.connects.get(), relay.closed.get());
    assertEquals(source.connects.get(), source.closed.get());
  }

  private static void awaitConnects(final AtomicInteger counter,
      final int expected) throws InterruptedException {
    final long deadline = System.currentTimeMillis() + 5_000;
    while (counter.get() < expected) {
      assertTrue(System.currentTimeMillis() < deadline,
          "expected " + expected + " connects, got " + counter.get());
      Thread.sleep(10);
    }
  }

  /** Relay that records what is published. */
  private static final class FakeRelay implements RelayConnector {

    private final AtomicInteger connects = new AtomicInteger();

    private final AtomicInteger closed = new AtomicInteger();

    private final BlockingQueue<String> published = new LinkedBlockingQueue<>();

    private final List<String> topics = new CopyOnWriteArrayList<>();

    private volatile boolean failPublish;

    @Override
    public RelayConnection connect() {
      connects.incrementAndGet();
      return new RelayConnection() {

        @Override
        public void publish(final String topic, final String message) {
          if (failPublish) {
            throw new NotifierConnectionException("broker gone");
          }
          topics.add(topic);
          published.offer(message);
        }

        @Override
        public void subscribe(final String topic) {
        }

        @Override
        public void unsubscribe() {
        }

        @Override
        public List<RelayMessage> receive(final Duration timeout) {
          return List.of();
        }

        @Override
        public void close() {
          closed.incrementAndGet();
        }
      };
    }
  }

  /** Source store fed through a queue. */
  private static final class FakeSource implements SourceConnector {

    private final AtomicInteger connects = new AtomicInteger();

    private final AtomicInteger closed = new AtomicInteger();

    private final BlockingQueue<SourceNotification> queue =
        new LinkedBlockingQueue<>();

    private volatile boolean available = true;

    private volatile boolean failNextPoll;

    @Override
    public SourceConnection connect() {
      if (!available) {
        throw new NotifierConnectionException("database unavailable");
      }
      connects.incrementAndGet();
      return new SourceConnection() {

        @Override
        public void listen(final String channel) {
        }

        @Override
        public void unlisten(final String channel) {
        }

        @Override
        public List<SourceNotification> poll(final Duration timeout) {
          if (failNextPoll) {
            failNextPoll = false;
            throw new NotifierConnectionException("connection reset");
          }
          final List<SourceNotification> result = new ArrayList<>();
          try {
            final SourceNotification first = queue.poll(timeout.toMillis(),
                TimeUnit.MILLISECONDS);
            if (first != null) {
              result.add(first);
            }
          } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return result;
        }

        @Override
        public boolean isValid() {
          return true;
        }

        @Override
        public void close() {
          closed.incrementAndGet();
        }
      };
    }
  }
}
