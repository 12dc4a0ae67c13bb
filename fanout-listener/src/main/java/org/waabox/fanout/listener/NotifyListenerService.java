package org.waabox.fanout.listener;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.waabox.fanout.NotifierConnectionException;
import org.waabox.fanout.relay.RelayNotifier;
import org.waabox.fanout.source.ChangeListener;
import org.waabox.fanout.source.SourceConnector;

/** Forwards every database change notification to the relay.
 *
 * <p>Each session connects the relay, then starts a {@link ChangeListener}
 * whose sink publishes on the relay topic. A session ends when the database
 * connection is lost or a publish fails; everything is then torn down and,
 * after the reconnect delay, a new session starts. This repeats until the
 * service is stopped.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NotifyListenerService implements SmartLifecycle {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      NotifyListenerService.class);

  /** How long stop() waits for the worker thread. */
  private static final long JOIN_TIMEOUT_MILLIS = 10_000;

  /** The relay to publish to, never null. */
  private final RelayNotifier relayNotifier;

  /** Opens the database connection, never null. */
  private final SourceConnector sourceConnector;

  /** The channels to listen on, never null. */
  private final List<String> channels;

  /** The wait between sessions, never null. */
  private final Duration reconnectDelay;

  /** Whether the service is running. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** The thread running the reconnect loop. */
  private volatile Thread worker;

  /** Creates a new listener service.
   *
   * @param theRelayNotifier the relay to publish to, never null
   * @param theSourceConnector opens the database connection, never null
   * @param theChannels the channels to listen on, never null
   * @param theReconnectDelay the wait between sessions, never null
   */
  public NotifyListenerService(final RelayNotifier theRelayNotifier,
      final SourceConnector theSourceConnector,
      final List<String> theChannels, final Duration theReconnectDelay) {
    relayNotifier = Objects.requireNonNull(theRelayNotifier,
        "relayNotifier must not be null");
    sourceConnector = Objects.requireNonNull(theSourceConnector,
        "sourceConnector must not be null");
    channels = List.copyOf(Objects.requireNonNull(theChannels,
        "channels must not be null"));
    reconnectDelay = Objects.requireNonNull(theReconnectDelay,
        "reconnectDelay must not be null");
  }

  @Override
  public void start() {
    if (running.getAndSet(true)) {
      log.warn("NotifyListenerService is already running");
      return;
    }
    final Thread thread = new Thread(this::runWithReconnect,
        "fanout-notify-listener");
    thread.setDaemon(true);
    worker = thread;
    thread.start();
    log.info("NotifyListenerService started on {} channels", channels.size());
  }

  @Override
  public void stop() {
    if (!running.getAndSet(false)) {
      return;
    }
    log.info("Stopping NotifyListenerService...");
    final Thread thread = worker;
    worker = null;
    if (thread != null) {
      thread.interrupt();
      try {
        thread.join(JOIN_TIMEOUT_MILLIS);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for the listener to stop");
      }
    }
    log.info("NotifyListenerService stopped");
  }

  @Override
  public boolean isRunning() {
    return running.get();
  }

  /** Runs sessions until the service stops, waiting the reconnect delay
   * after each one.
   */
  void runWithReconnect() {
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      try {
        runSession();
      } catch (final NotifierConnectionException e) {
        log.error("Listener session failed: {}", e.getMessage());
      }
      if (!running.get() || Thread.currentThread().isInterrupted()) {
        break;
      }
      log.info("Reconnecting in {} ms", reconnectDelay.toMillis());
      try {
        Thread.sleep(reconnectDelay.toMillis());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
    log.debug("Reconnect loop stopped");
  }

  /** Runs one session: connects the relay and the database, then blocks
   * until the session is lost or the thread is interrupted. Everything
   * opened is closed before returning.
   *
   * <p>Package-private for testability.
   *
   * @throws NotifierConnectionException if the relay or the database is
   *         unreachable
   */
  void runSession() {
    final CountDownLatch sessionLost = new CountDownLatch(1);
    ChangeListener listener = null;
    try {
      relayNotifier.connect();
      listener = new ChangeListener(sourceConnector, channels,
          (channel, payload) -> forward(channel, payload, sessionLost),
          sessionLost::countDown);
      listener.start();
      log.info("Forwarding {} channels to relay topic '{}'",
          channels.size(), relayNotifier.topic());
      sessionLost.await();
      log.warn("Listener session lost");
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      if (listener != null) {
        listener.stop();
      }
      relayNotifier.disconnect();
    }
  }

  /** Publishes one change, ending the session if the relay fails.
   *
   * @param channel the channel, never null
   * @param payload the payload, never null
   * @param sessionLost released when the relay fails, never null
   */
  private void forward(final String channel, final JsonNode payload,
      final CountDownLatch sessionLost) {
    try {
      relayNotifier.publish(channel, payload);
    } catch (final NotifierConnectionException | IllegalStateException e) {
      log.error("Failed to publish {} to relay: {}", channel,
          e.getMessage());
      sessionLost.countDown();
    }
  }

  @Override
  public int getPhase() {
    return Integer.MAX_VALUE - 1;
  }
}
