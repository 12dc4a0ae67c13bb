package org.waabox.fanout.relay;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.fanout.NotifierConnectionException;
import org.waabox.fanout.event.ChangeEvent;
import org.waabox.fanout.event.ChangeHandler;
import org.waabox.fanout.event.EnvelopeDecodeException;
import org.waabox.fanout.event.HandlerRegistry;
import org.waabox.fanout.event.RelayEnvelopeCodec;

/** Publishes change events to the relay and dispatches the ones received
 * back to per-channel callbacks.
 *
 * <p>All logical channels are multiplexed over a single relay topic, so the
 * number of relay subscriptions stays at one regardless of how many channels
 * exist. Each message is a JSON envelope produced by
 * {@link RelayEnvelopeCodec}.
 *
 * <p>Typical usage:
 * <pre>
 *   RelayNotifier notifier = new RelayNotifier(connector);
 *   notifier.connect();
 *   notifier.subscribe();
 *   notifier.registerCallback("match_change", handler);
 *   // on a dedicated thread, until cancelled:
 *   notifier.dispatchLoop();
 *   // ... on shutdown, once the dispatch thread is gone ...
 *   notifier.disconnect();
 * </pre>
 *
 * <p>One instance is created per process and handed to its collaborators.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RelayNotifier {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      RelayNotifier.class);

  /** The default relay topic shared by all channels. */
  public static final String DEFAULT_TOPIC = "pg_notify.events";

  /** Receive timeout of the dispatch loop, bounds cancellation latency. */
  private static final Duration RECEIVE_TIMEOUT = Duration.ofMillis(500);

  /** Opens relay connections, never null. */
  private final RelayConnector connector;

  /** The shared relay topic, never null. */
  private final String topic;

  /** The per-channel callbacks, read on every message. */
  private final HandlerRegistry callbacks = new HandlerRegistry();

  /** The open relay connection, null when disconnected. */
  private volatile RelayConnection connection;

  /** Whether the topic subscription is open. */
  private volatile boolean subscribed;

  /** Set to stop the dispatch loop. */
  private volatile boolean dispatchCancelled;

  /** Creates a notifier on the default topic.
   *
   * @param theConnector opens relay connections, never null
   */
  public RelayNotifier(final RelayConnector theConnector) {
    this(theConnector, DEFAULT_TOPIC);
  }

  /** Creates a notifier.
   *
   * @param theConnector opens relay connections, never null
   * @param theTopic the relay topic shared by all channels, never null
   */
  public RelayNotifier(final RelayConnector theConnector,
      final String theTopic) {
    connector = Objects.requireNonNull(theConnector,
        "connector must not be null");
    topic = Objects.requireNonNull(theTopic, "topic must not be null");
  }

  /** Establishes the relay connection.
   *
   * <p>Does nothing if already connected. On failure no connection is
   * kept.
   *
   * @throws NotifierConnectionException if the relay is unreachable
   */
  public synchronized void connect() {
    if (connection != null) {
      log.warn("RelayNotifier is already connected");
      return;
    }
    try {
      connection = connector.connect();
    } catch (final NotifierConnectionException e) {
      log.error("Failed to connect to relay: {}", e.getMessage());
      throw e;
    } catch (final RuntimeException e) {
      log.error("Failed to connect to relay: {}", e.getMessage());
      throw new NotifierConnectionException("Failed to connect to relay", e);
    }
    log.info("Connected to relay");
  }

  /** Closes the subscription and the connection if open.
   *
   * <p>Idempotent, safe from any state. A running dispatch loop is
   * cancelled; its owner should wait for it to return before calling this
   * method, since relay clients are not required to support a concurrent
   * receive and close.
   */
  public synchronized void disconnect() {
    cancelDispatch();
    unsubscribe();
    final RelayConnection conn = connection;
    connection = null;
    if (conn != null) {
      conn.close();
      log.info("Disconnected from relay");
    }
  }

  /** Publishes a change on the shared relay topic.
   *
   * @param channel the channel the change was raised on, never null
   * @param payload the change payload, never null
   *
   * @throws IllegalStateException if not connected
   * @throws NotifierConnectionException if the relay cannot accept it
   */
  public void publish(final String channel, final JsonNode payload) {
    Objects.requireNonNull(channel, "channel must not be null");
    final RelayConnection conn = connection;
    if (conn == null) {
      throw new IllegalStateException("Relay not connected");
    }
    conn.publish(topic, RelayEnvelopeCodec.encode(
        new ChangeEvent(channel, payload)));
    log.debug("Published to relay: channel={}", channel);
  }

  /** Opens the subscription to the shared relay topic.
   *
   * @throws IllegalStateException if not connected
   * @throws NotifierConnectionException if the subscription fails
   */
  public synchronized void subscribe() {
    final RelayConnection conn = connection;
    if (conn == null) {
      throw new IllegalStateException("Relay not connected");
    }
    if (subscribed) {
      log.debug("Already subscribed to relay topic: {}", topic);
      return;
    }
    conn.subscribe(topic);
    subscribed = true;
    dispatchCancelled = false;
    log.info("Subscribed to relay topic: {}", topic);
  }

  /** Closes the subscription, keeping the connection open. */
  public synchronized void unsubscribe() {
    final RelayConnection conn = connection;
    if (!subscribed || conn == null) {
      subscribed = false;
      return;
    }
    subscribed = false;
    try {
      conn.unsubscribe();
      log.info("Unsubscribed from relay topic: {}", topic);
    } catch (final Exception e) {
      log.warn("Error unsubscribing from relay topic {}: {}", topic,
          e.getMessage());
    }
  }

  /** Registers the callback of a channel, replacing any previous one.
   *
   * @param channel the channel name, never null
   * @param handler the callback, never null
   */
  public void registerCallback(final String channel,
      final ChangeHandler handler) {
    callbacks.register(channel, handler);
    log.debug("Registered callback for channel: {}", channel);
  }

  /** Removes the callback of a channel.
   *
   * @param channel the channel name, never null
   */
  public void unregisterCallback(final String channel) {
    callbacks.unregister(channel);
    log.debug("Unregistered callback for channel: {}", channel);
  }

  /** Receives relay messages and dispatches them to the channel callbacks
   * until cancelled.
   *
   * <p>Cancellation is requested with {@link #cancelDispatch()},
   * {@link #disconnect()} or by interrupting the calling thread, and is the
   * only way this method returns normally. Malformed messages and callback
   * failures are logged per message and never end the loop.
   *
   * @throws IllegalStateException if not subscribed
   * @throws NotifierConnectionException if the relay connection fails
   */
  public void dispatchLoop() {
    if (connection == null || !subscribed) {
      throw new IllegalStateException("Not subscribed to relay topic");
    }

    log.info("Starting relay dispatch loop");

    while (!dispatchCancelled && !Thread.currentThread().isInterrupted()) {
      final RelayConnection conn = connection;
      if (conn == null) {
        break;
      }
      final List<RelayMessage> messages = conn.receive(RECEIVE_TIMEOUT);
      for (final RelayMessage message : messages) {
        if (dispatchCancelled) {
          break;
        }
        dispatch(message);
      }
    }

    log.info("Relay dispatch loop cancelled");
  }

  /** Asks a running dispatch loop to return. Safe from any thread. */
  public void cancelDispatch() {
    dispatchCancelled = true;
    final RelayConnection conn = connection;
    if (conn != null) {
      conn.wakeup();
    }
  }

  /** Whether the relay connection is open.
   *
   * @return true if connected
   */
  public boolean isConnected() {
    return connection != null;
  }

  /** Whether the topic subscription is open.
   *
   * @return true if subscribed
   */
  public boolean isSubscribed() {
    return subscribed;
  }

  /** Returns the shared relay topic.
   *
   * @return the topic, never null
   */
  public String topic() {
    return topic;
  }

  /** Routes a single relay message to its channel callback.
   *
   * <p>Package-private for testability.
   *
   * @param message the received message, never null
   */
  void dispatch(final RelayMessage message) {
    if (!message.isData()) {
      log.debug("Skipping relay control message: {}", message.body());
      return;
    }

    final ChangeEvent event;
    try {
      event = RelayEnvelopeCodec.decode(message.body());
    } catch (final EnvelopeDecodeException e) {
      log.error("Failed to decode relay message: {}", e.getMessage());
      return;
    }

    final Optional<ChangeHandler> handler =
        callbacks.lookup(event.channel());
    if (handler.isEmpty()) {
      log.debug("No callback registered for channel: {}", event.channel());
      return;
    }

    try {
      handler.get().onChange(event.channel(), event.payload());
    } catch (final Exception e) {
      log.error("Error processing relay message on {}: {}",
          event.channel(), e.getMessage(), e);
    }
  }
}
