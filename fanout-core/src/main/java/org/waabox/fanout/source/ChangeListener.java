package org.waabox.fanout.source;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.fanout.NotifierConnectionException;
import org.waabox.fanout.event.ChangeHandler;
import org.waabox.fanout.event.EnvelopeDecodeException;
import org.waabox.fanout.event.RelayEnvelopeCodec;

/** Holds one connection to the source store, listens on a fixed set of
 * channels and hands every decoded change to a sink.
 *
 * <p>The sink is either a relay publisher (in the standalone listener
 * process) or the handler map of a {@link
 * org.waabox.fanout.ConnectionManager} running in fallback mode.
 *
 * <p>Notifications are received by a daemon thread that polls the
 * connection. Blank or malformed payloads are logged and dropped, and sink
 * failures are logged per message; none of them stops the thread. When the
 * connection itself fails the thread exits, the listener stops running and
 * the connection-lost callback fires. The listener never reconnects by
 * itself, its owner decides when to call {@link #start()} again on a new
 * instance.
 *
 * <p>Typical usage:
 * <pre>
 *   ChangeListener listener = new ChangeListener(connector,
 *       ChangeChannels.DEFAULT, relayNotifier::publish);
 *   listener.start();
 *   // ... on shutdown ...
 *   listener.stop();
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ChangeListener {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ChangeListener.class);

  /** Poll timeout of the receive loop, bounds how long stop() waits. */
  private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

  /** How long stop() waits for the receive thread. */
  private static final long JOIN_TIMEOUT_MILLIS = 5_000;

  /** Opens source connections, never null. */
  private final SourceConnector connector;

  /** The channels to listen on, never null. */
  private final List<String> channels;

  /** Receives every decoded change, never null. */
  private final ChangeHandler sink;

  /** Called once when the connection fails, never null. */
  private final Runnable connectionLostCallback;

  /** Whether the receive loop is running. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** The open connection, null when stopped. */
  private volatile SourceConnection connection;

  /** The daemon thread running the receive loop. */
  private volatile Thread receiveThread;

  /** Creates a listener that does not report connection loss.
   *
   * @param theConnector opens the source connection, never null
   * @param theChannels the channels to listen on, never null
   * @param theSink receives every decoded change, never null
   */
  public ChangeListener(final SourceConnector theConnector,
      final List<String> theChannels, final ChangeHandler theSink) {
    this(theConnector, theChannels, theSink, () -> { });
  }

  /** Creates a listener.
   *
   * @param theConnector opens the source connection, never null
   * @param theChannels the channels to listen on, never null
   * @param theSink receives every decoded change, never null
   * @param theConnectionLostCallback called from the receive thread when
   *        the connection fails, never null
   */
  public ChangeListener(final SourceConnector theConnector,
      final List<String> theChannels, final ChangeHandler theSink,
      final Runnable theConnectionLostCallback) {
    connector = Objects.requireNonNull(theConnector,
        "connector must not be null");
    channels = List.copyOf(Objects.requireNonNull(theChannels,
        "channels must not be null"));
    sink = Objects.requireNonNull(theSink, "sink must not be null");
    connectionLostCallback = Objects.requireNonNull(
        theConnectionLostCallback,
        "connectionLostCallback must not be null");
  }

  /** Opens the connection, listens on every channel and starts the receive
   * thread.
   *
   * <p>If a channel registration fails, the channels registered so far are
   * unregistered and the connection is closed before the error surfaces.
   *
   * @throws NotifierConnectionException if the store is unreachable or a
   *         channel cannot be registered
   * @throws IllegalStateException if the listener is already running
   */
  public synchronized void start() {
    if (running.get() || connection != null) {
      throw new IllegalStateException("ChangeListener is already running");
    }

    final SourceConnection conn;
    try {
      conn = connector.connect();
    } catch (final NotifierConnectionException e) {
      throw e;
    } catch (final RuntimeException e) {
      throw new NotifierConnectionException(
          "Failed to connect to the source store", e);
    }
    final List<String> registered = new ArrayList<>();
    try {
      for (final String channel : channels) {
        conn.listen(channel);
        registered.add(channel);
        log.info("Listening on channel: {}", channel);
      }
    } catch (final RuntimeException e) {
      log.warn("Channel registration failed after {} of {} channels, "
          + "rolling back", registered.size(), channels.size());
      unlistenQuietly(conn, registered);
      conn.close();
      if (e instanceof NotifierConnectionException) {
        throw e;
      }
      throw new NotifierConnectionException(
          "Failed to register source channels", e);
    }

    connection = conn;
    running.set(true);

    final Thread thread = new Thread(() -> receiveLoop(conn),
        "fanout-change-listener");
    thread.setDaemon(true);
    receiveThread = thread;
    thread.start();

    log.info("ChangeListener started on {} channels", channels.size());
  }

  /** Stops the receive thread, unregisters every channel and closes the
   * connection.
   *
   * <p>Idempotent: calling it twice, or on a listener that was never
   * started, does nothing. The receive thread is given five seconds to
   * finish; a sink still running after that is logged and left to
   * complete on its own.
   */
  public synchronized void stop() {
    running.set(false);

    final Thread thread = receiveThread;
    receiveThread = null;
    if (thread != null && thread != Thread.currentThread()) {
      thread.interrupt();
      try {
        thread.join(JOIN_TIMEOUT_MILLIS);
        if (thread.isAlive()) {
          log.error("Receive thread did not stop within {} ms, a handler"
              + " may still be running", JOIN_TIMEOUT_MILLIS);
        }
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for receive thread to stop");
      }
    }

    final SourceConnection conn = connection;
    connection = null;
    if (conn == null) {
      return;
    }

    unlistenQuietly(conn, channels);
    conn.close();
    log.info("ChangeListener stopped");
  }

  /** Whether the listener is receiving notifications.
   *
   * @return true between a successful start and a stop or connection loss
   */
  public boolean isRunning() {
    return running.get();
  }

  /** Decodes a notification and hands it to the sink.
   *
   * <p>Package-private for testability.
   *
   * @param channel the channel the notification was raised on, never null
   * @param rawPayload the raw payload text, may be null
   */
  void onNotification(final String channel, final String rawPayload) {
    if (rawPayload == null || rawPayload.isBlank()) {
      log.warn("Empty payload received on channel {}", channel);
      return;
    }

    final JsonNode payload;
    try {
      payload = RelayEnvelopeCodec.parsePayload(rawPayload);
    } catch (final EnvelopeDecodeException e) {
      log.error("Failed to decode payload on {}: {}", channel,
          e.getMessage());
      return;
    }

    try {
      sink.onChange(channel, payload);
      log.debug("Forwarded {} notification", channel);
    } catch (final Exception e) {
      log.error("Error processing notification on {}: {}", channel,
          e.getMessage(), e);
    }
  }

  /** The receive loop. Runs in a daemon thread until {@link #stop()} is
   * called or the connection fails.
   *
   * @param conn the connection to poll, never null
   */
  private void receiveLoop(final SourceConnection conn) {
    try {
      while (running.get() && !Thread.currentThread().isInterrupted()) {
        for (final SourceNotification notification
            : conn.poll(POLL_TIMEOUT)) {
          onNotification(notification.channel(), notification.payload());
        }
      }
    } catch (final RuntimeException e) {
      if (running.compareAndSet(true, false)) {
        log.error("Source connection lost: {}", e.getMessage(), e);
        notifyConnectionLost();
      }
    }
  }

  /** Runs the connection-lost callback, logging its failures. */
  private void notifyConnectionLost() {
    try {
      connectionLostCallback.run();
    } catch (final Exception e) {
      log.error("Connection lost callback failed: {}", e.getMessage(), e);
    }
  }

  /** Unregisters the given channels, logging failures.
   *
   * @param conn the connection, never null
   * @param names the channels to unregister, never null
   */
  private static void unlistenQuietly(final SourceConnection conn,
      final List<String> names) {
    for (final String channel : names) {
      try {
        conn.unlisten(channel);
        log.debug("Removed listener for channel: {}", channel);
      } catch (final Exception e) {
        log.warn("Error removing listener for {}: {}", channel,
            e.getMessage());
      }
    }
  }
}
