package org.waabox.fanout;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.fanout.event.ChangeHandler;
import org.waabox.fanout.event.HandlerRegistry;
import org.waabox.fanout.relay.RelayNotifier;
import org.waabox.fanout.source.ChangeListener;
import org.waabox.fanout.source.SourceConnector;

/**
 * Per-process orchestrator that keeps a live change-notification path open
 * and delivers every change to the handler of its channel.
 *
 * <p>The manager prefers consuming changes through the relay
 * ({@link ConnectionState#RELAY_CONNECTED}). When the relay is unreachable
 * it opens its own subscription to the source store
 * ({@link ConnectionState#FALLBACK_CONNECTED}). When neither is reachable it
 * stays {@link ConnectionState#DEGRADED}: the surrounding service keeps
 * serving last-known data while a background maintenance loop retries,
 * relay first, then fallback. When the relay comes back while the manager
 * runs in fallback, the maintenance loop moves it back to the relay and
 * closes the direct source connection.
 *
 * <p>The same handler map is used in both modes, so switching transport
 * never changes what the handlers receive. Messages in flight during a
 * switch may be lost.
 *
 * <p>Instances are created through the fluent {@link Builder} starting with
 * {@link #builder()}:
 * <pre>{@code
 * ConnectionManager manager = ConnectionManager.builder()
 *     .config(ConnectionManagerConfig.create(true))
 *     .relayNotifier(new RelayNotifier(kafkaRelayConnector))
 *     .sourceConnector(pgSourceConnector)
 *     .handler(ChangeChannels.MATCHDATA, broadcaster::matchDataChanged)
 *     .handler(ChangeChannels.PLAYCLOCK, broadcaster::playClockChanged)
 *     .build();
 *
 * manager.startup();
 * // ...
 * manager.shutdown();
 * }</pre>
 *
 * <p>Thread safety: transitions run under a single lock. Threads that
 * detect a lost connection (the relay dispatch thread, the listener receive
 * thread) never take that lock; they only wake the maintenance thread,
 * which performs the transition. State reads are lock-free.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ConnectionManager {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      ConnectionManager.class);

  /** How long shutdown waits for each background thread. */
  private static final long JOIN_TIMEOUT_MILLIS = 5_000;

  /** The manager configuration. */
  private final ConnectionManagerConfig config;

  /** The relay notifier, null when relay mode is not preferred. */
  private final RelayNotifier relayNotifier;

  /** Opens the direct source connection used in fallback mode. */
  private final SourceConnector sourceConnector;

  /** The handlers, keyed by channel. */
  private final HandlerRegistry handlers;

  /** Guards every transition and the resource handles below. */
  private final ReentrantLock lock = new ReentrantLock();

  /** Wakes the maintenance loop when a connection is lost. */
  private final Semaphore wakeups = new Semaphore(0);

  /** Whether startup() has been called. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether shutdown() has been called. */
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  /** The current state. Written under the lock. */
  private volatile ConnectionState state = ConnectionState.DISCONNECTED;

  /** Set by the dispatch thread when the relay connection fails. */
  private volatile boolean relayLost;

  /** Set by the listener receive thread when the source connection
   * fails. */
  private volatile boolean fallbackLost;

  /** The direct source listener while in fallback mode. */
  private ChangeListener fallbackListener;

  /** The thread running the relay dispatch loop. */
  private volatile Thread dispatchThread;

  /** The thread running the maintenance loop. */
  private volatile Thread maintenanceThread;

  /**
   * Creates a new connection manager.
   *
   * @param config          the configuration, never null
   * @param relayNotifier   the relay notifier, may be null when relay mode
   *                        is not preferred
   * @param sourceConnector the fallback source connector, never null
   * @param handlers        the handlers keyed by channel, never null
   */
  private ConnectionManager(final ConnectionManagerConfig config,
      final RelayNotifier relayNotifier,
      final SourceConnector sourceConnector,
      final HandlerRegistry handlers) {
    this.config = config;
    this.relayNotifier = relayNotifier;
    this.sourceConnector = sourceConnector;
    this.handlers = handlers;
  }

  /**
   * Creates a new builder for constructing a connection manager.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Opens the preferred notification path and starts the maintenance loop.
   *
   * <p>Tries the relay first when it is preferred, then the direct source
   * connection. If both fail the manager becomes degraded; this method still
   * returns normally and the maintenance loop keeps retrying.
   *
   * @throws IllegalStateException if already started or shut down
   */
  public void startup() {
    if (shutdown.get()) {
      throw new IllegalStateException(
          "ConnectionManager has been shut down");
    }
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException(
          "ConnectionManager has already been started");
    }

    log.info("Starting ConnectionManager ({} mode preferred, {} channels)",
        config.preferRelay() ? "relay" : "direct",
        config.channels().size());

    lock.lock();
    try {
      restoreConnection();
    } finally {
      lock.unlock();
    }

    startMaintenance();

    if (isDegraded()) {
      log.warn("ConnectionManager started degraded, serving without live "
          + "updates until a transport is reachable");
    }
  }

  /**
   * Connects to the relay, subscribes, registers one callback per channel
   * and starts the dispatch loop.
   *
   * <p>The state becomes {@link ConnectionState#RELAY_CONNECTED} only after
   * every step succeeded. On failure the callbacks registered so far are
   * removed and the relay is disconnected before the error is reported.
   *
   * <p>Any open direct subscription is closed first, so a single path is
   * ever open. Does nothing when the relay is already connected and
   * healthy.
   *
   * @throws NotifierConnectionException if the relay is unreachable
   * @throws IllegalStateException if no relay notifier is configured, or
   *         the manager is not started or has been shut down
   */
  public void connectToRelay() {
    lock.lock();
    try {
      requireRunning();
      connectToRelayLocked();
    } finally {
      wakeMaintenanceIfNotPreferred();
      lock.unlock();
    }
  }

  /**
   * Opens a direct subscription to the source store on every channel.
   *
   * <p>The relay and any previous listener are torn down first. The state
   * becomes {@link ConnectionState#FALLBACK_CONNECTED} on success. Does
   * nothing when a live direct listener is already open.
   *
   * @throws NotifierConnectionException if the store is unreachable
   * @throws IllegalStateException if the manager is not started or has
   *         been shut down
   */
  public void connectToFallback() {
    lock.lock();
    try {
      requireRunning();
      connectToFallbackLocked();
    } finally {
      wakeMaintenanceIfNotPreferred();
      lock.unlock();
    }
  }

  /**
   * Moves from the relay to a direct source subscription.
   *
   * <p>Used when the relay is lost while running. Does nothing and reports
   * success when already in fallback mode with a live listener. Otherwise
   * relay resources are torn down first, then the direct subscription is
   * opened; if that fails the manager becomes degraded.
   *
   * <p>Returns false without doing anything on a manager that is not
   * started or has been shut down.
   *
   * @return true if the manager is in fallback mode afterwards
   */
  public boolean switchToFallbackMode() {
    lock.lock();
    try {
      if (!isRunning()) {
        return false;
      }
      return switchToFallbackLocked();
    } finally {
      wakeMaintenanceIfNotPreferred();
      lock.unlock();
    }
  }

  /**
   * Moves from the direct source subscription back to the relay.
   *
   * <p>Does nothing when not in fallback mode, when the relay is not the
   * preferred mode, or on a manager that is not started or has been shut
   * down. Otherwise the direct listener is stopped first, then the relay is
   * connected. If the relay fails the direct subscription is reopened so
   * the manager is never left without a path it just had; if that fails
   * too the manager becomes degraded.
   *
   * @return true if the manager is in relay mode afterwards
   */
  public boolean switchToRelayMode() {
    lock.lock();
    try {
      if (!isRunning()) {
        return false;
      }
      return switchToRelayLocked();
    } finally {
      wakeMaintenanceIfNotPreferred();
      lock.unlock();
    }
  }

  /** Switches to fallback mode. Must hold the lock.
   *
   * @return true if the manager is in fallback mode afterwards
   */
  private boolean switchToFallbackLocked() {
    if (state == ConnectionState.FALLBACK_CONNECTED
        && fallbackListener != null && fallbackListener.isRunning()) {
      log.debug("Already in fallback mode");
      return true;
    }

    log.warn("Switching to fallback mode (direct source subscription)");
    teardownRelay();
    teardownFallback();
    try {
      connectToFallbackLocked();
      return true;
    } catch (final NotifierConnectionException e) {
      log.error("Fallback connection failed: {}", e.getMessage());
      transition(ConnectionState.DEGRADED);
      return false;
    }
  }

  /** Switches back to relay mode. Must hold the lock.
   *
   * @return true if the manager is in relay mode afterwards
   */
  private boolean switchToRelayLocked() {
    if (!config.preferRelay() || relayNotifier == null) {
      log.debug("Relay mode not preferred, ignoring switch to relay");
      return false;
    }
    if (state != ConnectionState.FALLBACK_CONNECTED) {
      log.debug("Not in fallback mode, ignoring switch to relay");
      return state == ConnectionState.RELAY_CONNECTED;
    }

    log.info("Relay available, switching from fallback to relay mode");
    teardownFallback();
    try {
      connectToRelayLocked();
      return true;
    } catch (final NotifierConnectionException e) {
      log.warn("Relay switch failed, reopening fallback: {}",
          e.getMessage());
    }
    try {
      connectToFallbackLocked();
    } catch (final NotifierConnectionException e) {
      log.error("Fallback reconnection failed: {}", e.getMessage());
      transition(ConnectionState.DEGRADED);
    }
    return false;
  }

  /**
   * Runs the maintenance loop until shutdown.
   *
   * <p>While the manager is in its preferred mode the loop sleeps until a
   * connection loss wakes it up. Otherwise it runs a
   * {@link #maintainOnce() maintenance pass} after each backoff period of
   * the retry policy, the backoff growing on every failed pass and resetting
   * once the preferred mode is restored.
   */
  void maintainConnection() {
    boolean healthy = isInPreferredMode();
    int attempt = healthy ? 0 : 1;

    while (!shutdown.get() && !Thread.currentThread().isInterrupted()) {
      try {
        if (healthy) {
          wakeups.acquire();
        } else {
          final Duration backoff = config.retryPolicy().backoff(attempt);
          log.debug("Next reconnection attempt in {} ms", backoff.toMillis());
          wakeups.tryAcquire(backoff.toMillis(), TimeUnit.MILLISECONDS);
        }
        wakeups.drainPermits();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }

      healthy = maintainOnce();
      attempt = healthy ? 0 : attempt + 1;
    }
    log.debug("Maintenance loop stopped");
  }

  /**
   * Runs a single maintenance pass.
   *
   * <p>Reacts to a lost relay by switching to fallback and to a lost
   * direct listener by becoming degraded; then, when degraded, retries the
   * relay and the fallback, and when in fallback while the relay is
   * preferred, probes the relay and switches back to it if reachable.
   *
   * <p>Package-private for testability.
   *
   * @return true if the manager is in its preferred mode afterwards
   */
  boolean maintainOnce() {
    lock.lock();
    try {
      if (shutdown.get()) {
        return true;
      }

      if (relayLost && state == ConnectionState.RELAY_CONNECTED) {
        log.warn("Relay connection lost");
        switchToFallbackLocked();
      }
      if (fallbackLost && state == ConnectionState.FALLBACK_CONNECTED) {
        log.warn("Direct source connection lost");
        teardownFallback();
        transition(ConnectionState.DEGRADED);
      }

      if (state == ConnectionState.DEGRADED) {
        restoreConnection();
      } else if (state == ConnectionState.FALLBACK_CONNECTED
          && config.preferRelay() && probeRelay()) {
        switchToRelayLocked();
      }

      return isInPreferredMode();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Tears down every active resource and returns to
   * {@link ConnectionState#DISCONNECTED}.
   *
   * <p>Stops the maintenance and dispatch threads and waits for them to
   * finish, disconnects the relay and stops the direct listener. Safe to
   * call from any state, including on a manager that never started or is
   * degraded with nothing open, and safe to call more than once.
   *
   * <p>Each background thread is given up to five seconds to finish. A
   * handler that blocks longer than that is logged at error level and may
   * still complete after this method returns; otherwise no handler is
   * invoked after this method returns.
   */
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      log.debug("ConnectionManager already shut down");
      return;
    }

    log.info("Shutting down ConnectionManager from state {}", state);

    stopMaintenance();

    lock.lock();
    try {
      if (relayNotifier != null) {
        teardownRelay();
      }
      teardownFallback();
      transition(ConnectionState.DISCONNECTED);
    } finally {
      lock.unlock();
    }

    log.info("ConnectionManager shut down");
  }

  /**
   * Returns the current state.
   *
   * @return the state, never null
   */
  public ConnectionState state() {
    return state;
  }

  /**
   * Whether a live notification path is open.
   *
   * @return true in relay or fallback mode
   */
  public boolean isConnected() {
    return state.isConnected();
  }

  /**
   * Whether the manager has no live notification path and is retrying.
   *
   * @return true when degraded
   */
  public boolean isDegraded() {
    return state == ConnectionState.DEGRADED;
  }

  /**
   * Whether changes are consumed directly from the source store.
   *
   * @return true in fallback mode
   */
  public boolean isUsingFallback() {
    return state == ConnectionState.FALLBACK_CONNECTED;
  }

  /**
   * Whether the maintenance loop is running.
   *
   * @return true between startup and shutdown
   */
  public boolean isMaintaining() {
    final Thread thread = maintenanceThread;
    return thread != null && thread.isAlive();
  }

  /**
   * Returns the configuration of this manager.
   *
   * @return the configuration, never null
   */
  public ConnectionManagerConfig config() {
    return config;
  }

  /** Tries the relay (when preferred) and then the fallback, becoming
   * degraded when both fail. Must hold the lock.
   */
  private void restoreConnection() {
    if (config.preferRelay()) {
      try {
        connectToRelayLocked();
        return;
      } catch (final NotifierConnectionException e) {
        log.warn("Relay unavailable: {}", e.getMessage());
      }
    }
    try {
      connectToFallbackLocked();
      return;
    } catch (final NotifierConnectionException e) {
      log.warn("Direct source unavailable: {}", e.getMessage());
    }
    transition(ConnectionState.DEGRADED);
  }

  /** Connects the relay path, closing the direct one. Must hold the lock.
   */
  private void connectToRelayLocked() {
    if (relayNotifier == null) {
      throw new IllegalStateException("No relay notifier configured");
    }
    if (state == ConnectionState.RELAY_CONNECTED && !relayLost) {
      log.debug("Already connected to relay");
      return;
    }
    teardownFallback();
    if (dispatchThread != null) {
      teardownRelay();
    }
    relayLost = false;
    try {
      if (!relayNotifier.isConnected()) {
        relayNotifier.connect();
      }
      relayNotifier.subscribe();
      for (final String channel : config.channels()) {
        relayNotifier.registerCallback(channel, this::deliver);
      }
      startDispatch();
    } catch (final RuntimeException e) {
      teardownRelay();
      if (state.isConnected()) {
        transition(ConnectionState.DEGRADED);
      }
      if (e instanceof NotifierConnectionException) {
        throw e;
      }
      throw new NotifierConnectionException("Failed to connect to relay", e);
    }
    transition(ConnectionState.RELAY_CONNECTED);
  }

  /** Opens the direct source path, closing the relay and any previous
   * listener. Must hold the lock.
   */
  private void connectToFallbackLocked() {
    if (state == ConnectionState.FALLBACK_CONNECTED && !fallbackLost
        && fallbackListener != null && fallbackListener.isRunning()) {
      log.debug("Already connected to the source store");
      return;
    }
    teardownRelay();
    teardownFallback();
    final ChangeListener listener = new ChangeListener(sourceConnector,
        config.channels(), this::deliver, this::onFallbackLost);
    try {
      listener.start();
    } catch (final RuntimeException e) {
      if (state.isConnected()) {
        transition(ConnectionState.DEGRADED);
      }
      throw e;
    }
    fallbackListener = listener;
    transition(ConnectionState.FALLBACK_CONNECTED);
  }

  /** Checks whether the relay accepts connections, keeping the connection
   * open for the switch that follows. Must hold the lock.
   *
   * @return true if the relay is reachable
   */
  private boolean probeRelay() {
    if (relayNotifier == null) {
      return false;
    }
    try {
      relayNotifier.connect();
      return true;
    } catch (final NotifierConnectionException e) {
      log.debug("Relay still unavailable: {}", e.getMessage());
      return false;
    }
  }

  /** Stops the dispatch thread, removes the callbacks and disconnects the
   * relay. Must hold the lock.
   */
  private void teardownRelay() {
    if (relayNotifier == null) {
      return;
    }
    stopDispatch();
    for (final String channel : config.channels()) {
      relayNotifier.unregisterCallback(channel);
    }
    relayNotifier.disconnect();
    relayLost = false;
  }

  /** Stops the direct listener if any. Must hold the lock. */
  private void teardownFallback() {
    final ChangeListener listener = fallbackListener;
    fallbackListener = null;
    if (listener != null) {
      listener.stop();
    }
    fallbackLost = false;
  }

  /** Starts the relay dispatch thread. */
  private void startDispatch() {
    final Thread thread = new Thread(this::runDispatch,
        "fanout-relay-dispatch");
    thread.setDaemon(true);
    dispatchThread = thread;
    thread.start();
  }

  /** Cancels the relay dispatch loop and waits for its thread. */
  private void stopDispatch() {
    final Thread thread = dispatchThread;
    dispatchThread = null;
    relayNotifier.cancelDispatch();
    if (thread != null && thread != Thread.currentThread()) {
      thread.interrupt();
      join(thread, "relay dispatch");
    }
  }

  /** Body of the dispatch thread. Flags relay loss for the maintenance
   * loop when the dispatch loop fails.
   */
  private void runDispatch() {
    try {
      relayNotifier.dispatchLoop();
    } catch (final RuntimeException e) {
      if (dispatchThread == Thread.currentThread()) {
        log.error("Relay dispatch loop failed: {}", e.getMessage(), e);
        relayLost = true;
        wakeups.release();
      }
    }
  }

  /** Called from the listener receive thread on source connection loss. */
  private void onFallbackLost() {
    fallbackLost = true;
    wakeups.release();
  }

  /** Starts the maintenance thread. */
  private void startMaintenance() {
    final Thread thread = new Thread(this::maintainConnection,
        "fanout-connection-maintenance");
    thread.setDaemon(true);
    maintenanceThread = thread;
    thread.start();
  }

  /** Interrupts the maintenance thread and waits for it. */
  private void stopMaintenance() {
    final Thread thread = maintenanceThread;
    maintenanceThread = null;
    if (thread != null && thread != Thread.currentThread()) {
      thread.interrupt();
      join(thread, "maintenance");
    }
  }

  /** Delivers a change to the handler of its channel.
   *
   * @param channel the channel, never null
   * @param payload the payload, never null
   */
  private void deliver(final String channel, final JsonNode payload) {
    final Optional<ChangeHandler> handler = handlers.lookup(channel);
    if (handler.isEmpty()) {
      log.debug("No handler registered for channel: {}", channel);
      return;
    }
    handler.get().onChange(channel, payload);
  }

  /** Sets the state, logging the transition. Must hold the lock.
   *
   * @param newState the new state, never null
   */
  private void transition(final ConnectionState newState) {
    final ConnectionState previous = state;
    state = newState;
    if (previous != newState) {
      log.info("Connection state {} -> {}", previous, newState);
    }
  }

  /** Whether the manager runs on its preferred transport.
   *
   * @return true if relay connected (or fallback connected when the relay
   *         is not preferred)
   */
  private boolean isInPreferredMode() {
    return config.preferRelay()
        ? state == ConnectionState.RELAY_CONNECTED
        : state == ConnectionState.FALLBACK_CONNECTED;
  }

  /** Whether startup() has been called and shutdown() has not. */
  private boolean isRunning() {
    return started.get() && !shutdown.get();
  }

  /** Fails unless the manager is started and not shut down. */
  private void requireRunning() {
    if (shutdown.get()) {
      throw new IllegalStateException(
          "ConnectionManager has been shut down");
    }
    if (!started.get()) {
      throw new IllegalStateException(
          "ConnectionManager has not been started");
    }
  }

  /** Wakes the maintenance loop after an external transition left the
   * manager outside its preferred mode, so retries resume.
   */
  private void wakeMaintenanceIfNotPreferred() {
    if (isRunning() && !isInPreferredMode()) {
      wakeups.release();
    }
  }

  /** Waits for a thread to finish, restoring the interrupt flag if
   * interrupted.
   *
   * @param thread the thread, never null
   * @param name the thread role for logging, never null
   */
  private static void join(final Thread thread, final String name) {
    try {
      thread.join(JOIN_TIMEOUT_MILLIS);
      if (thread.isAlive()) {
        log.error("The {} thread did not stop within {} ms, a handler may"
            + " still be running", name, JOIN_TIMEOUT_MILLIS);
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the {} thread to stop", name);
    }
  }

  /**
   * Builder for creating {@link ConnectionManager} instances.
   *
   * <p>The configuration defaults to
   * {@code ConnectionManagerConfig.create(true)}. A source connector is
   * always required; a relay notifier is required when the relay is
   * preferred.
   */
  public static final class Builder {

    /** The configuration. */
    private ConnectionManagerConfig config;

    /** The relay notifier. */
    private RelayNotifier relayNotifier;

    /** The fallback source connector. */
    private SourceConnector sourceConnector;

    /** The handlers. */
    private final HandlerRegistry handlers = new HandlerRegistry();

    /** Creates a new builder. */
    private Builder() {
    }

    /**
     * Sets the configuration.
     *
     * @param theConfig the configuration, never null
     * @return this builder, never null
     */
    public Builder config(final ConnectionManagerConfig theConfig) {
      config = Objects.requireNonNull(theConfig, "config must not be null");
      return this;
    }

    /**
     * Sets the relay notifier.
     *
     * @param theRelayNotifier the relay notifier, never null
     * @return this builder, never null
     */
    public Builder relayNotifier(final RelayNotifier theRelayNotifier) {
      relayNotifier = Objects.requireNonNull(theRelayNotifier,
          "relayNotifier must not be null");
      return this;
    }

    /**
     * Sets the connector of the direct source subscription.
     *
     * @param theSourceConnector the source connector, never null
     * @return this builder, never null
     */
    public Builder sourceConnector(final SourceConnector theSourceConnector) {
      sourceConnector = Objects.requireNonNull(theSourceConnector,
          "sourceConnector must not be null");
      return this;
    }

    /**
     * Registers the handler of a channel, replacing any previous one.
     *
     * @param channel the channel name, never null
     * @param handler the handler, never null
     * @return this builder, never null
     */
    public Builder handler(final String channel,
        final ChangeHandler handler) {
      handlers.register(channel, handler);
      return this;
    }

    /**
     * Registers several handlers at once.
     *
     * @param theHandlers the handlers keyed by channel, never null
     * @return this builder, never null
     */
    public Builder handlers(final Map<String, ChangeHandler> theHandlers) {
      Objects.requireNonNull(theHandlers, "handlers must not be null");
      theHandlers.forEach(handlers::register);
      return this;
    }

    /**
     * Builds the connection manager.
     *
     * @return a new manager in {@link ConnectionState#DISCONNECTED}, never
     *         null
     *
     * @throws IllegalStateException if the source connector is missing, or
     *         the relay is preferred and no relay notifier was set
     */
    public ConnectionManager build() {
      final ConnectionManagerConfig resolved = config != null
          ? config : ConnectionManagerConfig.create(true);
      if (sourceConnector == null) {
        throw new IllegalStateException("sourceConnector is required");
      }
      if (resolved.preferRelay() && relayNotifier == null) {
        throw new IllegalStateException(
            "relayNotifier is required when the relay is preferred");
      }
      final HandlerRegistry registry = new HandlerRegistry();
      for (final String channel : handlers.channels()) {
        handlers.lookup(channel).ifPresent(
            handler -> registry.register(channel, handler));
      }
      return new ConnectionManager(resolved, relayNotifier, sourceConnector,
          registry);
    }
  }
}
