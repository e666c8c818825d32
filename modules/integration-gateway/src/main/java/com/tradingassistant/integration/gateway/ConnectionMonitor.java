package com.tradingassistant.integration.gateway;

import com.tradingassistant.domain.connection.ConnectionDomainException;
import com.tradingassistant.domain.connection.ConnectionHealth;
import com.tradingassistant.domain.connection.ConnectionState;
import com.tradingassistant.domain.connection.ConnectionStateMachine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one gateway session alive.
 *
 * <p>Two background loops run every heartbeat interval on their own daemon threads: the
 * liveness loop decides whether the session is still usable and triggers {@link #reconnect()}
 * when it is not, the heartbeat loop pings the session and records latency. Reconnection is
 * serialized; callers that queue behind a running sequence get that sequence's outcome
 * instead of starting another one.
 *
 * <p>{@link ConnectionState#ERROR} is only left through an explicit {@link #reconnect()}: the
 * liveness loop does not retry an exhausted sequence on its own.
 */
public class ConnectionMonitor {
  private static final Logger log = LoggerFactory.getLogger(ConnectionMonitor.class);

  private final GatewaySessionFactory sessionFactory;
  private final ConnectionMonitorConfig config;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final Sleeper sleeper;
  private final ExponentialBackoff reconnectBackoff;

  private final AtomicReference<ConnectionHealth> health =
      new AtomicReference<>(ConnectionHealth.initial());
  private final AtomicReference<GatewaySession> sessionRef = new AtomicReference<>();
  private final AtomicReference<SessionCapabilities> capabilitiesRef = new AtomicReference<>();
  private final AtomicInteger stateGauge =
      new AtomicInteger(ConnectionState.DISCONNECTED.ordinal());

  private final ReentrantLock reconnectLock = new ReentrantLock();
  private final AtomicLong reconnectGeneration = new AtomicLong();
  private volatile boolean lastReconnectOutcome;

  private volatile ConnectionCallback connectedCallback = ConnectionCallback.noop();
  private volatile ConnectionCallback disconnectedCallback = ConnectionCallback.noop();
  private volatile ConnectionErrorCallback errorCallback = ConnectionErrorCallback.noop();

  private final ScheduledExecutorService livenessScheduler;
  private final ScheduledExecutorService heartbeatScheduler;
  private final AtomicReference<ScheduledFuture<?>> livenessTaskRef = new AtomicReference<>();
  private final AtomicReference<ScheduledFuture<?>> heartbeatTaskRef = new AtomicReference<>();
  private final AtomicBoolean loopsStarted = new AtomicBoolean(false);
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  private final Counter heartbeatFailures;
  private final Timer heartbeatLatency;

  public ConnectionMonitor(
      GatewaySessionFactory sessionFactory,
      ConnectionMonitorConfig config,
      MeterRegistry meterRegistry) {
    this(
        sessionFactory,
        config,
        meterRegistry,
        Clock.systemUTC(),
        duration -> Thread.sleep(duration.toMillis()));
  }

  public ConnectionMonitor(
      GatewaySessionFactory sessionFactory,
      ConnectionMonitorConfig config,
      MeterRegistry meterRegistry,
      Clock clock,
      Sleeper sleeper) {
    this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory must not be null");
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    this.reconnectBackoff = new ExponentialBackoff(config.reconnectDelay());
    this.livenessScheduler = daemonScheduler("gateway-liveness");
    this.heartbeatScheduler = daemonScheduler("gateway-heartbeat");
    this.heartbeatFailures =
        Counter.builder("gateway.connection.heartbeat.failures.total")
            .description("Heartbeats that failed or found the gateway unreachable")
            .register(meterRegistry);
    this.heartbeatLatency =
        Timer.builder("gateway.connection.heartbeat.latency")
            .description("Round-trip time of gateway heartbeats")
            .register(meterRegistry);
    meterRegistry.gauge("gateway.connection.state", List.of(), stateGauge);
  }

  public void start() {
    if (!transition(ConnectionState.CONNECTING, h -> h.withState(ConnectionState.CONNECTING))) {
      throw new ConnectionDomainException(
          "Cannot start gateway connection monitor from state " + state().value());
    }
    log.info(
        "Starting gateway connection monitor heartbeatIntervalMs={} maxReconnectAttempts={}",
        config.heartbeatInterval().toMillis(),
        config.maxReconnectAttempts());

    GatewaySession session;
    try {
      session = establish();
    } catch (GatewayConnectionException ex) {
      String message = messageOf(ex);
      transition(ConnectionState.ERROR, h -> h.withState(ConnectionState.ERROR).failed(message));
      log.error("Failed to start gateway connection monitor error={}", message);
      throw ex;
    }
    if (!install(session, false)) {
      throw new GatewayConnectionException("Gateway connection monitor was stopped during start");
    }
    log.info("Gateway connection established");
    fireConnected();
    ensureLoopsRunning();
  }

  /**
   * Stops both loops, waits for them to finish, then releases the session. Safe to call more
   * than once.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    log.info("Stopping gateway connection monitor");
    transition(ConnectionState.SHUTDOWN, h -> h.withState(ConnectionState.SHUTDOWN));
    cancelTask(livenessTaskRef);
    cancelTask(heartbeatTaskRef);
    livenessScheduler.shutdownNow();
    heartbeatScheduler.shutdownNow();
    awaitLoops();

    GatewaySession session = sessionRef.getAndSet(null);
    capabilitiesRef.set(null);
    if (session != null) {
      disconnectQuietly(session);
      log.info("Gateway session disconnected");
      fireDisconnected();
    }
  }

  /**
   * Runs the reconnection sequence unless the connection is already up.
   *
   * @return {@code true} when the monitor ends up connected
   */
  public boolean reconnect() {
    long observedGeneration = reconnectGeneration.get();
    try {
      reconnectLock.lockInterruptibly();
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      return false;
    }
    try {
      ConnectionState current = state();
      if (current == ConnectionState.CONNECTED) {
        return true;
      }
      if (current == ConnectionState.SHUTDOWN) {
        return false;
      }
      if (reconnectGeneration.get() != observedGeneration) {
        return lastReconnectOutcome;
      }
      boolean outcome = runReconnectSequence();
      lastReconnectOutcome = outcome;
      reconnectGeneration.incrementAndGet();
      return outcome;
    } finally {
      reconnectLock.unlock();
    }
  }

  public boolean isConnected() {
    return state() == ConnectionState.CONNECTED;
  }

  public ConnectionState state() {
    return health.get().state();
  }

  public ConnectionHealth health() {
    return health.get();
  }

  public ConnectionHealthReport healthReport() {
    return ConnectionHealthReport.from(health.get(), clock.instant());
  }

  /** The live session, present only while connected. */
  public Optional<GatewaySession> connection() {
    GatewaySession session = sessionRef.get();
    if (session == null || !isConnected()) {
      return Optional.empty();
    }
    return Optional.of(session);
  }

  public void onConnected(ConnectionCallback callback) {
    this.connectedCallback = callback == null ? ConnectionCallback.noop() : callback;
  }

  public void onDisconnected(ConnectionCallback callback) {
    this.disconnectedCallback = callback == null ? ConnectionCallback.noop() : callback;
  }

  public void onError(ConnectionErrorCallback callback) {
    this.errorCallback = callback == null ? ConnectionErrorCallback.noop() : callback;
  }

  public ConnectionMonitorConfig config() {
    return config;
  }

  void checkLiveness() {
    try {
      ConnectionState current = state();
      if (current != ConnectionState.CONNECTED && current != ConnectionState.DISCONNECTED) {
        return;
      }
      if (isAlive()) {
        return;
      }
      transition(ConnectionState.DISCONNECTED, h -> h.withState(ConnectionState.DISCONNECTED));
      log.warn("Gateway connection check failed, attempting recovery");
      reconnect();
    } catch (RuntimeException ex) {
      log.error("Unexpected failure in gateway liveness check", ex);
      String message = messageOf(ex);
      health.updateAndGet(h -> h.failed(message));
    }
  }

  void sendHeartbeat() {
    if (!isConnected()) {
      return;
    }
    SessionCapabilities capabilities = capabilitiesRef.get();
    if (sessionRef.get() == null || capabilities == null) {
      return;
    }
    long startedAt = System.nanoTime();
    try {
      Optional<Pingable> pingable = capabilities.ping();
      Optional<LivenessAware> liveness = capabilities.liveness();
      if (pingable.isPresent()) {
        pingable.get().ping();
      } else if (liveness.isPresent() && !liveness.get().isConnected()) {
        throw new ConnectionLostException("Gateway session reports disconnected");
      }
      long elapsedNanos = System.nanoTime() - startedAt;
      Instant now = clock.instant();
      health.updateAndGet(
          h ->
              h.state() == ConnectionState.CONNECTED
                  ? h.heartbeat(now, elapsedNanos / 1_000_000.0d)
                  : h);
      heartbeatLatency.record(elapsedNanos, TimeUnit.NANOSECONDS);
    } catch (ConnectionLostException ex) {
      heartbeatFailures.increment();
      String message = messageOf(ex);
      log.warn("Heartbeat detected gateway connection loss message={}", message);
      transition(
          ConnectionState.DISCONNECTED,
          h -> h.withState(ConnectionState.DISCONNECTED).lastError(message));
    } catch (RuntimeException ex) {
      heartbeatFailures.increment();
      log.error("Gateway heartbeat failed", ex);
      String message = messageOf(ex);
      health.updateAndGet(h -> h.failed(message));
    }
  }

  private boolean isAlive() {
    GatewaySession session = sessionRef.get();
    ConnectionHealth current = health.get();
    if (session == null || current.state() != ConnectionState.CONNECTED) {
      return false;
    }
    SessionCapabilities capabilities = capabilitiesRef.get();
    Optional<LivenessAware> liveness =
        capabilities == null ? Optional.empty() : capabilities.liveness();
    if (liveness.isPresent()) {
      boolean connected;
      try {
        connected = liveness.get().isConnected();
      } catch (RuntimeException ex) {
        log.warn("Gateway liveness probe failed message={}", messageOf(ex));
        return false;
      }
      if (!connected) {
        log.warn("Gateway session reports disconnected");
        return false;
      }
    }
    Instant lastHeartbeatAt = current.lastHeartbeatAt();
    if (lastHeartbeatAt != null) {
      Duration sinceHeartbeat = Duration.between(lastHeartbeatAt, clock.instant());
      if (sinceHeartbeat.compareTo(config.heartbeatTimeout()) > 0) {
        log.warn("No gateway heartbeat sinceHeartbeatMs={}", sinceHeartbeat.toMillis());
        return false;
      }
    }
    return true;
  }

  private boolean runReconnectSequence() {
    if (!transition(ConnectionState.RECONNECTING, h -> h.withState(ConnectionState.RECONNECTING))) {
      return isConnected();
    }
    int maxAttempts = config.maxReconnectAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      Duration delay = reconnectBackoff.backoffForAttempt(attempt);
      log.info(
          "Gateway reconnect attempt attempt={} maxAttempts={} delayMs={}",
          attempt,
          maxAttempts,
          delay.toMillis());
      try {
        releaseStaleSession();
        if (!delay.isZero()) {
          sleeper.sleep(delay);
        }
        if (state() == ConnectionState.SHUTDOWN) {
          return false;
        }
        GatewaySession session = establish();
        if (!install(session, true)) {
          return false;
        }
        recordReconnect("success");
        log.info("Gateway reconnect succeeded attempts={}", attempt);
        fireConnected();
        ensureLoopsRunning();
        return true;
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        recordReconnect("aborted");
        transition(
            ConnectionState.ERROR,
            h -> h.withState(ConnectionState.ERROR).lastError("Reconnect interrupted"));
        log.info("Gateway reconnect aborted attempt={}", attempt);
        return false;
      } catch (RuntimeException ex) {
        String message = messageOf(ex);
        health.updateAndGet(h -> h.failed(message));
        log.warn("Gateway reconnect attempt failed attempt={} error={}", attempt, message);
      }
    }

    if (!transition(ConnectionState.ERROR, h -> h.withState(ConnectionState.ERROR))) {
      return false;
    }
    recordReconnect("exhausted");
    log.error("Gateway reconnect attempts exhausted maxAttempts={}", maxAttempts);
    fireError(
        new ConnectionLostException(
            "Gateway reconnection failed after " + maxAttempts + " attempts"));
    return false;
  }

  private GatewaySession establish() {
    GatewaySession session;
    try {
      session = sessionFactory.create();
    } catch (RuntimeException ex) {
      throw connectFailure(ex);
    }
    if (session == null) {
      throw new GatewayConnectionException("Failed to connect: session factory returned null");
    }
    try {
      session.connect();
    } catch (RuntimeException ex) {
      disconnectQuietly(session);
      throw connectFailure(ex);
    }
    return session;
  }

  private boolean install(GatewaySession session, boolean reconnected) {
    Instant now = clock.instant();
    UnaryOperator<ConnectionHealth> change =
        reconnected ? h -> h.connected(now).reconnected() : h -> h.connected(now);
    sessionRef.set(session);
    capabilitiesRef.set(SessionCapabilities.of(session));
    if (transition(ConnectionState.CONNECTED, change)) {
      return true;
    }
    if (sessionRef.compareAndSet(session, null)) {
      capabilitiesRef.set(null);
      disconnectQuietly(session);
    }
    return false;
  }

  private void releaseStaleSession() {
    GatewaySession stale = sessionRef.getAndSet(null);
    capabilitiesRef.set(null);
    if (stale != null) {
      disconnectQuietly(stale);
      fireDisconnected();
    }
  }

  private boolean transition(ConnectionState next, UnaryOperator<ConnectionHealth> change) {
    while (true) {
      ConnectionHealth current = health.get();
      if (!ConnectionStateMachine.canTransition(current.state(), next)) {
        return false;
      }
      if (health.compareAndSet(current, change.apply(current))) {
        stateGauge.set(next.ordinal());
        log.debug(
            "Gateway connection state transition from={} to={}",
            current.state().value(),
            next.value());
        return true;
      }
    }
  }

  private void ensureLoopsRunning() {
    if (stopped.get() || !loopsStarted.compareAndSet(false, true)) {
      return;
    }
    long intervalMs = config.heartbeatInterval().toMillis();
    livenessTaskRef.set(
        livenessScheduler.scheduleWithFixedDelay(
            this::checkLiveness, intervalMs, intervalMs, TimeUnit.MILLISECONDS));
    heartbeatTaskRef.set(
        heartbeatScheduler.scheduleWithFixedDelay(
            this::sendHeartbeat, intervalMs, intervalMs, TimeUnit.MILLISECONDS));
  }

  private void awaitLoops() {
    long deadline = System.nanoTime() + config.shutdownTimeout().toNanos();
    try {
      for (ScheduledExecutorService scheduler : List.of(livenessScheduler, heartbeatScheduler)) {
        long remaining = Math.max(0L, deadline - System.nanoTime());
        if (!scheduler.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
          log.warn(
              "Gateway monitor loop did not stop in time shutdownTimeoutMs={}",
              config.shutdownTimeout().toMillis());
        }
      }
    } catch (InterruptedException interrupted) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for gateway monitor loops to stop");
    }
  }

  private void fireConnected() {
    ConnectionHealth snapshot = health.get();
    try {
      connectedCallback.onEvent(snapshot);
    } catch (RuntimeException ex) {
      log.error("Gateway connected callback failed", ex);
    }
  }

  private void fireDisconnected() {
    ConnectionHealth snapshot = health.get();
    try {
      disconnectedCallback.onEvent(snapshot);
    } catch (RuntimeException ex) {
      log.error("Gateway disconnected callback failed", ex);
    }
  }

  private void fireError(GatewayConnectionException error) {
    try {
      errorCallback.onError(error);
    } catch (RuntimeException ex) {
      log.error("Gateway error callback failed", ex);
    }
  }

  private void recordReconnect(String outcome) {
    Counter.builder("gateway.connection.reconnect.total")
        .description("Gateway reconnection sequences by outcome")
        .tag("outcome", outcome)
        .register(meterRegistry)
        .increment();
  }

  private static void disconnectQuietly(GatewaySession session) {
    try {
      session.disconnect();
    } catch (RuntimeException ex) {
      log.warn("Error while disconnecting gateway session message={}", messageOf(ex));
    }
  }

  private static GatewayConnectionException connectFailure(RuntimeException ex) {
    if (ex instanceof GatewayConnectionException connectionException) {
      return connectionException;
    }
    return new GatewayConnectionException("Failed to connect: " + messageOf(ex), ex);
  }

  private static void cancelTask(AtomicReference<ScheduledFuture<?>> taskRef) {
    ScheduledFuture<?> task = taskRef.getAndSet(null);
    if (task != null) {
      task.cancel(true);
    }
  }

  private static ScheduledExecutorService daemonScheduler(String threadName) {
    return Executors.newSingleThreadScheduledExecutor(
        runnable -> {
          Thread thread = new Thread(runnable, threadName);
          thread.setDaemon(true);
          return thread;
        });
  }

  private static String messageOf(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }

  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
