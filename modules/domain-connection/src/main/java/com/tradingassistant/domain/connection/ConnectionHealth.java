package com.tradingassistant.domain.connection;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time health of the gateway connection. Instances are immutable; the owner replaces
 * the whole record on every change.
 */
public record ConnectionHealth(
    ConnectionState state,
    Instant lastHeartbeatAt,
    Instant connectedAt,
    long reconnectCount,
    long errorCount,
    String lastError,
    double latencyMillis,
    long messagesSent,
    long messagesReceived) {
  public static final Duration HEARTBEAT_FRESHNESS = Duration.ofSeconds(30);

  public ConnectionHealth {
    Objects.requireNonNull(state, "state must not be null");
    if (reconnectCount < 0 || errorCount < 0) {
      throw new ConnectionDomainException("counters must be >= 0");
    }
    if (messagesSent < 0 || messagesReceived < 0) {
      throw new ConnectionDomainException("message counters must be >= 0");
    }
  }

  public static ConnectionHealth initial() {
    return new ConnectionHealth(
        ConnectionState.DISCONNECTED, null, null, 0L, 0L, null, 0.0d, 0L, 0L);
  }

  public boolean isHealthy(Instant now) {
    if (state != ConnectionState.CONNECTED || lastHeartbeatAt == null) {
      return false;
    }
    return Duration.between(lastHeartbeatAt, now).compareTo(HEARTBEAT_FRESHNESS) < 0;
  }

  public Optional<Duration> uptime(Instant now) {
    if (connectedAt == null) {
      return Optional.empty();
    }
    return Optional.of(Duration.between(connectedAt, now));
  }

  public ConnectionHealth withState(ConnectionState next) {
    ConnectionStateMachine.validateTransition(state, next);
    return new ConnectionHealth(
        next,
        lastHeartbeatAt,
        connectedAt,
        reconnectCount,
        errorCount,
        lastError,
        latencyMillis,
        messagesSent,
        messagesReceived);
  }

  public ConnectionHealth connected(Instant now) {
    ConnectionStateMachine.validateTransition(state, ConnectionState.CONNECTED);
    return new ConnectionHealth(
        ConnectionState.CONNECTED,
        now,
        now,
        reconnectCount,
        errorCount,
        lastError,
        latencyMillis,
        messagesSent,
        messagesReceived);
  }

  public ConnectionHealth heartbeat(Instant now, double latency) {
    return new ConnectionHealth(
        state,
        now,
        connectedAt,
        reconnectCount,
        errorCount,
        lastError,
        Math.max(0.0d, latency),
        messagesSent + 1,
        messagesReceived + 1);
  }

  public ConnectionHealth reconnected() {
    return new ConnectionHealth(
        state,
        lastHeartbeatAt,
        connectedAt,
        reconnectCount + 1,
        errorCount,
        lastError,
        latencyMillis,
        messagesSent,
        messagesReceived);
  }

  public ConnectionHealth failed(String error) {
    return new ConnectionHealth(
        state,
        lastHeartbeatAt,
        connectedAt,
        reconnectCount,
        errorCount + 1,
        error,
        latencyMillis,
        messagesSent,
        messagesReceived);
  }

  public ConnectionHealth lastError(String error) {
    return new ConnectionHealth(
        state,
        lastHeartbeatAt,
        connectedAt,
        reconnectCount,
        errorCount,
        error,
        latencyMillis,
        messagesSent,
        messagesReceived);
  }
}
