package com.tradingassistant.integration.gateway;

import java.time.Duration;

public record ConnectionMonitorConfig(
    Duration heartbeatInterval,
    int maxReconnectAttempts,
    Duration reconnectDelay,
    Duration shutdownTimeout) {
  public ConnectionMonitorConfig {
    if (heartbeatInterval == null || heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
      throw new IllegalArgumentException("heartbeatInterval must be > 0");
    }
    if (maxReconnectAttempts <= 0) {
      throw new IllegalArgumentException("maxReconnectAttempts must be > 0");
    }
    if (reconnectDelay == null || reconnectDelay.isNegative()) {
      throw new IllegalArgumentException("reconnectDelay must be >= 0");
    }
    if (shutdownTimeout == null || shutdownTimeout.isNegative() || shutdownTimeout.isZero()) {
      throw new IllegalArgumentException("shutdownTimeout must be > 0");
    }
  }

  public static ConnectionMonitorConfig defaults() {
    return new ConnectionMonitorConfig(
        Duration.ofSeconds(10), 5, Duration.ofSeconds(5), Duration.ofSeconds(5));
  }

  /** A handle that has not heartbeated for this long is treated as dead. */
  public Duration heartbeatTimeout() {
    return heartbeatInterval.multipliedBy(3);
  }
}
