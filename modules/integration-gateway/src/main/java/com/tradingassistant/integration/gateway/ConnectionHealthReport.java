package com.tradingassistant.integration.gateway;

import com.tradingassistant.domain.connection.ConnectionHealth;
import java.time.Duration;
import java.time.Instant;

public record ConnectionHealthReport(
    String state,
    boolean healthy,
    Duration uptime,
    long reconnectCount,
    long errorCount,
    double latencyMillis,
    String lastError) {
  public static ConnectionHealthReport from(ConnectionHealth health, Instant now) {
    return new ConnectionHealthReport(
        health.state().value(),
        health.isHealthy(now),
        health.uptime(now).orElse(null),
        health.reconnectCount(),
        health.errorCount(),
        health.latencyMillis(),
        health.lastError());
  }
}
