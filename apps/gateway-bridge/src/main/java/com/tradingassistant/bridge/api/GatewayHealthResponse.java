package com.tradingassistant.bridge.api;

import com.tradingassistant.integration.gateway.ConnectionHealthReport;

public record GatewayHealthResponse(
    String state,
    boolean healthy,
    Long uptimeSeconds,
    long reconnectCount,
    long errorCount,
    double latencyMillis,
    String lastError) {
  public static GatewayHealthResponse from(ConnectionHealthReport report) {
    return new GatewayHealthResponse(
        report.state(),
        report.healthy(),
        report.uptime() == null ? null : report.uptime().getSeconds(),
        report.reconnectCount(),
        report.errorCount(),
        report.latencyMillis(),
        report.lastError());
  }
}
