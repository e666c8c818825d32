package com.tradingassistant.integration.gateway.config;

import com.tradingassistant.integration.gateway.ConnectionMonitorConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.connection")
public class GatewayConnectionProperties {
  private boolean enabled = true;
  private long heartbeatIntervalSeconds = 10L;
  private int maxReconnectAttempts = 5;
  private long reconnectDelaySeconds = 5L;
  private long shutdownTimeoutSeconds = 5L;
  private Retry retry = new Retry();

  public ConnectionMonitorConfig toConfig() {
    return new ConnectionMonitorConfig(
        Duration.ofSeconds(heartbeatIntervalSeconds),
        maxReconnectAttempts,
        Duration.ofSeconds(reconnectDelaySeconds),
        Duration.ofSeconds(shutdownTimeoutSeconds));
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public long getHeartbeatIntervalSeconds() {
    return heartbeatIntervalSeconds;
  }

  public void setHeartbeatIntervalSeconds(long heartbeatIntervalSeconds) {
    this.heartbeatIntervalSeconds = heartbeatIntervalSeconds;
  }

  public int getMaxReconnectAttempts() {
    return maxReconnectAttempts;
  }

  public void setMaxReconnectAttempts(int maxReconnectAttempts) {
    this.maxReconnectAttempts = maxReconnectAttempts;
  }

  public long getReconnectDelaySeconds() {
    return reconnectDelaySeconds;
  }

  public void setReconnectDelaySeconds(long reconnectDelaySeconds) {
    this.reconnectDelaySeconds = reconnectDelaySeconds;
  }

  public long getShutdownTimeoutSeconds() {
    return shutdownTimeoutSeconds;
  }

  public void setShutdownTimeoutSeconds(long shutdownTimeoutSeconds) {
    this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
  }

  public Retry getRetry() {
    return retry;
  }

  public void setRetry(Retry retry) {
    this.retry = retry;
  }

  public static class Retry {
    private int maxAttempts = 3;
    private long baseDelayMs = 1000L;

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }
  }
}
