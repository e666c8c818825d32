package com.tradingassistant.infra.ratelimit.config;

import com.tradingassistant.infra.ratelimit.RateLimitConfig;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.rate-limit")
public class RateLimitProperties {
  private boolean enabled = true;
  private int maxRequestsPerSecond = 50;
  private int maxOrdersPerSecond = 5;
  private int maxMarketDataLines = 100;
  private int maxHistoricalDataRequests = 60;
  private long historicalDataWindowSeconds = 600L;
  private int burstSize = 10;
  private long initialBackoffMs = 100L;
  private long maxBackoffMs = 30_000L;
  private double backoffMultiplier = 2.0d;
  private boolean resetBackoffOnSuccess;

  public RateLimitConfig toConfig() {
    return new RateLimitConfig(
        maxRequestsPerSecond,
        maxOrdersPerSecond,
        maxMarketDataLines,
        maxHistoricalDataRequests,
        Duration.ofSeconds(historicalDataWindowSeconds),
        burstSize,
        Duration.ofMillis(initialBackoffMs),
        Duration.ofMillis(maxBackoffMs),
        backoffMultiplier);
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getMaxRequestsPerSecond() {
    return maxRequestsPerSecond;
  }

  public void setMaxRequestsPerSecond(int maxRequestsPerSecond) {
    this.maxRequestsPerSecond = maxRequestsPerSecond;
  }

  public int getMaxOrdersPerSecond() {
    return maxOrdersPerSecond;
  }

  public void setMaxOrdersPerSecond(int maxOrdersPerSecond) {
    this.maxOrdersPerSecond = maxOrdersPerSecond;
  }

  public int getMaxMarketDataLines() {
    return maxMarketDataLines;
  }

  public void setMaxMarketDataLines(int maxMarketDataLines) {
    this.maxMarketDataLines = maxMarketDataLines;
  }

  public int getMaxHistoricalDataRequests() {
    return maxHistoricalDataRequests;
  }

  public void setMaxHistoricalDataRequests(int maxHistoricalDataRequests) {
    this.maxHistoricalDataRequests = maxHistoricalDataRequests;
  }

  public long getHistoricalDataWindowSeconds() {
    return historicalDataWindowSeconds;
  }

  public void setHistoricalDataWindowSeconds(long historicalDataWindowSeconds) {
    this.historicalDataWindowSeconds = historicalDataWindowSeconds;
  }

  public int getBurstSize() {
    return burstSize;
  }

  public void setBurstSize(int burstSize) {
    this.burstSize = burstSize;
  }

  public long getInitialBackoffMs() {
    return initialBackoffMs;
  }

  public void setInitialBackoffMs(long initialBackoffMs) {
    this.initialBackoffMs = initialBackoffMs;
  }

  public long getMaxBackoffMs() {
    return maxBackoffMs;
  }

  public void setMaxBackoffMs(long maxBackoffMs) {
    this.maxBackoffMs = maxBackoffMs;
  }

  public double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  public void setBackoffMultiplier(double backoffMultiplier) {
    this.backoffMultiplier = backoffMultiplier;
  }

  public boolean isResetBackoffOnSuccess() {
    return resetBackoffOnSuccess;
  }

  public void setResetBackoffOnSuccess(boolean resetBackoffOnSuccess) {
    this.resetBackoffOnSuccess = resetBackoffOnSuccess;
  }
}
