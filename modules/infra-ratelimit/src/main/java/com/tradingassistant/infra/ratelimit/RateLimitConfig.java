package com.tradingassistant.infra.ratelimit;

import java.time.Duration;

public record RateLimitConfig(
    int maxRequestsPerSecond,
    int maxOrdersPerSecond,
    int maxMarketDataLines,
    int maxHistoricalDataRequests,
    Duration historicalDataWindow,
    int burstSize,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier) {
  public RateLimitConfig {
    if (maxRequestsPerSecond <= 0) {
      throw new IllegalArgumentException("maxRequestsPerSecond must be > 0");
    }
    if (maxOrdersPerSecond <= 0) {
      throw new IllegalArgumentException("maxOrdersPerSecond must be > 0");
    }
    if (maxMarketDataLines <= 0) {
      throw new IllegalArgumentException("maxMarketDataLines must be > 0");
    }
    if (maxHistoricalDataRequests <= 0) {
      throw new IllegalArgumentException("maxHistoricalDataRequests must be > 0");
    }
    if (historicalDataWindow == null
        || historicalDataWindow.isNegative()
        || historicalDataWindow.isZero()) {
      throw new IllegalArgumentException("historicalDataWindow must be > 0");
    }
    if (burstSize <= 0) {
      throw new IllegalArgumentException("burstSize must be > 0");
    }
    if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
      throw new IllegalArgumentException("initialBackoff must be > 0");
    }
    if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
    }
    if (backoffMultiplier < 1.0d) {
      throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
    }
  }

  public static RateLimitConfig defaults() {
    return new RateLimitConfig(
        50,
        5,
        100,
        60,
        Duration.ofMinutes(10),
        10,
        Duration.ofMillis(100),
        Duration.ofSeconds(30),
        2.0d);
  }
}
