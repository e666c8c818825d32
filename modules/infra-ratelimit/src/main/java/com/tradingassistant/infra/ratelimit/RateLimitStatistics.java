package com.tradingassistant.infra.ratelimit;

import java.time.Duration;

public record RateLimitStatistics(
    long totalRequests,
    long acceptedRequests,
    long rejectedRequests,
    long delayedRequests,
    double averageDelayMillis,
    double acceptanceRate,
    Duration period,
    int activeSubscriptions,
    boolean inBackoff,
    int consecutiveErrors) {
  static RateLimitStatistics of(
      long total,
      long accepted,
      long rejected,
      long delayed,
      long totalDelayNanos,
      Duration period,
      int activeSubscriptions,
      boolean inBackoff,
      int consecutiveErrors) {
    double totalDelayMillis = totalDelayNanos / 1_000_000.0d;
    return new RateLimitStatistics(
        total,
        accepted,
        rejected,
        delayed,
        totalDelayMillis / Math.max(delayed, 1L),
        (double) accepted / Math.max(total, 1L),
        period,
        activeSubscriptions,
        inBackoff,
        consecutiveErrors);
  }
}
