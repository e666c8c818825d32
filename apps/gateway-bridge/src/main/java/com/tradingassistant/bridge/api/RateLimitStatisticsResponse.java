package com.tradingassistant.bridge.api;

import com.tradingassistant.infra.ratelimit.RateLimitStatistics;

public record RateLimitStatisticsResponse(
    long totalRequests,
    long acceptedRequests,
    long rejectedRequests,
    long delayedRequests,
    double averageDelayMillis,
    double acceptanceRate,
    long periodSeconds,
    int activeSubscriptions,
    boolean inBackoff,
    int consecutiveErrors) {
  public static RateLimitStatisticsResponse from(RateLimitStatistics statistics) {
    return new RateLimitStatisticsResponse(
        statistics.totalRequests(),
        statistics.acceptedRequests(),
        statistics.rejectedRequests(),
        statistics.delayedRequests(),
        statistics.averageDelayMillis(),
        statistics.acceptanceRate(),
        statistics.period().getSeconds(),
        statistics.activeSubscriptions(),
        statistics.inBackoff(),
        statistics.consecutiveErrors());
  }
}
