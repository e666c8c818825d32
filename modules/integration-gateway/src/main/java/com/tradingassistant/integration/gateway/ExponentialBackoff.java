package com.tradingassistant.integration.gateway;

import java.time.Duration;

/** Doubling backoff: attempt 1 waits {@code base}, attempt n waits {@code base * 2^(n-1)}. */
public class ExponentialBackoff {
  private final long baseBackoffMs;

  public ExponentialBackoff(Duration baseBackoff) {
    if (baseBackoff == null || baseBackoff.isNegative()) {
      throw new IllegalArgumentException("baseBackoff must be >= 0");
    }
    this.baseBackoffMs = baseBackoff.toMillis();
  }

  public Duration backoffForAttempt(int attempt) {
    if (baseBackoffMs == 0L) {
      return Duration.ZERO;
    }
    int exponent = Math.max(0, attempt - 1);
    double scaled = baseBackoffMs * Math.pow(2.0d, exponent);
    return Duration.ofMillis((long) Math.min((double) Long.MAX_VALUE, scaled));
  }
}
