package com.tradingassistant.infra.ratelimit.errors;

import java.time.Duration;
import java.util.Objects;

public class RateLimitExceededException extends RuntimeException {
  private final String limitType;
  private final Duration retryAfter;

  public RateLimitExceededException(String limitType, Duration retryAfter) {
    super("Rate limit exceeded for " + limitType);
    this.limitType = Objects.requireNonNull(limitType, "limitType must not be null");
    this.retryAfter =
        retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
  }

  public String limitType() {
    return limitType;
  }

  public Duration retryAfter() {
    return retryAfter;
  }

  public long retryAfterSeconds() {
    return retryAfter.getSeconds();
  }
}
