package com.tradingassistant.infra.ratelimit.errors;

public class RateLimitInterruptedException extends RuntimeException {
  public RateLimitInterruptedException(String message, Throwable cause) {
    super(message, cause);
  }
}
