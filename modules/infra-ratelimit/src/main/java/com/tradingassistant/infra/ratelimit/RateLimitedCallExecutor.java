package com.tradingassistant.infra.ratelimit;

import java.util.Locale;
import java.util.Objects;

/**
 * Runs a gateway call behind {@link GatewayRateLimiter#acquire(OperationClass, int)} and feeds
 * gateway-reported rate violations back into the limiter's backoff.
 */
public class RateLimitedCallExecutor {
  private final GatewayRateLimiter rateLimiter;
  private final boolean resetBackoffOnSuccess;

  public RateLimitedCallExecutor(GatewayRateLimiter rateLimiter) {
    this(rateLimiter, false);
  }

  public RateLimitedCallExecutor(GatewayRateLimiter rateLimiter, boolean resetBackoffOnSuccess) {
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
    this.resetBackoffOnSuccess = resetBackoffOnSuccess;
  }

  public <T> T execute(OperationClass operationClass, Operation<T> operation) {
    return execute(operationClass, 1, operation);
  }

  public <T> T execute(OperationClass operationClass, int weight, Operation<T> operation) {
    Objects.requireNonNull(operation, "operation must not be null");
    rateLimiter.acquire(operationClass, weight);
    try {
      T result = operation.run();
      if (resetBackoffOnSuccess) {
        rateLimiter.resetBackoff();
      }
      return result;
    } catch (RuntimeException ex) {
      if (isGatewayRateViolation(ex)) {
        rateLimiter.handleRateLimitError(ex.getMessage());
      }
      throw ex;
    }
  }

  /** Matches "rate ... limit" or "pacing violation" anywhere in the cause chain. */
  public static boolean isGatewayRateViolation(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth < 16) {
      String message = current.getMessage();
      if (message != null) {
        String normalized = message.toLowerCase(Locale.ROOT);
        if ((normalized.contains("rate") && normalized.contains("limit"))
            || normalized.contains("pacing violation")) {
          return true;
        }
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
      depth++;
    }
    return false;
  }

  @FunctionalInterface
  public interface Operation<T> {
    T run();
  }
}
