package com.tradingassistant.infra.ratelimit.observability;

import com.tradingassistant.infra.ratelimit.OperationClass;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;

public class MicrometerRateLimitTelemetry implements RateLimitTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerRateLimitTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onAccepted(OperationClass operationClass) {
    Counter.builder("gateway.ratelimit.requests.total")
        .description("Gateway calls evaluated by the rate limiter, by outcome")
        .tag("operation", safeOperation(operationClass))
        .tag("outcome", "accepted")
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onRejected(OperationClass operationClass, String limitType) {
    Counter.builder("gateway.ratelimit.requests.total")
        .description("Gateway calls evaluated by the rate limiter, by outcome")
        .tag("operation", safeOperation(operationClass))
        .tag("outcome", "rejected")
        .tag("limit_type", limitType == null || limitType.isBlank() ? "unknown" : limitType)
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onDelayed(OperationClass operationClass, Duration delay) {
    Timer.builder("gateway.ratelimit.delay")
        .description("Time callers waited for rate limit tokens")
        .tag("operation", safeOperation(operationClass))
        .register(meterRegistry)
        .record(delay == null || delay.isNegative() ? Duration.ZERO : delay);
  }

  @Override
  public void onBackoff(Duration backoff, int consecutiveErrors) {
    Counter.builder("gateway.ratelimit.backoff.total")
        .description("Backoff windows opened after gateway rate violations")
        .register(meterRegistry)
        .increment();
  }

  private static String safeOperation(OperationClass operationClass) {
    return operationClass == null ? "unknown" : operationClass.limitType();
  }
}
