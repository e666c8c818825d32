package com.tradingassistant.bridge.connection;

import com.tradingassistant.infra.ratelimit.OperationClass;
import com.tradingassistant.infra.ratelimit.RateLimitedCallExecutor;
import com.tradingassistant.integration.gateway.ConnectionRetryExecutor;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Single entry point for outbound gateway calls. Every attempt, retries included, first takes
 * rate-limit permission; connection failures are retried around that.
 */
@Component
public class GatewayCallGuard {
  private final ConnectionRetryExecutor connectionRetryExecutor;
  private final RateLimitedCallExecutor rateLimitedCallExecutor;

  public GatewayCallGuard(
      ConnectionRetryExecutor connectionRetryExecutor,
      RateLimitedCallExecutor rateLimitedCallExecutor) {
    this.connectionRetryExecutor =
        Objects.requireNonNull(connectionRetryExecutor, "connectionRetryExecutor must not be null");
    this.rateLimitedCallExecutor =
        Objects.requireNonNull(rateLimitedCallExecutor, "rateLimitedCallExecutor must not be null");
  }

  public <T> T call(OperationClass operationClass, GuardedCall<T> call) {
    return call(operationClass, 1, call);
  }

  public <T> T call(OperationClass operationClass, int weight, GuardedCall<T> call) {
    Objects.requireNonNull(call, "call must not be null");
    return connectionRetryExecutor.execute(
        () -> rateLimitedCallExecutor.execute(operationClass, weight, call::run));
  }

  @FunctionalInterface
  public interface GuardedCall<T> {
    T run();
  }
}
