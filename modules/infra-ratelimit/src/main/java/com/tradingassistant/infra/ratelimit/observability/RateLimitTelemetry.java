package com.tradingassistant.infra.ratelimit.observability;

import com.tradingassistant.infra.ratelimit.OperationClass;
import java.time.Duration;

public interface RateLimitTelemetry {
  void onAccepted(OperationClass operationClass);

  void onRejected(OperationClass operationClass, String limitType);

  void onDelayed(OperationClass operationClass, Duration delay);

  void onBackoff(Duration backoff, int consecutiveErrors);
}
