package com.tradingassistant.infra.ratelimit.observability;

import com.tradingassistant.infra.ratelimit.OperationClass;
import java.time.Duration;

public class NoOpRateLimitTelemetry implements RateLimitTelemetry {
    @Override
    public void onAccepted(OperationClass operationClass) {
    }

    @Override
    public void onRejected(OperationClass operationClass, String limitType) {
    }

    @Override
    public void onDelayed(OperationClass operationClass, Duration delay) {
    }

    @Override
    public void onBackoff(Duration backoff, int consecutiveErrors) {
    }
}
