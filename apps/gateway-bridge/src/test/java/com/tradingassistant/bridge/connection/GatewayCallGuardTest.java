package com.tradingassistant.bridge.connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradingassistant.domain.connection.ConnectionState;
import com.tradingassistant.infra.ratelimit.GatewayRateLimiter;
import com.tradingassistant.infra.ratelimit.OperationClass;
import com.tradingassistant.infra.ratelimit.RateLimitConfig;
import com.tradingassistant.infra.ratelimit.RateLimitedCallExecutor;
import com.tradingassistant.infra.ratelimit.observability.NoOpRateLimitTelemetry;
import com.tradingassistant.integration.gateway.ConnectionLostException;
import com.tradingassistant.integration.gateway.ConnectionMonitor;
import com.tradingassistant.integration.gateway.ConnectionRetryExecutor;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GatewayCallGuardTest {
  private ConnectionMonitor monitor;
  private GatewayRateLimiter limiter;
  private List<Duration> retrySleeps;
  private GatewayCallGuard guard;

  @BeforeEach
  void setUp() {
    monitor = mock(ConnectionMonitor.class);
    when(monitor.state()).thenReturn(ConnectionState.CONNECTED);
    when(monitor.isConnected()).thenReturn(true);
    limiter = new GatewayRateLimiter(RateLimitConfig.defaults(), new NoOpRateLimitTelemetry());
    retrySleeps = new ArrayList<>();
    ConnectionRetryExecutor retryExecutor =
        new ConnectionRetryExecutor(monitor, 3, Duration.ofMillis(100), retrySleeps::add);
    guard = new GatewayCallGuard(retryExecutor, new RateLimitedCallExecutor(limiter));
  }

  @Test
  void shouldReturnResultAndCountAcceptedRequest() {
    String result = guard.call(OperationClass.ORDER, () -> "order-1");

    assertEquals("order-1", result);
    assertEquals(1L, limiter.statistics().acceptedRequests());
    verify(monitor, never()).reconnect();
  }

  @Test
  void shouldTakeRateLimitPermissionOnEveryRetryAttempt() {
    AtomicInteger calls = new AtomicInteger();

    String result =
        guard.call(
            OperationClass.GENERAL,
            () -> {
              if (calls.incrementAndGet() < 3) {
                throw new ConnectionLostException("socket closed");
              }
              return "ok";
            });

    assertEquals("ok", result);
    assertEquals(3, calls.get());
    assertEquals(3L, limiter.statistics().acceptedRequests());
    assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), retrySleeps);
  }

  @Test
  void shouldFeedGatewayRateViolationIntoBackoffWithoutRetrying() {
    AtomicInteger calls = new AtomicInteger();

    IllegalStateException error =
        assertThrows(
            IllegalStateException.class,
            () ->
                guard.call(
                    OperationClass.GENERAL,
                    () -> {
                      calls.incrementAndGet();
                      throw new IllegalStateException("Gateway rate limit exceeded");
                    }));

    assertEquals("Gateway rate limit exceeded", error.getMessage());
    assertEquals(1, calls.get());
    assertTrue(limiter.isInBackoff());
    assertTrue(retrySleeps.isEmpty());
  }

  @Test
  void shouldFailFastWhenConnectionIsInError() {
    when(monitor.state()).thenReturn(ConnectionState.ERROR);
    AtomicInteger calls = new AtomicInteger();

    assertThrows(
        ConnectionLostException.class,
        () -> guard.call(OperationClass.GENERAL, calls::incrementAndGet));

    assertEquals(0, calls.get());
    assertEquals(0L, limiter.statistics().totalRequests());
  }
}
