package com.tradingassistant.bridge.api;

import com.tradingassistant.infra.ratelimit.GatewayRateLimiter;
import com.tradingassistant.integration.gateway.ConnectionMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/gateway")
public class AdminGatewayController {
  private static final Logger log = LoggerFactory.getLogger(AdminGatewayController.class);

  private final ConnectionMonitor connectionMonitor;
  private final GatewayRateLimiter gatewayRateLimiter;

  public AdminGatewayController(
      ConnectionMonitor connectionMonitor, GatewayRateLimiter gatewayRateLimiter) {
    this.connectionMonitor = connectionMonitor;
    this.gatewayRateLimiter = gatewayRateLimiter;
  }

  @GetMapping("/health")
  public GatewayHealthResponse health() {
    return GatewayHealthResponse.from(connectionMonitor.healthReport());
  }

  @GetMapping("/rate-limits")
  public RateLimitStatisticsResponse rateLimits() {
    return RateLimitStatisticsResponse.from(gatewayRateLimiter.statistics());
  }

  @PostMapping("/reconnect")
  public ReconnectResponse reconnect() {
    log.info("Manual gateway reconnect requested state={}", connectionMonitor.state().value());
    boolean reconnected = connectionMonitor.reconnect();
    return new ReconnectResponse(reconnected, connectionMonitor.state().value());
  }

  @PostMapping("/rate-limits/reset-backoff")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void resetBackoff() {
    log.info("Manual rate limit backoff reset requested");
    gatewayRateLimiter.resetBackoff();
  }

  @DeleteMapping("/subscriptions")
  public ClearSubscriptionsResponse clearSubscriptions() {
    return new ClearSubscriptionsResponse(gatewayRateLimiter.clearSubscriptions());
  }
}
