package com.tradingassistant.infra.ratelimit.config;

import com.tradingassistant.infra.ratelimit.GatewayRateLimiter;
import com.tradingassistant.infra.ratelimit.RateLimitedCallExecutor;
import com.tradingassistant.infra.ratelimit.observability.MicrometerRateLimitTelemetry;
import com.tradingassistant.infra.ratelimit.observability.NoOpRateLimitTelemetry;
import com.tradingassistant.infra.ratelimit.observability.RateLimitTelemetry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
    })
@EnableConfigurationProperties(RateLimitProperties.class)
@ConditionalOnProperty(
    prefix = "gateway.rate-limit",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class RateLimitAutoConfiguration {
  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(RateLimitTelemetry.class)
  public RateLimitTelemetry micrometerRateLimitTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerRateLimitTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(RateLimitTelemetry.class)
  public RateLimitTelemetry noOpRateLimitTelemetry() {
    return new NoOpRateLimitTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public GatewayRateLimiter gatewayRateLimiter(
      RateLimitProperties properties, RateLimitTelemetry rateLimitTelemetry) {
    return new GatewayRateLimiter(properties.toConfig(), rateLimitTelemetry);
  }

  @Bean
  @ConditionalOnMissingBean
  public RateLimitedCallExecutor rateLimitedCallExecutor(
      GatewayRateLimiter gatewayRateLimiter, RateLimitProperties properties) {
    return new RateLimitedCallExecutor(gatewayRateLimiter, properties.isResetBackoffOnSuccess());
  }
}
