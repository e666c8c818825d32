package com.tradingassistant.integration.gateway.config;

import com.tradingassistant.integration.gateway.ConnectionMonitor;
import com.tradingassistant.integration.gateway.ConnectionRetryExecutor;
import com.tradingassistant.integration.gateway.GatewaySessionFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires a {@link ConnectionMonitor} around the application's {@link GatewaySessionFactory}.
 * The monitor is created stopped; the application decides when to call {@code start()}.
 */
@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
    })
@EnableConfigurationProperties(GatewayConnectionProperties.class)
@ConditionalOnProperty(
    prefix = "gateway.connection",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class GatewayConnectionAutoConfiguration {
  @Bean(destroyMethod = "stop")
  @ConditionalOnBean(GatewaySessionFactory.class)
  @ConditionalOnMissingBean
  public ConnectionMonitor connectionMonitor(
      GatewaySessionFactory gatewaySessionFactory,
      GatewayConnectionProperties properties,
      ObjectProvider<MeterRegistry> meterRegistry) {
    return new ConnectionMonitor(
        gatewaySessionFactory,
        properties.toConfig(),
        meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
  }

  @Bean
  @ConditionalOnBean(GatewaySessionFactory.class)
  @ConditionalOnMissingBean
  public ConnectionRetryExecutor connectionRetryExecutor(
      ConnectionMonitor connectionMonitor, GatewayConnectionProperties properties) {
    GatewayConnectionProperties.Retry retry = properties.getRetry();
    return new ConnectionRetryExecutor(
        connectionMonitor, retry.getMaxAttempts(), Duration.ofMillis(retry.getBaseDelayMs()));
  }
}
