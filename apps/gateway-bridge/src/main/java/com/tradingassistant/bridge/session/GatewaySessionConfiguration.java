package com.tradingassistant.bridge.session;

import com.tradingassistant.integration.gateway.GatewaySessionFactory;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(GatewaySessionProperties.class)
public class GatewaySessionConfiguration {
  @Bean
  @ConditionalOnMissingBean
  public GatewaySessionFactory gatewaySessionFactory(GatewaySessionProperties properties) {
    Duration connectTimeout = Duration.ofMillis(Math.max(100L, properties.getConnectTimeoutMs()));
    Duration pingTimeout = Duration.ofMillis(Math.max(1L, properties.getPingTimeoutMs()));
    return () ->
        new TcpGatewaySession(
            properties.getHost(), properties.getPort(), connectTimeout, pingTimeout);
  }
}
