package com.tradingassistant.integration.gateway;

@FunctionalInterface
public interface GatewaySessionFactory {
  GatewaySession create();
}
