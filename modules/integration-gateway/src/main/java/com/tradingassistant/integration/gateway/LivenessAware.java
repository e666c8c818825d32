package com.tradingassistant.integration.gateway;

public interface LivenessAware {
  boolean isConnected();
}
