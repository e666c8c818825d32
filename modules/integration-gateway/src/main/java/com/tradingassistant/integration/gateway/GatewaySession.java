package com.tradingassistant.integration.gateway;

/**
 * One handle to the brokerage gateway. Implementations may additionally implement {@link
 * Pingable} and/or {@link LivenessAware}; the monitor probes for them once per handle.
 */
public interface GatewaySession {
  void connect();

  void disconnect();
}
