package com.tradingassistant.integration.gateway;

public interface Pingable {
  /**
   * Round-trips a no-op request to the gateway.
   *
   * @throws ConnectionLostException when the gateway is unreachable
   */
  void ping();
}
