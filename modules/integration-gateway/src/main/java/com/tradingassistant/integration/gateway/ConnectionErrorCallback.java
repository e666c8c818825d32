package com.tradingassistant.integration.gateway;

/** Same isolation rules as {@link ConnectionCallback}. */
@FunctionalInterface
public interface ConnectionErrorCallback {
  void onError(GatewayConnectionException error);

  static ConnectionErrorCallback noop() {
    return error -> {};
  }
}
