package com.tradingassistant.integration.gateway;

import com.tradingassistant.domain.connection.ConnectionHealth;

/**
 * Lifecycle notification from {@link ConnectionMonitor}. Exceptions thrown here are logged by
 * the monitor and never reach the connection logic.
 */
@FunctionalInterface
public interface ConnectionCallback {
  void onEvent(ConnectionHealth health);

  static ConnectionCallback noop() {
    return health -> {};
  }
}
