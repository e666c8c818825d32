package com.tradingassistant.bridge.connection;

import com.tradingassistant.integration.gateway.ConnectionMonitor;
import com.tradingassistant.integration.gateway.GatewayConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Opens the gateway connection once the application is ready. A gateway that is down at boot
 * leaves the monitor in error and the application running, so an operator can trigger a
 * reconnect over the admin API.
 */
@Component
public class GatewayConnectionStarter {
  private static final Logger log = LoggerFactory.getLogger(GatewayConnectionStarter.class);

  private final ObjectProvider<ConnectionMonitor> connectionMonitor;

  public GatewayConnectionStarter(ObjectProvider<ConnectionMonitor> connectionMonitor) {
    this.connectionMonitor = connectionMonitor;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void start() {
    ConnectionMonitor monitor = connectionMonitor.getIfAvailable();
    if (monitor == null) {
      log.info("Gateway connection monitor disabled, not connecting");
      return;
    }
    monitor.onError(
        error ->
            log.error("Gateway connection lost and not recovered error={}", error.getMessage()));
    try {
      monitor.start();
    } catch (GatewayConnectionException ex) {
      log.warn(
          "Gateway unavailable at startup state={} error={}",
          monitor.state().value(),
          ex.getMessage());
    }
  }
}
