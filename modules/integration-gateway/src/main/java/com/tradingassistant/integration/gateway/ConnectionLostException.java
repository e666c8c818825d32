package com.tradingassistant.integration.gateway;

public class ConnectionLostException extends GatewayConnectionException {
  public ConnectionLostException(String message) {
    super(message);
  }

  public ConnectionLostException(String message, Throwable cause) {
    super(message, cause);
  }
}
