package com.tradingassistant.integration.gateway;

public class GatewayConnectionException extends RuntimeException {
  public GatewayConnectionException(String message) {
    super(message);
  }

  public GatewayConnectionException(String message, Throwable cause) {
    super(message, cause);
  }

  /** True when {@code error} or anything in its cause chain is a connection failure. */
  public static boolean isConnectionFailure(Throwable error) {
    Throwable current = error;
    int depth = 0;
    while (current != null && depth < 16) {
      if (current instanceof GatewayConnectionException) {
        return true;
      }
      if (current.getCause() == current) {
        return false;
      }
      current = current.getCause();
      depth++;
    }
    return false;
  }
}
