package com.tradingassistant.domain.connection;

public class ConnectionDomainException extends RuntimeException {
  public ConnectionDomainException(String message) {
    super(message);
  }
}
