package com.tradingassistant.domain.connection;

import java.util.Locale;

public enum ConnectionState {
  DISCONNECTED,
  CONNECTING,
  CONNECTED,
  RECONNECTING,
  ERROR,
  SHUTDOWN;

  public boolean isTerminal() {
    return this == SHUTDOWN;
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
