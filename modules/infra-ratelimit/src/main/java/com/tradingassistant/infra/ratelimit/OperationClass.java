package com.tradingassistant.infra.ratelimit;

public enum OperationClass {
  GENERAL("general"),
  ORDER("order"),
  HISTORICAL_DATA("historical_data"),
  MARKET_DATA("market_data");

  private final String limitType;

  OperationClass(String limitType) {
    this.limitType = limitType;
  }

  public String limitType() {
    return limitType;
  }
}
