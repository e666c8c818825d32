package com.tradingassistant.bridge.session;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.session")
public class GatewaySessionProperties {
  private String host = "127.0.0.1";
  private int port = 7497;
  private long connectTimeoutMs = 3000L;
  private long pingTimeoutMs = 100L;

  public String getHost() {
    return host;
  }

  public void setHost(String host) {
    this.host = host;
  }

  public int getPort() {
    return port;
  }

  public void setPort(int port) {
    this.port = port;
  }

  public long getConnectTimeoutMs() {
    return connectTimeoutMs;
  }

  public void setConnectTimeoutMs(long connectTimeoutMs) {
    this.connectTimeoutMs = connectTimeoutMs;
  }

  public long getPingTimeoutMs() {
    return pingTimeoutMs;
  }

  public void setPingTimeoutMs(long pingTimeoutMs) {
    this.pingTimeoutMs = pingTimeoutMs;
  }
}
