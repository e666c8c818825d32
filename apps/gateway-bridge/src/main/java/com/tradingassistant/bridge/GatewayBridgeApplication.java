package com.tradingassistant.bridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GatewayBridgeApplication {
  public static void main(String[] args) {
    SpringApplication.run(GatewayBridgeApplication.class, args);
  }
}
