package com.tradingassistant.bridge.api;

public record ReconnectResponse(boolean reconnected, String state) {}
