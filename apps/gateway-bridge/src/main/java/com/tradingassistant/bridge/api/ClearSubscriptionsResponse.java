package com.tradingassistant.bridge.api;

public record ClearSubscriptionsResponse(int cleared) {}
