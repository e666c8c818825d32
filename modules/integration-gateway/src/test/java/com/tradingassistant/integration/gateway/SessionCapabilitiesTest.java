package com.tradingassistant.integration.gateway;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.tradingassistant.integration.gateway.StubSessions.LivenessSession;
import com.tradingassistant.integration.gateway.StubSessions.PingableSession;
import com.tradingassistant.integration.gateway.StubSessions.StubSession;
import org.junit.jupiter.api.Test;

class SessionCapabilitiesTest {
  @Test
  void shouldDetectOptionalCapabilities() {
    SessionCapabilities plain = SessionCapabilities.of(new StubSession());
    SessionCapabilities pingable = SessionCapabilities.of(new PingableSession());
    SessionCapabilities liveness = SessionCapabilities.of(new LivenessSession());

    assertFalse(plain.ping().isPresent());
    assertFalse(plain.liveness().isPresent());
    assertTrue(pingable.ping().isPresent());
    assertFalse(pingable.liveness().isPresent());
    assertTrue(liveness.liveness().isPresent());
  }

  @Test
  void shouldFindConnectionFailureInCauseChain() {
    assertTrue(
        GatewayConnectionException.isConnectionFailure(
            new RuntimeException("wrapped", new ConnectionLostException("gone"))));
    assertFalse(GatewayConnectionException.isConnectionFailure(new RuntimeException("other")));
  }
}
