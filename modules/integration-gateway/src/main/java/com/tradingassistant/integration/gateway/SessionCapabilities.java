package com.tradingassistant.integration.gateway;

import java.util.Objects;
import java.util.Optional;

public record SessionCapabilities(Pingable pingable, LivenessAware livenessAware) {
  public static SessionCapabilities of(GatewaySession session) {
    Objects.requireNonNull(session, "session must not be null");
    return new SessionCapabilities(
        session instanceof Pingable ping ? ping : null,
        session instanceof LivenessAware aware ? aware : null);
  }

  public Optional<Pingable> ping() {
    return Optional.ofNullable(pingable);
  }

  public Optional<LivenessAware> liveness() {
    return Optional.ofNullable(livenessAware);
  }
}
