package com.tradingassistant.domain.connection;

import java.util.EnumSet;
import java.util.Map;

/**
 * Legal lifecycle transitions of the gateway connection. {@link ConnectionState#SHUTDOWN} is
 * terminal; every other state may be stopped.
 */
public final class ConnectionStateMachine {
  private static final Map<ConnectionState, EnumSet<ConnectionState>> ALLOWED_TRANSITIONS =
      Map.of(
          ConnectionState.DISCONNECTED,
              EnumSet.of(
                  ConnectionState.CONNECTING,
                  ConnectionState.RECONNECTING,
                  ConnectionState.SHUTDOWN),
          ConnectionState.CONNECTING,
              EnumSet.of(
                  ConnectionState.CONNECTED, ConnectionState.ERROR, ConnectionState.SHUTDOWN),
          ConnectionState.CONNECTED,
              EnumSet.of(
                  ConnectionState.DISCONNECTED,
                  ConnectionState.RECONNECTING,
                  ConnectionState.SHUTDOWN),
          ConnectionState.RECONNECTING,
              EnumSet.of(
                  ConnectionState.CONNECTED, ConnectionState.ERROR, ConnectionState.SHUTDOWN),
          ConnectionState.ERROR,
              EnumSet.of(ConnectionState.RECONNECTING, ConnectionState.SHUTDOWN),
          ConnectionState.SHUTDOWN, EnumSet.noneOf(ConnectionState.class));

  private ConnectionStateMachine() {}

  public static boolean canTransition(ConnectionState from, ConnectionState to) {
    if (from == null || to == null) {
      return false;
    }
    EnumSet<ConnectionState> allowed = ALLOWED_TRANSITIONS.get(from);
    return allowed != null && allowed.contains(to);
  }

  public static void validateTransition(ConnectionState from, ConnectionState to) {
    if (!canTransition(from, to)) {
      throw new ConnectionDomainException(
          "Invalid connection state transition from " + from + " to " + to);
    }
  }
}
