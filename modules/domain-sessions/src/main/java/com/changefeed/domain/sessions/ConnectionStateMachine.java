package com.changefeed.domain.sessions;

import java.util.EnumSet;
import java.util.Map;

public final class ConnectionStateMachine {
  private static final Map<ConnectionState, EnumSet<ConnectionState>> ALLOWED_TRANSITIONS =
      Map.of(
          ConnectionState.CONNECTING,
              EnumSet.of(ConnectionState.AUTHENTICATED, ConnectionState.CLOSED),
          ConnectionState.AUTHENTICATED,
              EnumSet.of(ConnectionState.ACTIVE, ConnectionState.DRAINING, ConnectionState.CLOSED),
          ConnectionState.ACTIVE, EnumSet.of(ConnectionState.DRAINING, ConnectionState.CLOSED),
          ConnectionState.DRAINING, EnumSet.of(ConnectionState.CLOSED),
          ConnectionState.CLOSED, EnumSet.noneOf(ConnectionState.class));

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
      throw new SessionDomainException(
          "Invalid connection state transition from " + from + " to " + to);
    }
  }
}
