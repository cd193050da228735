package com.changefeed.domain.sessions;

public enum ConnectionState {
  CONNECTING,
  AUTHENTICATED,
  ACTIVE,
  DRAINING,
  CLOSED;

  public boolean acceptsEvents() {
    return this == AUTHENTICATED || this == ACTIVE;
  }

  public boolean isTerminal() {
    return this == CLOSED;
  }
}
