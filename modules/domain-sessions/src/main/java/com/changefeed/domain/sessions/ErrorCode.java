package com.changefeed.domain.sessions;

/** Error codes sent to clients in {@code error} frames. */
public enum ErrorCode {
  OFFSET_EVICTED("OffsetEvicted", false),
  RESYNC_REQUIRED("ResyncRequired", false),
  SLOW_CONSUMER("SlowConsumer", true),
  AUTH_INVALID("AuthInvalid", true),
  AUTH_EXPIRED("AuthExpired", true),
  MALFORMED_CLIENT_MESSAGE("MalformedClientMessage", true),
  SUBSCRIPTION_NOT_FOUND("SubscriptionNotFound", false),
  HEARTBEAT_TIMEOUT("HeartbeatTimeout", true),
  HANDSHAKE_TIMEOUT("HandshakeTimeout", true),
  SERVER_SHUTDOWN("ServerShutdown", true);

  private final String wireCode;
  private final boolean closesConnection;

  ErrorCode(String wireCode, boolean closesConnection) {
    this.wireCode = wireCode;
    this.closesConnection = closesConnection;
  }

  public String wireCode() {
    return wireCode;
  }

  public boolean closesConnection() {
    return closesConnection;
  }
}
