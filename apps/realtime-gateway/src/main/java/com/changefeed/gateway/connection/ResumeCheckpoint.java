package com.changefeed.gateway.connection;

import com.changefeed.gateway.protocol.ServerMessage;

/**
 * Queue marker that never reaches the transport. Once the sender dequeues it, every subscription
 * of the connection has been offered the log through {@code sequence}.
 */
record ResumeCheckpoint(long sequence) implements ServerMessage {
  @Override
  public String type() {
    return "checkpoint";
  }
}
