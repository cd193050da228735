package com.changefeed.gateway.websocket;

import com.changefeed.gateway.connection.ClientTransport;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

/** Adapts a servlet WebSocket session. Sends are only issued by the connection's serial drain. */
class WebSocketClientTransport implements ClientTransport {
  private static final Logger log = LoggerFactory.getLogger(WebSocketClientTransport.class);
  private static final int MAX_REASON_LENGTH = 120;

  private final WebSocketSession session;

  WebSocketClientTransport(WebSocketSession session) {
    this.session = session;
  }

  @Override
  public String id() {
    return session.getId();
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void send(String frame) throws IOException {
    session.sendMessage(new TextMessage(frame));
  }

  @Override
  public void close(int statusCode, String reason) {
    if (!session.isOpen()) {
      return;
    }
    String trimmed =
        reason == null || reason.length() <= MAX_REASON_LENGTH ? reason : reason.substring(0, MAX_REASON_LENGTH);
    try {
      session.close(new CloseStatus(statusCode, trimmed));
    } catch (IOException ex) {
      log.warn("WebSocket close failed session_id={} error={}", session.getId(), ex.getMessage());
    }
  }
}
