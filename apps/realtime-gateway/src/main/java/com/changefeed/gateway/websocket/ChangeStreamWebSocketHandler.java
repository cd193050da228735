package com.changefeed.gateway.websocket;

import com.changefeed.gateway.connection.ClientConnection;
import com.changefeed.gateway.connection.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

public class ChangeStreamWebSocketHandler extends TextWebSocketHandler {
  private static final Logger log = LoggerFactory.getLogger(ChangeStreamWebSocketHandler.class);
  private static final String CONNECTION_ATTRIBUTE = "changefeed.connection";

  private final ConnectionManager connectionManager;

  public ChangeStreamWebSocketHandler(ConnectionManager connectionManager) {
    this.connectionManager = connectionManager;
  }

  @Override
  public void afterConnectionEstablished(WebSocketSession session) {
    String bearerToken = (String) session.getAttributes().get(CredentialHandshakeInterceptor.BEARER_TOKEN_ATTRIBUTE);
    String resumeToken = (String) session.getAttributes().get(CredentialHandshakeInterceptor.RESUME_TOKEN_ATTRIBUTE);
    ClientConnection connection =
        connectionManager.open(new WebSocketClientTransport(session), bearerToken, resumeToken);
    session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
  }

  @Override
  protected void handleTextMessage(WebSocketSession session, TextMessage message) {
    ClientConnection connection = connection(session);
    if (connection != null) {
      connectionManager.onMessage(connection, message.getPayload());
    }
  }

  @Override
  public void handleTransportError(WebSocketSession session, Throwable exception) {
    log.warn("WebSocket transport error session_id={} error={}", session.getId(), exception.getMessage());
    ClientConnection connection = connection(session);
    if (connection != null) {
      connectionManager.onTransportClosed(connection);
    }
  }

  @Override
  public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
    ClientConnection connection = connection(session);
    if (connection != null) {
      log.debug(
          "WebSocket closed session_id={} connection_id={} status={}",
          session.getId(),
          connection.connectionId(),
          status.getCode());
      connectionManager.onTransportClosed(connection);
    }
  }

  private static ClientConnection connection(WebSocketSession session) {
    return (ClientConnection) session.getAttributes().get(CONNECTION_ATTRIBUTE);
  }
}
