package com.changefeed.gateway.websocket;

import com.changefeed.gateway.connection.ConnectionManager;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {
  private final ConnectionManager connectionManager;
  private final String[] allowedOriginPatterns;

  public WebSocketConfig(
      ConnectionManager connectionManager,
      @Value("${changefeed.websocket.allowed-origin-patterns:*}") String[] allowedOriginPatterns) {
    this.connectionManager = connectionManager;
    this.allowedOriginPatterns = allowedOriginPatterns;
  }

  @Bean
  public ChangeStreamWebSocketHandler changeStreamWebSocketHandler() {
    return new ChangeStreamWebSocketHandler(connectionManager);
  }

  @Override
  public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
    registry
        .addHandler(changeStreamWebSocketHandler(), "/v1/stream")
        .addInterceptors(new CredentialHandshakeInterceptor())
        .setAllowedOriginPatterns(allowedOriginPatterns);
  }
}
