package com.changefeed.gateway.websocket;

import java.util.List;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Copies the bearer token and resume token from the upgrade request into the session attributes.
 * Validation happens after the upgrade so failures can be reported with an error frame.
 */
class CredentialHandshakeInterceptor implements HandshakeInterceptor {
  static final String BEARER_TOKEN_ATTRIBUTE = "changefeed.bearerToken";
  static final String RESUME_TOKEN_ATTRIBUTE = "changefeed.resumeToken";

  private static final String BEARER_PREFIX = "Bearer ";

  @Override
  public boolean beforeHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Map<String, Object> attributes) {
    Map<String, List<String>> query =
        UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
    String token = bearerToken(request.getHeaders());
    if (token == null) {
      token = first(query.get("access_token"));
    }
    if (token != null) {
      attributes.put(BEARER_TOKEN_ATTRIBUTE, token);
    }
    String resumeToken = first(query.get("resumeToken"));
    if (resumeToken != null) {
      attributes.put(RESUME_TOKEN_ATTRIBUTE, resumeToken);
    }
    return true;
  }

  @Override
  public void afterHandshake(
      ServerHttpRequest request,
      ServerHttpResponse response,
      WebSocketHandler wsHandler,
      Exception exception) {}

  private static String bearerToken(HttpHeaders headers) {
    String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
    if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return null;
    }
    String token = authorization.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? null : token;
  }

  private static String first(List<String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    String value = values.get(0);
    return value == null || value.isBlank() ? null : value;
  }
}
