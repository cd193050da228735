package com.changefeed.gateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Objects;

public class ServerMessageCodec {
  private final ObjectMapper objectMapper;

  public ServerMessageCodec(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
  }

  public String encode(ServerMessage message) {
    try {
      return objectMapper.writeValueAsString(message);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode " + message.type() + " frame", ex);
    }
  }
}
