package com.changefeed.gateway.protocol;

import com.changefeed.gateway.registry.ChannelFilter;
import com.changefeed.gateway.registry.InvalidFilterException;
import com.changefeed.gateway.registry.RowPredicate;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public class ClientMessageParser {
  private static final TypeReference<Map<String, Object>> FILTER_TYPE = new TypeReference<>() {};
  private static final Set<String> SUBSCRIBE_FIELDS = Set.of("type", "channel", "filter", "resumeFrom");

  private final ObjectMapper objectMapper;
  private final int maxFrameLength;

  public ClientMessageParser(ObjectMapper objectMapper, int maxFrameLength) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.maxFrameLength = maxFrameLength;
  }

  public ClientMessage parse(String payload) {
    if (payload == null || payload.isBlank()) {
      throw new MalformedClientMessageException("empty frame");
    }
    if (payload.length() > maxFrameLength) {
      throw new MalformedClientMessageException("frame exceeds " + maxFrameLength + " characters");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(payload);
    } catch (JsonProcessingException ex) {
      throw new MalformedClientMessageException("frame is not valid JSON", ex);
    }
    if (root == null || !root.isObject()) {
      throw new MalformedClientMessageException("frame must be a JSON object");
    }
    JsonNode type = root.get("type");
    if (type == null || !type.isTextual()) {
      throw new MalformedClientMessageException("frame has no string 'type'");
    }
    return switch (type.asText()) {
      case "subscribe" -> subscribe(root);
      case "unsubscribe" -> new ClientMessage.Unsubscribe(requireText(root, "subscriptionId"));
      case "ping" -> new ClientMessage.Ping();
      case "ready" -> new ClientMessage.Ready();
      default -> throw new MalformedClientMessageException("unknown message type '" + type.asText() + "'");
    };
  }

  private ClientMessage.Subscribe subscribe(JsonNode root) {
    root.fieldNames()
        .forEachRemaining(
            field -> {
              if (!SUBSCRIBE_FIELDS.contains(field)) {
                throw new MalformedClientMessageException("unexpected subscribe field '" + field + "'");
              }
            });
    String channel = requireText(root, "channel");
    RowPredicate predicate = null;
    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      if (!filter.isObject()) {
        throw new MalformedClientMessageException("'filter' must be a JSON object");
      }
      try {
        predicate = RowPredicate.parse(objectMapper.convertValue(filter, FILTER_TYPE));
      } catch (InvalidFilterException ex) {
        throw new MalformedClientMessageException("invalid filter: " + ex.getMessage(), ex);
      }
    }
    Long resumeFrom = null;
    JsonNode resume = root.get("resumeFrom");
    if (resume != null && !resume.isNull()) {
      if (!resume.canConvertToExactIntegral() || !resume.canConvertToLong() || resume.asLong() < 0L) {
        throw new MalformedClientMessageException("'resumeFrom' must be a non-negative integer");
      }
      resumeFrom = resume.asLong();
    }
    return new ClientMessage.Subscribe(new ChannelFilter(channel, predicate), resumeFrom);
  }

  private static String requireText(JsonNode root, String field) {
    JsonNode value = root.get(field);
    if (value == null || !value.isTextual() || value.asText().isBlank()) {
      throw new MalformedClientMessageException("'" + field + "' must be a non-blank string");
    }
    return value.asText();
  }
}
