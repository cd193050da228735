package com.changefeed.gateway.protocol;

import com.changefeed.domain.changes.ChangeEvent;
import com.changefeed.domain.sessions.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/** Frames the server sends. Each record carries its own {@code type} discriminator. */
public interface ServerMessage {
  String type();

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({
    "type",
    "subscriptionId",
    "sequence",
    "operation",
    "channel",
    "key",
    "before",
    "after",
    "commitTimestamp"
  })
  record Event(
      String type,
      String subscriptionId,
      long sequence,
      String operation,
      String channel,
      String key,
      Map<String, Object> before,
      Map<String, Object> after,
      String commitTimestamp)
      implements ServerMessage {
    public static Event of(String subscriptionId, ChangeEvent event) {
      return new Event(
          "event",
          subscriptionId,
          event.sequence(),
          event.operation().wireName(),
          event.channel(),
          event.key(),
          event.before(),
          event.after(),
          event.commitTimestamp().toString());
    }
  }

  @JsonPropertyOrder({"type", "subscriptionId", "atSequence"})
  record Subscribed(String type, String subscriptionId, long atSequence) implements ServerMessage {
    public static Subscribed of(String subscriptionId, long atSequence) {
      return new Subscribed("subscribed", subscriptionId, atSequence);
    }
  }

  @JsonPropertyOrder({"type", "subscriptionId"})
  record Unsubscribed(String type, String subscriptionId) implements ServerMessage {
    public static Unsubscribed of(String subscriptionId) {
      return new Unsubscribed("unsubscribed", subscriptionId);
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({"type", "code", "message", "subscriptionId"})
  record Error(String type, String code, String message, String subscriptionId)
      implements ServerMessage {
    public static Error of(ErrorCode code, String message, String subscriptionId) {
      return new Error("error", code.wireCode(), message, subscriptionId);
    }
  }

  record Pong(String type) implements ServerMessage {
    public static Pong of() {
      return new Pong("pong");
    }
  }

  @JsonPropertyOrder({"type", "connectionId", "resumeKey", "headSequence"})
  record Connected(String type, String connectionId, String resumeKey, long headSequence)
      implements ServerMessage {
    public static Connected of(String connectionId, String resumeKey, long headSequence) {
      return new Connected("connected", connectionId, resumeKey, headSequence);
    }
  }
}
