package com.changefeed.gateway.protocol;

import com.changefeed.gateway.registry.ChannelFilter;

/** Frames a client may send over the change stream. */
public interface ClientMessage {
  record Subscribe(ChannelFilter filter, Long resumeFrom) implements ClientMessage {}

  record Unsubscribe(String subscriptionId) implements ClientMessage {}

  record Ping() implements ClientMessage {}

  record Ready() implements ClientMessage {}
}
