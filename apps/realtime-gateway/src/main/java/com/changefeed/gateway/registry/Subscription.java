package com.changefeed.gateway.registry;

import com.changefeed.domain.sessions.AccessClaims;
import java.time.Instant;
import java.util.Objects;

/**
 * A live interest of one connection in one channel. {@code resumeFrom} is the last sequence the
 * client already holds, or null to start with live events only.
 */
public record Subscription(
    String subscriptionId,
    String connectionId,
    ChannelFilter filter,
    AccessClaims claims,
    Long resumeFrom,
    Instant createdAt) {
  public Subscription {
    if (subscriptionId == null || subscriptionId.isBlank()) {
      throw new IllegalArgumentException("subscriptionId must not be blank");
    }
    if (connectionId == null || connectionId.isBlank()) {
      throw new IllegalArgumentException("connectionId must not be blank");
    }
    Objects.requireNonNull(filter, "filter must not be null");
    Objects.requireNonNull(claims, "claims must not be null");
    if (resumeFrom != null && resumeFrom < 0L) {
      throw new IllegalArgumentException("resumeFrom must be >= 0");
    }
    Objects.requireNonNull(createdAt, "createdAt must not be null");
  }

  public String channel() {
    return filter.channel();
  }
}
