package com.changefeed.gateway.registry;

import com.changefeed.domain.changes.ChangeEvent;

/** Channel name plus an optional row predicate; a null predicate admits every row. */
public record ChannelFilter(String channel, RowPredicate predicate) {
  public ChannelFilter {
    if (channel == null || channel.isBlank()) {
      throw new InvalidFilterException("channel must not be blank");
    }
  }

  public static ChannelFilter allRows(String channel) {
    return new ChannelFilter(channel, null);
  }

  public boolean matches(ChangeEvent event) {
    return channel.equals(event.channel()) && (predicate == null || predicate.matches(event));
  }
}
