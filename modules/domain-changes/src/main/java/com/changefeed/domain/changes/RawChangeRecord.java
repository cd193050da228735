package com.changefeed.domain.changes;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

public record RawChangeRecord(
    CapturePosition position,
    String channel,
    ChangeOperation operation,
    String key,
    Map<String, Object> before,
    Map<String, Object> after,
    Instant commitTimestamp,
    String transactionId) {
  public RawChangeRecord {
    Objects.requireNonNull(position, "position must not be null");
    if (position.isLatest()) {
      throw new ChangeDomainException("position must be a concrete source position");
    }
    ChangePayloads.requireNonBlank(channel, "channel");
    Objects.requireNonNull(operation, "operation must not be null");
    ChangePayloads.requireNonBlank(key, "key");
    ChangePayloads.validateImages(operation, before, after);
    Objects.requireNonNull(commitTimestamp, "commitTimestamp must not be null");
    before = ChangePayloads.freeze(before);
    after = ChangePayloads.freeze(after);
  }
}
