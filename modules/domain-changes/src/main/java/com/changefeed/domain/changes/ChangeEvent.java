package com.changefeed.domain.changes;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * A committed row change after it has been assigned its global log sequence.
 *
 * <p>Sequences start at 1 and are gap-free for a single capture source. {@code before} and {@code
 * after} are immutable column images; which of them is present depends on the operation.
 */
public record ChangeEvent(
    long sequence,
    String channel,
    ChangeOperation operation,
    String key,
    Map<String, Object> before,
    Map<String, Object> after,
    Instant commitTimestamp,
    String transactionId) {
  public ChangeEvent {
    if (sequence < 1L) {
      throw new ChangeDomainException("sequence must be >= 1");
    }
    ChangePayloads.requireNonBlank(channel, "channel");
    Objects.requireNonNull(operation, "operation must not be null");
    ChangePayloads.requireNonBlank(key, "key");
    ChangePayloads.validateImages(operation, before, after);
    Objects.requireNonNull(commitTimestamp, "commitTimestamp must not be null");
    before = ChangePayloads.freeze(before);
    after = ChangePayloads.freeze(after);
  }

  public static ChangeEvent fromRaw(long sequence, RawChangeRecord raw) {
    Objects.requireNonNull(raw, "raw must not be null");
    return new ChangeEvent(
        sequence,
        raw.channel(),
        raw.operation(),
        raw.key(),
        raw.before(),
        raw.after(),
        raw.commitTimestamp(),
        raw.transactionId());
  }

  /** The most recent image of the row: {@code after} unless the row was deleted. */
  public Map<String, Object> currentImage() {
    return after != null ? after : before;
  }
}
