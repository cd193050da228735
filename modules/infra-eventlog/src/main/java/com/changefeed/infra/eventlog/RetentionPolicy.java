package com.changefeed.infra.eventlog;

import java.time.Duration;

/**
 * Retention limits for the in-memory window.
 *
 * <p>An entry becomes evictable once it is outside both soft limits ({@code maxEntries} newest
 * entries and {@code retention} age). A non-positive limit is treated as unset. {@code
 * hardMaxEntries} is applied regardless of readers.
 */
public record RetentionPolicy(int maxEntries, Duration retention, int hardMaxEntries) {
  public RetentionPolicy {
    if (retention != null && retention.isNegative()) {
      throw new IllegalArgumentException("retention must not be negative");
    }
    if (hardMaxEntries > 0 && maxEntries > hardMaxEntries) {
      throw new IllegalArgumentException("maxEntries must not exceed hardMaxEntries");
    }
  }

  boolean hasCountLimit() {
    return maxEntries > 0;
  }

  boolean hasAgeLimit() {
    return retention != null && !retention.isZero();
  }

  boolean hasHardLimit() {
    return hardMaxEntries > 0;
  }
}
