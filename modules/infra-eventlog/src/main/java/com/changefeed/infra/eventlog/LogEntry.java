package com.changefeed.infra.eventlog;

import com.changefeed.domain.changes.ChangeEvent;
import java.time.Instant;
import java.util.Objects;

public record LogEntry(long offset, ChangeEvent event, Instant appendedAt) {
  public LogEntry {
    Objects.requireNonNull(event, "event must not be null");
    Objects.requireNonNull(appendedAt, "appendedAt must not be null");
    if (offset != event.sequence()) {
      throw new IllegalArgumentException(
          "offset " + offset + " must match event sequence " + event.sequence());
    }
  }
}
