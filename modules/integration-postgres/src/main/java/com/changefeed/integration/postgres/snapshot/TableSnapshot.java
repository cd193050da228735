package com.changefeed.integration.postgres.snapshot;

import java.util.List;
import java.util.Map;

public record TableSnapshot(String channel, List<Map<String, Object>> rows, boolean truncated) {
  public TableSnapshot {
    rows = rows == null ? List.of() : List.copyOf(rows);
  }
}
