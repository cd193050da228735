package com.changefeed.gateway.dispatch;

import com.changefeed.gateway.registry.RegistrySnapshot;
import com.changefeed.infra.eventlog.LogEntry;
import java.util.List;

/**
 * One unit of fan-out work: the entries with offsets {@code fromOffset..throughOffset} (possibly
 * none) and the registry snapshot every worker uses for them.
 */
record DispatchPass(
    List<LogEntry> entries, long fromOffset, long throughOffset, RegistrySnapshot snapshot) {
  DispatchPass {
    entries = List.copyOf(entries);
    if (throughOffset < fromOffset - 1L) {
      throw new IllegalArgumentException("throughOffset must be >= fromOffset - 1");
    }
  }

  /** Last offset dispatched before this pass. */
  long previousOffset() {
    return fromOffset - 1L;
  }
}
