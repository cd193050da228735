package com.changefeed.infra.eventlog.journal;

import com.changefeed.infra.eventlog.LogEntry;
import java.util.List;

/** Write-through persistence behind the in-memory event log window. */
public interface EventLogJournal {
  void append(List<LogEntry> entries);

  /** Newest {@code limit} entries in ascending offset order. */
  List<LogEntry> loadTail(int limit);

  /**
   * Removes entries below {@code floorOffset}. The newest entry is always kept so sequencing can
   * continue after a restart even when the whole window was compacted away.
   */
  void truncateBefore(long floorOffset);
}
