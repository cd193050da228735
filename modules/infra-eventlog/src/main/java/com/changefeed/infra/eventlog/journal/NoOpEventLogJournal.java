package com.changefeed.infra.eventlog.journal;

import com.changefeed.infra.eventlog.LogEntry;
import java.util.List;

public class NoOpEventLogJournal implements EventLogJournal {
  @Override
  public void append(List<LogEntry> entries) {}

  @Override
  public List<LogEntry> loadTail(int limit) {
    return List.of();
  }

  @Override
  public void truncateBefore(long floorOffset) {}
}
