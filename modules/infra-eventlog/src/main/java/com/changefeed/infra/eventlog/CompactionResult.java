package com.changefeed.infra.eventlog;

public record CompactionResult(
    long previousFloor, long newFloor, long head, long evictedEntries, int readersMarkedLagging) {
  public boolean evicted() {
    return evictedEntries > 0L;
  }
}
