package com.changefeed.infra.eventlog.observability;

public class NoOpEventLogTelemetry implements EventLogTelemetry {
  @Override
  public void onAppended(int count, long durationNanos) {}

  @Override
  public void onCompacted(long evictedEntries, int readersMarkedLagging) {}

  @Override
  public void onOffsetEvicted(long requestedOffset) {}
}
