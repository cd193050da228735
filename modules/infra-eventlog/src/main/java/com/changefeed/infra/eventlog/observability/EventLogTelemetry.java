package com.changefeed.infra.eventlog.observability;

public interface EventLogTelemetry {
  void onAppended(int count, long durationNanos);

  void onCompacted(long evictedEntries, int readersMarkedLagging);

  void onOffsetEvicted(long requestedOffset);
}
