package com.changefeed.infra.eventlog.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerEventLogTelemetry implements EventLogTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerEventLogTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onAppended(int count, long durationNanos) {
    Counter.builder("changefeed.eventlog.appended.total")
        .description("Total change events appended to the event log")
        .register(meterRegistry)
        .increment(Math.max(0, count));

    Timer.builder("changefeed.eventlog.append.duration")
        .description("Event log batch append latency including the journal write")
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onCompacted(long evictedEntries, int readersMarkedLagging) {
    Counter.builder("changefeed.eventlog.evicted.total")
        .description("Total entries evicted from the event log window")
        .register(meterRegistry)
        .increment(Math.max(0L, evictedEntries));

    if (readersMarkedLagging > 0) {
      Counter.builder("changefeed.eventlog.readers.lagging.total")
          .description("Readers overtaken by the hard retention limit")
          .register(meterRegistry)
          .increment(readersMarkedLagging);
    }
  }

  @Override
  public void onOffsetEvicted(long requestedOffset) {
    Counter.builder("changefeed.eventlog.offset_evicted.total")
        .description("Reads rejected because the requested offset was evicted")
        .register(meterRegistry)
        .increment();
  }
}
