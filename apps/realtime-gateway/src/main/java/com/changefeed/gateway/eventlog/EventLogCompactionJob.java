package com.changefeed.gateway.eventlog;

import com.changefeed.infra.eventlog.CompactionResult;
import com.changefeed.infra.eventlog.DurableEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "changefeed.event-log.compaction",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class EventLogCompactionJob {
  private static final Logger log = LoggerFactory.getLogger(EventLogCompactionJob.class);

  private final DurableEventLog eventLog;

  public EventLogCompactionJob(DurableEventLog eventLog) {
    this.eventLog = eventLog;
  }

  @Scheduled(fixedDelayString = "${changefeed.event-log.compaction-interval-ms:5000}")
  public void compact() {
    try {
      CompactionResult result = eventLog.compact();
      if (result.evicted()) {
        log.info(
            "Event log compaction floor={} head={} evicted={} lagging_readers={}",
            result.newFloor(),
            result.head(),
            result.evictedEntries(),
            result.readersMarkedLagging());
      }
    } catch (RuntimeException ex) {
      log.warn("Event log compaction failed error={}", ex.getMessage(), ex);
    }
  }
}
