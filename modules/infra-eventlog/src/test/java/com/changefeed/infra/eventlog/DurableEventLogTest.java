package com.changefeed.infra.eventlog;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.changefeed.domain.changes.CapturePosition;
import com.changefeed.domain.changes.ChangeOperation;
import com.changefeed.domain.changes.RawChangeRecord;
import com.changefeed.infra.eventlog.journal.EventLogJournal;
import com.changefeed.infra.eventlog.journal.NoOpEventLogJournal;
import com.changefeed.infra.eventlog.observability.NoOpEventLogTelemetry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;
import org.junit.jupiter.api.Test;

class DurableEventLogTest {
  private static final RetentionPolicy UNBOUNDED = new RetentionPolicy(0, Duration.ZERO, 0);

  private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));

  @Test
  void shouldAssignContiguousOffsetsStartingAtOne() {
    DurableEventLog log = newLog(UNBOUNDED, new NoOpEventLogJournal());

    List<LogEntry> first = log.appendAll(records(3));
    long single = log.append(record(4));

    assertEquals(List.of(1L, 2L, 3L), first.stream().map(LogEntry::offset).toList());
    assertEquals(4L, single);
    assertEquals(4L, log.headOffset());
    assertEquals(1L, log.floorOffset());
    assertEquals(4L, log.size());
  }

  @Test
  void replayFromAnyRetainedOffsetShouldYieldExactSuffixInOrder() throws Exception {
    DurableEventLog log = newLog(UNBOUNDED, new NoOpEventLogJournal());
    log.appendAll(records(20));

    for (long from = 1L; from <= 21L; from++) {
      try (LogReader reader = log.openReader(from)) {
        List<Long> seen = new ArrayList<>();
        List<LogEntry> batch;
        while (!(batch = reader.poll(3, Duration.ZERO)).isEmpty()) {
          batch.forEach(entry -> seen.add(entry.offset()));
        }
        assertEquals(LongStream.rangeClosed(from, 20L).boxed().toList(), seen);
      }
    }
  }

  @Test
  void readerAtHeadShouldWaitForNextAppend() throws Exception {
    DurableEventLog log = newLog(UNBOUNDED, new NoOpEventLogJournal());
    log.appendAll(records(2));
    LogReader reader = log.openReaderAtHead();

    assertTrue(reader.poll(10, Duration.ofMillis(20)).isEmpty());

    CompletableFuture<List<LogEntry>> pending =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return reader.poll(10, Duration.ofSeconds(5));
              } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(ex);
              }
            });
    log.append(record(3));

    List<LogEntry> delivered = pending.get(5, TimeUnit.SECONDS);
    assertEquals(1, delivered.size());
    assertEquals(3L, delivered.get(0).offset());
    assertEquals(3L, reader.lastReadOffset());
  }

  @Test
  void compactionShouldEvictWhenEitherSoftLimitIsExceeded() {
    DurableEventLog log =
        newLog(new RetentionPolicy(5, Duration.ofMinutes(10), 0), new NoOpEventLogJournal());
    log.appendAll(records(10));

    CompactionResult overCount = log.compact();
    assertEquals(5L, overCount.evictedEntries());
    assertEquals(6L, log.floorOffset());

    clock.advance(Duration.ofMinutes(11));
    log.append(record(11));
    CompactionResult expired = log.compact();

    assertEquals(5L, expired.evictedEntries());
    assertEquals(11L, log.floorOffset());
    assertEquals(1L, log.size());
  }

  @Test
  void compactionWithinBothSoftLimitsShouldKeepEverything() {
    DurableEventLog log =
        newLog(new RetentionPolicy(20, Duration.ofMinutes(10), 0), new NoOpEventLogJournal());
    log.appendAll(records(10));
    clock.advance(Duration.ofMinutes(9));

    assertFalse(log.compact().evicted());
    assertEquals(1L, log.floorOffset());
  }

  @Test
  void shouldApplyCountLimitAloneWhenAgeLimitIsUnset() {
    DurableEventLog log = newLog(new RetentionPolicy(4, null, 0), new NoOpEventLogJournal());
    log.appendAll(records(10));

    log.compact();

    assertEquals(7L, log.floorOffset());
  }

  @Test
  void evictedOffsetsShouldAlwaysRaiseOffsetEvicted() {
    DurableEventLog log = newLog(new RetentionPolicy(50, null, 0), new NoOpEventLogJournal());
    log.appendAll(records(149));
    log.compact();
    assertEquals(100L, log.floorOffset());

    // client last processed sequence 50 and needs 51 next
    OffsetEvictedException readerFailure =
        assertThrows(OffsetEvictedException.class, () -> log.openReader(51L));
    assertEquals(51L, readerFailure.requestedOffset());
    assertEquals(100L, readerFailure.floorOffset());
    assertThrows(OffsetEvictedException.class, () -> log.readRange(99L, 10));
    assertEquals(100L, log.readRange(100L, 1).get(0).offset());
  }

  @Test
  void compactionShouldNeverEvictEntriesNeededByActiveReader() throws Exception {
    DurableEventLog log = newLog(new RetentionPolicy(2, null, 0), new NoOpEventLogJournal());
    log.appendAll(records(10));
    LogReader slowReader = log.openReader(3L);

    log.compact();
    assertEquals(3L, log.floorOffset());

    slowReader.poll(4, Duration.ZERO);
    log.compact();
    assertEquals(7L, log.floorOffset());

    slowReader.close();
    log.compact();
    assertEquals(9L, log.floorOffset());
  }

  @Test
  void hardLimitShouldMarkReaderLaggingInsteadOfGrowingUnbounded() {
    DurableEventLog log = newLog(new RetentionPolicy(2, null, 5), new NoOpEventLogJournal());
    log.appendAll(records(12));
    LogReader stalled = log.openReader(1L);
    LogReader healthy = log.openReader(10L);

    CompactionResult result = log.compact();

    assertEquals(8L, log.floorOffset());
    assertEquals(1, result.readersMarkedLagging());
    assertTrue(stalled.isLagging());
    assertFalse(healthy.isLagging());
    assertThrows(OffsetEvictedException.class, () -> stalled.poll(10, Duration.ZERO));
  }

  @Test
  void failedJournalWriteShouldNotPublishEntries() {
    FailingJournal journal = new FailingJournal();
    DurableEventLog log = newLog(UNBOUNDED, journal);
    log.appendAll(records(2));

    journal.failNext = true;
    assertThrows(IllegalStateException.class, () -> log.append(record(3)));

    assertEquals(2L, log.headOffset());
    assertEquals(3L, log.append(record(3)));
  }

  @Test
  void recoveryShouldContinueSequencingAfterJournalTail() {
    RecordingJournal journal = new RecordingJournal();
    DurableEventLog original = newLog(UNBOUNDED, journal);
    original.appendAll(records(6));

    DurableEventLog restarted = newLog(UNBOUNDED, journal);
    restarted.recover();

    assertEquals(1L, restarted.floorOffset());
    assertEquals(6L, restarted.headOffset());
    assertEquals("key-4", restarted.readRange(4L, 1).get(0).event().key());
    assertEquals(7L, restarted.append(record(7)));
  }

  @Test
  void recoveryAfterFullCompactionShouldNotReuseOffsets() {
    RecordingJournal journal = new RecordingJournal();
    DurableEventLog original = newLog(new RetentionPolicy(1, null, 0), journal);
    original.appendAll(records(5));
    original.compact();

    DurableEventLog restarted = newLog(UNBOUNDED, journal);
    restarted.recover();

    assertEquals(5L, restarted.headOffset());
    assertEquals(6L, restarted.append(record(6)));
  }

  private DurableEventLog newLog(RetentionPolicy policy, EventLogJournal journal) {
    return new DurableEventLog(journal, new NoOpEventLogTelemetry(), policy, clock);
  }

  private static List<RawChangeRecord> records(int count) {
    List<RawChangeRecord> records = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      records.add(record(i));
    }
    return records;
  }

  private static RawChangeRecord record(int i) {
    return new RawChangeRecord(
        CapturePosition.of(i, 0L),
        "tasks",
        ChangeOperation.INSERT,
        "key-" + i,
        null,
        Map.of("id", i, "user_id", "u" + (i % 3)),
        Instant.parse("2026-03-01T09:59:00Z"),
        "tx-" + i);
  }

  private static final class MutableClock extends Clock {
    private Instant now;

    private MutableClock(Instant now) {
      this.now = now;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return now;
    }
  }

  private static class RecordingJournal implements EventLogJournal {
    final List<LogEntry> stored = new ArrayList<>();

    @Override
    public void append(List<LogEntry> entries) {
      stored.addAll(entries);
    }

    @Override
    public List<LogEntry> loadTail(int limit) {
      int from = Math.max(0, stored.size() - limit);
      return List.copyOf(stored.subList(from, stored.size()));
    }

    @Override
    public void truncateBefore(long floorOffset) {
      if (stored.isEmpty()) {
        return;
      }
      long newest = stored.get(stored.size() - 1).offset();
      stored.removeIf(entry -> entry.offset() < floorOffset && entry.offset() < newest);
    }
  }

  private static final class FailingJournal extends RecordingJournal {
    boolean failNext;

    @Override
    public void append(List<LogEntry> entries) {
      if (failNext) {
        failNext = false;
        throw new IllegalStateException("journal unavailable");
      }
      super.append(entries);
    }
  }
}
