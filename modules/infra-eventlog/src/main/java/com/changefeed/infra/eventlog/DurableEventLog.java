package com.changefeed.infra.eventlog;

import com.changefeed.domain.changes.ChangeEvent;
import com.changefeed.domain.changes.RawChangeRecord;
import com.changefeed.infra.eventlog.journal.EventLogJournal;
import com.changefeed.infra.eventlog.observability.EventLogTelemetry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only, gap-free sequence of change events with a bounded replay window.
 *
 * <p>There is exactly one appender (the capture ingestion thread). Readers never take the append
 * monitor: they observe the volatile {@code head} and read entries from a concurrent sorted map.
 * Entries are written to the journal before {@code head} moves past them, so anything a reader can
 * see survives a restart. Offsets start at 1 and equal the event sequence.
 */
public class DurableEventLog {
  private static final Logger log = LoggerFactory.getLogger(DurableEventLog.class);

  private final ConcurrentSkipListMap<Long, LogEntry> entries = new ConcurrentSkipListMap<>();
  private final Set<LogReader> readers = ConcurrentHashMap.newKeySet();
  private final Object appendMonitor = new Object();
  private final Object readerMonitor = new Object();
  private final ReentrantLock headLock = new ReentrantLock();
  private final Condition headAdvanced = headLock.newCondition();

  private final EventLogJournal journal;
  private final EventLogTelemetry telemetry;
  private final RetentionPolicy retentionPolicy;
  private final Clock clock;

  private volatile long head;
  private volatile long floor = 1L;

  public DurableEventLog(
      EventLogJournal journal, EventLogTelemetry telemetry, RetentionPolicy retentionPolicy) {
    this(journal, telemetry, retentionPolicy, Clock.systemUTC());
  }

  DurableEventLog(
      EventLogJournal journal,
      EventLogTelemetry telemetry,
      RetentionPolicy retentionPolicy,
      Clock clock) {
    this.journal = Objects.requireNonNull(journal, "journal must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.retentionPolicy = Objects.requireNonNull(retentionPolicy, "retentionPolicy must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
  }

  /** Reloads the newest journal entries. Must run before the first append. */
  public void recover() {
    int limit = retentionPolicy.hasHardLimit() ? retentionPolicy.hardMaxEntries() : Integer.MAX_VALUE;
    List<LogEntry> recovered = journal.loadTail(limit);
    synchronized (appendMonitor) {
      if (head != 0L) {
        throw new IllegalStateException("recover() must run before the first append");
      }
      if (recovered.isEmpty()) {
        log.info("Event log recovery found empty journal");
        return;
      }
      long expected = recovered.get(0).offset();
      for (LogEntry entry : recovered) {
        if (entry.offset() != expected) {
          throw new IllegalStateException(
              "Journal is not contiguous: expected offset " + expected + " but found " + entry.offset());
        }
        entries.put(entry.offset(), entry);
        expected++;
      }
      floor = recovered.get(0).offset();
      publishHead(recovered.get(recovered.size() - 1).offset());
    }
    log.info("Event log recovered entries={} floor={} head={}", recovered.size(), floor, head);
  }

  public long append(RawChangeRecord record) {
    Objects.requireNonNull(record, "record must not be null");
    return appendAll(List.of(record)).get(0).offset();
  }

  /** Sequences, journals and publishes a batch; records keep their relative order. */
  public List<LogEntry> appendAll(List<RawChangeRecord> records) {
    if (records == null || records.isEmpty()) {
      return List.of();
    }
    long started = System.nanoTime();
    synchronized (appendMonitor) {
      Instant appendedAt = clock.instant();
      long next = head + 1L;
      List<LogEntry> batch = new ArrayList<>(records.size());
      for (RawChangeRecord record : records) {
        batch.add(new LogEntry(next, ChangeEvent.fromRaw(next, record), appendedAt));
        next++;
      }
      journal.append(batch);
      for (LogEntry entry : batch) {
        entries.put(entry.offset(), entry);
      }
      publishHead(batch.get(batch.size() - 1).offset());
      telemetry.onAppended(batch.size(), System.nanoTime() - started);
      return List.copyOf(batch);
    }
  }

  /**
   * Returns up to {@code maxCount} consecutive entries starting at {@code fromOffset} without
   * blocking. Offsets past the head yield an empty list.
   */
  public List<LogEntry> readRange(long fromOffset, int maxCount) {
    long currentFloor = floor;
    if (fromOffset < currentFloor) {
      telemetry.onOffsetEvicted(fromOffset);
      throw new OffsetEvictedException(fromOffset, currentFloor);
    }
    long last = Math.min(head, fromOffset + Math.max(1, maxCount) - 1L);
    if (fromOffset > last) {
      return List.of();
    }
    List<LogEntry> result = new ArrayList<>((int) (last - fromOffset + 1L));
    for (long offset = fromOffset; offset <= last; offset++) {
      LogEntry entry = entries.get(offset);
      if (entry == null) {
        telemetry.onOffsetEvicted(offset);
        throw new OffsetEvictedException(offset, floor);
      }
      result.add(entry);
    }
    return result;
  }

  /** Opens a reader whose first entry will be {@code fromOffset}. */
  public LogReader openReader(long fromOffset) {
    synchronized (readerMonitor) {
      long currentFloor = floor;
      if (fromOffset < currentFloor) {
        telemetry.onOffsetEvicted(fromOffset);
        throw new OffsetEvictedException(fromOffset, currentFloor);
      }
      long currentHead = head;
      if (fromOffset > currentHead + 1L) {
        throw new IllegalArgumentException(
            "fromOffset " + fromOffset + " is beyond the next offset " + (currentHead + 1L));
      }
      LogReader reader = new LogReader(this, fromOffset);
      readers.add(reader);
      return reader;
    }
  }

  /** Opens a reader positioned after the current head. */
  public LogReader openReaderAtHead() {
    synchronized (readerMonitor) {
      LogReader reader = new LogReader(this, head + 1L);
      readers.add(reader);
      return reader;
    }
  }

  /**
   * Drops entries that are outside either soft retention limit and not needed by an active
   * non-lagging reader. The hard limit overrides readers; readers behind it are marked lagging.
   */
  public CompactionResult compact() {
    synchronized (readerMonitor) {
      long currentHead = head;
      long currentFloor = floor;
      long candidate = retentionCandidate(currentHead, currentFloor);
      long newFloor = Math.min(candidate, slowestActiveReader());
      int markedLagging = 0;
      if (retentionPolicy.hasHardLimit()) {
        long hardFloor = currentHead - retentionPolicy.hardMaxEntries() + 1L;
        if (newFloor < hardFloor) {
          newFloor = hardFloor;
          for (LogReader reader : readers) {
            if (!reader.isLagging() && reader.nextOffset() < hardFloor) {
              reader.markLagging();
              markedLagging++;
            }
          }
        }
      }
      newFloor = Math.min(Math.max(newFloor, currentFloor), currentHead + 1L);
      if (newFloor == currentFloor) {
        return new CompactionResult(currentFloor, currentFloor, currentHead, 0L, markedLagging);
      }
      floor = newFloor;
      entries.headMap(newFloor).clear();
      journal.truncateBefore(newFloor);
      long evicted = newFloor - currentFloor;
      telemetry.onCompacted(evicted, markedLagging);
      if (markedLagging > 0) {
        log.warn(
            "Event log hard limit evicted entries needed by readers lagging_readers={} floor={} head={}",
            markedLagging,
            newFloor,
            currentHead);
      }
      log.debug(
          "Event log compacted previous_floor={} floor={} head={} evicted={}",
          currentFloor,
          newFloor,
          currentHead,
          evicted);
      return new CompactionResult(currentFloor, newFloor, currentHead, evicted, markedLagging);
    }
  }

  /** Last assigned offset, or 0 when nothing was ever appended. */
  public long headOffset() {
    return head;
  }

  /** Oldest retained offset; {@code headOffset() + 1} when the window is empty. */
  public long floorOffset() {
    return floor;
  }

  public long size() {
    return Math.max(0L, head - floor + 1L);
  }

  public int activeReaderCount() {
    return readers.size();
  }

  boolean awaitBeyond(long offset, Duration timeout) throws InterruptedException {
    if (head > offset) {
      return true;
    }
    long remaining = timeout == null ? 0L : timeout.toNanos();
    headLock.lock();
    try {
      while (head <= offset) {
        if (remaining <= 0L) {
          return false;
        }
        remaining = headAdvanced.awaitNanos(remaining);
      }
      return true;
    } finally {
      headLock.unlock();
    }
  }

  void release(LogReader reader) {
    readers.remove(reader);
  }

  private void publishHead(long newHead) {
    headLock.lock();
    try {
      head = newHead;
      headAdvanced.signalAll();
    } finally {
      headLock.unlock();
    }
  }

  /** Exceeding either soft limit is enough to evict, so the candidate is the higher of the two floors. */
  private long retentionCandidate(long currentHead, long currentFloor) {
    long candidate = currentFloor;
    if (retentionPolicy.hasCountLimit()) {
      candidate = Math.max(candidate, currentHead - retentionPolicy.maxEntries() + 1L);
    }
    if (retentionPolicy.hasAgeLimit()) {
      candidate =
          Math.max(
              candidate,
              firstOffsetNotOlderThan(clock.instant().minus(retentionPolicy.retention()), currentHead));
    }
    return candidate;
  }

  private long firstOffsetNotOlderThan(Instant cutoff, long currentHead) {
    for (LogEntry entry : entries.values()) {
      if (entry.offset() > currentHead || !entry.appendedAt().isBefore(cutoff)) {
        return entry.offset();
      }
    }
    return currentHead + 1L;
  }

  private long slowestActiveReader() {
    long slowest = Long.MAX_VALUE;
    for (LogReader reader : readers) {
      if (!reader.isClosed() && !reader.isLagging()) {
        slowest = Math.min(slowest, reader.nextOffset());
      }
    }
    return slowest;
  }
}
