package com.changefeed.infra.eventlog;

import java.time.Duration;
import java.util.List;

/**
 * Forward-only cursor over a {@link DurableEventLog}.
 *
 * <p>An open reader pins the entries it has not read yet against compaction unless it falls behind
 * the hard size limit, in which case it is marked lagging and its next poll fails with {@link
 * OffsetEvictedException}. A reader is meant to be used by one thread at a time.
 */
public final class LogReader implements AutoCloseable {
  private final DurableEventLog log;
  private volatile long nextOffset;
  private volatile boolean lagging;
  private volatile boolean closed;

  LogReader(DurableEventLog log, long nextOffset) {
    this.log = log;
    this.nextOffset = nextOffset;
  }

  /**
   * Returns up to {@code maxEntries} entries starting at {@link #nextOffset()}, waiting up to
   * {@code timeout} when the reader is already at the head. An empty list means the wait expired.
   */
  public List<LogEntry> poll(int maxEntries, Duration timeout) throws InterruptedException {
    if (closed) {
      throw new IllegalStateException("reader is closed");
    }
    if (lagging) {
      throw new OffsetEvictedException(nextOffset, log.floorOffset());
    }
    if (!log.awaitBeyond(nextOffset - 1L, timeout)) {
      return List.of();
    }
    List<LogEntry> batch;
    try {
      batch = log.readRange(nextOffset, Math.max(1, maxEntries));
    } catch (OffsetEvictedException ex) {
      lagging = true;
      throw ex;
    }
    if (!batch.isEmpty()) {
      nextOffset = batch.get(batch.size() - 1).offset() + 1L;
    }
    return batch;
  }

  public long nextOffset() {
    return nextOffset;
  }

  public long lastReadOffset() {
    return nextOffset - 1L;
  }

  public boolean isLagging() {
    return lagging;
  }

  public boolean isClosed() {
    return closed;
  }

  void markLagging() {
    lagging = true;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      log.release(this);
    }
  }
}
