package com.changefeed.gateway.capture;

import com.changefeed.domain.changes.CapturePosition;
import com.changefeed.domain.changes.RawChangeRecord;
import com.changefeed.domain.changes.capture.CaptureException;
import com.changefeed.domain.changes.capture.CapturePositionStore;
import com.changefeed.domain.changes.capture.ChangeCaptureSource;
import com.changefeed.domain.changes.capture.ResyncRequiredException;
import com.changefeed.infra.eventlog.DurableEventLog;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Single appender of the event log. Pulls committed changes from the capture source, appends them
 * and only then records and acknowledges the source position, so a restart replays at most the
 * last unacknowledged batch.
 *
 * <p>Faults the {@link CaptureRetryPolicy} deems recoverable are retried with backoff. A source
 * disconnect reopens the source at the last saved position; a journal or position-store outage
 * retries the batch already in hand from the step that failed, so no record is appended twice. A
 * lost resume position or an unreadable change halts capture, because skipping ahead would break
 * the gap-free sequence.
 */
public class CaptureIngestionService {
  private static final Logger log = LoggerFactory.getLogger(CaptureIngestionService.class);

  private final ChangeCaptureSource source;
  private final CapturePositionStore positionStore;
  private final DurableEventLog eventLog;
  private final CaptureHealth health;
  private final CaptureRetryPolicy retryPolicy;
  private final Duration pollTimeout;
  private final MeterRegistry meterRegistry;
  private final Sleeper sleeper;
  private volatile CaptureHaltListener haltListener = CaptureHaltListener.NONE;

  private volatile boolean running;
  private volatile Thread worker;

  public CaptureIngestionService(
      ChangeCaptureSource source,
      CapturePositionStore positionStore,
      DurableEventLog eventLog,
      CaptureHealth health,
      CaptureRetryPolicy retryPolicy,
      CaptureProperties properties,
      MeterRegistry meterRegistry) {
    this(
        source,
        positionStore,
        eventLog,
        health,
        retryPolicy,
        properties,
        meterRegistry,
        duration -> Thread.sleep(duration.toMillis()));
  }

  CaptureIngestionService(
      ChangeCaptureSource source,
      CapturePositionStore positionStore,
      DurableEventLog eventLog,
      CaptureHealth health,
      CaptureRetryPolicy retryPolicy,
      CaptureProperties properties,
      MeterRegistry meterRegistry,
      Sleeper sleeper) {
    this.source = source;
    this.positionStore = positionStore;
    this.eventLog = eventLog;
    this.health = health;
    this.retryPolicy = retryPolicy;
    this.pollTimeout = Duration.ofMillis(Math.max(0L, properties.getPollTimeoutMs()));
    this.meterRegistry = meterRegistry;
    this.sleeper = sleeper;
  }

  @EventListener(ApplicationReadyEvent.class)
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    Thread thread = new Thread(this::ingestLoop, "capture-ingest");
    thread.setDaemon(true);
    worker = thread;
    thread.start();
  }

  @PreDestroy
  public synchronized void stop() {
    running = false;
    Thread thread = worker;
    worker = null;
    if (thread != null) {
      thread.interrupt();
      try {
        thread.join(pollTimeout.toMillis() + 5_000L);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
    closeSource();
    health.stopped();
  }

  public void setHaltListener(CaptureHaltListener haltListener) {
    this.haltListener = haltListener == null ? CaptureHaltListener.NONE : haltListener;
  }

  public boolean isRunning() {
    return running;
  }

  /** Runs the ingestion loop on the calling thread until stopped or halted. */
  void runUntilStopped() {
    running = true;
    ingestLoop();
  }

  private void ingestLoop() {
    CapturePosition position = positionStore.load(source.name()).orElse(CapturePosition.latest());
    boolean open = false;
    int failures = 0;
    PendingBatch pending = null;
    log.info("Capture ingestion starting source={} resume_after={}", source.name(), position.encode());

    while (running) {
      try {
        if (pending == null) {
          if (!open) {
            source.open(position);
            open = true;
            health.running(position.encode());
          }
          List<RawChangeRecord> records = source.poll(pollTimeout);
          failures = 0;
          if (records.isEmpty()) {
            continue;
          }
          pending = new PendingBatch(records);
        }
        ingest(pending);
        position = pending.last();
        pending = null;
        failures = 0;
      } catch (ResyncRequiredException ex) {
        halt(true, "resync required: " + ex.getMessage(), ex);
        return;
      } catch (RuntimeException ex) {
        if (pending != null && pending.saved) {
          position = pending.last();
          pending = null;
        }
        if (!retryPolicy.isRecoverable(ex)) {
          String reason =
              ex instanceof CaptureException ? "capture failed: " + ex.getMessage() : "ingestion failed: " + ex;
          halt(false, reason, ex);
          return;
        }
        failures++;
        if (pending == null) {
          closeSource();
          open = false;
        }
        meterRegistry
            .counter(
                "changefeed.capture.retry.total",
                "source",
                source.name(),
                "stage",
                pending == null ? "source" : "append")
            .increment();
        if (retryPolicy.exhausted(failures)) {
          halt(false, "retries exhausted after " + failures + ": " + ex.getMessage(), ex);
          return;
        }
        Duration delay = retryPolicy.delayAfter(failures);
        health.reconnecting(failures, ex.getMessage());
        log.warn(
            "Capture retrying source={} stage={} attempt={} delay_ms={} error={}",
            source.name(),
            pending == null ? "source" : "append",
            failures,
            delay.toMillis(),
            ex.getMessage());
        if (!pause(delay)) {
          break;
        }
      }
    }
    closeSource();
    log.info("Capture ingestion stopped source={} position={}", source.name(), position.encode());
  }

  /** Each step runs at most once per batch, so a retry resumes where the last attempt failed. */
  private void ingest(PendingBatch batch) {
    long started = System.nanoTime();
    if (!batch.appended) {
      eventLog.appendAll(batch.records);
      batch.appended = true;
    }
    CapturePosition last = batch.last();
    positionStore.save(source.name(), last);
    batch.saved = true;
    source.acknowledge(last);
    health.appended(last.encode());
    meterRegistry
        .counter("changefeed.capture.records.total", "source", source.name())
        .increment(batch.records.size());
    meterRegistry
        .timer("changefeed.capture.batch.latency", "source", source.name())
        .record(Duration.ofNanos(System.nanoTime() - started));
    log.debug(
        "Capture batch appended source={} records={} position={} head={}",
        source.name(),
        batch.records.size(),
        last.encode(),
        eventLog.headOffset());
  }

  private void halt(boolean resyncRequired, String reason, RuntimeException cause) {
    running = false;
    closeSource();
    health.halted(reason);
    meterRegistry.counter("changefeed.capture.halted.total", "source", source.name()).increment();
    log.error("Capture ingestion halted source={} reason={}", source.name(), reason, cause);
    try {
      haltListener.onHalted(resyncRequired, reason);
    } catch (RuntimeException ex) {
      log.warn("Capture halt listener failed source={} error={}", source.name(), ex.getMessage());
    }
  }

  private boolean pause(Duration delay) {
    try {
      sleeper.sleep(delay);
      return running;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void closeSource() {
    try {
      source.close();
    } catch (RuntimeException ex) {
      log.warn("Capture source close failed source={} error={}", source.name(), ex.getMessage());
    }
  }

  private static final class PendingBatch {
    private final List<RawChangeRecord> records;
    private boolean appended;
    private boolean saved;

    private PendingBatch(List<RawChangeRecord> records) {
      this.records = records;
    }

    private CapturePosition last() {
      return records.get(records.size() - 1).position();
    }
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
