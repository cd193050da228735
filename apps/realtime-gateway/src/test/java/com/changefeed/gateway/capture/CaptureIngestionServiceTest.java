package com.changefeed.gateway.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.changefeed.domain.changes.CapturePosition;
import com.changefeed.domain.changes.ChangeOperation;
import com.changefeed.domain.changes.RawChangeRecord;
import com.changefeed.domain.changes.capture.CaptureException;
import com.changefeed.domain.changes.capture.ChangeCaptureSource;
import com.changefeed.domain.changes.capture.InMemoryCapturePositionStore;
import com.changefeed.domain.changes.capture.ResyncRequiredException;
import com.changefeed.domain.changes.capture.SourceDisconnectedException;
import com.changefeed.infra.eventlog.DurableEventLog;
import com.changefeed.infra.eventlog.RetentionPolicy;
import com.changefeed.infra.eventlog.journal.EventLogJournal;
import com.changefeed.infra.eventlog.journal.NoOpEventLogJournal;
import com.changefeed.infra.eventlog.observability.NoOpEventLogTelemetry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessResourceException;

class CaptureIngestionServiceTest {
  private static final String SOURCE = "primary";

  private ChangeCaptureSource source;
  private InMemoryCapturePositionStore positionStore;
  private DurableEventLog eventLog;
  private CaptureHealth health;
  private CaptureProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private List<Duration> sleeps;
  private List<String> halts;

  @BeforeEach
  void setUp() {
    source = mock(ChangeCaptureSource.class);
    when(source.name()).thenReturn(SOURCE);
    positionStore = new InMemoryCapturePositionStore();
    eventLog =
        new DurableEventLog(
            new NoOpEventLogJournal(), new NoOpEventLogTelemetry(), new RetentionPolicy(0, Duration.ZERO, 0));
    health = new CaptureHealth(Clock.systemUTC());
    properties = new CaptureProperties();
    properties.setPollTimeoutMs(10L);
    meterRegistry = new SimpleMeterRegistry();
    sleeps = new ArrayList<>();
    halts = new ArrayList<>();
  }

  @Test
  void shouldAppendThenSaveThenAcknowledgeEachBatch() {
    RawChangeRecord first = record(10L, 1L);
    RawChangeRecord second = record(10L, 2L);
    when(source.poll(any()))
        .thenReturn(List.of(first, second))
        .thenReturn(List.of())
        .thenThrow(resync());
    CaptureIngestionService service = service();

    service.runUntilStopped();

    assertEquals(2L, eventLog.headOffset());
    assertEquals(CapturePosition.of(10L, 2L), positionStore.load(SOURCE).orElseThrow());
    InOrder order = inOrder(source);
    order.verify(source).open(CapturePosition.latest());
    order.verify(source).acknowledge(CapturePosition.of(10L, 2L));
    assertEquals(2.0, meterRegistry.counter("changefeed.capture.records.total", "source", SOURCE).count());
  }

  @Test
  void shouldResumeAfterStoredPosition() {
    positionStore.save(SOURCE, CapturePosition.of(41L, 7L));
    when(source.poll(any())).thenThrow(resync());

    service().runUntilStopped();

    verify(source).open(CapturePosition.of(41L, 7L));
  }

  @Test
  void disconnectShouldReopenFromLastPositionWithGrowingBackoff() {
    RawChangeRecord first = record(3L, 1L);
    RawChangeRecord second = record(4L, 1L);
    when(source.poll(any()))
        .thenReturn(List.of(first))
        .thenThrow(new SourceDisconnectedException(SOURCE, "connection reset"))
        .thenThrow(new SourceDisconnectedException(SOURCE, "connection refused"))
        .thenReturn(List.of(second))
        .thenThrow(resync());
    CaptureIngestionService service = service();

    service.runUntilStopped();

    assertEquals(List.of(Duration.ofMillis(100L), Duration.ofMillis(200L)), sleeps);
    verify(source).open(CapturePosition.latest());
    verify(source, times(2)).open(CapturePosition.of(3L, 1L));
    assertEquals(2L, eventLog.headOffset());
    assertEquals(
        2.0,
        meterRegistry
            .counter("changefeed.capture.retry.total", "source", SOURCE, "stage", "source")
            .count());
  }

  @Test
  void exhaustedRetriesShouldHaltWithoutResync() {
    properties.setMaxAttempts(3);
    when(source.poll(any())).thenThrow(new SourceDisconnectedException(SOURCE, "down"));
    CaptureIngestionService service = service();

    service.runUntilStopped();

    assertEquals(2, sleeps.size());
    assertEquals(1, halts.size());
    assertTrue(halts.get(0).startsWith("false:retries exhausted after 3"));
    assertFalse(service.isRunning());
    assertEquals(CaptureStatus.HALTED, health.current().status());
  }

  @Test
  void unreachableJournalShouldRetrySameBatchWithoutReopeningSource() {
    EventLogJournal journal = mock(EventLogJournal.class);
    doThrow(new DataAccessResourceFailureException("event_log unreachable"))
        .doNothing()
        .when(journal)
        .append(any());
    eventLog = new DurableEventLog(journal, new NoOpEventLogTelemetry(), new RetentionPolicy(0, Duration.ZERO, 0));
    RawChangeRecord first = record(5L, 1L);
    RawChangeRecord second = record(5L, 2L);
    when(source.poll(any())).thenReturn(List.of(first, second)).thenThrow(resync());
    CaptureIngestionService service = service();

    service.runUntilStopped();

    assertEquals(2L, eventLog.headOffset());
    assertEquals(List.of(Duration.ofMillis(100L)), sleeps);
    assertEquals(CapturePosition.of(5L, 2L), positionStore.load(SOURCE).orElseThrow());
    verify(source, times(1)).open(any());
    verify(source).acknowledge(CapturePosition.of(5L, 2L));
    assertEquals(
        1.0,
        meterRegistry
            .counter("changefeed.capture.retry.total", "source", SOURCE, "stage", "append")
            .count());
    assertEquals(1, halts.size());
    assertTrue(halts.get(0).startsWith("true:resync required"));
  }

  @Test
  void positionStoreOutageShouldNotAppendBatchTwice() {
    positionStore = spy(new InMemoryCapturePositionStore());
    doThrow(new TransientDataAccessResourceException("position store busy"))
        .doCallRealMethod()
        .when(positionStore)
        .save(any(), any());
    when(source.poll(any())).thenReturn(List.of(record(6L, 1L), record(6L, 2L))).thenThrow(resync());
    CaptureIngestionService service = service();

    service.runUntilStopped();

    assertEquals(2L, eventLog.headOffset());
    assertEquals(CapturePosition.of(6L, 2L), positionStore.load(SOURCE).orElseThrow());
    verify(source, times(1)).acknowledge(CapturePosition.of(6L, 2L));
    assertEquals(1, sleeps.size());
  }

  @Test
  void nonTransientJournalFailureShouldHalt() {
    EventLogJournal journal = mock(EventLogJournal.class);
    doThrow(new DataIntegrityViolationException("duplicate offset")).when(journal).append(any());
    eventLog = new DurableEventLog(journal, new NoOpEventLogTelemetry(), new RetentionPolicy(0, Duration.ZERO, 0));
    when(source.poll(any())).thenReturn(List.of(record(7L, 1L)));
    CaptureIngestionService service = service();

    service.runUntilStopped();

    assertEquals(1, halts.size());
    assertTrue(halts.get(0).startsWith("false:ingestion failed"));
    assertTrue(sleeps.isEmpty());
    assertEquals(0L, eventLog.headOffset());
    verify(source, never()).acknowledge(any());
  }

  @Test
  void resyncShouldHaltAndNotifyListener() {
    when(source.poll(any())).thenThrow(resync());
    CaptureIngestionService service = service();

    service.runUntilStopped();

    assertEquals(1, halts.size());
    assertTrue(halts.get(0).startsWith("true:resync required"));
    assertEquals(
        1.0, meterRegistry.counter("changefeed.capture.halted.total", "source", SOURCE).count());
    verify(source, never()).acknowledge(any());
  }

  @Test
  void unreadableChangeShouldHaltWithoutResync() {
    when(source.poll(any())).thenThrow(new CaptureException(SOURCE, "undecodable row image"));
    CaptureIngestionService service = service();

    service.runUntilStopped();

    assertEquals(List.of("false:capture failed: undecodable row image"), halts);
    assertTrue(sleeps.isEmpty());
  }

  @Test
  void failingHaltListenerShouldNotEscape() {
    when(source.poll(any())).thenThrow(resync());
    CaptureIngestionService service = service();
    service.setHaltListener(
        (resyncRequired, reason) -> {
          throw new IllegalStateException("broadcast failed");
        });

    service.runUntilStopped();

    assertEquals(CaptureStatus.HALTED, health.current().status());
    verify(source, times(1)).close();
  }

  private CaptureIngestionService service() {
    properties.getBackoff().setBaseMs(100L);
    properties.getBackoff().setMaxMs(1_000L);
    properties.getBackoff().setJitterEnabled(false);
    CaptureIngestionService service =
        new CaptureIngestionService(
            source,
            positionStore,
            eventLog,
            health,
            CaptureRetryPolicy.from(properties),
            properties,
            meterRegistry,
            sleeps::add);
    service.setHaltListener((resyncRequired, reason) -> halts.add(resyncRequired + ":" + reason));
    return service;
  }

  private static ResyncRequiredException resync() {
    return new ResyncRequiredException(SOURCE, CapturePosition.of(1L, 0L), CapturePosition.of(9L, 0L));
  }

  private static RawChangeRecord record(long txid, long id) {
    return new RawChangeRecord(
        CapturePosition.of(txid, id),
        "tasks",
        ChangeOperation.INSERT,
        "t-" + txid + "-" + id,
        null,
        Map.of("id", "t-" + txid + "-" + id),
        Instant.parse("2026-03-01T12:00:00Z"),
        String.valueOf(txid));
  }
}
