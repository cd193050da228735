package com.changefeed.gateway.capture;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/** Last known state of change capture, shared between the ingestion thread and health checks. */
public class CaptureHealth {
  private final Clock clock;
  private final AtomicReference<Snapshot> current;

  public CaptureHealth(Clock clock) {
    this.clock = clock;
    this.current =
        new AtomicReference<>(new Snapshot(CaptureStatus.STARTING, null, 0, null, null, clock.instant()));
  }

  public Snapshot current() {
    return current.get();
  }

  void running(String position) {
    current.updateAndGet(
        previous ->
            new Snapshot(CaptureStatus.RUNNING, position, 0, null, previous.lastAppendAt(), clock.instant()));
  }

  void appended(String position) {
    Instant now = clock.instant();
    current.updateAndGet(
        previous -> new Snapshot(CaptureStatus.RUNNING, position, 0, null, now, now));
  }

  void reconnecting(int attempt, String error) {
    current.updateAndGet(
        previous ->
            new Snapshot(
                CaptureStatus.RECONNECTING,
                previous.position(),
                attempt,
                error,
                previous.lastAppendAt(),
                clock.instant()));
  }

  void halted(String error) {
    current.updateAndGet(
        previous ->
            new Snapshot(
                CaptureStatus.HALTED,
                previous.position(),
                previous.reconnectAttempts(),
                error,
                previous.lastAppendAt(),
                clock.instant()));
  }

  void stopped() {
    current.updateAndGet(
        previous ->
            previous.status() == CaptureStatus.HALTED
                ? previous
                : new Snapshot(
                    CaptureStatus.STOPPED,
                    previous.position(),
                    previous.reconnectAttempts(),
                    previous.lastError(),
                    previous.lastAppendAt(),
                    clock.instant()));
  }

  public record Snapshot(
      CaptureStatus status,
      String position,
      int reconnectAttempts,
      String lastError,
      Instant lastAppendAt,
      Instant updatedAt) {}
}
