package com.changefeed.gateway.api;

import com.changefeed.gateway.capture.CaptureHealth;
import java.time.Instant;
import java.util.Map;

public record EngineStatusResponse(
    Capture capture,
    EventLog eventLog,
    Dispatch dispatch,
    Connections connections,
    Map<String, Integer> subscriptionsByChannel) {

  public record Capture(
      String status, String position, int reconnectAttempts, String lastError, Instant lastAppendAt) {
    public static Capture from(CaptureHealth.Snapshot snapshot) {
      return new Capture(
          snapshot.status().name(),
          snapshot.position(),
          snapshot.reconnectAttempts(),
          snapshot.lastError(),
          snapshot.lastAppendAt());
    }
  }

  public record EventLog(long headSequence, long floorSequence, long size, int activeReaders) {}

  public record Dispatch(int workers, long dispatchedThrough, long lag) {}

  public record Connections(int total, long lagging, Map<String, Integer> byState) {}
}
