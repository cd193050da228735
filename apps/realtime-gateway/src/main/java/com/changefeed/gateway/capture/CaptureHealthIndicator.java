package com.changefeed.gateway.capture;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/** Reports the capture stream as {@code capture} under the actuator health endpoint. */
public class CaptureHealthIndicator implements HealthIndicator {
  private final CaptureHealth captureHealth;

  public CaptureHealthIndicator(CaptureHealth captureHealth) {
    this.captureHealth = captureHealth;
  }

  @Override
  public Health health() {
    CaptureHealth.Snapshot snapshot = captureHealth.current();
    Health.Builder builder =
        switch (snapshot.status()) {
          case HALTED -> Health.down();
          case STOPPED -> Health.outOfService();
          case STARTING -> Health.unknown();
          case RUNNING, RECONNECTING -> Health.up();
        };
    builder.withDetail("status", snapshot.status().name());
    builder.withDetail("reconnectAttempts", snapshot.reconnectAttempts());
    if (snapshot.position() != null) {
      builder.withDetail("position", snapshot.position());
    }
    if (snapshot.lastError() != null) {
      builder.withDetail("lastError", snapshot.lastError());
    }
    if (snapshot.lastAppendAt() != null) {
      builder.withDetail("lastAppendAt", snapshot.lastAppendAt().toString());
    }
    return builder.build();
  }
}
