package com.changefeed.gateway.dispatch;

import com.changefeed.gateway.connection.OfferResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;

class DispatchMetrics {
  private final Counter delivered;
  private final Counter dropped;
  private final Counter rejected;
  private final Counter evicted;
  private final Counter failed;
  private final Timer passLatency;

  DispatchMetrics(MeterRegistry meterRegistry) {
    this.delivered = meterRegistry.counter("changefeed.dispatch.events.total", "outcome", "enqueued");
    this.dropped = meterRegistry.counter("changefeed.dispatch.events.total", "outcome", "dropped");
    this.rejected = meterRegistry.counter("changefeed.dispatch.events.total", "outcome", "rejected");
    this.evicted = meterRegistry.counter("changefeed.dispatch.subscriptions.evicted.total");
    this.failed = meterRegistry.counter("changefeed.dispatch.subscriptions.failed.total");
    this.passLatency = meterRegistry.timer("changefeed.dispatch.pass.latency");
  }

  void recordOffer(OfferResult result) {
    switch (result) {
      case ACCEPTED -> delivered.increment();
      case DROPPED -> dropped.increment();
      case REJECTED -> rejected.increment();
    }
  }

  void recordEvicted() {
    evicted.increment();
  }

  void recordFailed() {
    failed.increment();
  }

  void recordPass(long startedNanos) {
    passLatency.record(Duration.ofNanos(System.nanoTime() - startedNanos));
  }
}
