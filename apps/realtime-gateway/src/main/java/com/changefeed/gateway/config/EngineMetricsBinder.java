package com.changefeed.gateway.config;

import com.changefeed.gateway.connection.ConnectionManager;
import com.changefeed.gateway.dispatch.FanOutDispatcher;
import com.changefeed.gateway.registry.SubscriptionRegistry;
import com.changefeed.infra.eventlog.DurableEventLog;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

/** Gauges over live engine state; sampled at scrape time. */
@Component
public class EngineMetricsBinder implements MeterBinder {
  private final DurableEventLog eventLog;
  private final FanOutDispatcher dispatcher;
  private final ConnectionManager connectionManager;
  private final SubscriptionRegistry registry;

  public EngineMetricsBinder(
      DurableEventLog eventLog,
      FanOutDispatcher dispatcher,
      ConnectionManager connectionManager,
      SubscriptionRegistry registry) {
    this.eventLog = eventLog;
    this.dispatcher = dispatcher;
    this.connectionManager = connectionManager;
    this.registry = registry;
  }

  @Override
  public void bindTo(MeterRegistry meterRegistry) {
    Gauge.builder("changefeed.event_log.head", eventLog, DurableEventLog::headOffset)
        .description("Last assigned event sequence")
        .register(meterRegistry);
    Gauge.builder("changefeed.event_log.floor", eventLog, DurableEventLog::floorOffset)
        .description("Oldest retained event sequence")
        .register(meterRegistry);
    Gauge.builder("changefeed.event_log.readers", eventLog, DurableEventLog::activeReaderCount)
        .register(meterRegistry);
    Gauge.builder("changefeed.dispatch.lag", dispatcher, FanOutDispatcher::lag)
        .description("Appended events not yet dispatched")
        .register(meterRegistry);
    Gauge.builder("changefeed.connections.active", connectionManager, manager -> manager.connections().size())
        .register(meterRegistry);
    Gauge.builder("changefeed.connections.lagging", connectionManager, ConnectionManager::laggingCount)
        .register(meterRegistry);
    Gauge.builder("changefeed.subscriptions.active", registry, SubscriptionRegistry::size)
        .register(meterRegistry);
  }
}
