package com.changefeed.gateway.api;

import com.changefeed.domain.sessions.ConnectionState;
import com.changefeed.gateway.capture.CaptureHealth;
import com.changefeed.gateway.connection.ConnectionManager;
import com.changefeed.gateway.dispatch.FanOutDispatcher;
import com.changefeed.gateway.registry.SubscriptionRegistry;
import com.changefeed.infra.eventlog.DurableEventLog;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/engine")
@PreAuthorize("hasRole('ADMIN')")
public class EngineStatusController {
  private final CaptureHealth captureHealth;
  private final DurableEventLog eventLog;
  private final FanOutDispatcher dispatcher;
  private final ConnectionManager connectionManager;
  private final SubscriptionRegistry registry;

  public EngineStatusController(
      CaptureHealth captureHealth,
      DurableEventLog eventLog,
      FanOutDispatcher dispatcher,
      ConnectionManager connectionManager,
      SubscriptionRegistry registry) {
    this.captureHealth = captureHealth;
    this.eventLog = eventLog;
    this.dispatcher = dispatcher;
    this.connectionManager = connectionManager;
    this.registry = registry;
  }

  @GetMapping("/status")
  public EngineStatusResponse status() {
    Map<String, Integer> byState = new LinkedHashMap<>();
    Map<ConnectionState, Integer> counts = connectionManager.countByState();
    int total = 0;
    for (ConnectionState state : ConnectionState.values()) {
      int count = counts.getOrDefault(state, 0);
      byState.put(state.name(), count);
      total += count;
    }
    return new EngineStatusResponse(
        EngineStatusResponse.Capture.from(captureHealth.current()),
        new EngineStatusResponse.EventLog(
            eventLog.headOffset(), eventLog.floorOffset(), eventLog.size(), eventLog.activeReaderCount()),
        new EngineStatusResponse.Dispatch(
            dispatcher.workerCount(), dispatcher.dispatchedThrough(), dispatcher.lag()),
        new EngineStatusResponse.Connections(total, connectionManager.laggingCount(), byState),
        registry.countByChannel());
  }
}
