package com.changefeed.gateway.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "changefeed.connection.sweep",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class HeartbeatSweeper {
  private static final Logger log = LoggerFactory.getLogger(HeartbeatSweeper.class);

  private final ConnectionManager connectionManager;

  public HeartbeatSweeper(ConnectionManager connectionManager) {
    this.connectionManager = connectionManager;
  }

  @Scheduled(fixedDelayString = "${changefeed.connection.sweep-interval-ms:1000}")
  public void sweep() {
    try {
      connectionManager.sweep();
    } catch (RuntimeException ex) {
      log.warn("Connection sweep failed error={}", ex.getMessage(), ex);
    }
  }
}
