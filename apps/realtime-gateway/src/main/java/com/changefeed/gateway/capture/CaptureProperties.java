package com.changefeed.gateway.capture;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "changefeed.capture")
public class CaptureProperties {
  private boolean enabled = true;
  private String mode = "jdbc";
  private String sourceName = "primary";
  private long pollTimeoutMs = 500L;
  private int batchSize = 500;
  private List<String> watchedTables = new ArrayList<>(List.of("tasks"));
  private boolean purgeAcknowledged = true;
  private int maxAttempts = 20;
  private Backoff backoff = new Backoff();

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getMode() {
    return mode;
  }

  public void setMode(String mode) {
    this.mode = mode;
  }

  public String getSourceName() {
    return sourceName;
  }

  public void setSourceName(String sourceName) {
    this.sourceName = sourceName;
  }

  public long getPollTimeoutMs() {
    return pollTimeoutMs;
  }

  public void setPollTimeoutMs(long pollTimeoutMs) {
    this.pollTimeoutMs = pollTimeoutMs;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public List<String> getWatchedTables() {
    return watchedTables;
  }

  public void setWatchedTables(List<String> watchedTables) {
    this.watchedTables = watchedTables;
  }

  public boolean isPurgeAcknowledged() {
    return purgeAcknowledged;
  }

  public void setPurgeAcknowledged(boolean purgeAcknowledged) {
    this.purgeAcknowledged = purgeAcknowledged;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public Backoff getBackoff() {
    return backoff;
  }

  public void setBackoff(Backoff backoff) {
    this.backoff = backoff;
  }

  public static class Backoff {
    private long baseMs = 200L;
    private long maxMs = 10_000L;
    private boolean jitterEnabled = true;

    public long getBaseMs() {
      return baseMs;
    }

    public void setBaseMs(long baseMs) {
      this.baseMs = baseMs;
    }

    public long getMaxMs() {
      return maxMs;
    }

    public void setMaxMs(long maxMs) {
      this.maxMs = maxMs;
    }

    public boolean isJitterEnabled() {
      return jitterEnabled;
    }

    public void setJitterEnabled(boolean jitterEnabled) {
      this.jitterEnabled = jitterEnabled;
    }
  }
}
