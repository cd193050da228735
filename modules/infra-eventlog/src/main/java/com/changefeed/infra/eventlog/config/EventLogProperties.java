package com.changefeed.infra.eventlog.config;

import com.changefeed.infra.eventlog.RetentionPolicy;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "changefeed.event-log")
public class EventLogProperties {
  private int maxEntries = 100_000;
  private int hardMaxEntries = 500_000;
  private Duration retention = Duration.ofMinutes(30);
  private long compactionIntervalMs = 5_000L;
  private Journal journal = new Journal();

  public RetentionPolicy toRetentionPolicy() {
    return new RetentionPolicy(maxEntries, retention, hardMaxEntries);
  }

  public int getMaxEntries() {
    return maxEntries;
  }

  public void setMaxEntries(int maxEntries) {
    this.maxEntries = maxEntries;
  }

  public int getHardMaxEntries() {
    return hardMaxEntries;
  }

  public void setHardMaxEntries(int hardMaxEntries) {
    this.hardMaxEntries = hardMaxEntries;
  }

  public Duration getRetention() {
    return retention;
  }

  public void setRetention(Duration retention) {
    this.retention = retention;
  }

  public long getCompactionIntervalMs() {
    return compactionIntervalMs;
  }

  public void setCompactionIntervalMs(long compactionIntervalMs) {
    this.compactionIntervalMs = compactionIntervalMs;
  }

  public Journal getJournal() {
    return journal;
  }

  public void setJournal(Journal journal) {
    this.journal = journal;
  }

  public static class Journal {
    /** {@code jdbc} persists entries to the {@code event_log} table, {@code none} keeps them in memory only. */
    private String mode = "jdbc";

    public String getMode() {
      return mode;
    }

    public void setMode(String mode) {
      this.mode = mode;
    }
  }
}
