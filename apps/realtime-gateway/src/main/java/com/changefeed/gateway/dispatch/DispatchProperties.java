package com.changefeed.gateway.dispatch;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "changefeed.dispatch")
public class DispatchProperties {
  private boolean enabled = true;
  @Min(1)
  private int workers = 4;
  @Min(1)
  private int batchSize = 256;
  @Min(1)
  private long idleTickMs = 100L;
  @Min(1)
  private int catchUpChunk = 512;

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getWorkers() {
    return workers;
  }

  public void setWorkers(int workers) {
    this.workers = workers;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public long getIdleTickMs() {
    return idleTickMs;
  }

  public void setIdleTickMs(long idleTickMs) {
    this.idleTickMs = idleTickMs;
  }

  public int getCatchUpChunk() {
    return catchUpChunk;
  }

  public void setCatchUpChunk(int catchUpChunk) {
    this.catchUpChunk = catchUpChunk;
  }
}
