package com.changefeed.gateway.connection;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "changefeed.connection")
public class ConnectionProperties {
  private int queueCapacity = 1_000;
  private long lagThreshold = 500L;
  private Duration slowConsumerTimeout = Duration.ofSeconds(30);
  private Duration handshakeTimeout = Duration.ofSeconds(10);
  private Duration credentialTimeout = Duration.ofSeconds(5);
  private Duration idleTimeout = Duration.ofSeconds(60);
  private Duration drainGracePeriod = Duration.ofSeconds(5);
  private long sweepIntervalMs = 1_000L;
  private int senderThreads = 8;
  private String resumeSecret = "";
  private Duration resumeSessionTtl = Duration.ofMinutes(15);
  private int maxFrameLength = 65_536;

  public int getQueueCapacity() {
    return queueCapacity;
  }

  public void setQueueCapacity(int queueCapacity) {
    this.queueCapacity = queueCapacity;
  }

  public long getLagThreshold() {
    return lagThreshold;
  }

  public void setLagThreshold(long lagThreshold) {
    this.lagThreshold = lagThreshold;
  }

  public Duration getSlowConsumerTimeout() {
    return slowConsumerTimeout;
  }

  public void setSlowConsumerTimeout(Duration slowConsumerTimeout) {
    this.slowConsumerTimeout = slowConsumerTimeout;
  }

  public Duration getHandshakeTimeout() {
    return handshakeTimeout;
  }

  public void setHandshakeTimeout(Duration handshakeTimeout) {
    this.handshakeTimeout = handshakeTimeout;
  }

  public Duration getCredentialTimeout() {
    return credentialTimeout;
  }

  public void setCredentialTimeout(Duration credentialTimeout) {
    this.credentialTimeout = credentialTimeout;
  }

  public Duration getIdleTimeout() {
    return idleTimeout;
  }

  public void setIdleTimeout(Duration idleTimeout) {
    this.idleTimeout = idleTimeout;
  }

  public Duration getDrainGracePeriod() {
    return drainGracePeriod;
  }

  public void setDrainGracePeriod(Duration drainGracePeriod) {
    this.drainGracePeriod = drainGracePeriod;
  }

  public long getSweepIntervalMs() {
    return sweepIntervalMs;
  }

  public void setSweepIntervalMs(long sweepIntervalMs) {
    this.sweepIntervalMs = sweepIntervalMs;
  }

  public int getSenderThreads() {
    return senderThreads;
  }

  public void setSenderThreads(int senderThreads) {
    this.senderThreads = senderThreads;
  }

  public String getResumeSecret() {
    return resumeSecret;
  }

  public void setResumeSecret(String resumeSecret) {
    this.resumeSecret = resumeSecret;
  }

  public Duration getResumeSessionTtl() {
    return resumeSessionTtl;
  }

  public void setResumeSessionTtl(Duration resumeSessionTtl) {
    this.resumeSessionTtl = resumeSessionTtl;
  }

  public int getMaxFrameLength() {
    return maxFrameLength;
  }

  public void setMaxFrameLength(int maxFrameLength) {
    this.maxFrameLength = maxFrameLength;
  }
}
