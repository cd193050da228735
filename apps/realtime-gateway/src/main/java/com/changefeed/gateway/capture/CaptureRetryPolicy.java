package com.changefeed.gateway.capture;

import com.changefeed.domain.changes.capture.SourceDisconnectedException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * How the ingestion loop rides out a recoverable capture fault: which faults qualify, how long to
 * wait before each retry and when to give up. Consecutive failures share one counter, which the
 * loop resets after the next batch goes through.
 */
public class CaptureRetryPolicy {
  private final int maxAttempts;
  private final long initialDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;
  private final DoubleSupplier random;

  public CaptureRetryPolicy(
      int maxAttempts, long initialDelayMs, long maxDelayMs, boolean jitter, DoubleSupplier random) {
    this.maxAttempts = maxAttempts;
    this.initialDelayMs = Math.max(0L, initialDelayMs);
    this.maxDelayMs = Math.max(this.initialDelayMs, maxDelayMs);
    this.jitter = jitter;
    this.random = Objects.requireNonNull(random, "random must not be null");
  }

  public static CaptureRetryPolicy from(CaptureProperties properties) {
    CaptureProperties.Backoff backoff = properties.getBackoff();
    return new CaptureRetryPolicy(
        properties.getMaxAttempts(),
        backoff.getBaseMs(),
        backoff.getMaxMs(),
        backoff.isJitterEnabled(),
        () -> ThreadLocalRandom.current().nextDouble());
  }

  /**
   * Source disconnects and journal or position-store outages are retried. Anything else, resync
   * included, halts capture.
   */
  public boolean isRecoverable(RuntimeException fault) {
    return fault instanceof SourceDisconnectedException
        || fault instanceof TransientDataAccessException
        || fault instanceof RecoverableDataAccessException
        || fault instanceof DataAccessResourceFailureException;
  }

  /** A non-positive limit retries forever. */
  public boolean exhausted(int failures) {
    return maxAttempts > 0 && failures >= maxAttempts;
  }

  /**
   * Wait before the retry that follows failure number {@code failures}, counting from 1. The
   * ceiling doubles per failure up to the maximum; with jitter the wait is drawn from the upper
   * half of the ceiling.
   */
  public Duration delayAfter(int failures) {
    long ceiling = ceiling(failures);
    if (!jitter || ceiling < 2L) {
      return Duration.ofMillis(ceiling);
    }
    long floor = ceiling / 2L;
    double draw = Math.max(0.0d, Math.min(1.0d, random.getAsDouble()));
    return Duration.ofMillis(floor + Math.round(draw * (ceiling - floor)));
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration maxDelay() {
    return Duration.ofMillis(maxDelayMs);
  }

  private long ceiling(int failures) {
    long ceiling = initialDelayMs;
    for (int i = 1; i < failures && ceiling > 0L && ceiling < maxDelayMs; i++) {
      ceiling = ceiling > maxDelayMs / 2L ? maxDelayMs : ceiling * 2L;
    }
    return Math.min(ceiling, maxDelayMs);
  }
}
