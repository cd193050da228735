package com.changefeed.gateway.connection;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers, per resume key, the latest checkpoint the connection's sender passed, so a reconnect
 * can be clamped to what every subscription really received. Entries expire after the configured
 * TTL without activity.
 */
public class ResumeSessionStore {
  private final Map<String, ResumeSession> sessions = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;

  public ResumeSessionStore(Duration ttl, Clock clock) {
    this.ttl = ttl;
    this.clock = clock;
  }

  public void register(String resumeKey, String subject, long lastDeliveredSequence) {
    Instant now = clock.instant();
    sessions.merge(
        resumeKey,
        new ResumeSession(resumeKey, subject, lastDeliveredSequence, now),
        (existing, fresh) ->
            new ResumeSession(
                resumeKey,
                subject,
                Math.max(existing.lastDeliveredSequence(), lastDeliveredSequence),
                now));
  }

  /** Moves the session to {@code sequence}, backwards too when a replaying subscription joined. */
  public void checkpoint(String resumeKey, long sequence) {
    if (resumeKey == null) {
      return;
    }
    Instant now = clock.instant();
    sessions.computeIfPresent(resumeKey, (key, session) -> session.at(sequence, now));
  }

  public Optional<ResumeSession> find(String resumeKey) {
    ResumeSession session = sessions.get(resumeKey);
    if (session == null || isExpired(session, clock.instant())) {
      return Optional.empty();
    }
    return Optional.of(session);
  }

  public int evictExpired() {
    Instant now = clock.instant();
    int before = sessions.size();
    sessions.values().removeIf(session -> isExpired(session, now));
    return before - sessions.size();
  }

  public int size() {
    return sessions.size();
  }

  private boolean isExpired(ResumeSession session, Instant now) {
    return session.updatedAt().plus(ttl).isBefore(now);
  }
}
