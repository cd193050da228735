package com.changefeed.gateway.connection;

import java.time.Instant;

public record ResumeSession(String resumeKey, String subject, long lastDeliveredSequence, Instant updatedAt) {
  ResumeSession at(long sequence, Instant now) {
    return new ResumeSession(resumeKey, subject, sequence, now);
  }
}
