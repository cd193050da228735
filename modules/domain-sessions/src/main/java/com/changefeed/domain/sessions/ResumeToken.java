package com.changefeed.domain.sessions;

/**
 * Client-held resume cursor: {@code <connectionIdentity>.<signature>.<lastDeliveredSequence>}.
 *
 * <p>The first two parts form the resume key the server hands out on connect; the client appends
 * the last sequence it processed.
 */
public record ResumeToken(String connectionIdentity, String signature, long lastDeliveredSequence) {
  private static final char SEPARATOR = '.';

  public ResumeToken {
    requireSegment(connectionIdentity, "connectionIdentity");
    requireSegment(signature, "signature");
    if (lastDeliveredSequence < 0L) {
      throw new SessionDomainException("lastDeliveredSequence must be >= 0");
    }
  }

  public static ResumeToken parse(String token) {
    if (token == null || token.isBlank()) {
      throw new SessionDomainException("resume token must not be blank");
    }
    String[] parts = token.trim().split("\\.", -1);
    if (parts.length != 3) {
      throw new SessionDomainException("resume token must have three segments");
    }
    long sequence;
    try {
      sequence = Long.parseLong(parts[2]);
    } catch (NumberFormatException ex) {
      throw new SessionDomainException("resume token sequence is not a number");
    }
    return new ResumeToken(parts[0], parts[1], sequence);
  }

  public String resumeKey() {
    return connectionIdentity + SEPARATOR + signature;
  }

  public String encode() {
    return resumeKey() + SEPARATOR + lastDeliveredSequence;
  }

  private static void requireSegment(String value, String fieldName) {
    if (value == null || value.isBlank()) {
      throw new SessionDomainException(fieldName + " must not be blank");
    }
    if (value.indexOf(SEPARATOR) >= 0) {
      throw new SessionDomainException(fieldName + " must not contain '.'");
    }
  }
}
