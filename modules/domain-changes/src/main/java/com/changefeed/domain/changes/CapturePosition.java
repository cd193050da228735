package com.changefeed.domain.changes;

/**
 * Totally ordered position inside a capture source.
 *
 * <p>The meaning of the two components is source specific: the change-log table uses {@code
 * (transaction id, row id)} while a Kafka partition uses {@code (offset, 0)}. {@link #latest()} is
 * a marker for "start from whatever is committed next" and never compares against real positions.
 */
public record CapturePosition(long primary, long secondary) implements Comparable<CapturePosition> {
  private static final CapturePosition LATEST = new CapturePosition(-1L, -1L);
  private static final CapturePosition BEGINNING = new CapturePosition(0L, 0L);

  public CapturePosition {
    boolean latestMarker = primary == -1L && secondary == -1L;
    if (!latestMarker && (primary < 0L || secondary < 0L)) {
      throw new ChangeDomainException("position components must be >= 0");
    }
  }

  public static CapturePosition latest() {
    return LATEST;
  }

  public static CapturePosition beginning() {
    return BEGINNING;
  }

  public static CapturePosition of(long primary, long secondary) {
    return new CapturePosition(primary, secondary);
  }

  public boolean isLatest() {
    return this.equals(LATEST);
  }

  public boolean isAfter(CapturePosition other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(CapturePosition other) {
    if (isLatest() || other.isLatest()) {
      throw new ChangeDomainException("latest() marker is not comparable");
    }
    int byPrimary = Long.compare(primary, other.primary);
    return byPrimary != 0 ? byPrimary : Long.compare(secondary, other.secondary);
  }

  public String encode() {
    return primary + ":" + secondary;
  }

  public static CapturePosition decode(String value) {
    if (value == null || value.isBlank()) {
      throw new ChangeDomainException("encoded position must not be blank");
    }
    int separator = value.indexOf(':');
    if (separator <= 0 || separator == value.length() - 1) {
      throw new ChangeDomainException("Malformed capture position: " + value);
    }
    try {
      return new CapturePosition(
          Long.parseLong(value.substring(0, separator)),
          Long.parseLong(value.substring(separator + 1)));
    } catch (NumberFormatException ex) {
      throw new ChangeDomainException("Malformed capture position: " + value);
    }
  }
}
