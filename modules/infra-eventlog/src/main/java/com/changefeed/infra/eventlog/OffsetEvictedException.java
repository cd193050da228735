package com.changefeed.infra.eventlog;

/** Thrown when a reader asks for an offset that is no longer retained. */
public class OffsetEvictedException extends RuntimeException {
  private final long requestedOffset;
  private final long floorOffset;

  public OffsetEvictedException(long requestedOffset, long floorOffset) {
    super(
        "Offset "
            + requestedOffset
            + " has been evicted from the event log (oldest retained offset is "
            + floorOffset
            + ")");
    this.requestedOffset = requestedOffset;
    this.floorOffset = floorOffset;
  }

  public long requestedOffset() {
    return requestedOffset;
  }

  public long floorOffset() {
    return floorOffset;
  }
}
