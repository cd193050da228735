package com.changefeed.domain.changes.capture;

import com.changefeed.domain.changes.CapturePosition;

/**
 * The requested resume position is no longer retained upstream. Continuing would silently skip
 * changes, so the caller has to rebuild from a fresh baseline instead.
 */
public class ResyncRequiredException extends CaptureException {
  private final CapturePosition requested;
  private final CapturePosition earliestAvailable;

  public ResyncRequiredException(
      String sourceName, CapturePosition requested, CapturePosition earliestAvailable) {
    super(
        sourceName,
        String.format(
            "Resume position %s is no longer available upstream for source %s (earliest=%s)",
            requested == null ? "n/a" : requested.encode(),
            sourceName,
            earliestAvailable == null ? "unknown" : earliestAvailable.encode()));
    this.requested = requested;
    this.earliestAvailable = earliestAvailable;
  }

  public CapturePosition requested() {
    return requested;
  }

  public CapturePosition earliestAvailable() {
    return earliestAvailable;
  }
}
