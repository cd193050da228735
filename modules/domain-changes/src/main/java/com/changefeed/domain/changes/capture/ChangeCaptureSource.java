package com.changefeed.domain.changes.capture;

import com.changefeed.domain.changes.CapturePosition;
import com.changefeed.domain.changes.RawChangeRecord;
import java.time.Duration;
import java.util.List;

/**
 * Ordered stream of committed row changes from one upstream database.
 *
 * <p>A source is driven by a single thread: {@link #open} once, then {@link #poll} repeatedly.
 * Records come back in commit order and each one carries the position to {@link #acknowledge}
 * once it has been stored durably downstream. Implementations throw {@link
 * SourceDisconnectedException} for transient faults (the caller reopens from its last
 * acknowledged position) and {@link ResyncRequiredException} when that position is gone.
 */
public interface ChangeCaptureSource extends AutoCloseable {
  String name();

  /** Starts reading strictly after {@code resumeAfter}, or from now for {@link CapturePosition#latest()}. */
  void open(CapturePosition resumeAfter);

  List<RawChangeRecord> poll(Duration maxWait);

  void acknowledge(CapturePosition position);

  @Override
  void close();
}
