package com.changefeed.domain.changes.capture;

import com.changefeed.domain.changes.CapturePosition;
import java.util.Optional;

public interface CapturePositionStore {
  Optional<CapturePosition> load(String sourceName);

  void save(String sourceName, CapturePosition position);
}
