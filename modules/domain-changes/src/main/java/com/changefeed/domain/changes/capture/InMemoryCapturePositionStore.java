package com.changefeed.domain.changes.capture;

import com.changefeed.domain.changes.CapturePosition;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCapturePositionStore implements CapturePositionStore {
  private final Map<String, CapturePosition> positions = new ConcurrentHashMap<>();

  @Override
  public Optional<CapturePosition> load(String sourceName) {
    return Optional.ofNullable(positions.get(sourceName));
  }

  @Override
  public void save(String sourceName, CapturePosition position) {
    Objects.requireNonNull(position, "position must not be null");
    if (position.isLatest()) {
      throw new IllegalArgumentException("latest() marker cannot be stored");
    }
    positions.merge(sourceName, position, (current, next) -> next.isAfter(current) ? next : current);
  }
}
