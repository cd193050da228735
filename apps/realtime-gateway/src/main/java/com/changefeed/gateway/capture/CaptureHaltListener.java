package com.changefeed.gateway.capture;

/** Notified once when ingestion stops for good. */
@FunctionalInterface
public interface CaptureHaltListener {
  void onHalted(boolean resyncRequired, String reason);

  CaptureHaltListener NONE = (resyncRequired, reason) -> {};
}
