package com.changefeed.gateway.capture;

public enum CaptureStatus {
  STARTING,
  RUNNING,
  RECONNECTING,
  HALTED,
  STOPPED
}
