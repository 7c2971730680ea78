package io.cardwatch.monitor;

public enum MonitorState {
  IDLE,
  LISTING,
  CLASSIFYING,
  EXECUTING,
  SKIPPING_EMPTY,
  PERSISTING,
  SHUTTING_DOWN
}
