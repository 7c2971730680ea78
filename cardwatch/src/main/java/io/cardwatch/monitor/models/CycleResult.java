package io.cardwatch.monitor.models;

import lombok.Builder;
import lombok.Value;

@Builder
@Value
public class CycleResult {
  Status status;
  int cycleNumber;
  int listedItems;
  int batchSize;

  public enum Status {
    // listing failed, history untouched
    REMOTE_ERROR,
    NO_NEW_ITEMS,
    COMMITTED,
    PIPELINE_FAILED,
    CANCELLED,
    UNEXPECTED_FAILURE
  }
}
