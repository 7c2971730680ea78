package io.cardwatch.history.models;

import com.google.common.collect.ImmutableSet;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Immutable view of the processing history. Every change produces a new snapshot; {@code
 * processedIds} keeps first-commit order and never shrinks.
 */
@Value
@Builder(toBuilder = true)
public class HistorySnapshot {
  // null until the first check was recorded
  @Nullable Instant lastCheckedAt;
  int checkCount;
  @NonNull @Builder.Default ImmutableSet<String> processedIds = ImmutableSet.of();

  public static HistorySnapshot empty() {
    return HistorySnapshot.builder().build();
  }

  public boolean isProcessed(String id) {
    return processedIds.contains(id);
  }

  public HistorySnapshot withCommittedIds(Collection<String> newIds, Instant checkedAt) {
    return toBuilder()
        .processedIds(ImmutableSet.<String>builder().addAll(processedIds).addAll(newIds).build())
        .checkCount(checkCount + 1)
        .lastCheckedAt(checkedAt)
        .build();
  }

  public HistorySnapshot touched(Instant checkedAt) {
    return withCommittedIds(Collections.emptySet(), checkedAt);
  }
}
