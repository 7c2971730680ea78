package io.cardwatch.pipeline.models;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Builder
@Value
public class RunOutcome {
  public static final int NO_EXIT_CODE = -1;

  boolean succeeded;
  // NO_EXIT_CODE when the process never produced an exit status
  @Builder.Default int exitCode = NO_EXIT_CODE;
  @NonNull @Builder.Default ImmutableList<String> stdoutTail = ImmutableList.of();
  @NonNull @Builder.Default ImmutableList<String> stderrTail = ImmutableList.of();
  boolean durationExceeded;
  boolean cancelled;
  @NonNull @Builder.Default Duration duration = Duration.ZERO;
}
