package io.cardwatch.config.models.configv1;

import static io.cardwatch.constants.MonitorConstants.DEFAULT_HISTORY_FILE_PATH;
import static io.cardwatch.constants.MonitorConstants.DEFAULT_INTERVAL_MINUTES;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Getter
@Jacksonized
@EqualsAndHashCode
public class MonitorConfig {
  @Builder.Default private JobRunMode jobRunMode = JobRunMode.CONTINUOUS;
  // delay between the end of one check and the start of the next
  @Builder.Default private int intervalMinutes = DEFAULT_INTERVAL_MINUTES;
  @Builder.Default private String historyFilePath = DEFAULT_HISTORY_FILE_PATH;
  @Builder.Default private ClassifierConfig classifierConfig = ClassifierConfig.builder().build();
  @Builder.Default private PipelineConfig pipelineConfig = PipelineConfig.builder().build();

  public enum JobRunMode {
    CONTINUOUS,
    ONCE
  }
}
