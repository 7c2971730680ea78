package io.cardwatch.config.models.configv1;

import static io.cardwatch.constants.MonitorConstants.DEFAULT_PIPELINE_COMMAND;
import static io.cardwatch.constants.MonitorConstants.DEFAULT_PIPELINE_TIMEOUT_SECONDS;
import static io.cardwatch.constants.MonitorConstants.DEFAULT_STDERR_TAIL_LINES;
import static io.cardwatch.constants.MonitorConstants.DEFAULT_STDOUT_TAIL_LINES;

import java.util.List;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Builder
@Getter
@Jacksonized
@EqualsAndHashCode
public class PipelineConfig {
  @Builder.Default private List<String> command = DEFAULT_PIPELINE_COMMAND;
  @Nullable private String workingDirectory;
  @Builder.Default private int timeoutSeconds = DEFAULT_PIPELINE_TIMEOUT_SECONDS;
  @Builder.Default private int stdoutTailLines = DEFAULT_STDOUT_TAIL_LINES;
  @Builder.Default private int stderrTailLines = DEFAULT_STDERR_TAIL_LINES;
}
