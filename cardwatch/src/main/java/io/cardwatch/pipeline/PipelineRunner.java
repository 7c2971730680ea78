package io.cardwatch.pipeline;

import io.cardwatch.monitor.models.Batch;
import io.cardwatch.pipeline.models.RunOutcome;

/** Runs the external correction pipeline once for a batch of new items. */
public interface PipelineRunner {
  /**
   * Blocks until the pipeline finished, failed, timed out or the calling thread was interrupted.
   * Pipeline faults are reported through the outcome and never thrown.
   */
  RunOutcome run(Batch batch);
}
