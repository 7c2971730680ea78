package io.cardwatch.metrics;

import io.cardwatch.config.Config;
import io.cardwatch.constants.MetricsConstants;
import io.micrometer.core.instrument.Tag;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;
import javax.inject.Inject;
import lombok.Getter;

public class CardMonitorMetrics {
  private final Metrics metrics;
  private final Metrics.Gauge discoveredItemsGaugeMetric;
  private final Metrics.Gauge processedItemsGaugeMetric;
  private final Config monitorConfig;

  static final String METRICS_COMMON_PREFIX = "cardwatch_";

  // Tag keys
  static final String CONFIG_VERSION_TAG_KEY = "config_version";
  static final String JOB_RUN_MODE_TAG_KEY = "job_run_mode";
  static final String PIPELINE_FAILURE_REASON_TAG_KEY = "pipeline_failure_reason";

  // Metrics
  static final String CHECK_COUNTER = METRICS_COMMON_PREFIX + "checks";
  static final String REMOTE_LISTING_FAILURE_COUNTER =
      METRICS_COMMON_PREFIX + "remote_listing_failure";
  static final String PIPELINE_SUCCESS_COUNTER = METRICS_COMMON_PREFIX + "pipeline_success";
  static final String PIPELINE_FAILURE_COUNTER = METRICS_COMMON_PREFIX + "pipeline_failure";
  static final String HISTORY_WRITE_FAILURE_COUNTER =
      METRICS_COMMON_PREFIX + "history_write_failure";

  @Inject
  public CardMonitorMetrics(@Nonnull Metrics metrics, @Nonnull Config config) {
    this.metrics = metrics;
    this.monitorConfig = config;
    this.discoveredItemsGaugeMetric =
        metrics.gauge(
            DiscoveredItemsGaugeMetricsMetadata.NAME,
            DiscoveredItemsGaugeMetricsMetadata.DESCRIPTION,
            getDefaultTags());
    this.processedItemsGaugeMetric =
        metrics.gauge(
            ProcessedItemsGaugeMetricsMetadata.NAME,
            ProcessedItemsGaugeMetricsMetadata.DESCRIPTION,
            getDefaultTags());
  }

  public void incrementCheckCounter() {
    metrics.increment(CHECK_COUNTER, getDefaultTags());
  }

  public void incrementRemoteListingFailureCounter() {
    metrics.increment(REMOTE_LISTING_FAILURE_COUNTER, getDefaultTags());
  }

  public void setDiscoveredItemsPerCheck(long numItemsDiscovered) {
    discoveredItemsGaugeMetric.setValue(numItemsDiscovered);
  }

  public void setProcessedItems(long numProcessedItems) {
    processedItemsGaugeMetric.setValue(numProcessedItems);
  }

  public void incrementPipelineSuccessCounter() {
    metrics.increment(PIPELINE_SUCCESS_COUNTER, getDefaultTags());
  }

  public void incrementPipelineFailureCounter(
      MetricsConstants.PipelineFailureReasons pipelineFailureReason) {
    List<Tag> tags = getDefaultTags();
    tags.add(Tag.of(PIPELINE_FAILURE_REASON_TAG_KEY, pipelineFailureReason.name()));
    metrics.increment(PIPELINE_FAILURE_COUNTER, tags);
  }

  public void incrementHistoryWriteFailureCounter() {
    metrics.increment(HISTORY_WRITE_FAILURE_COUNTER, getDefaultTags());
  }

  private List<Tag> getDefaultTags() {
    List<Tag> tags = new ArrayList<>();
    tags.add(Tag.of(CONFIG_VERSION_TAG_KEY, monitorConfig.getVersion().toString()));
    tags.add(
        Tag.of(JOB_RUN_MODE_TAG_KEY, monitorConfig.getMonitorConfig().getJobRunMode().toString()));
    return tags;
  }

  @Getter
  private static class DiscoveredItemsGaugeMetricsMetadata {
    public static final String NAME = METRICS_COMMON_PREFIX + "discovered_items";
    public static final String DESCRIPTION = "Number of new answer cards found in the last check";
  }

  @Getter
  private static class ProcessedItemsGaugeMetricsMetadata {
    public static final String NAME = METRICS_COMMON_PREFIX + "processed_items";
    public static final String DESCRIPTION = "Number of item ids recorded in the history";
  }
}
