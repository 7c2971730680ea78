package io.cardwatch.constants;

public class MetricsConstants {
  public static final int PROMETHEUS_METRICS_SCRAPING_DISABLED = 0;
  public static final int PROMETHEUS_METRICS_SCRAPE_PORT =
      Integer.parseInt(
          System.getenv()
              .getOrDefault(
                  "PROMETHEUS_METRICS_SCRAPE_PORT",
                  String.valueOf(PROMETHEUS_METRICS_SCRAPING_DISABLED)));

  public enum PipelineFailureReasons {
    NON_ZERO_EXIT,
    SPAWN_FAILURE,
    TIMEOUT,
    CANCELLED,
  }
}
