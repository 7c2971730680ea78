package io.cardwatch.metrics;

import static io.cardwatch.constants.MetricsConstants.PROMETHEUS_METRICS_SCRAPING_DISABLED;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.HTTPServer;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/**
 * Prometheus scrape endpoint. Runs on daemon threads so a single check can exit without waiting
 * for it; port {@code 0} leaves it switched off.
 */
@Slf4j
public class MetricsServer {
  @Nullable private final HTTPServer server;
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  public MetricsServer(CollectorRegistry registry, int port) {
    if (port == PROMETHEUS_METRICS_SCRAPING_DISABLED) {
      log.debug("Metrics scraping disabled");
      server = null;
      return;
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid metrics scrape port: " + port);
    }
    try {
      server =
          new HTTPServer.Builder()
              .withPort(port)
              .withRegistry(registry)
              .withDaemonThreads(true)
              .build();
      log.info("Serving metrics on http://0.0.0.0:{}/metrics", server.getPort());
    } catch (IOException e) {
      throw new RuntimeException("Failed to start metrics server on port " + port, e);
    }
  }

  public boolean isRunning() {
    return server != null && !stopped.get();
  }

  public int getPort() {
    return server == null ? PROMETHEUS_METRICS_SCRAPING_DISABLED : server.getPort();
  }

  public void shutdown() {
    if (server != null && stopped.compareAndSet(false, true)) {
      log.info("Shutting down metrics server");
      server.close();
    }
  }
}
