package io.cardwatch;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.cardwatch.api.AsyncHttpClientWithRetry;
import io.cardwatch.cli_parser.CliParser;
import io.cardwatch.config.Config;
import io.cardwatch.config.ConfigLoader;
import io.cardwatch.config.models.configv1.MonitorConfig;
import io.cardwatch.env.EnvironmentLookupProvider;
import io.cardwatch.exceptions.ConfigurationException;
import io.cardwatch.metrics.MetricsModule;
import io.cardwatch.metrics.MetricsServer;
import io.cardwatch.monitor.MonitorLoop;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.cli.ParseException;

@Slf4j
public class Main {

  private MonitorLoop job;
  private AsyncHttpClientWithRetry asyncHttpClientWithRetry;
  private MetricsServer metricsServer;
  private final CliParser parser;
  private final ConfigLoader configLoader;
  private final EnvironmentLookupProvider environmentLookupProvider;
  private final AtomicBoolean isShutdown = new AtomicBoolean(false);

  public Main(CliParser parser, ConfigLoader configLoader) {
    this(parser, configLoader, new EnvironmentLookupProvider.ProcessEnvironment());
  }

  @VisibleForTesting
  Main(
      CliParser parser,
      ConfigLoader configLoader,
      EnvironmentLookupProvider environmentLookupProvider) {
    this.parser = parser;
    this.configLoader = configLoader;
    this.environmentLookupProvider = environmentLookupProvider;
  }

  public static void main(String[] args) {
    CliParser parser = new CliParser();
    ConfigLoader configLoader = new ConfigLoader();

    Main main = new Main(parser, configLoader);
    int exitStatus = main.start(args);
    if (exitStatus != 0) {
      System.exit(exitStatus);
    }
  }

  /** Returns the process exit status; in continuous mode the monitor keeps running afterwards. */
  public int start(String[] args) {
    log.info("Starting cardwatch answer card monitor");
    Config config;
    try {
      parser.parse(args);

      if (parser.isHelpRequested()) {
        return 0;
      }

      config =
          configLoader.applyOverrides(
              loadConfig(parser.getConfigFilePath(), parser.getConfigYamlString()),
              parser.getIntervalMinutes(),
              parser.isSingleCheck());
    } catch (ParseException e) {
      log.error("Failed to parse command line arguments", e);
      return 1;
    } catch (ConfigurationException e) {
      log.error("Invalid configuration: {}", e.getMessage(), e);
      return 1;
    }

    Injector injector = Guice.createInjector(new RuntimeModule(config), new MetricsModule());
    job = injector.getInstance(MonitorLoop.class);
    asyncHttpClientWithRetry = injector.getInstance(AsyncHttpClientWithRetry.class);
    metricsServer = injector.getInstance(MetricsServer.class);

    return runJob(config);
  }

  private Config loadConfig(String configFilePath, String configYamlString) {
    if (configFilePath != null) {
      return configLoader.loadConfigFromConfigFile(configFilePath);
    } else if (configYamlString != null) {
      return configLoader.loadConfigFromString(configYamlString);
    } else {
      log.info("No configuration file provided, reading configuration from the environment");
      return configLoader.loadConfigFromEnvironment(environmentLookupProvider);
    }
  }

  private int runJob(Config config) {
    try {
      MonitorConfig monitorConfig = config.getMonitorConfig();
      // a single check can also be stopped mid-pipeline
      registerShutdownHook();
      if (MonitorConfig.JobRunMode.CONTINUOUS.equals(monitorConfig.getJobRunMode())) {
        job.runInContinuousMode(monitorConfig);
      } else {
        job.runOnce();
        shutdown();
      }
      return 0;
    } catch (Exception e) {
      log.error(e.getMessage(), e);
      shutdown();
      return 1;
    }
  }

  // SIGINT and SIGTERM stop the monitor through the JVM shutdown hooks
  @VisibleForTesting
  void registerShutdownHook() {
    Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "cardwatch-shutdown"));
  }

  @VisibleForTesting
  void shutdown() {
    if (!isShutdown.compareAndSet(false, true)) {
      return;
    }
    job.shutdown();
    asyncHttpClientWithRetry.shutdownScheduler();
    metricsServer.shutdown();
    log.info("MONITOR STOPPED");
  }
}
