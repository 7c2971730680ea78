package io.cardwatch;

import com.google.common.annotations.VisibleForTesting;
import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import io.cardwatch.api.AsyncHttpClientWithRetry;
import io.cardwatch.api.GoogleDriveApiClient;
import io.cardwatch.config.Config;
import io.cardwatch.config.models.common.RemoteStorageConfiguration;
import io.cardwatch.history.HistoryStore;
import io.cardwatch.metrics.CardMonitorMetrics;
import io.cardwatch.monitor.NewItemClassifier;
import io.cardwatch.pipeline.PipelineRunner;
import io.cardwatch.pipeline.ProcessPipelineRunner;
import io.cardwatch.storage.GoogleDriveRemoteLister;
import io.cardwatch.storage.LocalDirectoryRemoteLister;
import io.cardwatch.storage.RemoteLister;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinWorkerThread;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;

@Slf4j
public class RuntimeModule extends AbstractModule {
  private static final int IO_WORKLOAD_NUM_THREAD_MULTIPLIER = 2;
  private static final int HTTP_CLIENT_DEFAULT_TIMEOUT_SECONDS = 15;
  private static final int HTTP_CLIENT_MAX_RETRIES = 3;
  private static final long HTTP_CLIENT_RETRY_DELAY_MS = 1000;
  private final Config config;

  public RuntimeModule(Config config) {
    this.config = config;
  }

  @Provides
  @Singleton
  static OkHttpClient providesOkHttpClient(ExecutorService executorService) {
    Dispatcher dispatcher = new Dispatcher(executorService);
    return new OkHttpClient.Builder()
        .readTimeout(HTTP_CLIENT_DEFAULT_TIMEOUT_SECONDS, TimeUnit.SECONDS)
        .writeTimeout(HTTP_CLIENT_DEFAULT_TIMEOUT_SECONDS, TimeUnit.SECONDS)
        .connectTimeout(HTTP_CLIENT_DEFAULT_TIMEOUT_SECONDS, TimeUnit.SECONDS)
        .dispatcher(dispatcher)
        .build();
  }

  @Provides
  @Singleton
  static AsyncHttpClientWithRetry providesHttpAsyncClient(OkHttpClient okHttpClient) {
    return new AsyncHttpClientWithRetry(
        HTTP_CLIENT_MAX_RETRIES, HTTP_CLIENT_RETRY_DELAY_MS, okHttpClient);
  }

  @Provides
  @Singleton
  static RemoteLister providesRemoteLister(
      Config config,
      Provider<GoogleDriveApiClient> googleDriveApiClientProvider,
      ExecutorService executorService) {
    RemoteStorageConfiguration remoteStorageConfig = config.getRemoteStorageConfig();
    if (remoteStorageConfig.getGoogleDriveConfig() != null) {
      return new GoogleDriveRemoteLister(googleDriveApiClientProvider.get(), executorService);
    } else {
      return new LocalDirectoryRemoteLister(executorService);
    }
  }

  @Provides
  @Singleton
  static Clock providesClock() {
    return Clock.systemDefaultZone();
  }

  @Provides
  @Singleton
  static HistoryStore providesHistoryStore(
      Config config, Clock clock, CardMonitorMetrics cardMonitorMetrics) {
    return new HistoryStore(
        Paths.get(config.getMonitorConfig().getHistoryFilePath()), clock, cardMonitorMetrics);
  }

  @Provides
  @Singleton
  static NewItemClassifier providesNewItemClassifier(Config config) {
    return new NewItemClassifier(config.getMonitorConfig().getClassifierConfig());
  }

  @Provides
  @Singleton
  static PipelineRunner providesPipelineRunner(Config config) {
    return new ProcessPipelineRunner(
        config.getMonitorConfig().getPipelineConfig(),
        config.getRemoteStorageConfig().folderRef());
  }

  @Provides
  @Singleton
  static ExecutorService providesExecutorService() {
    // listing is IO bound, a few threads per core are plenty
    int numThreads = Runtime.getRuntime().availableProcessors() * IO_WORKLOAD_NUM_THREAD_MULTIPLIER;
    log.info("Spinning up {} threads", numThreads);
    class ApplicationThreadFactory implements ForkJoinPool.ForkJoinWorkerThreadFactory {
      private static final String THREAD_GROUP_NAME_TEMPLATE = "cardwatch-io-%d";
      private final AtomicInteger counter = new AtomicInteger(1);

      @Override
      public ForkJoinWorkerThread newThread(ForkJoinPool pool) {
        return new ForkJoinWorkerThread(pool) {
          {
            setName(String.format(THREAD_GROUP_NAME_TEMPLATE, counter.getAndIncrement()));
          }
        };
      }
    }

    return new ForkJoinPool(
        numThreads,
        new ApplicationThreadFactory(),
        (thread, throwable) -> {
          if (throwable != null) {
            log.error(
                String.format("Uncaught exception in a thread (%s)", thread.getName()), throwable);
          }
        },
        // asyncMode must stay true for the future chains running on this pool
        true);
  }

  @VisibleForTesting
  long getHttpClientRetryDelayMs() {
    return HTTP_CLIENT_RETRY_DELAY_MS;
  }

  @VisibleForTesting
  int getHttpClientMaxRetries() {
    return HTTP_CLIENT_MAX_RETRIES;
  }

  @Override
  protected void configure() {
    bind(Config.class).toInstance(config);
  }
}
