package io.cardwatch.monitor;

import static io.cardwatch.constants.MonitorConstants.SHUTDOWN_AWAIT_SECONDS;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import io.cardwatch.config.Config;
import io.cardwatch.config.models.configv1.MonitorConfig;
import io.cardwatch.constants.MetricsConstants;
import io.cardwatch.history.HistoryStore;
import io.cardwatch.history.models.HistorySnapshot;
import io.cardwatch.metrics.CardMonitorMetrics;
import io.cardwatch.monitor.models.Batch;
import io.cardwatch.monitor.models.CycleResult;
import io.cardwatch.pipeline.PipelineRunner;
import io.cardwatch.pipeline.models.RunOutcome;
import io.cardwatch.storage.RemoteLister;
import io.cardwatch.storage.models.RemoteItem;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Drives the check cycle: list the watched folder, select new cards, run the pipeline on them
 * and record the batch in the history only when the pipeline succeeded. Cycles never overlap;
 * in continuous mode the next one starts {@code intervalMinutes} after the previous one ended.
 */
@Slf4j
public class MonitorLoop {
  private static final String SEPARATOR = StringUtils.repeat('=', 60);

  private final RemoteLister remoteLister;
  private final NewItemClassifier newItemClassifier;
  private final PipelineRunner pipelineRunner;
  private final HistoryStore historyStore;
  private final CardMonitorMetrics cardMonitorMetrics;
  private final String folderRef;
  private final ScheduledExecutorService scheduler;

  // held for the duration of a cycle so shutdown can wait for it
  private final ReentrantLock cycleLock = new ReentrantLock();
  private final AtomicReference<MonitorState> state = new AtomicReference<>(MonitorState.IDLE);
  private final AtomicBoolean initialized = new AtomicBoolean(false);
  private final AtomicBoolean shutdownRequested = new AtomicBoolean(false);
  private final AtomicInteger cycleCounter = new AtomicInteger(0);
  private volatile Thread cycleThread;

  @Inject
  public MonitorLoop(
      @Nonnull RemoteLister remoteLister,
      @Nonnull NewItemClassifier newItemClassifier,
      @Nonnull PipelineRunner pipelineRunner,
      @Nonnull HistoryStore historyStore,
      @Nonnull CardMonitorMetrics cardMonitorMetrics,
      @Nonnull Config config) {
    this.scheduler = getScheduler();
    this.remoteLister = remoteLister;
    this.newItemClassifier = newItemClassifier;
    this.pipelineRunner = pipelineRunner;
    this.historyStore = historyStore;
    this.cardMonitorMetrics = cardMonitorMetrics;
    this.folderRef = config.getRemoteStorageConfig().folderRef();
  }

  /** Loads the history. Only the first call has an effect. */
  public void initialize() {
    if (initialized.compareAndSet(false, true)) {
      historyStore.load();
    }
  }

  /*
   * runs the first check immediately, then one check every intervalMinutes after the previous
   * one completed
   */
  public void runInContinuousMode(MonitorConfig monitorConfig) {
    initialize();
    log.info(SEPARATOR);
    log.info("ANSWER CARD MONITOR STARTED");
    log.info("Watched folder: {}", folderRef);
    log.info("Interval: {} minutes", monitorConfig.getIntervalMinutes());
    log.info("Items already processed: {}", historyStore.current().getProcessedIds().size());
    log.info(SEPARATOR);
    scheduler.scheduleWithFixedDelay(
        this::runCycle, 0, monitorConfig.getIntervalMinutes(), TimeUnit.MINUTES);
  }

  /** Runs a single check in the calling thread. */
  public CycleResult runOnce() {
    initialize();
    log.info("=== SINGLE CHECK MODE ===");
    return runCycle();
  }

  public CycleResult runCycle() {
    cycleLock.lock();
    cycleThread = Thread.currentThread();
    try {
      if (isCancelled()) {
        log.info("Monitor is shutting down, skipping check");
        return result(CycleResult.Status.CANCELLED, cycleCounter.get(), 0, 0);
      }
      int cycleNumber = cycleCounter.incrementAndGet();
      log.info("=== CHECK #{} ===", cycleNumber);
      cardMonitorMetrics.incrementCheckCounter();
      try {
        return check(cycleNumber);
      } catch (RuntimeException e) {
        log.error("Unexpected failure during check #{}", cycleNumber, e);
        return result(CycleResult.Status.UNEXPECTED_FAILURE, cycleNumber, 0, 0);
      } finally {
        moveTo(MonitorState.IDLE);
        log.info(SEPARATOR);
      }
    } finally {
      cycleThread = null;
      cycleLock.unlock();
    }
  }

  private CycleResult check(int cycleNumber) {
    moveTo(MonitorState.LISTING);
    List<RemoteItem> listing;
    try {
      listing = remoteLister.listItems(folderRef).get();
    } catch (ExecutionException e) {
      log.error("Failed to list items in {}", folderRef, e.getCause());
      cardMonitorMetrics.incrementRemoteListingFailureCounter();
      return result(CycleResult.Status.REMOTE_ERROR, cycleNumber, 0, 0);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Check #{} interrupted while listing", cycleNumber);
      return result(CycleResult.Status.CANCELLED, cycleNumber, 0, 0);
    }

    moveTo(MonitorState.CLASSIFYING);
    if (listing.isEmpty()) {
      log.warn("No files found in the watched folder");
    } else {
      log.info("Total files in the folder: {}", listing.size());
    }
    HistorySnapshot history = historyStore.current();
    Batch batch = newItemClassifier.classify(listing, history);
    cardMonitorMetrics.setDiscoveredItemsPerCheck(batch.size());

    if (batch.isEmpty()) {
      moveTo(MonitorState.SKIPPING_EMPTY);
      long known = listing.stream().filter(item -> history.isProcessed(item.getId())).count();
      log.info("No new cards found");
      log.info("Files already known: {}/{}", known, listing.size());
      moveTo(MonitorState.PERSISTING);
      historyStore.touch();
      return result(CycleResult.Status.NO_NEW_ITEMS, cycleNumber, listing.size(), 0);
    }

    log.info(">>> FOUND {} NEW CARDS <<<", batch.size());
    batch.getItems().forEach(item -> log.info("  -> {}", item.getName()));
    moveTo(MonitorState.EXECUTING);
    RunOutcome outcome = pipelineRunner.run(batch);

    if (outcome.isCancelled()) {
      log.warn("Pipeline run abandoned because the monitor is stopping, nothing recorded");
      cardMonitorMetrics.incrementPipelineFailureCounter(
          MetricsConstants.PipelineFailureReasons.CANCELLED);
      return result(CycleResult.Status.CANCELLED, cycleNumber, listing.size(), batch.size());
    }
    if (!outcome.isSucceeded()) {
      log.error(">>> PROCESSING FAILED <<<");
      cardMonitorMetrics.incrementPipelineFailureCounter(getFailureReason(outcome));
      return result(
          CycleResult.Status.PIPELINE_FAILED, cycleNumber, listing.size(), batch.size());
    }

    moveTo(MonitorState.PERSISTING);
    historyStore.commit(batch.ids());
    cardMonitorMetrics.incrementPipelineSuccessCounter();
    log.info(">>> PROCESSING COMPLETED SUCCESSFULLY <<<");
    return result(CycleResult.Status.COMMITTED, cycleNumber, listing.size(), batch.size());
  }

  /**
   * Stops scheduling, interrupts a running check (an in-flight pipeline is killed and its batch
   * is not recorded) and writes the history one last time. Later calls do nothing.
   */
  public void shutdown() {
    if (!shutdownRequested.compareAndSet(false, true)) {
      return;
    }
    state.set(MonitorState.SHUTTING_DOWN);
    log.info("MONITOR STOPPING");
    scheduler.shutdownNow();
    Thread runningCycle = cycleThread;
    if (runningCycle != null && runningCycle != Thread.currentThread()) {
      runningCycle.interrupt();
    }
    boolean cycleFinished = false;
    try {
      if (!scheduler.awaitTermination(SHUTDOWN_AWAIT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Monitor scheduler did not terminate within {} seconds", SHUTDOWN_AWAIT_SECONDS);
      }
      cycleFinished = cycleLock.tryLock(SHUTDOWN_AWAIT_SECONDS, TimeUnit.SECONDS);
      if (!cycleFinished) {
        log.warn("Running check did not finish within {} seconds", SHUTDOWN_AWAIT_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    try {
      historyStore.flush();
      log.info("Total checks run: {}", cycleCounter.get());
      log.info("Items processed: {}", historyStore.current().getProcessedIds().size());
    } finally {
      if (cycleFinished) {
        cycleLock.unlock();
      }
    }
  }

  public MonitorState getState() {
    return state.get();
  }

  private boolean isCancelled() {
    return shutdownRequested.get() || Thread.currentThread().isInterrupted();
  }

  private void moveTo(MonitorState next) {
    state.updateAndGet(
        current -> current == MonitorState.SHUTTING_DOWN ? MonitorState.SHUTTING_DOWN : next);
  }

  private static MetricsConstants.PipelineFailureReasons getFailureReason(RunOutcome outcome) {
    if (outcome.isDurationExceeded()) {
      return MetricsConstants.PipelineFailureReasons.TIMEOUT;
    }
    if (outcome.getExitCode() == RunOutcome.NO_EXIT_CODE) {
      return MetricsConstants.PipelineFailureReasons.SPAWN_FAILURE;
    }
    return MetricsConstants.PipelineFailureReasons.NON_ZERO_EXIT;
  }

  private static CycleResult result(
      CycleResult.Status status, int cycleNumber, int listedItems, int batchSize) {
    return CycleResult.builder()
        .status(status)
        .cycleNumber(cycleNumber)
        .listedItems(listedItems)
        .batchSize(batchSize)
        .build();
  }

  @VisibleForTesting
  ScheduledExecutorService getScheduler() {
    return Executors.newSingleThreadScheduledExecutor(
        new ThreadFactoryBuilder().setNameFormat("cardwatch-monitor-%d").build());
  }
}
