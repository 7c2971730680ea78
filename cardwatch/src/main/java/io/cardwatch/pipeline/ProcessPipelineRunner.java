package io.cardwatch.pipeline;

import static io.cardwatch.constants.MonitorConstants.BATCH_IDS_FILE_ENV_KEY;
import static io.cardwatch.constants.MonitorConstants.BATCH_SIZE_ENV_KEY;
import static io.cardwatch.constants.MonitorConstants.FOLDER_ID_PLACEHOLDER;

import com.google.common.collect.EvictingQueue;
import com.google.common.collect.ImmutableList;
import io.cardwatch.config.models.configv1.PipelineConfig;
import io.cardwatch.monitor.models.Batch;
import io.cardwatch.pipeline.models.RunOutcome;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Runs the pipeline as a child process. Both output streams are drained concurrently and only
 * their last non-blank lines are kept. A run that exceeds the timeout is killed together with
 * its descendants.
 */
@Slf4j
public class ProcessPipelineRunner implements PipelineRunner {
  private static final long DESTROY_AWAIT_SECONDS = 10;
  private static final long READER_JOIN_MILLIS = 5_000;

  private final List<String> command;
  @Nullable private final String workingDirectory;
  private final long timeoutSeconds;
  private final int stdoutTailLines;
  private final int stderrTailLines;

  public ProcessPipelineRunner(PipelineConfig pipelineConfig, String folderRef) {
    this.command =
        pipelineConfig.getCommand().stream()
            .map(argument -> argument.replace(FOLDER_ID_PLACEHOLDER, folderRef))
            .collect(Collectors.toList());
    this.workingDirectory = pipelineConfig.getWorkingDirectory();
    this.timeoutSeconds = pipelineConfig.getTimeoutSeconds();
    this.stdoutTailLines = pipelineConfig.getStdoutTailLines();
    this.stderrTailLines = pipelineConfig.getStderrTailLines();
  }

  @Override
  public RunOutcome run(Batch batch) {
    Path batchIdsFile;
    try {
      batchIdsFile = writeBatchIds(batch);
    } catch (IOException e) {
      log.error("Failed to write the batch ids for the pipeline", e);
      return RunOutcome.builder()
          .succeeded(false)
          .stderrTail(ImmutableList.of("Failed to write batch ids: " + e.getMessage()))
          .build();
    }
    try {
      return runProcess(batch, batchIdsFile);
    } finally {
      deleteBatchIds(batchIdsFile);
    }
  }

  private RunOutcome runProcess(Batch batch, Path batchIdsFile) {
    ProcessBuilder processBuilder = new ProcessBuilder(command);
    if (StringUtils.isNotBlank(workingDirectory)) {
      processBuilder.directory(new File(workingDirectory));
    }
    processBuilder.environment().put(BATCH_SIZE_ENV_KEY, String.valueOf(batch.size()));
    processBuilder
        .environment()
        .put(BATCH_IDS_FILE_ENV_KEY, batchIdsFile.toAbsolutePath().toString());

    OutputTail stdout = new OutputTail(stdoutTailLines);
    OutputTail stderr = new OutputTail(stderrTailLines);
    long startNanos = System.nanoTime();
    Process process;
    try {
      log.info("Starting pipeline for {} items: {}", batch.size(), command);
      process = processBuilder.start();
    } catch (IOException e) {
      log.error("Failed to start pipeline {}", command, e);
      return RunOutcome.builder()
          .succeeded(false)
          .stderrTail(ImmutableList.of("Failed to start pipeline: " + e.getMessage()))
          .duration(elapsedSince(startNanos))
          .build();
    }

    Thread stdoutReader =
        startReader("cardwatch-pipeline-stdout", stdout, process.getInputStream());
    Thread stderrReader =
        startReader("cardwatch-pipeline-stderr", stderr, process.getErrorStream());

    try {
      if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
        log.error("TIMEOUT: pipeline ran for more than {} seconds, killing it", timeoutSeconds);
        destroyProcessTree(process);
        awaitReaders(stdoutReader, stderrReader);
        return RunOutcome.builder()
            .succeeded(false)
            .stdoutTail(stdout.lines())
            .stderrTail(stderr.lines())
            .durationExceeded(true)
            .duration(elapsedSince(startNanos))
            .build();
      }
      awaitReaders(stdoutReader, stderrReader);
    } catch (InterruptedException e) {
      log.warn("Interrupted while the pipeline was running, killing it");
      destroyProcessTree(process);
      Thread.currentThread().interrupt();
      return RunOutcome.builder()
          .succeeded(false)
          .stdoutTail(stdout.lines())
          .stderrTail(stderr.lines())
          .cancelled(true)
          .duration(elapsedSince(startNanos))
          .build();
    }

    int exitCode = process.exitValue();
    RunOutcome outcome =
        RunOutcome.builder()
            .succeeded(exitCode == 0)
            .exitCode(exitCode)
            .stdoutTail(stdout.lines())
            .stderrTail(stderr.lines())
            .duration(elapsedSince(startNanos))
            .build();
    if (outcome.isSucceeded()) {
      log.info("Pipeline finished successfully in {}", outcome.getDuration());
      outcome.getStdoutTail().forEach(line -> log.info("OUTPUT: {}", line));
    } else {
      log.error("Pipeline failed with exit code {}", exitCode);
      outcome.getStderrTail().forEach(line -> log.error("ERROR: {}", line));
    }
    return outcome;
  }

  // one id per line
  private static Path writeBatchIds(Batch batch) throws IOException {
    Path batchIdsFile = Files.createTempFile("cardwatch-batch-", ".txt");
    try {
      Files.write(batchIdsFile, batch.ids(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      Files.deleteIfExists(batchIdsFile);
      throw e;
    }
    return batchIdsFile;
  }

  private static void deleteBatchIds(Path batchIdsFile) {
    try {
      Files.deleteIfExists(batchIdsFile);
    } catch (IOException e) {
      log.warn("Failed to delete batch ids file {}", batchIdsFile, e);
    }
  }

  private void destroyProcessTree(Process process) {
    // descendants are collected first, they get reparented once the child is gone
    process.descendants().forEach(ProcessHandle::destroyForcibly);
    process.destroyForcibly();
    try {
      if (!process.waitFor(DESTROY_AWAIT_SECONDS, TimeUnit.SECONDS)) {
        log.warn("Pipeline process {} did not exit after being killed", process.pid());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static Thread startReader(String name, OutputTail tail, InputStream stream) {
    Thread reader = new Thread(() -> tail.drain(stream), name);
    reader.setDaemon(true);
    reader.start();
    return reader;
  }

  // a grandchild may keep the pipes open after the child exited
  private static void awaitReaders(Thread... readers) throws InterruptedException {
    for (Thread reader : readers) {
      reader.join(READER_JOIN_MILLIS);
    }
  }

  private static Duration elapsedSince(long startNanos) {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  private static class OutputTail {
    private final EvictingQueue<String> tail;

    OutputTail(int maxLines) {
      this.tail = EvictingQueue.create(maxLines);
    }

    void drain(InputStream stream) {
      try (BufferedReader reader =
          new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
        String line;
        while ((line = reader.readLine()) != null) {
          if (StringUtils.isNotBlank(line)) {
            append(line.strip());
          }
        }
      } catch (IOException e) {
        log.debug("Stopped reading pipeline output: {}", e.getMessage());
      }
    }

    private synchronized void append(String line) {
      tail.add(line);
    }

    synchronized ImmutableList<String> lines() {
      return ImmutableList.copyOf(tail);
    }
  }
}
