package io.cardwatch.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import io.cardwatch.config.models.configv1.PipelineConfig;
import io.cardwatch.monitor.models.Batch;
import io.cardwatch.pipeline.models.RunOutcome;
import io.cardwatch.storage.models.ItemKind;
import io.cardwatch.storage.models.RemoteItem;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessPipelineRunnerTest {
  private static final String FOLDER_ID = "folder-9";
  private static final Batch BATCH =
      Batch.of(
          Arrays.asList(
              RemoteItem.builder().id("a").name("a.pdf").kind(ItemKind.DOCUMENT).build(),
              RemoteItem.builder().id("b").name("b.png").kind(ItemKind.IMAGE).build()));

  @TempDir Path tempDir;

  @Test
  void testSuccessKeepsLastNonBlankStdoutLines() {
    RunOutcome outcome =
        runner("for i in 1 2 3 4 5 6 7; do echo line$i; echo; done; echo warn >&2")
            .run(BATCH);

    assertTrue(outcome.isSucceeded());
    assertEquals(0, outcome.getExitCode());
    assertEquals(
        ImmutableList.of("line3", "line4", "line5", "line6", "line7"), outcome.getStdoutTail());
    assertEquals(ImmutableList.of("warn"), outcome.getStderrTail());
    assertFalse(outcome.isDurationExceeded());
    assertFalse(outcome.isCancelled());
  }

  @Test
  void testNonZeroExitIsFailureWithStderrTail() {
    RunOutcome outcome =
        runner("echo e1 >&2; echo e2 >&2; echo '   ' >&2; echo e3 >&2; echo e4 >&2; exit 3")
            .run(BATCH);

    assertFalse(outcome.isSucceeded());
    assertEquals(3, outcome.getExitCode());
    assertEquals(ImmutableList.of("e2", "e3", "e4"), outcome.getStderrTail());
    assertFalse(outcome.isDurationExceeded());
  }

  @Test
  void testFolderPlaceholderAndBatchEnvironment() {
    PipelineConfig config =
        PipelineConfig.builder()
            .command(
                Arrays.asList(
                    "sh",
                    "-c",
                    "echo \"$1 $CARDWATCH_BATCH_SIZE\"; cat \"$CARDWATCH_BATCH_IDS_FILE\"",
                    "sh",
                    "{folderId}"))
            .build();

    RunOutcome outcome = new ProcessPipelineRunner(config, FOLDER_ID).run(BATCH);

    assertTrue(outcome.isSucceeded());
    assertEquals(ImmutableList.of("folder-9 2", "a", "b"), outcome.getStdoutTail());
  }

  @Test
  void testLargeBatchIdsAreHandedOverThroughFile() throws IOException {
    List<RemoteItem> items = new ArrayList<>();
    for (int i = 0; i < 5000; i++) {
      String id = String.format("1AbCdEfGhIjKlMnOpQrStUvWxYz%06d", i);
      items.add(RemoteItem.builder().id(id).name(id + ".pdf").kind(ItemKind.DOCUMENT).build());
    }
    Path idsFileCopy = tempDir.resolve("ids-copy");
    PipelineConfig config =
        PipelineConfig.builder()
            .command(
                Arrays.asList(
                    "sh",
                    "-c",
                    "cp \"$CARDWATCH_BATCH_IDS_FILE\" '"
                        + idsFileCopy
                        + "'; echo \"$CARDWATCH_BATCH_IDS_FILE\""))
            .build();

    RunOutcome outcome = new ProcessPipelineRunner(config, FOLDER_ID).run(Batch.of(items));

    assertTrue(outcome.isSucceeded());
    List<String> handedOver = Files.readAllLines(idsFileCopy, StandardCharsets.UTF_8);
    assertEquals(5000, handedOver.size());
    assertEquals(items.get(0).getId(), handedOver.get(0));
    assertEquals(items.get(4999).getId(), handedOver.get(4999));
    // removed once the run is over
    assertFalse(Files.exists(Paths.get(outcome.getStdoutTail().get(0))));
  }

  @Test
  void testZeroTailLinesKeepsNoOutput() {
    PipelineConfig config =
        PipelineConfig.builder()
            .command(Arrays.asList("sh", "-c", "echo out; echo err >&2; exit 1"))
            .stdoutTailLines(0)
            .stderrTailLines(0)
            .build();

    RunOutcome outcome = new ProcessPipelineRunner(config, FOLDER_ID).run(BATCH);

    assertFalse(outcome.isSucceeded());
    assertEquals(1, outcome.getExitCode());
    assertTrue(outcome.getStdoutTail().isEmpty());
    assertTrue(outcome.getStderrTail().isEmpty());
  }

  @Test
  void testWorkingDirectory() throws IOException {
    PipelineConfig config =
        PipelineConfig.builder()
            .command(Arrays.asList("sh", "-c", "pwd -P"))
            .workingDirectory(tempDir.toString())
            .build();

    RunOutcome outcome = new ProcessPipelineRunner(config, FOLDER_ID).run(BATCH);

    assertEquals(ImmutableList.of(tempDir.toRealPath().toString()), outcome.getStdoutTail());
  }

  @Test
  void testTimeoutKillsProcess() throws IOException {
    Path pidFile = tempDir.resolve("pid");
    PipelineConfig config =
        PipelineConfig.builder()
            .command(Arrays.asList("sh", "-c", "echo $$ > '" + pidFile + "'; exec sleep 30"))
            .timeoutSeconds(1)
            .build();

    RunOutcome outcome = new ProcessPipelineRunner(config, FOLDER_ID).run(BATCH);

    assertFalse(outcome.isSucceeded());
    assertTrue(outcome.isDurationExceeded());
    assertEquals(RunOutcome.NO_EXIT_CODE, outcome.getExitCode());
    assertTrue(outcome.getDuration().compareTo(Duration.ofSeconds(20)) < 0);
    long pid = readPid(pidFile);
    assertFalse(ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false));
  }

  @Test
  void testMissingBinaryIsSpawnFailure() {
    PipelineConfig config =
        PipelineConfig.builder()
            .command(Collections.singletonList("/nonexistent/cardwatch-pipeline"))
            .build();

    RunOutcome outcome = new ProcessPipelineRunner(config, FOLDER_ID).run(BATCH);

    assertFalse(outcome.isSucceeded());
    assertEquals(RunOutcome.NO_EXIT_CODE, outcome.getExitCode());
    assertFalse(outcome.isDurationExceeded());
    assertEquals(1, outcome.getStderrTail().size());
    assertTrue(outcome.getStderrTail().get(0).startsWith("Failed to start pipeline"));
  }

  @Test
  void testInterruptCancelsRun() throws Exception {
    Path pidFile = tempDir.resolve("pid");
    ProcessPipelineRunner runner =
        new ProcessPipelineRunner(
            PipelineConfig.builder()
                .command(Arrays.asList("sh", "-c", "echo $$ > '" + pidFile + "'; exec sleep 30"))
                .build(),
            FOLDER_ID);
    AtomicReference<RunOutcome> outcome = new AtomicReference<>();
    AtomicBoolean interruptFlagRestored = new AtomicBoolean(false);
    Thread worker =
        new Thread(
            () -> {
              outcome.set(runner.run(BATCH));
              interruptFlagRestored.set(Thread.currentThread().isInterrupted());
            });
    worker.start();

    long deadline = System.currentTimeMillis() + 10_000;
    while (!isPidWritten(pidFile) && System.currentTimeMillis() < deadline) {
      Thread.sleep(20);
    }
    worker.interrupt();
    worker.join(15_000);

    assertFalse(worker.isAlive());
    assertTrue(outcome.get().isCancelled());
    assertFalse(outcome.get().isSucceeded());
    assertTrue(interruptFlagRestored.get());
    long pid = readPid(pidFile);
    assertFalse(ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false));
  }

  private ProcessPipelineRunner runner(String script) {
    List<String> command = Arrays.asList("sh", "-c", script);
    return new ProcessPipelineRunner(PipelineConfig.builder().command(command).build(), FOLDER_ID);
  }

  private static boolean isPidWritten(Path pidFile) throws IOException {
    return Files.exists(pidFile)
        && !new String(Files.readAllBytes(pidFile), StandardCharsets.UTF_8).trim().isEmpty();
  }

  private static long readPid(Path pidFile) throws IOException {
    return Long.parseLong(new String(Files.readAllBytes(pidFile), StandardCharsets.UTF_8).trim());
  }
}
