package io.cardwatch.history;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import io.cardwatch.exceptions.HistoryPersistenceException;
import io.cardwatch.history.models.HistoryFile;
import io.cardwatch.history.models.HistorySnapshot;
import io.cardwatch.metrics.CardMonitorMetrics;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Durable record of the item ids already handed to the pipeline successfully. The in-memory
 * snapshot is authoritative; every change rewrites the whole file through a temp file and a
 * rename so readers never observe a partial document.
 */
@Slf4j
public class HistoryStore {
  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  private final Path historyFile;
  private final Clock clock;
  private final CardMonitorMetrics cardMonitorMetrics;
  private volatile HistorySnapshot snapshot = HistorySnapshot.empty();

  public HistoryStore(Path historyFile, Clock clock, CardMonitorMetrics cardMonitorMetrics) {
    this.historyFile = historyFile;
    this.clock = clock;
    this.cardMonitorMetrics = cardMonitorMetrics;
  }

  /** Reads the history file. A missing or unreadable file yields an empty history. */
  public synchronized HistorySnapshot load() {
    if (!Files.exists(historyFile)) {
      log.info("No history file at {}, starting with an empty history", historyFile);
      return replaceSnapshot(HistorySnapshot.empty());
    }
    try {
      HistoryFile file = MAPPER.readValue(historyFile.toFile(), HistoryFile.class);
      if (file == null) {
        log.warn("History file {} is empty, starting with an empty history", historyFile);
        return replaceSnapshot(HistorySnapshot.empty());
      }
      HistorySnapshot loaded =
          HistorySnapshot.builder()
              .lastCheckedAt(parseTimestamp(file.getLastCheckedAt()))
              .checkCount(file.getCheckCount())
              .processedIds(toProcessedIds(file.getProcessedIds()))
              .build();
      log.info(
          "Loaded history from {}: {} processed items, {} checks",
          historyFile,
          loaded.getProcessedIds().size(),
          loaded.getCheckCount());
      return replaceSnapshot(loaded);
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Failed to read history file {}, starting with an empty history: {}",
          historyFile,
          e.getMessage());
      return replaceSnapshot(HistorySnapshot.empty());
    }
  }

  private ImmutableSet<String> toProcessedIds(@Nullable List<String> ids) {
    if (ids == null) {
      return ImmutableSet.of();
    }
    ImmutableSet<String> processedIds =
        ids.stream().filter(StringUtils::isNotBlank).collect(ImmutableSet.toImmutableSet());
    if (processedIds.size() < ids.size()) {
      log.warn("Skipped blank or duplicate ids in history file {}", historyFile);
    }
    return processedIds;
  }

  public HistorySnapshot current() {
    return snapshot;
  }

  /** Records a completed check and the ids of a batch the pipeline processed successfully. */
  public synchronized HistorySnapshot commit(Set<String> newIds) {
    HistorySnapshot updated = snapshot.withCommittedIds(newIds, clock.instant());
    replaceSnapshot(updated);
    persist(updated);
    return updated;
  }

  /** Records a completed check that found nothing to process. */
  public synchronized HistorySnapshot touch() {
    return commit(Collections.emptySet());
  }

  /** Writes the in-memory snapshot unchanged. */
  public synchronized void flush() {
    persist(snapshot);
  }

  private HistorySnapshot replaceSnapshot(HistorySnapshot updated) {
    snapshot = updated;
    cardMonitorMetrics.setProcessedItems(updated.getProcessedIds().size());
    return updated;
  }

  private void persist(HistorySnapshot toWrite) {
    try {
      writeSnapshot(toWrite);
    } catch (HistoryPersistenceException e) {
      log.error("Failed to save history, it will be written again on the next check", e);
      cardMonitorMetrics.incrementHistoryWriteFailureCounter();
    }
  }

  @VisibleForTesting
  void writeSnapshot(HistorySnapshot toWrite) throws HistoryPersistenceException {
    Path target = historyFile.toAbsolutePath();
    Path tempFile = null;
    try {
      Files.createDirectories(target.getParent());
      tempFile = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
      MAPPER.writeValue(tempFile.toFile(), toHistoryFile(toWrite));
      try {
        Files.move(
            tempFile,
            target,
            StandardCopyOption.ATOMIC_MOVE,
            StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported for {}, replacing in place", target);
        Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      HistoryPersistenceException exception =
          new HistoryPersistenceException("Failed to write history file " + target, e);
      if (tempFile != null) {
        try {
          Files.deleteIfExists(tempFile);
        } catch (IOException deleteFailure) {
          exception.addSuppressed(deleteFailure);
        }
      }
      throw exception;
    }
  }

  private HistoryFile toHistoryFile(HistorySnapshot toWrite) {
    return HistoryFile.builder()
        .lastCheckedAt(
            toWrite.getLastCheckedAt() == null
                ? null
                : DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(
                    toWrite.getLastCheckedAt().atZone(clock.getZone())))
        .checkCount(toWrite.getCheckCount())
        .processedIds(toWrite.getProcessedIds().asList())
        .build();
  }

  // older history files carry a local timestamp without offset
  @Nullable
  private Instant parseTimestamp(@Nullable String value) {
    if (StringUtils.isBlank(value)) {
      return null;
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(value).atZone(clock.getZone()).toInstant();
      } catch (DateTimeParseException inner) {
        log.warn("Ignoring unparsable last check timestamp {} in {}", value, historyFile);
        return null;
      }
    }
  }
}
