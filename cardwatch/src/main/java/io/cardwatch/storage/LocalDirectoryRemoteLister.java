package io.cardwatch.storage;

import io.cardwatch.exceptions.RemoteListingException;
import io.cardwatch.storage.models.ItemKind;
import io.cardwatch.storage.models.RemoteItem;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.annotation.Nonnull;
import lombok.extern.slf4j.Slf4j;

/** Lists the regular files of a local directory; the file name serves as the item id. */
@Slf4j
public class LocalDirectoryRemoteLister implements RemoteLister {
  private final ExecutorService executorService;

  public LocalDirectoryRemoteLister(@Nonnull ExecutorService executorService) {
    this.executorService = executorService;
  }

  @Override
  public CompletableFuture<List<RemoteItem>> listItems(String folderRef) {
    return CompletableFuture.supplyAsync(() -> listDirectory(Paths.get(folderRef)), executorService);
  }

  private List<RemoteItem> listDirectory(Path directory) {
    log.debug("Listing files in {}", directory);
    if (!Files.isDirectory(directory)) {
      throw new RemoteListingException("Folder does not exist or is not a directory: " + directory);
    }
    List<Path> files;
    try (Stream<Path> entries = Files.list(directory)) {
      files =
          entries
              .filter(Files::isRegularFile)
              .sorted(Comparator.comparing(path -> path.getFileName().toString()))
              .collect(Collectors.toList());
    } catch (IOException e) {
      throw new RemoteListingException(e);
    }

    List<RemoteItem> items = new ArrayList<>(files.size());
    for (Path file : files) {
      String name = file.getFileName().toString();
      try {
        String mimeType = Files.probeContentType(file);
        items.add(
            RemoteItem.builder()
                .id(name)
                .name(name)
                .modifiedAt(Files.getLastModifiedTime(file).toInstant())
                .mimeType(mimeType)
                .kind(ItemKind.from(mimeType, name))
                .build());
      } catch (IOException e) {
        // the file may have been moved away by the pipeline in the meantime
        log.warn("Skipping {} which could not be read: {}", file, e.getMessage());
      }
    }
    return items;
  }
}
