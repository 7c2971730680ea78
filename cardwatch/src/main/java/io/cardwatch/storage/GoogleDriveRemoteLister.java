package io.cardwatch.storage;

import com.google.inject.Inject;
import io.cardwatch.api.GoogleDriveApiClient;
import io.cardwatch.api.models.response.ListFilesResponse;
import io.cardwatch.exceptions.RemoteListingException;
import io.cardwatch.storage.models.ItemKind;
import io.cardwatch.storage.models.RemoteItem;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

/** Lists a Google Drive folder page by page until Drive stops returning a page token. */
@Slf4j
public class GoogleDriveRemoteLister implements RemoteLister {
  private final GoogleDriveApiClient driveApiClient;
  private final ExecutorService executorService;

  @Inject
  public GoogleDriveRemoteLister(
      @Nonnull GoogleDriveApiClient driveApiClient, @Nonnull ExecutorService executorService) {
    this.driveApiClient = driveApiClient;
    this.executorService = executorService;
  }

  @Override
  public CompletableFuture<List<RemoteItem>> listItems(String folderRef) {
    log.debug("Listing files in Drive folder {}", folderRef);
    return listAllPages(folderRef, null, new ArrayList<>())
        .exceptionally(
            throwable -> {
              Throwable cause =
                  throwable instanceof CompletionException && throwable.getCause() != null
                      ? throwable.getCause()
                      : throwable;
              if (cause instanceof RemoteListingException) {
                throw (RemoteListingException) cause;
              }
              throw new RemoteListingException(cause);
            });
  }

  private CompletableFuture<List<RemoteItem>> listAllPages(
      String folderId, @Nullable String pageToken, List<RemoteItem> items) {
    return driveApiClient
        .listFiles(folderId, pageToken)
        .thenComposeAsync(
            response -> {
              if (response.isFailure()) {
                throw new RemoteListingException(
                    String.format(
                        "Drive listing failed with status %d: %s",
                        response.getStatusCode(), response.getCause()),
                    response.getStatusCode());
              }
              if (response.getFiles() != null) {
                response.getFiles().stream().map(this::toRemoteItem).forEach(items::add);
              }
              if (response.getNextPageToken() != null && !response.getNextPageToken().isEmpty()) {
                return listAllPages(folderId, response.getNextPageToken(), items);
              }
              return CompletableFuture.completedFuture(items);
            },
            executorService);
  }

  private RemoteItem toRemoteItem(ListFilesResponse.DriveFile file) {
    return RemoteItem.builder()
        .id(file.getId())
        .name(file.getName())
        .mimeType(file.getMimeType())
        .modifiedAt(parseModifiedTime(file.getModifiedTime()))
        .kind(ItemKind.from(file.getMimeType(), file.getName()))
        .build();
  }

  @Nullable
  private static Instant parseModifiedTime(@Nullable String modifiedTime) {
    if (modifiedTime == null) {
      return null;
    }
    try {
      return Instant.parse(modifiedTime);
    } catch (DateTimeParseException e) {
      log.debug("Ignoring unparsable modifiedTime {}", modifiedTime);
      return null;
    }
  }
}
