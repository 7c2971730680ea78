package io.cardwatch.storage;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.cardwatch.api.GoogleDriveApiClient;
import io.cardwatch.api.models.response.ListFilesResponse;
import io.cardwatch.exceptions.RemoteListingException;
import io.cardwatch.storage.models.ItemKind;
import io.cardwatch.storage.models.RemoteItem;
import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GoogleDriveRemoteListerTest {
  private static final String FOLDER_ID = "folder-1";
  private final ExecutorService executorService = ForkJoinPool.commonPool();

  @Mock private GoogleDriveApiClient driveApiClient;
  private GoogleDriveRemoteLister remoteLister;

  @BeforeEach
  void setUp() {
    remoteLister = new GoogleDriveRemoteLister(driveApiClient, executorService);
  }

  @Test
  void testFollowsPageTokensUntilExhausted() throws ExecutionException, InterruptedException {
    when(driveApiClient.listFiles(eq(FOLDER_ID), isNull()))
        .thenReturn(
            CompletableFuture.completedFuture(
                page(
                    "page-2",
                    file("a1", "card_01.pdf", "application/pdf", "2024-03-01T12:30:00.000Z"),
                    file("a2", "card_02.jpg", "image/jpeg", null))));
    when(driveApiClient.listFiles(FOLDER_ID, "page-2"))
        .thenReturn(
            CompletableFuture.completedFuture(
                page(null, file("a3", "card_03.png", null, "not-a-timestamp"))));

    List<RemoteItem> items = remoteLister.listItems(FOLDER_ID).get();

    assertEquals(3, items.size());
    assertEquals("a1", items.get(0).getId());
    assertEquals(ItemKind.DOCUMENT, items.get(0).getKind());
    assertEquals(Instant.parse("2024-03-01T12:30:00Z"), items.get(0).getModifiedAt());
    assertEquals(ItemKind.IMAGE, items.get(1).getKind());
    assertNull(items.get(1).getModifiedAt());
    assertEquals("a3", items.get(2).getId());
    assertEquals(ItemKind.IMAGE, items.get(2).getKind());
    assertNull(items.get(2).getModifiedAt());
    verify(driveApiClient).listFiles(FOLDER_ID, "page-2");
  }

  @Test
  void testEmptyFolder() throws ExecutionException, InterruptedException {
    ListFilesResponse empty = new ListFilesResponse();
    when(driveApiClient.listFiles(eq(FOLDER_ID), isNull()))
        .thenReturn(CompletableFuture.completedFuture(empty));

    assertTrue(remoteLister.listItems(FOLDER_ID).get().isEmpty());
  }

  @Test
  void testFailureResponseFailsWithStatus() {
    ListFilesResponse forbidden = new ListFilesResponse();
    forbidden.setError(403, "Forbidden");
    when(driveApiClient.listFiles(eq(FOLDER_ID), isNull()))
        .thenReturn(CompletableFuture.completedFuture(forbidden));

    ExecutionException exception =
        assertThrows(ExecutionException.class, () -> remoteLister.listItems(FOLDER_ID).get());
    RemoteListingException cause =
        assertInstanceOf(RemoteListingException.class, exception.getCause());
    assertEquals(403, cause.getStatusCode());
  }

  @Test
  void testTransportFailureIsWrapped() {
    when(driveApiClient.listFiles(any(), any()))
        .thenReturn(CompletableFuture.failedFuture(new IOException("connection reset")));

    ExecutionException exception =
        assertThrows(ExecutionException.class, () -> remoteLister.listItems(FOLDER_ID).get());
    RemoteListingException cause =
        assertInstanceOf(RemoteListingException.class, exception.getCause());
    assertInstanceOf(IOException.class, cause.getCause());
  }

  private static ListFilesResponse page(String nextPageToken, ListFilesResponse.DriveFile... files) {
    return ListFilesResponse.builder()
        .nextPageToken(nextPageToken)
        .files(files.length == 0 ? Collections.emptyList() : Arrays.asList(files))
        .build();
  }

  private static ListFilesResponse.DriveFile file(
      String id, String name, String mimeType, String modifiedTime) {
    return ListFilesResponse.DriveFile.builder()
        .id(id)
        .name(name)
        .mimeType(mimeType)
        .modifiedTime(modifiedTime)
        .build();
  }
}
