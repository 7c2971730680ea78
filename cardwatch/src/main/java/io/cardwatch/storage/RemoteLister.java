package io.cardwatch.storage;

import io.cardwatch.storage.models.RemoteItem;
import java.util.List;
import java.util.concurrent.CompletableFuture;

public interface RemoteLister {
  /**
   * Lists the items currently present in the watched folder, in the order the remote returns
   * them. Completes exceptionally with {@link io.cardwatch.exceptions.RemoteListingException} on
   * authentication, quota or network failures.
   */
  CompletableFuture<List<RemoteItem>> listItems(String folderRef);
}
