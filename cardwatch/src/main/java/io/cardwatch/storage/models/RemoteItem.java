package io.cardwatch.storage.models;

import java.time.Instant;
import javax.annotation.Nullable;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Snapshot of one remote file at listing time. */
@Builder
@Value
public class RemoteItem {
  @NonNull String id;
  @NonNull String name;
  @Nullable Instant modifiedAt;
  @NonNull ItemKind kind;
  @Nullable String mimeType;
}
