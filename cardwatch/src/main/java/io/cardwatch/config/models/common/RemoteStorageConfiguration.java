package io.cardwatch.config.models.common;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/** Exactly one of the two locations is expected to be set. */
@Builder
@Jacksonized
@Getter
@EqualsAndHashCode
public class RemoteStorageConfiguration {
  private GoogleDriveConfig googleDriveConfig;
  private LocalDirectoryConfig localDirectoryConfig;

  /** Reference of the watched folder, handed to both the lister and the pipeline. */
  public String folderRef() {
    if (googleDriveConfig != null) {
      return googleDriveConfig.getFolderId();
    }
    return localDirectoryConfig == null ? null : localDirectoryConfig.getPath();
  }
}
