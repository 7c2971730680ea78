package io.cardwatch.config.models.common;

import javax.annotation.Nullable;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Getter
@Setter
@Jacksonized
@EqualsAndHashCode
public class GoogleDriveConfig {
  @Nullable private String folderId;
  @Nullable private String accessToken;
  // re-read before every listing so an external process can rotate the token
  @Nullable private String accessTokenFile;
  @Nullable private String apiKey;
}
