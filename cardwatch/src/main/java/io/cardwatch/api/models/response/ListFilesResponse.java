package io.cardwatch.api.models.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** One page of a Drive v3 {@code files.list} response. */
@Builder
@Getter
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ListFilesResponse extends ApiResponse {
  @Builder
  @Getter
  @AllArgsConstructor
  @NoArgsConstructor
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class DriveFile {
    String id;
    String name;
    String mimeType;
    // RFC 3339, e.g. 2024-03-01T12:30:00.000Z
    String modifiedTime;
  }

  private String nextPageToken;
  private List<DriveFile> files;
}
