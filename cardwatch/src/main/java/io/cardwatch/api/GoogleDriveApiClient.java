package io.cardwatch.api;

import static io.cardwatch.constants.ApiConstants.API_KEY_QUERY_PARAMETER;
import static io.cardwatch.constants.ApiConstants.AUTHORIZATION_HEADER;
import static io.cardwatch.constants.ApiConstants.BEARER_PREFIX;
import static io.cardwatch.constants.ApiConstants.DRIVE_API_ENDPOINT;
import static io.cardwatch.constants.ApiConstants.LIST_FILES_FIELDS;
import static io.cardwatch.constants.ApiConstants.LIST_FILES_PAGE_SIZE;
import static io.cardwatch.constants.ApiConstants.LIST_FILES_PATH;
import static io.cardwatch.constants.ApiConstants.LIST_FILES_QUERY_TEMPLATE;
import static io.cardwatch.constants.ApiConstants.UNAUTHORIZED_ERROR_MESSAGE;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Inject;
import io.cardwatch.api.models.response.ListFilesResponse;
import io.cardwatch.config.Config;
import io.cardwatch.config.models.common.GoogleDriveConfig;
import io.cardwatch.exceptions.RemoteListingException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.concurrent.CompletableFuture;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.StringUtils;

public class GoogleDriveApiClient {
  private final AsyncHttpClientWithRetry asyncClient;
  private final GoogleDriveConfig driveConfig;
  private final HttpUrl apiEndpoint;
  private final ObjectMapper mapper;

  @Inject
  public GoogleDriveApiClient(@Nonnull AsyncHttpClientWithRetry asyncClient, @Nonnull Config config) {
    this(asyncClient, config.getRemoteStorageConfig().getGoogleDriveConfig(), DRIVE_API_ENDPOINT);
  }

  @VisibleForTesting
  GoogleDriveApiClient(
      AsyncHttpClientWithRetry asyncClient, GoogleDriveConfig driveConfig, String apiEndpoint) {
    this.asyncClient = asyncClient;
    this.driveConfig = driveConfig;
    this.apiEndpoint = HttpUrl.get(apiEndpoint);
    this.mapper =
        new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /** Fetches one page of the non-trashed children of a folder. */
  public CompletableFuture<ListFilesResponse> listFiles(
      String folderId, @Nullable String pageToken) {
    Request request;
    try {
      request = buildListFilesRequest(folderId, pageToken);
    } catch (IOException e) {
      return CompletableFuture.failedFuture(
          new RemoteListingException("Failed to read Drive access token: " + e.getMessage()));
    }
    return asyncClient.makeRequestWithRetry(request).thenApply(this::handleResponse);
  }

  @VisibleForTesting
  Request buildListFilesRequest(String folderId, @Nullable String pageToken) throws IOException {
    HttpUrl.Builder urlBuilder =
        apiEndpoint
            .newBuilder()
            .encodedPath(LIST_FILES_PATH)
            .addQueryParameter("q", MessageFormat.format(LIST_FILES_QUERY_TEMPLATE, folderId))
            .addQueryParameter("fields", LIST_FILES_FIELDS)
            .addQueryParameter("pageSize", String.valueOf(LIST_FILES_PAGE_SIZE));
    if (StringUtils.isNotEmpty(pageToken)) {
      urlBuilder.addQueryParameter("pageToken", pageToken);
    }

    Request.Builder requestBuilder = new Request.Builder().get();
    String accessToken = resolveAccessToken();
    if (StringUtils.isNotBlank(accessToken)) {
      requestBuilder.header(AUTHORIZATION_HEADER, BEARER_PREFIX + accessToken);
    } else {
      urlBuilder.addQueryParameter(API_KEY_QUERY_PARAMETER, driveConfig.getApiKey());
    }
    return requestBuilder.url(urlBuilder.build()).build();
  }

  @Nullable
  private String resolveAccessToken() throws IOException {
    if (StringUtils.isNotBlank(driveConfig.getAccessTokenFile())) {
      return new String(
              Files.readAllBytes(Paths.get(driveConfig.getAccessTokenFile())),
              StandardCharsets.UTF_8)
          .trim();
    }
    return driveConfig.getAccessToken();
  }

  private ListFilesResponse handleResponse(Response response) {
    try (ResponseBody body = response.body()) {
      if (response.isSuccessful()) {
        if (body == null) {
          return new ListFilesResponse();
        }
        return mapper.readValue(body.string(), ListFilesResponse.class);
      }
      ListFilesResponse errorResponse = new ListFilesResponse();
      if (response.code() == 401) {
        errorResponse.setError(response.code(), UNAUTHORIZED_ERROR_MESSAGE);
      } else {
        errorResponse.setError(response.code(), response.message());
      }
      return errorResponse;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to deserialize", e);
    }
  }
}
