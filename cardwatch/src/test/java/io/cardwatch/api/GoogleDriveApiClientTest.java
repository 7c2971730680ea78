package io.cardwatch.api;

import static org.junit.jupiter.api.Assertions.*;

import io.cardwatch.api.models.response.ListFilesResponse;
import io.cardwatch.config.models.common.GoogleDriveConfig;
import io.cardwatch.constants.ApiConstants;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GoogleDriveApiClientTest {
  private static final String FOLDER_ID = "folder-1";

  private MockWebServer mockWebServer;
  private AsyncHttpClientWithRetry asyncHttpClientWithRetry;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    asyncHttpClientWithRetry = new AsyncHttpClientWithRetry(3, 10, new OkHttpClient());
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
    asyncHttpClientWithRetry.shutdownScheduler();
  }

  @Test
  void testListFilesSendsFolderQueryWithBearerToken()
      throws ExecutionException, InterruptedException {
    mockWebServer.enqueue(
        new MockResponse()
            .setResponseCode(200)
            .setBody(
                "{\"nextPageToken\":\"page-2\",\"kind\":\"drive#fileList\",\"files\":["
                    + "{\"id\":\"a1\",\"name\":\"card_01.pdf\",\"mimeType\":\"application/pdf\","
                    + "\"modifiedTime\":\"2024-03-01T12:30:00.000Z\"}]}"));

    ListFilesResponse response =
        client(GoogleDriveConfig.builder().folderId(FOLDER_ID).accessToken("token-1").build())
            .listFiles(FOLDER_ID, null)
            .get();

    assertFalse(response.isFailure());
    assertEquals("page-2", response.getNextPageToken());
    assertEquals(1, response.getFiles().size());
    assertEquals("a1", response.getFiles().get(0).getId());
    assertEquals("card_01.pdf", response.getFiles().get(0).getName());

    RecordedRequest recorded = mockWebServer.takeRequest(1, TimeUnit.SECONDS);
    HttpUrl url = recorded.getRequestUrl();
    assertEquals(ApiConstants.LIST_FILES_PATH, url.encodedPath());
    assertEquals("'folder-1' in parents and trashed = false", url.queryParameter("q"));
    assertEquals("100", url.queryParameter("pageSize"));
    assertNull(url.queryParameter("pageToken"));
    assertNull(url.queryParameter("key"));
    assertEquals("Bearer token-1", recorded.getHeader("Authorization"));
  }

  @Test
  void testApiKeyIsUsedWithoutAccessToken() throws IOException {
    Request request =
        client(GoogleDriveConfig.builder().folderId(FOLDER_ID).apiKey("key-1").build())
            .buildListFilesRequest(FOLDER_ID, "page-2");

    assertEquals("key-1", request.url().queryParameter("key"));
    assertEquals("page-2", request.url().queryParameter("pageToken"));
    assertNull(request.header("Authorization"));
  }

  @Test
  void testAccessTokenFileIsReadForEveryRequest(@TempDir Path tempDir) throws IOException {
    Path tokenFile = tempDir.resolve("token");
    Files.write(tokenFile, "first-token\n".getBytes(StandardCharsets.UTF_8));
    GoogleDriveApiClient client =
        client(
            GoogleDriveConfig.builder()
                .folderId(FOLDER_ID)
                .accessTokenFile(tokenFile.toString())
                .build());

    assertEquals(
        "Bearer first-token", client.buildListFilesRequest(FOLDER_ID, null).header("Authorization"));
    Files.write(tokenFile, "rotated-token".getBytes(StandardCharsets.UTF_8));
    assertEquals(
        "Bearer rotated-token",
        client.buildListFilesRequest(FOLDER_ID, null).header("Authorization"));
  }

  @Test
  void testUnauthorizedResponseIsReportedAsFailure()
      throws ExecutionException, InterruptedException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(401));

    ListFilesResponse response =
        client(GoogleDriveConfig.builder().folderId(FOLDER_ID).accessToken("expired").build())
            .listFiles(FOLDER_ID, null)
            .get();

    assertTrue(response.isFailure());
    assertEquals(401, response.getStatusCode());
    assertEquals(ApiConstants.UNAUTHORIZED_ERROR_MESSAGE, response.getCause());
    assertEquals(1, mockWebServer.getRequestCount());
  }

  @Test
  void testMissingTokenFileFailsTheListing() {
    GoogleDriveApiClient client =
        client(
            GoogleDriveConfig.builder()
                .folderId(FOLDER_ID)
                .accessTokenFile("/does/not/exist/token")
                .build());

    ExecutionException exception =
        assertThrows(ExecutionException.class, () -> client.listFiles(FOLDER_ID, null).get());
    assertTrue(exception.getCause().getMessage().contains("Failed to read Drive access token"));
    assertEquals(0, mockWebServer.getRequestCount());
  }

  private GoogleDriveApiClient client(GoogleDriveConfig driveConfig) {
    return new GoogleDriveApiClient(
        asyncHttpClientWithRetry, driveConfig, mockWebServer.url("/").toString());
  }
}
