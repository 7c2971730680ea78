package io.cardwatch.api;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AsyncHttpClientWithRetryTest {

  private MockWebServer mockWebServer;
  private AsyncHttpClientWithRetry asyncHttpClientWithRetry;
  private OkHttpClient okHttpClient;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();

    okHttpClient = new OkHttpClient.Builder().build();
    asyncHttpClientWithRetry = new AsyncHttpClientWithRetry(3, 100, okHttpClient);
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
    asyncHttpClientWithRetry.shutdownScheduler();
    assertEquals(0, okHttpClient.connectionPool().connectionCount());
    assertTrue(okHttpClient.dispatcher().executorService().isShutdown());
  }

  @Test
  void testRetriesServerErrorsUntilSuccess() throws InterruptedException, ExecutionException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));
    mockWebServer.enqueue(new MockResponse().setResponseCode(503));
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));

    Request request = new Request.Builder().url(mockWebServer.url("/")).get().build();

    CompletableFuture<Response> future = asyncHttpClientWithRetry.makeRequestWithRetry(request);
    try (Response response = future.get()) {
      assertTrue(response.isSuccessful());
    }
    assertEquals(3, mockWebServer.getRequestCount());
  }

  @Test
  void testReturnsLastResponseWhenAllRetriesFail()
      throws InterruptedException, ExecutionException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));
    mockWebServer.enqueue(new MockResponse().setResponseCode(500));

    Request request = new Request.Builder().url(mockWebServer.url("/")).get().build();

    try (Response response = asyncHttpClientWithRetry.makeRequestWithRetry(request).get()) {
      assertFalse(response.isSuccessful());
      assertEquals(500, response.code());
    }
    assertEquals(3, mockWebServer.getRequestCount());
  }

  @Test
  void testClientErrorIsNotRetried() throws InterruptedException, ExecutionException {
    mockWebServer.enqueue(new MockResponse().setResponseCode(403));
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));

    Request request = new Request.Builder().url(mockWebServer.url("/")).get().build();

    try (Response response = asyncHttpClientWithRetry.makeRequestWithRetry(request).get()) {
      assertEquals(403, response.code());
    }
    assertEquals(1, mockWebServer.getRequestCount());
  }

  @Test
  void testTransportFailureCompletesExceptionally() throws IOException {
    String url = mockWebServer.url("/").toString();
    // nothing listens on the port any more
    mockWebServer.shutdown();

    Request request = new Request.Builder().url(url).get().build();

    CompletableFuture<Response> future = asyncHttpClientWithRetry.makeRequestWithRetry(request);

    ExecutionException exception = assertThrows(ExecutionException.class, future::get);
    assertInstanceOf(IOException.class, exception.getCause());
  }
}
