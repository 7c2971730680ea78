package io.cardwatch.constants;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class ApiConstants {

  private ApiConstants() {}

  public static final String DRIVE_API_ENDPOINT =
      System.getenv().getOrDefault("DRIVE_API_ENDPOINT", "https://www.googleapis.com");

  public static final String LIST_FILES_PATH = "/drive/v3/files";
  public static final String LIST_FILES_QUERY_TEMPLATE = "''{0}'' in parents and trashed = false";
  public static final String LIST_FILES_FIELDS = "nextPageToken, files(id, name, mimeType, modifiedTime)";
  public static final int LIST_FILES_PAGE_SIZE = 100;

  public static final String AUTHORIZATION_HEADER = "Authorization";
  public static final String BEARER_PREFIX = "Bearer ";
  public static final String API_KEY_QUERY_PARAMETER = "key";

  // client errors are not retried, the same request would fail again
  public static final List<Integer> ACCEPTABLE_HTTP_FAILURE_STATUS_CODES =
      Collections.unmodifiableList(new ArrayList<>(Arrays.asList(404, 400, 401, 403)));

  public static final String UNAUTHORIZED_ERROR_MESSAGE =
      "Confirm that the Drive access token is valid and has not expired.";
}
