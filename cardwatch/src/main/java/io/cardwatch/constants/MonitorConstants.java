package io.cardwatch.constants;

import com.google.common.collect.ImmutableList;
import java.util.List;

public class MonitorConstants {

  private MonitorConstants() {}

  public static final int DEFAULT_INTERVAL_MINUTES = 5;
  public static final String DEFAULT_HISTORY_FILE_PATH = "historico_processados.json";

  // classifier defaults
  public static final List<String> DEFAULT_EXCLUDED_MARKERS = ImmutableList.of("gabarito");
  public static final List<String> DEFAULT_ALLOWED_EXTENSIONS =
      ImmutableList.of("pdf", "png", "jpg", "jpeg");

  // pipeline defaults
  public static final String FOLDER_ID_PLACEHOLDER = "{folderId}";
  public static final List<String> DEFAULT_PIPELINE_COMMAND =
      ImmutableList.of("python", "script.py", "--drive-folder", FOLDER_ID_PLACEHOLDER);
  public static final int DEFAULT_PIPELINE_TIMEOUT_SECONDS = 600;
  public static final int DEFAULT_STDOUT_TAIL_LINES = 5;
  public static final int DEFAULT_STDERR_TAIL_LINES = 3;
  public static final String BATCH_SIZE_ENV_KEY = "CARDWATCH_BATCH_SIZE";
  public static final String BATCH_IDS_FILE_ENV_KEY = "CARDWATCH_BATCH_IDS_FILE";

  public static final int SHUTDOWN_AWAIT_SECONDS = 30;

  // environment configuration keys
  public static final String DRIVE_FOLDER_ID_ENV_KEY = "DRIVE_FOLDER_ID";
  public static final String DRIVE_ACCESS_TOKEN_ENV_KEY = "DRIVE_ACCESS_TOKEN";
  public static final String DRIVE_API_KEY_ENV_KEY = "DRIVE_API_KEY";
  public static final String LOCAL_FOLDER_ENV_KEY = "CARDWATCH_LOCAL_FOLDER";
  public static final String HISTORY_FILE_ENV_KEY = "CARDWATCH_HISTORY_FILE";
}
