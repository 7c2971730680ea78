package io.cardwatch.config;

import static io.cardwatch.constants.MonitorConstants.DRIVE_ACCESS_TOKEN_ENV_KEY;
import static io.cardwatch.constants.MonitorConstants.DRIVE_API_KEY_ENV_KEY;
import static io.cardwatch.constants.MonitorConstants.DRIVE_FOLDER_ID_ENV_KEY;
import static io.cardwatch.constants.MonitorConstants.HISTORY_FILE_ENV_KEY;
import static io.cardwatch.constants.MonitorConstants.LOCAL_FOLDER_ENV_KEY;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import io.cardwatch.config.models.common.GoogleDriveConfig;
import io.cardwatch.config.models.common.LocalDirectoryConfig;
import io.cardwatch.config.models.common.RemoteStorageConfiguration;
import io.cardwatch.config.models.configv1.ConfigV1;
import io.cardwatch.config.models.configv1.MonitorConfig;
import io.cardwatch.config.models.configv1.PipelineConfig;
import io.cardwatch.env.EnvironmentLookupProvider;
import io.cardwatch.exceptions.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

public class ConfigLoader {
  private final ObjectMapper MAPPER;

  public ConfigLoader() {
    this.MAPPER = new ObjectMapper(new YAMLFactory());
    MAPPER.registerModule(new Jdk8Module());
  }

  public Config loadConfigFromConfigFile(String configFilePath) {
    try (InputStream in = Files.newInputStream(Paths.get(configFilePath))) {
      return loadConfigFromJsonNode(MAPPER.readTree(in));
    } catch (ConfigurationException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigurationException("Failed to load config from " + configFilePath, e);
    }
  }

  public Config loadConfigFromString(String configYaml) {
    try {
      return loadConfigFromJsonNode(MAPPER.readTree(configYaml));
    } catch (ConfigurationException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigurationException("Failed to load config", e);
    }
  }

  /**
   * Builds a config from environment variables only: a local folder when {@code
   * CARDWATCH_LOCAL_FOLDER} is set, a Drive folder otherwise.
   */
  public Config loadConfigFromEnvironment(EnvironmentLookupProvider environment) {
    RemoteStorageConfiguration remoteStorageConfig;
    String localFolder = environment.getSetting(LOCAL_FOLDER_ENV_KEY);
    if (localFolder != null) {
      remoteStorageConfig =
          RemoteStorageConfiguration.builder()
              .localDirectoryConfig(LocalDirectoryConfig.builder().path(localFolder).build())
              .build();
    } else {
      remoteStorageConfig =
          RemoteStorageConfiguration.builder()
              .googleDriveConfig(
                  GoogleDriveConfig.builder()
                      .folderId(environment.getSetting(DRIVE_FOLDER_ID_ENV_KEY))
                      .accessToken(environment.getSetting(DRIVE_ACCESS_TOKEN_ENV_KEY))
                      .apiKey(environment.getSetting(DRIVE_API_KEY_ENV_KEY))
                      .build())
              .build();
    }

    MonitorConfig.MonitorConfigBuilder monitorConfig = MonitorConfig.builder();
    String historyFile = environment.getSetting(HISTORY_FILE_ENV_KEY);
    if (historyFile != null) {
      monitorConfig.historyFilePath(historyFile);
    }

    ConfigV1 configV1 =
        ConfigV1.builder()
            .version(ConfigVersion.V1.name())
            .remoteStorageConfig(remoteStorageConfig)
            .monitorConfig(monitorConfig.build())
            .build();
    validateConfig(configV1);
    return configV1;
  }

  private Config loadConfigFromJsonNode(JsonNode jsonNode) throws IOException {
    JsonNode versionNode = jsonNode == null ? null : jsonNode.get("version");
    if (versionNode == null) {
      throw new ConfigurationException("Config is missing the version field");
    }
    ConfigVersion version;
    try {
      version = ConfigVersion.valueOf(versionNode.asText());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Unsupported config version: " + versionNode.asText(), e);
    }
    switch (version) {
      case V1:
        ConfigV1 configV1 = MAPPER.treeToValue(jsonNode, ConfigV1.class);
        validateConfig(configV1);
        return configV1;
      default:
        throw new UnsupportedOperationException("Unsupported config version: " + version);
    }
  }

  /** Applies the command line overrides on top of a loaded config. */
  public Config applyOverrides(Config config, Integer intervalMinutes, boolean singleCheck) {
    ConfigV1 configV1 = (ConfigV1) config;
    MonitorConfig.MonitorConfigBuilder monitorConfig = configV1.getMonitorConfig().toBuilder();
    if (intervalMinutes != null) {
      monitorConfig.intervalMinutes(intervalMinutes);
    }
    if (singleCheck) {
      monitorConfig.jobRunMode(MonitorConfig.JobRunMode.ONCE);
    }
    ConfigV1 overridden = configV1.toBuilder().monitorConfig(monitorConfig.build()).build();
    validateConfig(overridden);
    return overridden;
  }

  private void validateConfig(ConfigV1 configV1) {
    List<String> problems = new ArrayList<>();
    RemoteStorageConfiguration remoteStorageConfig = configV1.getRemoteStorageConfig();
    GoogleDriveConfig driveConfig = remoteStorageConfig.getGoogleDriveConfig();
    LocalDirectoryConfig localDirectoryConfig = remoteStorageConfig.getLocalDirectoryConfig();
    if (driveConfig == null && localDirectoryConfig == null) {
      problems.add("remoteStorageConfig (googleDriveConfig or localDirectoryConfig)");
    } else if (driveConfig != null && localDirectoryConfig != null) {
      throw new ConfigurationException(
          "Cannot specify both googleDriveConfig and localDirectoryConfig");
    } else if (driveConfig != null) {
      if (StringUtils.isBlank(driveConfig.getFolderId())) {
        problems.add("folderId");
      }
      if (StringUtils.isAllBlank(
          driveConfig.getAccessToken(), driveConfig.getAccessTokenFile(), driveConfig.getApiKey())) {
        problems.add("accessToken, accessTokenFile or apiKey");
      }
    }

    MonitorConfig monitorConfig = configV1.getMonitorConfig();
    if (monitorConfig == null) {
      problems.add("monitorConfig");
    } else {
      if (monitorConfig.getIntervalMinutes() <= 0) {
        problems.add("intervalMinutes (must be positive)");
      }
      if (StringUtils.isBlank(monitorConfig.getHistoryFilePath())) {
        problems.add("historyFilePath");
      }
      PipelineConfig pipelineConfig = monitorConfig.getPipelineConfig();
      if (pipelineConfig == null
          || pipelineConfig.getCommand() == null
          || pipelineConfig.getCommand().isEmpty()) {
        problems.add("pipelineConfig.command");
      } else {
        if (pipelineConfig.getTimeoutSeconds() <= 0) {
          problems.add("pipelineConfig.timeoutSeconds (must be positive)");
        }
        if (pipelineConfig.getStdoutTailLines() < 0) {
          problems.add("pipelineConfig.stdoutTailLines (must not be negative)");
        }
        if (pipelineConfig.getStderrTailLines() < 0) {
          problems.add("pipelineConfig.stderrTailLines (must not be negative)");
        }
      }
    }

    if (!problems.isEmpty()) {
      throw new ConfigurationException(
          String.format("Missing or invalid config params: %s", String.join(", ", problems)));
    }
  }
}
