package io.cardwatch.config.models.configv1;

import io.cardwatch.config.Config;
import io.cardwatch.config.ConfigVersion;
import io.cardwatch.config.models.common.RemoteStorageConfiguration;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.jackson.Jacksonized;

@Builder(toBuilder = true)
@Getter
@Jacksonized
@EqualsAndHashCode
public class ConfigV1 implements Config {
  @NonNull private String version;
  @NonNull private RemoteStorageConfiguration remoteStorageConfig;
  @Builder.Default private MonitorConfig monitorConfig = MonitorConfig.builder().build();

  @Override
  public ConfigVersion getVersion() {
    return ConfigVersion.valueOf(version);
  }
}
