package io.cardwatch.config;

import io.cardwatch.config.models.common.RemoteStorageConfiguration;
import io.cardwatch.config.models.configv1.MonitorConfig;

public interface Config {
  ConfigVersion getVersion();

  RemoteStorageConfiguration getRemoteStorageConfig();

  MonitorConfig getMonitorConfig();
}
