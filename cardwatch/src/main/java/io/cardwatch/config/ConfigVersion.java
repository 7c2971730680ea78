package io.cardwatch.config;

public enum ConfigVersion {
  V1
}
