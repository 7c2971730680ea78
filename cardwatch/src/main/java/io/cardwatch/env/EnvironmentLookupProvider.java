package io.cardwatch.env;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;

/** Reads the process environment; tests supply a map instead. */
@FunctionalInterface
public interface EnvironmentLookupProvider {

  @Nullable
  String getValue(@Nonnull String key);

  /** The trimmed value, or {@code null} when the variable is unset or blank. */
  @Nullable
  default String getSetting(@Nonnull String key) {
    return StringUtils.trimToNull(getValue(key));
  }

  class ProcessEnvironment implements EnvironmentLookupProvider {
    @Nullable @Override
    public String getValue(@Nonnull String key) {
      return System.getenv(key);
    }
  }
}
