package io.cardwatch.config.models.configv1;

import static io.cardwatch.constants.MonitorConstants.DEFAULT_ALLOWED_EXTENSIONS;
import static io.cardwatch.constants.MonitorConstants.DEFAULT_EXCLUDED_MARKERS;

import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

@Builder
@Getter
@Jacksonized
@EqualsAndHashCode
public class ClassifierConfig {
  // names containing any of these (case-insensitive) are answer keys, not cards
  @Builder.Default private List<String> excludedMarkers = DEFAULT_EXCLUDED_MARKERS;
  @Builder.Default private List<String> allowedExtensions = DEFAULT_ALLOWED_EXTENSIONS;
}
