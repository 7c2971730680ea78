package io.cardwatch.monitor;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableSet;
import io.cardwatch.config.models.configv1.ClassifierConfig;
import io.cardwatch.history.models.HistorySnapshot;
import io.cardwatch.monitor.models.Batch;
import io.cardwatch.storage.models.RemoteItem;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Selects the listed items that still need processing: not yet in the history, not an answer key
 * and carrying a supported extension. Listing order is preserved.
 */
@Slf4j
public class NewItemClassifier {
  private final Set<String> excludedMarkers;
  private final Set<String> allowedExtensions;

  public NewItemClassifier(ClassifierConfig classifierConfig) {
    this(classifierConfig.getExcludedMarkers(), classifierConfig.getAllowedExtensions());
  }

  @VisibleForTesting
  NewItemClassifier(Collection<String> excludedMarkers, Collection<String> allowedExtensions) {
    ImmutableSet.Builder<String> markers = ImmutableSet.builder();
    for (String marker : excludedMarkers) {
      if (StringUtils.isNotBlank(marker)) {
        markers.add(marker.toLowerCase(Locale.ROOT));
      }
    }
    ImmutableSet.Builder<String> extensions = ImmutableSet.builder();
    for (String extension : allowedExtensions) {
      if (StringUtils.isNotBlank(extension)) {
        extensions.add(StringUtils.removeStart(extension, ".").toLowerCase(Locale.ROOT));
      }
    }
    this.excludedMarkers = markers.build();
    this.allowedExtensions = extensions.build();
  }

  public Batch classify(List<RemoteItem> listing, HistorySnapshot history) {
    List<RemoteItem> selected = new ArrayList<>();
    Set<String> selectedIds = new HashSet<>();
    for (RemoteItem item : listing) {
      if (history.isProcessed(item.getId()) || selectedIds.contains(item.getId())) {
        continue;
      }
      String name = item.getName().toLowerCase(Locale.ROOT);
      if (isExcluded(name)) {
        log.debug("Skipping {}: excluded by name", item.getName());
        continue;
      }
      if (!hasAllowedExtension(name)) {
        log.debug("Skipping {}: unsupported extension", item.getName());
        continue;
      }
      selected.add(item);
      selectedIds.add(item.getId());
    }
    return Batch.of(selected);
  }

  private boolean isExcluded(String lowerCaseName) {
    for (String marker : excludedMarkers) {
      if (lowerCaseName.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  private boolean hasAllowedExtension(String lowerCaseName) {
    int lastDot = lowerCaseName.lastIndexOf('.');
    if (lastDot < 0 || lastDot == lowerCaseName.length() - 1) {
      return false;
    }
    return allowedExtensions.contains(lowerCaseName.substring(lastDot + 1));
  }
}
