package io.cardwatch.monitor.models;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.cardwatch.storage.models.RemoteItem;
import java.util.List;
import lombok.NonNull;
import lombok.Value;

/** Items of one cycle that go to the pipeline together, in listing order. */
@Value
public class Batch {
  @NonNull ImmutableList<RemoteItem> items;

  public static Batch of(List<RemoteItem> items) {
    return new Batch(ImmutableList.copyOf(items));
  }

  public ImmutableSet<String> ids() {
    ImmutableSet.Builder<String> ids = ImmutableSet.builder();
    items.forEach(item -> ids.add(item.getId()));
    return ids.build();
  }

  public int size() {
    return items.size();
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }
}
