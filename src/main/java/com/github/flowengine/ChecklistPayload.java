package com.github.flowengine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Payload of a {@link StepType#CHECKLIST} step. Item completion state is kept in flowData under
 * {@link #getDataKey()}. When {@code minItemsToComplete} is null every mandatory item must be
 * completed.
 */
public final class ChecklistPayload {
  private final List<ChecklistItem> items;
  private final String dataKey;
  private final Integer minItemsToComplete;

  public ChecklistPayload(final List<ChecklistItem> items, final String dataKey,
      final Integer minItemsToComplete) {
    this.items = items == null ? Collections.<ChecklistItem>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(items));
    this.dataKey = dataKey;
    this.minItemsToComplete = minItemsToComplete;
  }

  public ChecklistPayload(final List<ChecklistItem> items, final String dataKey) {
    this(items, dataKey, null);
  }

  public List<ChecklistItem> getItems() {
    return items;
  }

  public String getDataKey() {
    return dataKey;
  }

  public Integer getMinItemsToComplete() {
    return minItemsToComplete;
  }

  public ChecklistItem findItem(final String itemId) {
    for (final ChecklistItem item : items) {
      if (item.getId().equals(itemId)) {
        return item;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "ChecklistPayload [items=" + items + ", dataKey=" + dataKey + ", minItemsToComplete="
        + minItemsToComplete + "]";
  }
}
