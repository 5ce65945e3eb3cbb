package com.paperdex.app.model;

import java.util.EnumMap;
import java.util.Map;
import lombok.Data;

/** Outcome of one loader run. */
@Data
public class LoadSummary {

  /** Records read from the corpus, including skipped ones. */
  private int totalPapers;

  /** Records that could not be keyed and were left out. */
  private int skippedPapers;

  private int batchesWritten;

  private long durationMs;

  private final Map<ItemType, Integer> itemCounts = new EnumMap<>(ItemType.class);

  public void increment(ItemType type) {
    itemCounts.merge(type, 1, Integer::sum);
  }

  public int count(ItemType type) {
    return itemCounts.getOrDefault(type, 0);
  }

  public int totalItems() {
    return itemCounts.values().stream().mapToInt(Integer::intValue).sum();
  }

  /** Derived items per source record; 0 for an empty corpus. */
  public double denormalizationFactor() {
    return totalPapers == 0 ? 0.0 : (double) totalItems() / totalPapers;
  }
}
