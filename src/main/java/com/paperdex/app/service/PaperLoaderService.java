package com.paperdex.app.service;

import com.paperdex.app.model.LoadSummary;
import com.paperdex.app.model.Paper;
import com.paperdex.app.repository.BatchWriteException;
import com.paperdex.app.repository.PaperStore;
import com.paperdex.app.repository.PaperStoreException;
import com.paperdex.app.repository.dynamodb.PaperItem;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Consumer;
import lombok.extern.log4j.Log4j2;

/**
 * Write path: provision the table, project the whole corpus, then persist the items in sequential
 * batches.
 *
 * <ol>
 *   <li>Every paper is projected before the first write, so a bad record never leaves half a paper
 *       in the table.
 *   <li>Batches are independent: a failed batch leaves earlier ones committed and reports which
 *       papers it carried.
 *   <li>Items the store leaves unprocessed are retried with exponential backoff before the batch is
 *       declared failed.
 * </ol>
 */
@Log4j2
public class PaperLoaderService {

  /** BatchWriteItem accepts at most this many put requests. */
  public static final int MAX_BATCH_SIZE = 25;

  private final PaperStore store;
  private final PaperItemProjector projector;
  private final int batchSize;
  private final int maxAttempts;
  private final Duration initialBackoff;

  public PaperLoaderService(
      PaperStore store,
      PaperItemProjector projector,
      int batchSize,
      int maxAttempts,
      Duration initialBackoff) {
    if (batchSize < 1 || batchSize > MAX_BATCH_SIZE) {
      throw new IllegalArgumentException(
          "batchSize must be between 1 and " + MAX_BATCH_SIZE + ": " + batchSize);
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.projector = Objects.requireNonNull(projector, "projector must not be null");
    this.batchSize = batchSize;
    this.maxAttempts = maxAttempts;
    this.initialBackoff = Objects.requireNonNull(initialBackoff, "initialBackoff");
  }

  /** Convenience overload that reports progress to the log only. */
  public LoadSummary load(List<Paper> papers) {
    return load(papers, message -> {});
  }

  /**
   * Loads {@code papers} into the store. Re-running with the same input rewrites the same keys.
   *
   * @param progress receives human-readable progress lines
   * @throws BatchWriteException if a batch cannot be fully committed
   * @throws PaperStoreException if provisioning or a store call fails
   */
  public LoadSummary load(List<Paper> papers, Consumer<String> progress) {
    long t0 = System.nanoTime();
    progress.accept("Ensuring table " + store.tableName() + " and its secondary indexes");
    store.ensureTable();

    LoadSummary summary = new LoadSummary();
    progress.accept("Extracting keywords and projecting " + papers.size() + " papers...");
    List<ProjectedItem> items = projectAll(papers, summary);

    progress.accept("Writing " + items.size() + " items in batches of " + batchSize + "...");
    writeAll(items, summary, progress);

    summary.setDurationMs((System.nanoTime() - t0) / 1_000_000);
    log.info(
        "loader.done table={} papers={} skipped={} items={} batches={} durationMs={}",
        store.tableName(),
        summary.getTotalPapers(),
        summary.getSkippedPapers(),
        summary.totalItems(),
        summary.getBatchesWritten(),
        summary.getDurationMs());
    return summary;
  }

  /** Projects every paper; records that cannot be keyed are skipped and counted. */
  List<ProjectedItem> projectAll(List<Paper> papers, LoadSummary summary) {
    List<ProjectedItem> all = new ArrayList<>();
    for (int i = 0; i < papers.size(); i++) {
      summary.setTotalPapers(summary.getTotalPapers() + 1);
      List<PaperItem> items;
      try {
        items = projector.project(papers.get(i));
      } catch (InvalidPaperException e) {
        log.warn("loader.skip paperIndex={} reason={}", i, e.getMessage());
        summary.setSkippedPapers(summary.getSkippedPapers() + 1);
        continue;
      }
      for (PaperItem item : items) {
        all.add(new ProjectedItem(i, item));
        summary.increment(item.getItemType());
      }
    }
    return all;
  }

  private void writeAll(List<ProjectedItem> items, LoadSummary summary, Consumer<String> progress) {
    int batchCount = (items.size() + batchSize - 1) / batchSize;
    int lastCommitted = -1;
    for (int b = 0; b < batchCount; b++) {
      List<ProjectedItem> batch =
          items.subList(b * batchSize, Math.min((b + 1) * batchSize, items.size()));
      writeBatch(b, lastCommitted, batch);
      lastCommitted = b;
      summary.setBatchesWritten(summary.getBatchesWritten() + 1);
      if ((b + 1) % 100 == 0 || b + 1 == batchCount) {
        progress.accept("  committed batch " + (b + 1) + "/" + batchCount);
      }
    }
  }

  private void writeBatch(int batchIndex, int lastCommitted, List<ProjectedItem> batch) {
    // same primary key twice in one request is rejected; the later item wins, as on overwrite
    Map<String, ProjectedItem> byKey = new LinkedHashMap<>();
    for (ProjectedItem p : batch) {
      byKey.remove(p.getItem().primaryKey());
      byKey.put(p.getItem().primaryKey(), p);
    }
    SortedSet<Integer> paperIndices = new TreeSet<>();
    batch.forEach(p -> paperIndices.add(p.getPaperIndex()));

    List<PaperItem> pending = byKey.values().stream().map(ProjectedItem::getItem).toList();
    for (int attempt = 1; ; attempt++) {
      List<PaperItem> unprocessed;
      try {
        unprocessed = store.writeBatch(pending);
      } catch (PaperStoreException e) {
        log.error(
            "loader.batch.failed batch={} papers={} lastCommitted={} msg={}",
            batchIndex,
            paperIndices,
            lastCommitted,
            e.getMessage());
        throw new BatchWriteException(batchIndex, lastCommitted, paperIndices, keys(pending), e);
      }
      if (unprocessed.isEmpty()) {
        log.debug("loader.batch.committed batch={} items={}", batchIndex, byKey.size());
        return;
      }
      if (attempt >= maxAttempts) {
        log.error(
            "loader.batch.unconfirmed batch={} papers={} unconfirmed={} attempts={}",
            batchIndex,
            paperIndices,
            unprocessed.size(),
            attempt);
        throw new BatchWriteException(
            batchIndex, lastCommitted, paperIndices, keys(unprocessed), null);
      }
      Duration backoff = initialBackoff.multipliedBy(1L << Math.min(attempt - 1, 10));
      log.warn(
          "loader.batch.retry batch={} unprocessed={} attempt={} backoffMs={}",
          batchIndex,
          unprocessed.size(),
          attempt,
          backoff.toMillis());
      sleep(backoff, batchIndex);
      pending = unprocessed;
    }
  }

  private static List<String> keys(List<PaperItem> items) {
    return items.stream().map(PaperItem::primaryKey).toList();
  }

  private void sleep(Duration backoff, int batchIndex) {
    try {
      Thread.sleep(backoff.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PaperStoreException("batchWrite", "batch " + batchIndex, "interrupted", e);
    }
  }
}
