package com.paperdex.app.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.paperdex.app.model.ItemType;
import com.paperdex.app.model.LoadSummary;
import com.paperdex.app.model.Paper;
import com.paperdex.app.repository.BatchWriteException;
import com.paperdex.app.repository.PaperStore;
import com.paperdex.app.repository.PaperStoreException;
import com.paperdex.app.repository.dynamodb.PaperItem;
import com.paperdex.app.repository.memory.InMemoryPaperStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

class PaperLoaderServiceTest {

  private PaperStore store;
  private PaperItemProjector projector;

  @BeforeEach
  void setUp() {
    store = mock(PaperStore.class);
    when(store.tableName()).thenReturn("papers");
    projector = new PaperItemProjector(new KeywordExtractor(10));
  }

  private PaperLoaderService loader(int batchSize, int maxAttempts) {
    return new PaperLoaderService(store, projector, batchSize, maxAttempts, Duration.ZERO);
  }

  /** One detail row plus one category row: two items per paper. */
  private static Paper minimal(String id) {
    return Paper.builder()
        .arxivId(id)
        .title("t " + id)
        .categories(List.of("cs.LG"))
        .published("2024-01-01T00:00:00Z")
        .build();
  }

  private static List<Paper> minimalPapers(int count) {
    return IntStream.range(0, count).mapToObj(i -> minimal("p" + i)).toList();
  }

  @Test
  @SuppressWarnings("unchecked")
  void writesInBatchesOfAtMostTwentyFive() {
    LoadSummary summary = loader(25, 3).load(minimalPapers(30));

    ArgumentCaptor<List<PaperItem>> batches = ArgumentCaptor.forClass(List.class);
    verify(store, times(3)).writeBatch(batches.capture());
    assertEquals(List.of(25, 25, 10), batches.getAllValues().stream().map(List::size).toList());
    assertEquals(3, summary.getBatchesWritten());
    assertEquals(30, summary.getTotalPapers());
    assertEquals(60, summary.totalItems());
    assertEquals(30, summary.count(ItemType.PAPER_DETAIL));
    assertEquals(30, summary.count(ItemType.CATEGORY_ITEM));
    assertEquals(2.0, summary.denormalizationFactor(), 1e-9);
  }

  @Test
  void provisionsBeforeWriting() {
    loader(25, 3).load(minimalPapers(1));

    InOrder order = inOrder(store);
    order.verify(store).ensureTable();
    order.verify(store).writeBatch(anyList());
  }

  @Test
  void emptyCorpusWritesNothing() {
    LoadSummary summary = loader(25, 3).load(List.of());

    verify(store).ensureTable();
    verify(store, never()).writeBatch(anyList());
    assertEquals(0, summary.totalItems());
    assertEquals(0.0, summary.denormalizationFactor());
  }

  @Test
  @SuppressWarnings("unchecked")
  void duplicatePrimaryKeysInOneBatchCollapseToTheLast() {
    Paper first = minimal("p1");
    Paper second = minimal("p1");
    second.setTitle("second");

    loader(25, 3).load(List.of(first, second));

    ArgumentCaptor<List<PaperItem>> batch = ArgumentCaptor.forClass(List.class);
    verify(store).writeBatch(batch.capture());
    assertEquals(2, batch.getValue().size());
    assertTrue(batch.getValue().stream().allMatch(i -> i.getTitle().equals("second")));
  }

  @Test
  void retriesUnprocessedItemsUntilConfirmed() {
    List<Paper> papers = minimalPapers(1);
    List<PaperItem> items = projector.project(papers.get(0));
    PaperItem straggler = items.get(1);
    when(store.writeBatch(anyList())).thenReturn(List.of(straggler)).thenReturn(List.of());

    LoadSummary summary = loader(25, 3).load(papers);

    verify(store).writeBatch(List.of(straggler));
    verify(store, times(2)).writeBatch(anyList());
    assertEquals(1, summary.getBatchesWritten());
  }

  @Test
  void unconfirmedItemsAfterLastAttemptFailTheBatch() {
    List<Paper> papers = minimalPapers(1);
    PaperItem straggler = projector.project(papers.get(0)).get(1);
    when(store.writeBatch(anyList())).thenReturn(List.of(straggler));

    BatchWriteException e =
        assertThrows(BatchWriteException.class, () -> loader(25, 3).load(papers));

    verify(store, times(3)).writeBatch(anyList());
    assertEquals(0, e.getBatchIndex());
    assertEquals(-1, e.getLastCommittedBatch());
    assertEquals(List.of(straggler.primaryKey()), e.getUnconfirmedKeys());
    assertEquals(new TreeSet<>(List.of(0)), e.getPaperIndices());
    assertNull(e.getCause());
  }

  @Test
  void storeFailureReportsPaperIndicesAndLastCommittedBatch() {
    PaperStoreException throttled =
        new PaperStoreException("batchWriteItem", "papers", "throughput exceeded");
    when(store.writeBatch(anyList())).thenReturn(List.of()).thenThrow(throttled);

    // four items per batch, two per paper: batch 1 covers papers 2 and 3
    BatchWriteException e =
        assertThrows(BatchWriteException.class, () -> loader(4, 3).load(minimalPapers(6)));

    assertEquals(1, e.getBatchIndex());
    assertEquals(0, e.getLastCommittedBatch());
    SortedSet<Integer> expected = new TreeSet<>(List.of(2, 3));
    assertEquals(expected, e.getPaperIndices());
    assertEquals(4, e.getUnconfirmedKeys().size());
    assertEquals(throttled, e.getCause());
    verify(store, times(2)).writeBatch(anyList());
  }

  @Test
  void paperSplitAcrossBatchesIsReportedByBoth() {
    when(store.writeBatch(anyList())).thenReturn(List.of()).thenThrow(
        new PaperStoreException("batchWriteItem", "papers", "timeout"));

    // three items per batch, two per paper: paper 1 straddles batches 0 and 1
    BatchWriteException e =
        assertThrows(BatchWriteException.class, () -> loader(3, 1).load(minimalPapers(3)));

    assertEquals(new TreeSet<>(List.of(1, 2)), e.getPaperIndices());
  }

  @Test
  void recordsWithoutIdAreSkippedAndCounted() {
    Paper noId = minimal("x");
    noId.setArxivId(null);

    LoadSummary summary = loader(25, 3).load(List.of(minimal("p1"), noId, minimal("p2")));

    assertEquals(3, summary.getTotalPapers());
    assertEquals(1, summary.getSkippedPapers());
    assertEquals(4, summary.totalItems());
  }

  @Test
  void progressLinesAreReported() {
    List<String> lines = new ArrayList<>();

    loader(25, 3).load(minimalPapers(2), lines::add);

    assertTrue(lines.stream().anyMatch(l -> l.contains("committed batch 1/1")));
  }

  @Test
  void reloadingTheSameCorpusIsIdempotent() {
    InMemoryPaperStore memory = new InMemoryPaperStore("papers", 100);
    PaperLoaderService real = new PaperLoaderService(memory, projector, 25, 3, Duration.ZERO);
    List<Paper> papers =
        List.of(
            Paper.builder()
                .arxivId("2401.00001")
                .title("Pruning")
                .authors(List.of("Alice", "Bob"))
                .abstractText("Network pruning keeps sparse network accuracy.")
                .categories(List.of("cs.LG", "cs.AI"))
                .published("2024-01-05T00:00:00Z")
                .build(),
            minimal("2401.00002"));

    LoadSummary first = real.load(papers);
    int sizeAfterFirst = memory.size();
    LoadSummary second = real.load(papers);

    assertEquals(first.totalItems(), sizeAfterFirst);
    assertEquals(sizeAfterFirst, memory.size());
    assertEquals(first.totalItems(), second.totalItems());
  }

  @Test
  void rejectsBatchSizeAboveStoreLimit() {
    assertThrows(IllegalArgumentException.class, () -> loader(26, 3));
    assertThrows(IllegalArgumentException.class, () -> loader(0, 3));
    assertThrows(IllegalArgumentException.class, () -> loader(25, 0));
  }
}
