package com.paperdex.app.service;

import com.paperdex.app.model.PaperKeys;
import com.paperdex.app.repository.IndexQuery;
import com.paperdex.app.repository.ItemPage;
import com.paperdex.app.repository.PaperIndex;
import com.paperdex.app.repository.PaperStore;
import com.paperdex.app.repository.dynamodb.PaperItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;

/**
 * The five read patterns of the paper table. Each maps onto exactly one index and one partition;
 * none scans. Stateless, so one instance serves any number of concurrent callers.
 *
 * <p>Empty partitions yield empty lists. Store failures propagate as {@link
 * com.paperdex.app.repository.PaperStoreException}.
 */
@Log4j2
public class PaperQueryService {

  private final PaperStore store;
  private final int defaultLimit;

  public PaperQueryService(PaperStore store, int defaultLimit) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    if (defaultLimit < 1) {
      throw new IllegalArgumentException("defaultLimit must be positive: " + defaultLimit);
    }
    this.defaultLimit = defaultLimit;
  }

  public int defaultLimit() {
    return defaultLimit;
  }

  /** Most recent papers of a category, newest first, one page of at most {@code limit}. */
  public List<PaperItem> recentInCategory(String category, Integer limit) {
    int cap = resolveLimit(limit);
    ItemPage page =
        store.query(
            IndexQuery.builder()
                .index(PaperIndex.PRIMARY)
                .partitionValue(PaperKeys.category(category))
                .ascending(false)
                .limit(cap)
                .build());
    log.debug("query.recent category={} limit={} count={}", category, cap, page.getItems().size());
    return page.getItems();
  }

  /** Every paper by {@code author}, newest first, following all continuation keys. */
  public List<PaperItem> papersByAuthor(String author) {
    List<PaperItem> items =
        drain(
            IndexQuery.builder()
                .index(PaperIndex.AUTHOR)
                .partitionValue(PaperKeys.author(author))
                .ascending(false)
                .build());
    log.debug("query.author author={} count={}", author, items.size());
    return items;
  }

  /** The detail row of one paper, if it was loaded. */
  public Optional<PaperItem> paperById(String arxivId) {
    ItemPage page =
        store.query(
            IndexQuery.builder()
                .index(PaperIndex.PAPER_ID)
                .partitionValue(PaperKeys.paper(arxivId))
                .ascending(true)
                .limit(1)
                .build());
    return page.getItems().stream().findFirst();
  }

  /**
   * Papers of a category published between {@code startDate} and {@code endDate} (both inclusive,
   * {@code yyyy-MM-dd}), oldest first, following all continuation keys.
   */
  public List<PaperItem> papersInDateRange(String category, String startDate, String endDate) {
    List<PaperItem> items =
        drain(
            IndexQuery.builder()
                .index(PaperIndex.PRIMARY)
                .partitionValue(PaperKeys.category(category))
                .sortFrom(PaperKeys.rangeStart(startDate))
                .sortTo(PaperKeys.rangeEnd(endDate))
                .ascending(true)
                .build());
    log.debug(
        "query.daterange category={} start={} end={} count={}",
        category,
        startDate,
        endDate,
        items.size());
    return items;
  }

  /** Papers whose abstract yielded {@code keyword} (any case), newest first, one page. */
  public List<PaperItem> papersByKeyword(String keyword, Integer limit) {
    int cap = resolveLimit(limit);
    ItemPage page =
        store.query(
            IndexQuery.builder()
                .index(PaperIndex.KEYWORD)
                .partitionValue(PaperKeys.keyword(keyword))
                .ascending(false)
                .limit(cap)
                .build());
    log.debug("query.keyword keyword={} limit={} count={}", keyword, cap, page.getItems().size());
    return page.getItems();
  }

  // -------- helpers --------

  private int resolveLimit(Integer limit) {
    if (limit == null) return defaultLimit;
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive: " + limit);
    }
    return limit;
  }

  private List<PaperItem> drain(IndexQuery first) {
    List<PaperItem> items = new ArrayList<>();
    IndexQuery query = first;
    while (true) {
      ItemPage page = store.query(query);
      items.addAll(page.getItems());
      if (!page.hasMore()) return items;
      query = query.toBuilder().exclusiveStartKey(page.getLastEvaluatedKey()).build();
    }
  }
}
