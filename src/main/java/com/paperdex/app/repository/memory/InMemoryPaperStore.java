package com.paperdex.app.repository.memory;

import com.paperdex.app.repository.IndexQuery;
import com.paperdex.app.repository.ItemPage;
import com.paperdex.app.repository.PaperIndex;
import com.paperdex.app.repository.PaperStore;
import com.paperdex.app.repository.dynamodb.PaperItem;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Process-local {@link PaperStore} with DynamoDB semantics: upsert by primary key, sparse secondary
 * indexes kept as auxiliary namespaces updated in the same write as the base row, INCLUDE
 * projections, and paged queries with continuation keys.
 *
 * <p>Layout of every namespace: partition value -> sort value -> primary key -> item. Ties on the
 * sort value are ordered by primary key.
 */
@Log4j2
public class InMemoryPaperStore implements PaperStore {

  private final String tableName;
  private final int pageSize;

  private final Map<PaperIndex, Map<String, NavigableMap<String, NavigableMap<String, PaperItem>>>>
      namespaces = new EnumMap<>(PaperIndex.class);

  public InMemoryPaperStore(String tableName, int pageSize) {
    if (pageSize < 1) {
      throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
    }
    this.tableName = tableName;
    this.pageSize = pageSize;
    for (PaperIndex index : PaperIndex.values()) {
      namespaces.put(index, new ConcurrentHashMap<>());
    }
  }

  @Override
  public String tableName() {
    return tableName;
  }

  @Override
  public void ensureTable() {
    log.info("memstore.ensureTable table={} ready", tableName);
  }

  @Override
  public synchronized List<PaperItem> writeBatch(List<PaperItem> items) {
    for (PaperItem incoming : items) {
      PaperItem item = incoming.toBuilder().build();
      PaperItem previous = lookup(item.getPk(), item.getSk());
      if (previous != null) {
        for (PaperIndex index : PaperIndex.values()) {
          unlink(index, previous);
        }
      }
      for (PaperIndex index : PaperIndex.values()) {
        link(index, item);
      }
    }
    log.debug("memstore.writeBatch table={} items={}", tableName, items.size());
    return List.of();
  }

  @Override
  public ItemPage query(IndexQuery query) {
    PaperIndex index = query.getIndex();
    NavigableMap<String, NavigableMap<String, PaperItem>> partition =
        namespaces.get(index).get(query.getPartitionValue());
    if (partition == null) {
      return new ItemPage(List.of(), null);
    }

    NavigableMap<String, NavigableMap<String, PaperItem>> range =
        query.hasSortRange()
            ? partition.subMap(query.getSortFrom(), true, query.getSortTo(), true)
            : partition;
    if (!query.isAscending()) {
      range = range.descendingMap();
    }

    Map<String, AttributeValue> startKey = query.getExclusiveStartKey();
    boolean started = startKey == null || startKey.isEmpty();
    int cap = query.getLimit() == null ? pageSize : Math.min(query.getLimit(), pageSize);

    List<PaperItem> page = new ArrayList<>();
    PaperItem last = null;
    for (Map.Entry<String, NavigableMap<String, PaperItem>> bySort : range.entrySet()) {
      NavigableMap<String, PaperItem> ties =
          query.isAscending() ? bySort.getValue() : bySort.getValue().descendingMap();
      for (PaperItem item : ties.values()) {
        if (!started) {
          started = isAfter(index, item, startKey, query.isAscending());
          if (!started) continue;
        }
        if (page.size() == cap) {
          return new ItemPage(page, keyOf(index, last));
        }
        page.add(project(index, item));
        last = item;
      }
    }
    return new ItemPage(page, null);
  }

  /** Number of base-table rows; test and diagnostics helper. */
  public int size() {
    return namespaces.get(PaperIndex.PRIMARY).values().stream()
        .flatMap(p -> p.values().stream())
        .mapToInt(Map::size)
        .sum();
  }

  // -------- Internals --------

  private PaperItem lookup(String pk, String sk) {
    NavigableMap<String, NavigableMap<String, PaperItem>> partition =
        namespaces.get(PaperIndex.PRIMARY).get(pk);
    if (partition == null) return null;
    NavigableMap<String, PaperItem> rows = partition.get(sk);
    return rows == null ? null : rows.get(primaryKey(pk, sk));
  }

  private void link(PaperIndex index, PaperItem item) {
    String partitionValue = index.partitionValueOf(item);
    String sortValue = index.sortValueOf(item);
    if (partitionValue == null || sortValue == null) return;
    namespaces
        .get(index)
        .computeIfAbsent(partitionValue, k -> new ConcurrentSkipListMap<>())
        .computeIfAbsent(sortValue, k -> new ConcurrentSkipListMap<>())
        .put(item.primaryKey(), item);
  }

  private void unlink(PaperIndex index, PaperItem item) {
    String partitionValue = index.partitionValueOf(item);
    String sortValue = index.sortValueOf(item);
    if (partitionValue == null || sortValue == null) return;
    NavigableMap<String, NavigableMap<String, PaperItem>> partition =
        namespaces.get(index).get(partitionValue);
    if (partition == null) return;
    NavigableMap<String, PaperItem> rows = partition.get(sortValue);
    if (rows == null) return;
    rows.remove(item.primaryKey());
    if (rows.isEmpty()) partition.remove(sortValue);
    if (partition.isEmpty()) namespaces.get(index).remove(partitionValue);
  }

  /** True when {@code item} lies strictly past the continuation key in scan direction. */
  private static boolean isAfter(
      PaperIndex index, PaperItem item, Map<String, AttributeValue> startKey, boolean ascending) {
    String startSort = stringValue(startKey, index.sortAttribute());
    String startPrimary =
        primaryKey(
            stringValue(startKey, PaperIndex.PRIMARY.partitionAttribute()),
            stringValue(startKey, PaperIndex.PRIMARY.sortAttribute()));
    int cmp = index.sortValueOf(item).compareTo(startSort);
    if (cmp == 0) {
      cmp = item.primaryKey().compareTo(startPrimary);
    }
    return ascending ? cmp > 0 : cmp < 0;
  }

  private static Map<String, AttributeValue> keyOf(PaperIndex index, PaperItem item) {
    Map<String, AttributeValue> key = new HashMap<>();
    key.put(PaperIndex.PRIMARY.partitionAttribute(), AttributeValue.fromS(item.getPk()));
    key.put(PaperIndex.PRIMARY.sortAttribute(), AttributeValue.fromS(item.getSk()));
    key.put(index.partitionAttribute(), AttributeValue.fromS(index.partitionValueOf(item)));
    key.put(index.sortAttribute(), AttributeValue.fromS(index.sortValueOf(item)));
    return key;
  }

  private static String stringValue(Map<String, AttributeValue> key, String attribute) {
    AttributeValue value = key.get(attribute);
    return value == null || value.s() == null ? "" : value.s();
  }

  private static String primaryKey(String pk, String sk) {
    return pk + "|" + sk;
  }

  /** Copy of {@code item} restricted to what {@code index} projects. */
  private static PaperItem project(PaperIndex index, PaperItem item) {
    if (index.projectsAll()) {
      return item.toBuilder().build();
    }
    PaperItem.PaperItemBuilder projected = PaperItem.builder().pk(item.getPk()).sk(item.getSk());
    switch (index) {
      case AUTHOR -> projected.gsi1pk(item.getGsi1pk()).gsi1sk(item.getGsi1sk());
      case KEYWORD -> projected.gsi2pk(item.getGsi2pk()).gsi2sk(item.getGsi2sk());
      case PAPER_ID -> projected.gsi3pk(item.getGsi3pk()).gsi3sk(item.getGsi3sk());
      default -> {}
    }
    for (String attribute : index.includedAttributes()) {
      switch (attribute) {
        case PaperItem.ATTR_ARXIV_ID -> projected.arxivId(item.getArxivId());
        case PaperItem.ATTR_TITLE -> projected.title(item.getTitle());
        case PaperItem.ATTR_AUTHORS -> projected.authors(item.getAuthors());
        case PaperItem.ATTR_ABSTRACT -> projected.abstractText(item.getAbstractText());
        case PaperItem.ATTR_CATEGORIES -> projected.categories(item.getCategories());
        case PaperItem.ATTR_KEYWORDS -> projected.keywords(item.getKeywords());
        case PaperItem.ATTR_PUBLISHED -> projected.published(item.getPublished());
        case PaperItem.ATTR_ITEM_TYPE -> projected.itemType(item.getItemType());
        default -> log.warn("memstore.project unknown attribute={}", attribute);
      }
    }
    return projected.build();
  }
}
