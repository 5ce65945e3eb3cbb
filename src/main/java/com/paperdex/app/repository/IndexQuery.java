package com.paperdex.app.repository;

import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** A single-partition key-condition query against one {@link PaperIndex}. */
@Value
@Builder(toBuilder = true)
public class IndexQuery {

  @NonNull PaperIndex index;

  @NonNull String partitionValue;

  /** Inclusive lower sort-key bound; set together with {@link #sortTo}. */
  String sortFrom;

  /** Inclusive upper sort-key bound. */
  String sortTo;

  /** Ascending sort-key order when true. */
  boolean ascending;

  /** Page size cap; {@code null} lets the store choose. */
  Integer limit;

  /** Continuation key from the previous page, or {@code null} for the first page. */
  Map<String, AttributeValue> exclusiveStartKey;

  public boolean hasSortRange() {
    return sortFrom != null && sortTo != null;
  }
}
