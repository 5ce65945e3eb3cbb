package com.paperdex.app.repository;

import com.paperdex.app.repository.dynamodb.PaperItem;
import java.util.List;
import java.util.Map;
import lombok.Value;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/** One page of query results plus the key to resume from. */
@Value
public class ItemPage {

  List<PaperItem> items;

  /** {@code null} or empty when the partition is exhausted. */
  Map<String, AttributeValue> lastEvaluatedKey;

  public boolean hasMore() {
    return lastEvaluatedKey != null && !lastEvaluatedKey.isEmpty();
  }
}
