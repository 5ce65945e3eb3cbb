package com.paperdex.app.repository;

import com.paperdex.app.repository.dynamodb.PaperItem;
import java.util.List;
import java.util.function.Function;

/**
 * Access paths over the paper table: the primary key plus the three global secondary indexes, with
 * the key attributes and projection of each.
 */
public enum PaperIndex {
  PRIMARY(null, PaperItem.ATTR_PK, PaperItem.ATTR_SK, PaperItem::getPk, PaperItem::getSk, null),
  AUTHOR(
      PaperItem.AUTHOR_INDEX,
      PaperItem.ATTR_GSI1PK,
      PaperItem.ATTR_GSI1SK,
      PaperItem::getGsi1pk,
      PaperItem::getGsi1sk,
      PaperItem.SUMMARY_ATTRIBUTES),
  KEYWORD(
      PaperItem.KEYWORD_INDEX,
      PaperItem.ATTR_GSI2PK,
      PaperItem.ATTR_GSI2SK,
      PaperItem::getGsi2pk,
      PaperItem::getGsi2sk,
      PaperItem.SUMMARY_ATTRIBUTES),
  PAPER_ID(
      PaperItem.PAPER_ID_INDEX,
      PaperItem.ATTR_GSI3PK,
      PaperItem.ATTR_GSI3SK,
      PaperItem::getGsi3pk,
      PaperItem::getGsi3sk,
      null);

  private final String indexName;
  private final String partitionAttribute;
  private final String sortAttribute;
  private final Function<PaperItem, String> partitionValue;
  private final Function<PaperItem, String> sortValue;
  private final List<String> includedAttributes;

  PaperIndex(
      String indexName,
      String partitionAttribute,
      String sortAttribute,
      Function<PaperItem, String> partitionValue,
      Function<PaperItem, String> sortValue,
      List<String> includedAttributes) {
    this.indexName = indexName;
    this.partitionAttribute = partitionAttribute;
    this.sortAttribute = sortAttribute;
    this.partitionValue = partitionValue;
    this.sortValue = sortValue;
    this.includedAttributes = includedAttributes;
  }

  /** GSI name, or {@code null} for the base table. */
  public String indexName() {
    return indexName;
  }

  public boolean isSecondary() {
    return indexName != null;
  }

  public String partitionAttribute() {
    return partitionAttribute;
  }

  public String sortAttribute() {
    return sortAttribute;
  }

  public String partitionValueOf(PaperItem item) {
    return partitionValue.apply(item);
  }

  public String sortValueOf(PaperItem item) {
    return sortValue.apply(item);
  }

  /** True when the index projects every attribute (base table or ALL projection). */
  public boolean projectsAll() {
    return includedAttributes == null;
  }

  /** Non-key attributes of an INCLUDE projection; empty for ALL. */
  public List<String> includedAttributes() {
    return includedAttributes == null ? List.of() : includedAttributes;
  }
}
