package com.paperdex.app.repository.dynamodb;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.paperdex.app.model.ItemType;
import java.util.List;
import lombok.*;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

/**
 * One row of the single-table paper layout. All four variants (detail, category, author, keyword)
 * share this shape; the variant decides which keys and payload fields are populated. Null
 * attributes are not written, which keeps the secondary indexes sparse.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@DynamoDbBean
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaperItem {

  public static final String AUTHOR_INDEX = "AuthorIndex";
  public static final String KEYWORD_INDEX = "KeywordIndex";
  public static final String PAPER_ID_INDEX = "PaperIdIndex";

  public static final String ATTR_PK = "PK";
  public static final String ATTR_SK = "SK";
  public static final String ATTR_GSI1PK = "GSI1PK";
  public static final String ATTR_GSI1SK = "GSI1SK";
  public static final String ATTR_GSI2PK = "GSI2PK";
  public static final String ATTR_GSI2SK = "GSI2SK";
  public static final String ATTR_GSI3PK = "GSI3PK";
  public static final String ATTR_GSI3SK = "GSI3SK";

  public static final String ATTR_ARXIV_ID = "arxiv_id";
  public static final String ATTR_TITLE = "title";
  public static final String ATTR_AUTHORS = "authors";
  public static final String ATTR_ABSTRACT = "abstract";
  public static final String ATTR_CATEGORIES = "categories";
  public static final String ATTR_KEYWORDS = "keywords";
  public static final String ATTR_PUBLISHED = "published";
  public static final String ATTR_ITEM_TYPE = "item_type";

  /** Non-key attributes carried into the author and keyword indexes. */
  public static final List<String> SUMMARY_ATTRIBUTES =
      List.of(ATTR_ARXIV_ID, ATTR_TITLE, ATTR_CATEGORIES, ATTR_PUBLISHED);

  // ---------- primary key ----------

  @JsonProperty(ATTR_PK)
  private String pk;

  @JsonProperty(ATTR_SK)
  private String sk;

  // ---------- secondary index keys ----------

  /** AuthorIndex partition: {@code AUTHOR#<author>}. */
  @JsonProperty(ATTR_GSI1PK)
  private String gsi1pk;

  @JsonProperty(ATTR_GSI1SK)
  private String gsi1sk;

  /** KeywordIndex partition: {@code KW#<keyword>}. */
  @JsonProperty(ATTR_GSI2PK)
  private String gsi2pk;

  @JsonProperty(ATTR_GSI2SK)
  private String gsi2sk;

  /** PaperIdIndex partition: {@code PAPER#<id>}, detail rows only. */
  @JsonProperty(ATTR_GSI3PK)
  private String gsi3pk;

  @JsonProperty(ATTR_GSI3SK)
  private String gsi3sk;

  // ---------- payload ----------

  @JsonProperty(ATTR_ARXIV_ID)
  private String arxivId;

  private String title;

  private List<String> authors;

  @JsonProperty(ATTR_ABSTRACT)
  private String abstractText;

  private List<String> categories;

  private List<String> keywords;

  private String published;

  @JsonProperty(ATTR_ITEM_TYPE)
  private ItemType itemType;

  // ---------- DynamoDB mapping ----------

  @DynamoDbPartitionKey
  @DynamoDbAttribute(ATTR_PK)
  public String getPk() {
    return pk;
  }

  @DynamoDbSortKey
  @DynamoDbAttribute(ATTR_SK)
  public String getSk() {
    return sk;
  }

  @DynamoDbSecondaryPartitionKey(indexNames = AUTHOR_INDEX)
  @DynamoDbAttribute(ATTR_GSI1PK)
  public String getGsi1pk() {
    return gsi1pk;
  }

  @DynamoDbSecondarySortKey(indexNames = AUTHOR_INDEX)
  @DynamoDbAttribute(ATTR_GSI1SK)
  public String getGsi1sk() {
    return gsi1sk;
  }

  @DynamoDbSecondaryPartitionKey(indexNames = KEYWORD_INDEX)
  @DynamoDbAttribute(ATTR_GSI2PK)
  public String getGsi2pk() {
    return gsi2pk;
  }

  @DynamoDbSecondarySortKey(indexNames = KEYWORD_INDEX)
  @DynamoDbAttribute(ATTR_GSI2SK)
  public String getGsi2sk() {
    return gsi2sk;
  }

  @DynamoDbSecondaryPartitionKey(indexNames = PAPER_ID_INDEX)
  @DynamoDbAttribute(ATTR_GSI3PK)
  public String getGsi3pk() {
    return gsi3pk;
  }

  @DynamoDbSecondarySortKey(indexNames = PAPER_ID_INDEX)
  @DynamoDbAttribute(ATTR_GSI3SK)
  public String getGsi3sk() {
    return gsi3sk;
  }

  @DynamoDbAttribute(ATTR_ARXIV_ID)
  public String getArxivId() {
    return arxivId;
  }

  @DynamoDbAttribute(ATTR_TITLE)
  public String getTitle() {
    return title;
  }

  @DynamoDbAttribute(ATTR_AUTHORS)
  public List<String> getAuthors() {
    return authors;
  }

  @DynamoDbAttribute(ATTR_ABSTRACT)
  public String getAbstractText() {
    return abstractText;
  }

  @DynamoDbAttribute(ATTR_CATEGORIES)
  public List<String> getCategories() {
    return categories;
  }

  @DynamoDbAttribute(ATTR_KEYWORDS)
  public List<String> getKeywords() {
    return keywords;
  }

  @DynamoDbAttribute(ATTR_PUBLISHED)
  public String getPublished() {
    return published;
  }

  @DynamoDbAttribute(ATTR_ITEM_TYPE)
  public ItemType getItemType() {
    return itemType;
  }

  /** Primary key pair rendered as {@code PK|SK}, for logs and error reports. */
  public String primaryKey() {
    return pk + "|" + sk;
  }
}
