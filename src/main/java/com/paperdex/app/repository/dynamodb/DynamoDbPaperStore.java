package com.paperdex.app.repository.dynamodb;

import com.paperdex.app.repository.IndexQuery;
import com.paperdex.app.repository.ItemPage;
import com.paperdex.app.repository.PaperIndex;
import com.paperdex.app.repository.PaperStore;
import com.paperdex.app.repository.PaperStoreException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.pagination.sync.SdkIterable;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.BatchWriteItemEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.BatchWriteResult;
import software.amazon.awssdk.enhanced.dynamodb.model.Page;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryEnhancedRequest;
import software.amazon.awssdk.enhanced.dynamodb.model.WriteBatch;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndexDescription;
import software.amazon.awssdk.services.dynamodb.model.IndexStatus;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.Projection;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;

/** {@link PaperStore} over a single DynamoDB table, mapped with the Enhanced client. */
@Log4j2
public class DynamoDbPaperStore implements PaperStore {

  private static final List<PaperIndex> SECONDARY_INDEXES =
      List.of(PaperIndex.AUTHOR, PaperIndex.KEYWORD, PaperIndex.PAPER_ID);

  private final DynamoDbClient ddb;
  private final DynamoDbEnhancedClient enhanced;
  private final DynamoDbTable<PaperItem> table;
  private final String tableName;
  private final Duration pollInterval;
  private final Duration maxWait;

  public DynamoDbPaperStore(
      DynamoDbClient ddb, String tableName, Duration pollInterval, Duration maxWait) {
    this.ddb = Objects.requireNonNull(ddb, "DynamoDbClient must not be null");
    this.tableName = Objects.requireNonNull(tableName, "tableName must not be null");
    this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
    this.maxWait = Objects.requireNonNull(maxWait, "maxWait must not be null");
    this.enhanced = DynamoDbEnhancedClient.builder().dynamoDbClient(ddb).build();
    this.table = enhanced.table(tableName, TableSchema.fromBean(PaperItem.class));
  }

  @Override
  public String tableName() {
    return tableName;
  }

  // -------- Provisioning --------

  @Override
  public void ensureTable() {
    Optional<TableDescription> existing = describe();
    if (existing.isPresent()) {
      warnOnMissingIndexes(existing.get());
      log.info(
          "paperstore.ensureTable table={} exists status={}",
          tableName,
          existing.get().tableStatus());
    } else {
      createTable();
    }
    awaitReady();
  }

  private Optional<TableDescription> describe() {
    try {
      return Optional.of(
          ddb.describeTable(DescribeTableRequest.builder().tableName(tableName).build()).table());
    } catch (ResourceNotFoundException e) {
      return Optional.empty();
    } catch (SdkException e) {
      throw new PaperStoreException("describeTable", tableName, e.getMessage(), e);
    }
  }

  private void createTable() {
    List<AttributeDefinition> attributes = new ArrayList<>();
    attributes.add(stringAttribute(PaperIndex.PRIMARY.partitionAttribute()));
    attributes.add(stringAttribute(PaperIndex.PRIMARY.sortAttribute()));
    List<GlobalSecondaryIndex> indexes = new ArrayList<>();
    for (PaperIndex index : SECONDARY_INDEXES) {
      attributes.add(stringAttribute(index.partitionAttribute()));
      attributes.add(stringAttribute(index.sortAttribute()));
      indexes.add(globalSecondaryIndex(index));
    }

    CreateTableRequest request =
        CreateTableRequest.builder()
            .tableName(tableName)
            .attributeDefinitions(attributes)
            .keySchema(
                keyElement(PaperIndex.PRIMARY.partitionAttribute(), KeyType.HASH),
                keyElement(PaperIndex.PRIMARY.sortAttribute(), KeyType.RANGE))
            .billingMode(BillingMode.PAY_PER_REQUEST)
            .globalSecondaryIndexes(indexes)
            .build();

    log.info(
        "paperstore.createTable table={} indexes={}",
        tableName,
        SECONDARY_INDEXES.stream().map(PaperIndex::indexName).toList());
    try {
      ddb.createTable(request);
    } catch (ResourceInUseException e) {
      // created concurrently by another loader
      log.info("paperstore.createTable table={} already being created", tableName);
    } catch (SdkException e) {
      throw new PaperStoreException("createTable", tableName, e.getMessage(), e);
    }
  }

  private void awaitReady() {
    long deadline = System.nanoTime() + maxWait.toNanos();
    while (true) {
      Optional<TableDescription> current = describe();
      List<String> pending = new ArrayList<>();
      if (current.isEmpty() || current.get().tableStatus() != TableStatus.ACTIVE) {
        pending.add(tableName);
      } else {
        for (GlobalSecondaryIndexDescription gsi : current.get().globalSecondaryIndexes()) {
          if (gsi.indexStatus() != IndexStatus.ACTIVE) {
            pending.add(gsi.indexName());
          }
        }
      }
      if (pending.isEmpty()) {
        log.info("paperstore.ready table={}", tableName);
        return;
      }
      if (System.nanoTime() >= deadline) {
        throw new PaperStoreException(
            "awaitTable", tableName, "not active after " + maxWait + ": " + pending);
      }
      log.info("paperstore.awaitTable table={} pending={}", tableName, pending);
      try {
        Thread.sleep(pollInterval.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new PaperStoreException("awaitTable", tableName, "interrupted", e);
      }
    }
  }

  private void warnOnMissingIndexes(TableDescription description) {
    Set<String> present = new HashSet<>();
    description.globalSecondaryIndexes().forEach(g -> present.add(g.indexName()));
    for (PaperIndex index : SECONDARY_INDEXES) {
      if (!present.contains(index.indexName())) {
        log.warn("paperstore.ensureTable table={} missing index={}", tableName, index.indexName());
      }
    }
  }

  private static GlobalSecondaryIndex globalSecondaryIndex(PaperIndex index) {
    Projection projection =
        index.projectsAll()
            ? Projection.builder().projectionType(ProjectionType.ALL).build()
            : Projection.builder()
                .projectionType(ProjectionType.INCLUDE)
                .nonKeyAttributes(index.includedAttributes())
                .build();
    return GlobalSecondaryIndex.builder()
        .indexName(index.indexName())
        .keySchema(
            keyElement(index.partitionAttribute(), KeyType.HASH),
            keyElement(index.sortAttribute(), KeyType.RANGE))
        .projection(projection)
        .build();
  }

  private static AttributeDefinition stringAttribute(String name) {
    return AttributeDefinition.builder()
        .attributeName(name)
        .attributeType(ScalarAttributeType.S)
        .build();
  }

  private static KeySchemaElement keyElement(String name, KeyType type) {
    return KeySchemaElement.builder().attributeName(name).keyType(type).build();
  }

  // -------- Writes --------

  @Override
  public List<PaperItem> writeBatch(List<PaperItem> items) {
    if (items.isEmpty()) return List.of();
    WriteBatch.Builder<PaperItem> batch =
        WriteBatch.builder(PaperItem.class).mappedTableResource(table);
    items.forEach(batch::addPutItem);
    try {
      BatchWriteResult result =
          enhanced.batchWriteItem(
              BatchWriteItemEnhancedRequest.builder().writeBatches(batch.build()).build());
      List<PaperItem> unprocessed = result.unprocessedPutItemsForTable(table);
      log.debug(
          "paperstore.writeBatch table={} items={} unprocessed={}",
          tableName,
          items.size(),
          unprocessed.size());
      return unprocessed;
    } catch (SdkException e) {
      throw new PaperStoreException(
          "batchWriteItem",
          tableName + " " + items.get(0).primaryKey() + ".." + last(items).primaryKey(),
          e.getMessage(),
          e);
    }
  }

  private static PaperItem last(List<PaperItem> items) {
    return items.get(items.size() - 1);
  }

  // -------- Reads --------

  @Override
  public ItemPage query(IndexQuery query) {
    PaperIndex index = query.getIndex();
    QueryEnhancedRequest.Builder request =
        QueryEnhancedRequest.builder()
            .queryConditional(conditional(query))
            .scanIndexForward(query.isAscending())
            .exclusiveStartKey(query.getExclusiveStartKey());
    if (query.getLimit() != null) {
      request.limit(query.getLimit());
    }

    try {
      SdkIterable<Page<PaperItem>> pages =
          index.isSecondary()
              ? table.index(index.indexName()).query(request.build())
              : table.query(request.build());
      Page<PaperItem> first = pages.iterator().next();
      log.debug(
          "paperstore.query index={} partition={} items={} more={}",
          index,
          query.getPartitionValue(),
          first.items().size(),
          first.lastEvaluatedKey() != null && !first.lastEvaluatedKey().isEmpty());
      return new ItemPage(first.items(), first.lastEvaluatedKey());
    } catch (SdkException e) {
      throw new PaperStoreException(
          "query", index + ":" + query.getPartitionValue(), e.getMessage(), e);
    }
  }

  private static QueryConditional conditional(IndexQuery query) {
    if (!query.hasSortRange()) {
      return QueryConditional.keyEqualTo(
          Key.builder().partitionValue(query.getPartitionValue()).build());
    }
    String partition = query.getPartitionValue();
    return QueryConditional.sortBetween(
        Key.builder().partitionValue(partition).sortValue(query.getSortFrom()).build(),
        Key.builder().partitionValue(partition).sortValue(query.getSortTo()).build());
  }
}
