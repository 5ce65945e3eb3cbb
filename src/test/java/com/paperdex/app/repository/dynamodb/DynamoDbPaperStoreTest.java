package com.paperdex.app.repository.dynamodb;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.paperdex.app.model.ItemType;
import com.paperdex.app.repository.IndexQuery;
import com.paperdex.app.repository.ItemPage;
import com.paperdex.app.repository.PaperIndex;
import com.paperdex.app.repository.PaperStoreException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.BatchWriteItemResponse;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableRequest;
import software.amazon.awssdk.services.dynamodb.model.DescribeTableResponse;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndex;
import software.amazon.awssdk.services.dynamodb.model.GlobalSecondaryIndexDescription;
import software.amazon.awssdk.services.dynamodb.model.IndexStatus;
import software.amazon.awssdk.services.dynamodb.model.ProjectionType;
import software.amazon.awssdk.services.dynamodb.model.ProvisionedThroughputExceededException;
import software.amazon.awssdk.services.dynamodb.model.PutRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryResponse;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.TableDescription;
import software.amazon.awssdk.services.dynamodb.model.TableStatus;
import software.amazon.awssdk.services.dynamodb.model.WriteRequest;
import software.amazon.awssdk.services.dynamodb.paginators.QueryIterable;

class DynamoDbPaperStoreTest {

  private static final String TABLE = "arxiv-papers";

  private DynamoDbClient ddb;
  private DynamoDbPaperStore store;

  @BeforeEach
  void setUp() {
    ddb = mock(DynamoDbClient.class);
    store = new DynamoDbPaperStore(ddb, TABLE, Duration.ofMillis(1), Duration.ofSeconds(5));
  }

  private static DescribeTableResponse described(TableStatus status, IndexStatus indexStatus) {
    List<GlobalSecondaryIndexDescription> indexes =
        List.of("AuthorIndex", "KeywordIndex", "PaperIdIndex").stream()
            .map(
                n ->
                    GlobalSecondaryIndexDescription.builder()
                        .indexName(n)
                        .indexStatus(indexStatus)
                        .build())
            .toList();
    return DescribeTableResponse.builder()
        .table(
            TableDescription.builder()
                .tableName(TABLE)
                .tableStatus(status)
                .globalSecondaryIndexes(indexes)
                .build())
        .build();
  }

  private static ResourceNotFoundException notFound() {
    return ResourceNotFoundException.builder().message("Requested resource not found").build();
  }

  // ---------- provisioning ----------

  @Test
  void createsTableWithThreeIndexesAndTheirProjections() {
    when(ddb.describeTable(any(DescribeTableRequest.class)))
        .thenThrow(notFound())
        .thenReturn(described(TableStatus.ACTIVE, IndexStatus.ACTIVE));

    store.ensureTable();

    ArgumentCaptor<CreateTableRequest> captor = ArgumentCaptor.forClass(CreateTableRequest.class);
    verify(ddb).createTable(captor.capture());
    CreateTableRequest request = captor.getValue();
    assertEquals(TABLE, request.tableName());
    assertEquals(BillingMode.PAY_PER_REQUEST, request.billingMode());
    assertEquals("PK", request.keySchema().get(0).attributeName());
    assertEquals("SK", request.keySchema().get(1).attributeName());
    assertEquals(8, request.attributeDefinitions().size());

    Map<String, GlobalSecondaryIndex> byName =
        request.globalSecondaryIndexes().stream()
            .collect(Collectors.toMap(GlobalSecondaryIndex::indexName, g -> g));
    assertEquals(3, byName.size());
    GlobalSecondaryIndex author = byName.get("AuthorIndex");
    assertEquals("GSI1PK", author.keySchema().get(0).attributeName());
    assertEquals("GSI1SK", author.keySchema().get(1).attributeName());
    assertEquals(ProjectionType.INCLUDE, author.projection().projectionType());
    assertEquals(
        List.of("arxiv_id", "title", "categories", "published"),
        author.projection().nonKeyAttributes());
    assertEquals(ProjectionType.INCLUDE, byName.get("KeywordIndex").projection().projectionType());
    assertEquals("GSI2PK", byName.get("KeywordIndex").keySchema().get(0).attributeName());
    assertEquals(ProjectionType.ALL, byName.get("PaperIdIndex").projection().projectionType());
    assertEquals("GSI3PK", byName.get("PaperIdIndex").keySchema().get(0).attributeName());
  }

  @Test
  void existingTableIsLeftAlone() {
    when(ddb.describeTable(any(DescribeTableRequest.class)))
        .thenReturn(described(TableStatus.ACTIVE, IndexStatus.ACTIVE));

    store.ensureTable();

    verify(ddb, never()).createTable(any(CreateTableRequest.class));
  }

  @Test
  void concurrentCreationIsTreatedAsExisting() {
    when(ddb.describeTable(any(DescribeTableRequest.class)))
        .thenThrow(notFound())
        .thenReturn(described(TableStatus.ACTIVE, IndexStatus.ACTIVE));
    when(ddb.createTable(any(CreateTableRequest.class)))
        .thenThrow(ResourceInUseException.builder().message("Table already exists").build());

    store.ensureTable();

    verify(ddb, times(2)).describeTable(any(DescribeTableRequest.class));
  }

  @Test
  void waitsUntilTableAndIndexesAreActive() {
    when(ddb.describeTable(any(DescribeTableRequest.class)))
        .thenThrow(notFound())
        .thenReturn(described(TableStatus.CREATING, IndexStatus.CREATING))
        .thenReturn(described(TableStatus.ACTIVE, IndexStatus.CREATING))
        .thenReturn(described(TableStatus.ACTIVE, IndexStatus.ACTIVE));

    store.ensureTable();

    verify(ddb, times(4)).describeTable(any(DescribeTableRequest.class));
  }

  @Test
  void givesUpWhenIndexesNeverBecomeActive() {
    DynamoDbPaperStore impatient =
        new DynamoDbPaperStore(ddb, TABLE, Duration.ofMillis(1), Duration.ZERO);
    when(ddb.describeTable(any(DescribeTableRequest.class)))
        .thenReturn(described(TableStatus.ACTIVE, IndexStatus.CREATING));

    PaperStoreException e = assertThrows(PaperStoreException.class, impatient::ensureTable);

    assertEquals("awaitTable", e.getOperation());
    assertTrue(e.getMessage().contains("AuthorIndex"));
  }

  // ---------- writes ----------

  private static PaperItem authorItem() {
    return PaperItem.builder()
        .pk("AUTHORITEM#Alice")
        .sk("2024-01-05#2401.00001")
        .gsi1pk("AUTHOR#Alice")
        .gsi1sk("2024-01-05#2401.00001")
        .arxivId("2401.00001")
        .title("Pruning")
        .categories(List.of("cs.LG"))
        .published("2024-01-05T09:00:00Z")
        .itemType(ItemType.AUTHOR_ITEM)
        .build();
  }

  @Test
  void batchWriteSendsPutsForEveryItem() {
    when(ddb.batchWriteItem(any(BatchWriteItemRequest.class)))
        .thenReturn(BatchWriteItemResponse.builder().build());

    List<PaperItem> unprocessed = store.writeBatch(List.of(authorItem()));

    ArgumentCaptor<BatchWriteItemRequest> captor =
        ArgumentCaptor.forClass(BatchWriteItemRequest.class);
    verify(ddb).batchWriteItem(captor.capture());
    List<WriteRequest> writes = captor.getValue().requestItems().get(TABLE);
    assertEquals(1, writes.size());
    Map<String, AttributeValue> item = writes.get(0).putRequest().item();
    assertEquals("AUTHORITEM#Alice", item.get("PK").s());
    assertEquals("AUTHOR#Alice", item.get("GSI1PK").s());
    assertEquals("AUTHOR_ITEM", item.get("item_type").s());
    assertFalse(item.containsKey("GSI2PK"));
    assertFalse(item.containsKey("abstract"));
    assertTrue(unprocessed.isEmpty());
  }

  @Test
  void unprocessedPutsAreHandedBack() {
    Map<String, AttributeValue> raw =
        Map.of(
            "PK", AttributeValue.fromS("AUTHORITEM#Alice"),
            "SK", AttributeValue.fromS("2024-01-05#2401.00001"),
            "arxiv_id", AttributeValue.fromS("2401.00001"));
    when(ddb.batchWriteItem(any(BatchWriteItemRequest.class)))
        .thenReturn(
            BatchWriteItemResponse.builder()
                .unprocessedItems(
                    Map.of(
                        TABLE,
                        List.of(
                            WriteRequest.builder()
                                .putRequest(PutRequest.builder().item(raw).build())
                                .build())))
                .build());

    List<PaperItem> unprocessed = store.writeBatch(List.of(authorItem()));

    assertEquals(1, unprocessed.size());
    assertEquals("AUTHORITEM#Alice|2024-01-05#2401.00001", unprocessed.get(0).primaryKey());
  }

  @Test
  void throttlingSurfacesAsStoreException() {
    when(ddb.batchWriteItem(any(BatchWriteItemRequest.class)))
        .thenThrow(ProvisionedThroughputExceededException.builder().message("slow down").build());

    PaperStoreException e =
        assertThrows(PaperStoreException.class, () -> store.writeBatch(List.of(authorItem())));

    assertEquals("batchWriteItem", e.getOperation());
    assertTrue(e.getKey().contains("AUTHORITEM#Alice"));
  }

  @Test
  void emptyBatchMakesNoCall() {
    assertTrue(store.writeBatch(List.of()).isEmpty());
    verify(ddb, never()).batchWriteItem(any(BatchWriteItemRequest.class));
  }

  // ---------- reads ----------

  private void stubQuery(QueryResponse response) {
    when(ddb.query(any(QueryRequest.class))).thenReturn(response);
    when(ddb.queryPaginator(any(QueryRequest.class)))
        .thenAnswer(inv -> new QueryIterable(ddb, inv.getArgument(0)));
  }

  private QueryRequest capturedQuery() {
    ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
    verify(ddb).query(captor.capture());
    return captor.getValue();
  }

  @Test
  void indexQueryTargetsGsiInRequestedOrder() {
    Map<String, AttributeValue> lastKey =
        Map.of(
            "PK", AttributeValue.fromS("AUTHORITEM#Alice"),
            "SK", AttributeValue.fromS("2024-01-05#2401.00001"),
            "GSI1PK", AttributeValue.fromS("AUTHOR#Alice"),
            "GSI1SK", AttributeValue.fromS("2024-01-05#2401.00001"));
    stubQuery(
        QueryResponse.builder()
            .items(
                Map.of(
                    "PK", AttributeValue.fromS("AUTHORITEM#Alice"),
                    "SK", AttributeValue.fromS("2024-01-05#2401.00001"),
                    "arxiv_id", AttributeValue.fromS("2401.00001"),
                    "title", AttributeValue.fromS("Pruning")))
            .lastEvaluatedKey(lastKey)
            .build());

    ItemPage page =
        store.query(
            IndexQuery.builder()
                .index(PaperIndex.AUTHOR)
                .partitionValue("AUTHOR#Alice")
                .ascending(false)
                .limit(7)
                .build());

    QueryRequest request = capturedQuery();
    assertEquals(TABLE, request.tableName());
    assertEquals("AuthorIndex", request.indexName());
    assertFalse(request.scanIndexForward());
    assertEquals(7, request.limit());
    assertTrue(
        request.expressionAttributeValues().containsValue(AttributeValue.fromS("AUTHOR#Alice")));

    assertEquals(1, page.getItems().size());
    assertEquals("Pruning", page.getItems().get(0).getTitle());
    assertNull(page.getItems().get(0).getAbstractText());
    assertTrue(page.hasMore());
    assertEquals(lastKey, page.getLastEvaluatedKey());
  }

  @Test
  void rangeQueryUsesInclusiveSortBounds() {
    stubQuery(QueryResponse.builder().items(List.of()).build());

    ItemPage page =
        store.query(
            IndexQuery.builder()
                .index(PaperIndex.PRIMARY)
                .partitionValue("CATEGORY#cs.LG")
                .sortFrom("2024-01-01#")
                .sortTo("2024-01-31#~")
                .ascending(true)
                .build());

    QueryRequest request = capturedQuery();
    assertNull(request.indexName());
    assertTrue(request.scanIndexForward());
    assertTrue(request.keyConditionExpression().contains("BETWEEN"));
    assertTrue(
        request
            .expressionAttributeValues()
            .values()
            .containsAll(
                List.of(
                    AttributeValue.fromS("CATEGORY#cs.LG"),
                    AttributeValue.fromS("2024-01-01#"),
                    AttributeValue.fromS("2024-01-31#~"))));
    assertTrue(page.getItems().isEmpty());
    assertFalse(page.hasMore());
  }

  @Test
  void queryFailureSurfacesAsStoreException() {
    when(ddb.query(any(QueryRequest.class)))
        .thenThrow(ProvisionedThroughputExceededException.builder().message("slow down").build());
    when(ddb.queryPaginator(any(QueryRequest.class)))
        .thenAnswer(inv -> new QueryIterable(ddb, inv.getArgument(0)));

    PaperStoreException e =
        assertThrows(
            PaperStoreException.class,
            () ->
                store.query(
                    IndexQuery.builder()
                        .index(PaperIndex.KEYWORD)
                        .partitionValue("KW#network")
                        .build()));

    assertEquals("query", e.getOperation());
  }
}
