package com.paperdex.app.repository;

import com.paperdex.app.repository.dynamodb.PaperItem;
import java.util.List;

/**
 * Storage seam for the paper table. Implementations must be safe for concurrent reads; writes are
 * issued by a single loader thread.
 */
public interface PaperStore {

  /** Name of the backing table, for logs and reports. */
  String tableName();

  /**
   * Creates the table and its secondary indexes unless they already exist, and blocks until they
   * accept reads and writes.
   *
   * @throws PaperStoreException if the table cannot be created or never becomes ready
   */
  void ensureTable();

  /**
   * Puts every item in one request, overwriting items with the same primary key.
   *
   * @param items at most 25 items with distinct primary keys
   * @return items the store did not confirm; empty when the whole batch committed
   * @throws PaperStoreException if the request itself fails
   */
  List<PaperItem> writeBatch(List<PaperItem> items);

  /**
   * Returns one page of a key-condition query.
   *
   * @throws PaperStoreException on any read failure
   */
  ItemPage query(IndexQuery query);
}
