package com.paperdex.app.repository;

import java.util.List;
import java.util.SortedSet;
import lombok.Getter;

/**
 * A write batch could not be fully committed. Earlier batches stay committed; the fields identify
 * exactly what has to be retried.
 */
@Getter
public class BatchWriteException extends PaperStoreException {

  private final int batchIndex;

  /** Index of the last batch the store fully acknowledged, or -1 if none. */
  private final int lastCommittedBatch;

  /** Positions in the source corpus whose items this batch carried. */
  private final SortedSet<Integer> paperIndices;

  /** Primary keys ({@code PK|SK}) the store did not confirm. */
  private final List<String> unconfirmedKeys;

  public BatchWriteException(
      int batchIndex,
      int lastCommittedBatch,
      SortedSet<Integer> paperIndices,
      List<String> unconfirmedKeys,
      Throwable cause) {
    super(
        "batchWrite",
        "batch " + batchIndex,
        unconfirmedKeys.size()
            + " item(s) not confirmed, papers "
            + paperIndices
            + ", last committed batch "
            + lastCommittedBatch,
        cause);
    this.batchIndex = batchIndex;
    this.lastCommittedBatch = lastCommittedBatch;
    this.paperIndices = paperIndices;
    this.unconfirmedKeys = unconfirmedKeys;
  }
}
