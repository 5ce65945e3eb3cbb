package com.paperdex.app.repository;

import lombok.Getter;

/**
 * Raised when the backing store fails an operation: connectivity, throttling, timeouts or
 * provisioning errors. Never used for "no results".
 */
@Getter
public class PaperStoreException extends RuntimeException {

  /** Store operation that failed, e.g. {@code query} or {@code createTable}. */
  private final String operation;

  /** Table, partition or item key the operation targeted. */
  private final String key;

  public PaperStoreException(String operation, String key, String message, Throwable cause) {
    super(operation + " failed for " + key + ": " + message, cause);
    this.operation = operation;
    this.key = key;
  }

  public PaperStoreException(String operation, String key, String message) {
    this(operation, key, message, null);
  }
}
