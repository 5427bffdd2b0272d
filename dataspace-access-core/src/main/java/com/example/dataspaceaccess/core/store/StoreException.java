package com.example.dataspaceaccess.core.store;

/** Raised when the backing store rejects an operation (commit, rollback, statement execution). */
public class StoreException extends RuntimeException {

  public StoreException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
